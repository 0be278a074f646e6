package ru.aritmos.clusterreceiver.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.event.EventJournal;
import ru.aritmos.clusterreceiver.event.ReceiverEvent;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;
import ru.aritmos.clusterreceiver.security.RequesterIdentityResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Журнал событий receiver'ов.
 */
@Controller("/v1/events")
@Tag(name = "Events", description = "События создания, удаления и вызова receiver'ов")
public class EventController {

    private static final Set<String> ALLOWED_PARAMS = Set.of("obj_id", "limit", "global_project");

    private final EventJournal journal;
    private final RequesterIdentityResolver identityResolver;
    private final ClusterReceiverProperties.Listing listing;

    public EventController(EventJournal journal,
                           RequesterIdentityResolver identityResolver,
                           ClusterReceiverProperties properties) {
        this.journal = journal;
        this.identityResolver = identityResolver;
        this.listing = properties.getListing();
    }

    @Get
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Список событий", description = "От новых к старым. Параметры: obj_id, limit, global_project.")
    @ApiResponse(responseCode = "200", description = "События", content = @Content(schema = @Schema(implementation = EventListBody.class)))
    @ApiResponse(responseCode = "400", description = "Некорректные параметры", content = @Content(schema = @Schema(implementation = ApiErrors.ErrorBody.class)))
    @ApiResponse(responseCode = "403", description = "global_project без operator-прав")
    public HttpResponse<?> list(HttpRequest<?> request) {
        String requestId = ApiErrors.requestId(request);
        try {
            Map<String, List<String>> params = request.getParameters().asMap();
            for (String key : params.keySet()) {
                if (!ALLOWED_PARAMS.contains(key)) {
                    throw ReceiverException.validation("Недопустимый параметр запроса: '" + key + "'");
                }
            }
            RequesterIdentity requester = identityResolver.resolve(request);
            ClusterReceiverSecurityProperties.Rbac rbac = identityResolver.rbac();
            if (!requester.canRead(rbac)) {
                throw ReceiverException.forbidden("Недостаточно прав для просмотра событий");
            }
            boolean global = parseBoolean(first(params, "global_project"));
            if (global && !requester.isOperator(rbac)) {
                throw ReceiverException.forbidden("Листинг по всем проектам доступен только оператору");
            }
            int limit = parseLimit(first(params, "limit"));

            List<EventRepresentation> out = new ArrayList<>();
            for (ReceiverEvent e : journal.list(global ? null : requester.projectId(), first(params, "obj_id"), limit)) {
                out.add(EventRepresentation.of(e));
            }
            return HttpResponse.ok(new EventListBody(out));
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    private int parseLimit(String raw) {
        if (raw == null) {
            return listing.getDefaultLimit();
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ReceiverException.validation("Параметр limit должен быть положительным целым числом");
        }
        if (limit < 1 || limit > listing.getMaxLimit()) {
            throw ReceiverException.validation("Параметр limit должен быть от 1 до " + listing.getMaxLimit());
        }
        return limit;
    }

    private static boolean parseBoolean(String raw) {
        if (raw == null) {
            return false;
        }
        if (raw.equalsIgnoreCase("true")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false")) {
            return false;
        }
        throw ReceiverException.validation("Параметр global_project должен быть true или false");
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> values = params.get(key);
        if (values == null || values.isEmpty() || values.get(0) == null || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    @Serdeable
    @Schema(name = "EventListBody", description = "Обёртка списка событий")
    public record EventListBody(@Schema(description = "События") List<EventRepresentation> events) {
    }

    @Serdeable
    @Schema(name = "Event", description = "Событие журнала")
    public record EventRepresentation(
            @Schema(description = "Идентификатор") String id,
            @Schema(description = "Время") String timestamp,
            @JsonProperty("obj_id") @Schema(description = "Объект") String objId,
            @JsonProperty("obj_name") @Schema(description = "Имя объекта") String objName,
            @JsonProperty("obj_type") @Schema(description = "Тип объекта") String objType,
            @JsonProperty("cluster_id") @Schema(description = "Кластер") String clusterId,
            @Schema(description = "Событие") String action,
            @Schema(description = "Уровень", allowableValues = {"DEBUG", "INFO", "WARNING", "ERROR"}) String level,
            @Schema(description = "Статус") String status,
            @JsonProperty("status_reason") @Schema(description = "Пояснение") String statusReason,
            @Schema(description = "Инициатор") String user,
            @Schema(description = "Проект") String project
    ) {
        static EventRepresentation of(ReceiverEvent e) {
            return new EventRepresentation(e.id(), e.timestamp().toString(), e.objId(), e.objName(), e.objType(),
                    e.clusterId(), e.action(), e.level().name(), e.status(), e.statusReason(), e.userId(), e.project());
        }
    }
}
