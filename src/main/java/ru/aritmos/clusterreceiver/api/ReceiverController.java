package ru.aritmos.clusterreceiver.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.lifecycle.ReceiverLifecycleManager;
import ru.aritmos.clusterreceiver.lifecycle.ReceiverView;
import ru.aritmos.clusterreceiver.receiver.ListMarker;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverQuery;
import ru.aritmos.clusterreceiver.receiver.ReceiverSpec;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;
import ru.aritmos.clusterreceiver.security.RequesterIdentityResolver;
import ru.aritmos.clusterreceiver.security.TokenAuthenticationFetcher;
import ru.aritmos.clusterreceiver.trigger.InvocationCredentials;
import ru.aritmos.clusterreceiver.trigger.TriggerDispatcher;
import ru.aritmos.clusterreceiver.trigger.TriggerOutcome;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * API receiver'ов: создание, листинг, просмотр, удаление и notify для signal-receiver'ов.
 */
@Controller("/v1/receivers")
@Tag(name = "Receivers", description = "Webhook- и signal-receiver'ы, запускающие действия над кластером")
public class ReceiverController {

    private final ReceiverLifecycleManager lifecycle;
    private final TriggerDispatcher dispatcher;
    private final RequesterIdentityResolver identityResolver;
    private final ClusterReceiverProperties.Listing listing;

    public ReceiverController(ReceiverLifecycleManager lifecycle,
                              TriggerDispatcher dispatcher,
                              RequesterIdentityResolver identityResolver,
                              ClusterReceiverProperties properties) {
        this.lifecycle = lifecycle;
        this.dispatcher = dispatcher;
        this.identityResolver = identityResolver;
        this.listing = properties.getListing();
    }

    @Get
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Список receiver'ов",
            description = "Фильтры name, type, cluster_id, action (повторяемые), limit, marker, sort, global_project. " +
                    "Неизвестный параметр запроса даёт 400.")
    @ApiResponse(responseCode = "200", description = "Receiver'ы", content = @Content(schema = @Schema(implementation = ReceiverListBody.class)))
    @ApiResponse(responseCode = "400", description = "Некорректные параметры", content = @Content(schema = @Schema(implementation = ApiErrors.ErrorBody.class)))
    @ApiResponse(responseCode = "403", description = "global_project без operator-прав")
    public HttpResponse<?> list(HttpRequest<?> request) {
        String requestId = ApiErrors.requestId(request);
        try {
            ReceiverQuery query = ReceiverQuery.parse(request.getParameters().asMap(), listing);
            List<ReceiverView> page = lifecycle.list(query, identityResolver.resolve(request));
            List<ReceiverRepresentation> out = new ArrayList<>();
            for (ReceiverView v : page) {
                out.add(ReceiverRepresentation.of(v));
            }
            return HttpResponse.ok(new ReceiverListBody(out, nextMarker(query, page)));
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    @Post(consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Создать receiver",
            description = "Для webhook выпускается делегированный trust от имени запрашивающего; " +
                    "при сбое записи trust отзывается. cluster_id может быть id, именем или коротким id кластера.")
    @ApiResponse(responseCode = "201", description = "Receiver создан", content = @Content(schema = @Schema(implementation = ReceiverBody.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный запрос или кластер не найден", content = @Content(schema = @Schema(implementation = ApiErrors.ErrorBody.class)))
    @ApiResponse(responseCode = "409", description = "Имя уже занято в проекте")
    @ApiResponse(responseCode = "500", description = "Не удалось делегировать права")
    @ApiResponse(responseCode = "503", description = "Зависимость временно недоступна")
    public HttpResponse<?> create(HttpRequest<?> request, @Nullable @Body Map<String, Object> body) {
        String requestId = ApiErrors.requestId(request);
        try {
            ReceiverSpec spec = ReceiverSpec.fromBody(body);
            ReceiverView created = lifecycle.create(spec, identityResolver.resolve(request));
            return HttpResponse.created(new ReceiverBody(ReceiverRepresentation.of(created)),
                    URI.create("/v1/receivers/" + created.receiver().id()));
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    @Get("/{receiverId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Показать receiver", description = "Поиск по id, затем по имени, затем по короткому id.")
    @ApiResponse(responseCode = "200", description = "Receiver", content = @Content(schema = @Schema(implementation = ReceiverBody.class)))
    @ApiResponse(responseCode = "404", description = "Не найден")
    @ApiResponse(responseCode = "409", description = "Неоднозначное имя или короткий id")
    public HttpResponse<?> show(HttpRequest<?> request, @PathVariable @NotBlank String receiverId) {
        String requestId = ApiErrors.requestId(request);
        try {
            ReceiverView v = lifecycle.show(receiverId, identityResolver.resolve(request));
            return HttpResponse.ok(new ReceiverBody(ReceiverRepresentation.of(v)));
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    @Delete("/{receiverId}")
    @Operation(summary = "Удалить receiver", description = "Делегированный trust отзывается до удаления записи.")
    @ApiResponse(responseCode = "204", description = "Удалён")
    @ApiResponse(responseCode = "403", description = "Недостаточно прав")
    @ApiResponse(responseCode = "404", description = "Не найден")
    public HttpResponse<?> delete(HttpRequest<?> request, @PathVariable @NotBlank String receiverId) {
        String requestId = ApiErrors.requestId(request);
        try {
            lifecycle.delete(receiverId, identityResolver.resolve(request));
            return HttpResponse.noContent();
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    @Post(uri = "/{receiverId}/notify", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Вызвать signal-receiver",
            description = "Вызывающий предъявляет X-Auth-Token проекта receiver'а. Параметры тела перекрывают сохранённые.")
    @ApiResponse(responseCode = "202", description = "Действие поставлено", content = @Content(schema = @Schema(implementation = ActionAccepted.class)))
    @ApiResponse(responseCode = "401", description = "Токен недействителен или не того проекта")
    @ApiResponse(responseCode = "404", description = "Signal-receiver не найден")
    @ApiResponse(responseCode = "409", description = "Action engine отклонил действие")
    public HttpResponse<?> notifyReceiver(HttpRequest<?> request,
                                          @PathVariable @NotBlank String receiverId,
                                          @Nullable @Body Map<String, Object> body) {
        String requestId = ApiErrors.requestId(request);
        try {
            Map<String, Object> params = invocationParams(body);
            InvocationCredentials credentials = new InvocationCredentials(
                    request.getHeaders().get(TokenAuthenticationFetcher.AUTH_TOKEN_HEADER));
            TriggerOutcome outcome = dispatcher.invoke(receiverId, ReceiverType.SIGNAL, params, credentials, requestId);
            return accepted(outcome);
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    /**
     * Извлечь {@code params} из тела вызова ({@code {"params": {...}}}).
     */
    static Map<String, Object> invocationParams(Map<String, Object> body) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (body == null) {
            return out;
        }
        Object params = body.get("params");
        if (params == null) {
            return out;
        }
        if (!(params instanceof Map<?, ?> m)) {
            throw ReceiverException.validation("Поле 'params' должно быть JSON-объектом");
        }
        for (Map.Entry<?, ?> e : m.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    static HttpResponse<ActionAccepted> accepted(TriggerOutcome outcome) {
        return HttpResponse.<ActionAccepted>status(HttpStatus.ACCEPTED)
                .header("Location", "/v1/actions/" + outcome.actionId())
                .body(new ActionAccepted(outcome.actionId()));
    }

    /**
     * Курсор на последний элемент полной страницы; неполная страница последняя.
     */
    static String nextMarker(ReceiverQuery query, List<ReceiverView> page) {
        if (query.limit() == 0 || page.size() < query.limit()) {
            return null;
        }
        return ListMarker.after(page.get(page.size() - 1).receiver(), query.sort()).encode();
    }

    @Serdeable
    @Schema(name = "ReceiverBody", description = "Обёртка одного receiver'а")
    public record ReceiverBody(@Schema(description = "Receiver") ReceiverRepresentation receiver) {
    }

    @Serdeable
    @Schema(name = "ReceiverListBody", description = "Обёртка списка receiver'ов")
    public record ReceiverListBody(@Schema(description = "Receiver'ы") List<ReceiverRepresentation> receivers,
                                   @JsonProperty("next_marker")
                                   @Schema(description = "Значение marker для следующей страницы; отсутствует на последней странице")
                                   @Nullable String nextMarker) {
    }

    @Serdeable
    @Schema(name = "ActionAccepted", description = "Поставленное действие")
    public record ActionAccepted(@Schema(description = "Идентификатор действия") String action) {
    }

    @Serdeable
    @Schema(name = "Receiver", description = "Представление receiver'а")
    public record ReceiverRepresentation(
            @Schema(description = "Идентификатор") String id,
            @Schema(description = "Имя") String name,
            @Schema(description = "Тип", allowableValues = {"webhook", "signal"}) String type,
            @JsonProperty("cluster_id") @Schema(description = "Канонический id кластера") String clusterId,
            @Schema(description = "Действие") String action,
            @Schema(description = "Делегированные права (для webhook: trust_id)") Map<String, Object> actor,
            @Schema(description = "Параметры по умолчанию") Map<String, Object> params,
            @Schema(description = "Канал вызова (для webhook: alarm_url)") Map<String, Object> channel,
            @Schema(description = "Проект") String project,
            @Schema(description = "Домен") String domain,
            @Schema(description = "Создатель") String user,
            @JsonProperty("created_at") @Schema(description = "Время создания") String createdAt,
            @JsonProperty("updated_at") @Schema(description = "Время изменения") String updatedAt
    ) {
        static ReceiverRepresentation of(ReceiverView v) {
            Receiver r = v.receiver();
            return new ReceiverRepresentation(
                    r.id(),
                    r.name(),
                    r.type().wire(),
                    r.clusterId(),
                    r.action().name(),
                    r.actor(),
                    r.params(),
                    v.channel() == null ? null : v.channel().toWire(),
                    r.project(),
                    r.domain(),
                    r.userId(),
                    r.createdAt().toString(),
                    r.updatedAt().toString()
            );
        }
    }
}
