package ru.aritmos.clusterreceiver.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import ru.aritmos.clusterreceiver.channel.ChannelAllocator;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;
import ru.aritmos.clusterreceiver.trigger.InvocationCredentials;
import ru.aritmos.clusterreceiver.trigger.TriggerDispatcher;
import ru.aritmos.clusterreceiver.trigger.TriggerOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Анонимная точка вызова webhook-receiver'ов ({@code alarm_url}).
 * <p>
 * Вызывающий не предъявляет учётных данных: действие выполняется от имени создателя receiver'а
 * через делегированный trust. Параметры строки запроса (кроме {@code V}) сливаются с параметрами тела,
 * тело побеждает при совпадении ключей.
 */
@Controller("/v1/webhooks")
@Tag(name = "Webhooks", description = "Анонимный вызов webhook-receiver'ов")
public class WebhookTriggerController {

    static final String VERSION_PARAM = "V";

    private final TriggerDispatcher dispatcher;

    public WebhookTriggerController(TriggerDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Post(uri = "/{receiverId}/trigger", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Вызвать webhook-receiver",
            description = "Требуется параметр V=1. Тело (необязательно): {\"params\": {...}}.")
    @ApiResponse(responseCode = "202", description = "Действие поставлено", content = @Content(schema = @Schema(implementation = ReceiverController.ActionAccepted.class)))
    @ApiResponse(responseCode = "400", description = "Некорректная версия webhook или тело", content = @Content(schema = @Schema(implementation = ApiErrors.ErrorBody.class)))
    @ApiResponse(responseCode = "401", description = "Делегированные права отозваны или истекли")
    @ApiResponse(responseCode = "404", description = "Webhook не найден")
    @ApiResponse(responseCode = "409", description = "Action engine отклонил действие")
    @ApiResponse(responseCode = "503", description = "Зависимость временно недоступна")
    public HttpResponse<?> trigger(HttpRequest<?> request,
                                   @PathVariable @NotBlank String receiverId,
                                   @Nullable @Body Map<String, Object> body) {
        String requestId = ApiErrors.requestId(request);
        try {
            Map<String, List<String>> query = request.getParameters().asMap();
            Map<String, Object> params = mergeQueryAndBody(query, ReceiverController.invocationParams(body));
            TriggerOutcome outcome = dispatcher.invoke(receiverId, ReceiverType.WEBHOOK, params,
                    InvocationCredentials.anonymous(), requestId);
            return ReceiverController.accepted(outcome);
        } catch (ReceiverException e) {
            return ApiErrors.toResponse(e, requestId);
        } catch (Exception e) {
            return ApiErrors.internal(e, requestId);
        }
    }

    /**
     * Проверить {@code V} и слить параметры строки запроса с параметрами тела.
     */
    static Map<String, Object> mergeQueryAndBody(Map<String, List<String>> query, Map<String, Object> bodyParams) {
        List<String> versions = query.get(VERSION_PARAM);
        if (versions == null || versions.size() != 1 || !ChannelAllocator.WEBHOOK_VERSION.equals(versions.get(0))) {
            throw ReceiverException.validation("Параметр V должен быть равен " + ChannelAllocator.WEBHOOK_VERSION);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : query.entrySet()) {
            if (VERSION_PARAM.equals(e.getKey()) || e.getValue() == null || e.getValue().isEmpty()) {
                continue;
            }
            out.put(e.getKey(), e.getValue().size() == 1 ? e.getValue().get(0) : List.copyOf(e.getValue()));
        }
        out.putAll(bodyParams);
        return out;
    }
}
