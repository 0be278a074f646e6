package ru.aritmos.clusterreceiver.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.core.CorrelationContext;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.core.SensitiveDataSanitizer;

/**
 * Перевод ошибок в HTTP-ответы API.
 * <p>
 * Тело ошибки: {@code {"code": <status>, "error": {"type": "<KIND>", "message": "..."}, "request_id": "req-..."}}.
 * Сообщение всегда санитизировано.
 */
public final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {
    }

    public static MutableHttpResponse<ErrorBody> toResponse(ReceiverException e, String requestId) {
        ReceiverException.ErrorKind kind = e.kind();
        if (kind.httpStatus() >= 500) {
            log.warn("[API] Ошибка {} requestId={}: {}", kind, requestId, e.getMessage());
        }
        return respond(kind.httpStatus(), kind.name(), e.getMessage(), requestId);
    }

    /**
     * Непредвиденная ошибка: наружу уходит только общий текст.
     */
    public static MutableHttpResponse<ErrorBody> internal(Exception e, String requestId) {
        log.error("[API] Внутренняя ошибка requestId={}: {}", requestId, SensitiveDataSanitizer.sanitizeText(String.valueOf(e.getMessage())), e);
        return respond(500, ReceiverException.ErrorKind.INTERNAL.name(), "Внутренняя ошибка сервиса", requestId);
    }

    public static String requestId(HttpRequest<?> request) {
        return request.getAttribute(CorrelationContext.ATTRIBUTE, CorrelationContext.class)
                .map(CorrelationContext::requestId)
                .orElseGet(() -> CorrelationContext.resolve(request.getHeaders().get(CorrelationContext.REQUEST_ID_HEADER)).requestId());
    }

    private static MutableHttpResponse<ErrorBody> respond(int status, String type, String message, String requestId) {
        ErrorBody body = new ErrorBody(status, new ErrorDetail(type, SensitiveDataSanitizer.sanitizeText(message)), requestId);
        return HttpResponse.<ErrorBody>status(HttpStatus.valueOf(status)).body(body);
    }

    @Serdeable
    @Schema(name = "ErrorBody", description = "Ошибка API")
    public record ErrorBody(
            @Schema(description = "HTTP-статус") int code,
            @Schema(description = "Вид и текст ошибки") ErrorDetail error,
            @JsonProperty("request_id") @Schema(description = "Идентификатор запроса") String requestId
    ) {
    }

    @Serdeable
    @Schema(name = "ErrorDetail", description = "Вид и текст ошибки")
    public record ErrorDetail(
            @Schema(description = "Вид ошибки", example = "NOT_FOUND") String type,
            @Schema(description = "Санитизированное сообщение") String message
    ) {
    }
}
