package ru.aritmos.clusterreceiver.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ResponseFilter;
import io.micronaut.http.annotation.ServerFilter;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.CorrelationContext;
import ru.aritmos.clusterreceiver.core.ReceiverException;

/**
 * Общая обработка запросов {@code /v1/**}: идентификатор запроса и согласование микроверсии.
 * <p>
 * Каждый ответ получает {@code X-OpenStack-Request-Id}, {@code OpenStack-API-Version} и
 * {@code Vary: OpenStack-API-Version}. Некорректный заголовок версии даёт 400, версия вне диапазона 406.
 */
@ServerFilter("/v1/**")
public class ApiRequestFilter {

    private final ApiVersion minVersion;
    private final ApiVersion maxVersion;

    public ApiRequestFilter(ClusterReceiverProperties properties) {
        this.minVersion = ApiVersion.parse(properties.getApi().getMinVersion());
        this.maxVersion = ApiVersion.parse(properties.getApi().getMaxVersion());
    }

    @RequestFilter
    @Nullable
    public HttpResponse<?> onRequest(HttpRequest<?> request) {
        HttpHeaders headers = request.getHeaders();
        String incoming = headers.get(CorrelationContext.REQUEST_ID_HEADER);
        if (incoming == null || incoming.isBlank()) {
            incoming = headers.get(CorrelationContext.FALLBACK_REQUEST_ID_HEADER);
        }
        CorrelationContext ctx = CorrelationContext.resolve(incoming);
        request.setAttribute(CorrelationContext.ATTRIBUTE, ctx);

        try {
            ApiVersion version = ApiVersion.negotiate(headers.get(ApiVersion.HEADER), minVersion, maxVersion);
            request.setAttribute(ApiVersion.ATTRIBUTE, version);
            return null;
        } catch (ReceiverException e) {
            MutableHttpResponse<?> response = ApiErrors.toResponse(e, ctx.requestId());
            decorate(response, ctx, minVersion);
            return response;
        }
    }

    @ResponseFilter
    public void onResponse(HttpRequest<?> request, MutableHttpResponse<?> response) {
        CorrelationContext ctx = request.getAttribute(CorrelationContext.ATTRIBUTE, CorrelationContext.class)
                .orElseGet(() -> CorrelationContext.resolve(null));
        ApiVersion version = request.getAttribute(ApiVersion.ATTRIBUTE, ApiVersion.class).orElse(minVersion);
        decorate(response, ctx, version);
    }

    private static void decorate(MutableHttpResponse<?> response, CorrelationContext ctx, ApiVersion version) {
        response.header(CorrelationContext.REQUEST_ID_HEADER, ctx.requestId());
        response.header(ApiVersion.HEADER, version.headerValue());
        response.header(HttpHeaders.VARY, ApiVersion.HEADER);
    }
}
