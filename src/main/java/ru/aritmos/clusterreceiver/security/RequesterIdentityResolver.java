package ru.aritmos.clusterreceiver.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Построение {@link RequesterIdentity} для запроса API.
 * <p>
 * Источники по приоритету:
 * <ol>
 *   <li>{@link Authentication}, полученная {@link TokenAuthenticationFetcher};</li>
 *   <li>в режиме OPEN: заголовки {@code X-User-Id}, {@code X-Project-Id}, {@code X-Domain-Id}, {@code X-Roles}.</li>
 * </ol>
 * Без пользователя и проекта запрос считается неаутентифицированным.
 */
@Singleton
public class RequesterIdentityResolver {

    public static final String USER_HEADER = "X-User-Id";
    public static final String PROJECT_HEADER = "X-Project-Id";
    public static final String DOMAIN_HEADER = "X-Domain-Id";
    public static final String ROLES_HEADER = "X-Roles";

    private final ClusterReceiverSecurityProperties securityProperties;

    public RequesterIdentityResolver(ClusterReceiverSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public RequesterIdentity resolve(HttpRequest<?> request) {
        Optional<Authentication> auth = request.getUserPrincipal(Authentication.class);
        if (auth.isPresent()) {
            return fromAuthentication(auth.get());
        }
        if (securityProperties.getMode() == ClusterReceiverSecurityProperties.Mode.OPEN) {
            return fromHeaders(request.getHeaders());
        }
        throw ReceiverException.unauthorized("Требуется аутентификация");
    }

    public ClusterReceiverSecurityProperties.Rbac rbac() {
        return securityProperties.getRbac();
    }

    static RequesterIdentity fromAuthentication(Authentication authentication) {
        Map<String, Object> attrs = authentication.getAttributes();
        String project = attr(attrs, TokenAuthenticationFetcher.ATTR_PROJECT_ID);
        if (project == null) {
            throw ReceiverException.unauthorized("Токен не привязан к проекту");
        }
        return new RequesterIdentity(
                authentication.getName(),
                project,
                attr(attrs, TokenAuthenticationFetcher.ATTR_DOMAIN_ID),
                new ArrayList<>(authentication.getRoles()),
                attr(attrs, TokenAuthenticationFetcher.ATTR_TOKEN)
        );
    }

    static RequesterIdentity fromHeaders(HttpHeaders headers) {
        String user = trimToNull(headers.get(USER_HEADER));
        String project = trimToNull(headers.get(PROJECT_HEADER));
        if (user == null || project == null) {
            throw ReceiverException.unauthorized("Не заданы заголовки " + USER_HEADER + "/" + PROJECT_HEADER);
        }
        return new RequesterIdentity(
                user,
                project,
                trimToNull(headers.get(DOMAIN_HEADER)),
                splitRoles(headers.get(ROLES_HEADER)),
                trimToNull(headers.get(TokenAuthenticationFetcher.AUTH_TOKEN_HEADER))
        );
    }

    static List<String> splitRoles(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split(",")) {
            String r = part.trim();
            if (!r.isEmpty()) {
                out.add(r);
            }
        }
        return out;
    }

    private static String attr(Map<String, Object> attrs, String name) {
        Object v = attrs == null ? null : attrs.get(name);
        if (v instanceof Collection<?> c) {
            v = c.isEmpty() ? null : c.iterator().next();
        }
        return v == null ? null : trimToNull(String.valueOf(v));
    }

    private static String trimToNull(String v) {
        if (v == null) {
            return null;
        }
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
