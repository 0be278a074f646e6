package ru.aritmos.clusterreceiver.identity;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Разобранный токен identity-сервиса.
 *
 * @param token значение токена (не логируется)
 * @param userId пользователь (для trust-scoped токена: trustor при impersonation)
 * @param projectId проект области действия токена
 * @param domainId домен пользователя
 * @param roles роли в проекте
 * @param trustId идентификатор trust, если токен trust-scoped
 * @param expiresAt время истечения или null
 */
public record TokenInfo(String token,
                        String userId,
                        String projectId,
                        String domainId,
                        List<String> roles,
                        String trustId,
                        Instant expiresAt) {

    public TokenInfo {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * Разобрать тело ответа {@code /v3/auth/tokens}.
     *
     * @param token значение из заголовка {@code X-Subject-Token}
     * @param body тело ответа
     */
    public static TokenInfo fromTokenBody(String token, JsonNode body) {
        JsonNode t = body == null ? null : body.path("token");
        if (t == null || t.isMissingNode()) {
            throw new IdentityCallException(502, "Ответ identity-сервиса не содержит token");
        }
        JsonNode user = t.path("user");
        JsonNode project = t.path("project");

        List<String> roles = new ArrayList<>();
        for (JsonNode r : t.path("roles")) {
            String name = r.path("name").asText(null);
            if (name != null && !name.isBlank()) {
                roles.add(name);
            }
        }

        String domainId = text(user.path("domain"), "id");
        if (domainId == null) {
            domainId = text(project.path("domain"), "id");
        }

        String trustId = text(t.path("OS-TRUST:trust"), "id");

        return new TokenInfo(
                token,
                text(user, "id"),
                text(project, "id"),
                domainId,
                roles,
                trustId,
                parseInstant(t.path("expires_at").asText(null))
        );
    }

    public boolean expiresWithin(Instant now, long millis) {
        return expiresAt != null && !expiresAt.isAfter(now.plusMillis(millis));
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isMissingNode()) {
            return null;
        }
        String v = node.path(field).asText(null);
        return v == null || v.isBlank() ? null : v;
    }

    private static Instant parseInstant(String v) {
        if (v == null || v.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
