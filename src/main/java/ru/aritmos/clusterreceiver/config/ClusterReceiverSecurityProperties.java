package ru.aritmos.clusterreceiver.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.List;

/**
 * Typed-конфигурация security-контура Cluster Receiver Service.
 * <p>
 * Режимы:
 * <ul>
 *   <li>OPEN: аутентификация не требуется, идентичность запрашивающего берётся из заголовков
 *   {@code X-User-Id}/{@code X-Project-Id}/{@code X-Roles} (стенды и локальная разработка);</li>
 *   <li>TOKEN_OPTIONAL: анонимно доступны только пути из {@code anonymous.allow-paths};</li>
 *   <li>TOKEN_REQUIRED: все бизнес-пути требуют токен identity-сервиса.</li>
 * </ul>
 * Путь webhook-триггера всегда должен быть в anonymous allow-list: вызывающий его не предъявляет учётных данных.
 */
@ConfigurationProperties("clusterreceiver.security")
public class ClusterReceiverSecurityProperties {

    public enum Mode {
        OPEN,
        TOKEN_OPTIONAL,
        TOKEN_REQUIRED
    }

    private Mode mode = Mode.OPEN;

    private Anonymous anonymous = new Anonymous();
    private Rbac rbac = new Rbac();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode == null ? Mode.OPEN : mode;
    }

    public Anonymous getAnonymous() {
        return anonymous;
    }

    public void setAnonymous(Anonymous anonymous) {
        this.anonymous = anonymous == null ? new Anonymous() : anonymous;
    }

    public Rbac getRbac() {
        return rbac;
    }

    public void setRbac(Rbac rbac) {
        this.rbac = rbac == null ? new Rbac() : rbac;
    }

    @ConfigurationProperties("anonymous")
    public static class Anonymous {
        private boolean enabled = true;
        private List<String> allowPaths = List.of("/v1/webhooks/**", "/health");

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getAllowPaths() {
            return allowPaths;
        }

        public void setAllowPaths(List<String> allowPaths) {
            this.allowPaths = (allowPaths == null || allowPaths.isEmpty()) ? List.of() : List.copyOf(allowPaths);
        }
    }

    /**
     * Роли:
     * <ul>
     *   <li>admin: operator-scope: глобальный листинг и операции над receiver'ами чужих проектов;</li>
     *   <li>member: создание, удаление и signal-вызовы в своём проекте;</li>
     *   <li>readonly: только list/show.</li>
     * </ul>
     */
    @ConfigurationProperties("rbac")
    public static class Rbac {
        private String adminRole = "admin";
        private String memberRole = "member";
        private String readonlyRole = "reader";

        public String getAdminRole() {
            return adminRole;
        }

        public void setAdminRole(String adminRole) {
            this.adminRole = normalizeRole(adminRole, "admin");
        }

        public String getMemberRole() {
            return memberRole;
        }

        public void setMemberRole(String memberRole) {
            this.memberRole = normalizeRole(memberRole, "member");
        }

        public String getReadonlyRole() {
            return readonlyRole;
        }

        public void setReadonlyRole(String readonlyRole) {
            this.readonlyRole = normalizeRole(readonlyRole, "reader");
        }

        private static String normalizeRole(String value, String fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return value.trim();
        }
    }
}
