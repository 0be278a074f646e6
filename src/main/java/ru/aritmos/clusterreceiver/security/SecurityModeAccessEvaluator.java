package ru.aritmos.clusterreceiver.security;

import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;

import java.util.List;

/**
 * Оценивает доступ к пути согласно режиму безопасности сервиса.
 */
@Singleton
public class SecurityModeAccessEvaluator {

    private static final List<String> TECHNICAL_PATHS = List.of(
            "/health", "/health/**", "/info", "/info/**", "/swagger/**", "/swagger-ui/**");

    public enum Decision {
        ALLOW,
        REQUIRE_AUTH
    }

    public Decision evaluate(String path, ClusterReceiverSecurityProperties props) {
        ClusterReceiverSecurityProperties effective = props == null
                ? new ClusterReceiverSecurityProperties()
                : props;
        ClusterReceiverSecurityProperties.Mode mode = effective.getMode();
        if (mode == null || mode == ClusterReceiverSecurityProperties.Mode.OPEN) {
            return Decision.ALLOW;
        }

        // Анонимный webhook-триггер допустим в обоих token-режимах: его аутентифицирует делегированный trust.
        if (effective.getAnonymous() != null
                && effective.getAnonymous().isEnabled()
                && matchesAny(path, effective.getAnonymous().getAllowPaths())) {
            return Decision.ALLOW;
        }

        if (matchesAny(path, TECHNICAL_PATHS)) {
            return Decision.ALLOW;
        }
        return Decision.REQUIRE_AUTH;
    }

    boolean matchesAny(String path, List<String> patterns) {
        if (path == null || path.isBlank() || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String p : patterns) {
            if (matches(path, p)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String path, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String p = pattern.trim();
        if ("/**".equals(p) || "*".equals(p)) {
            return true;
        }
        if (p.endsWith("/**")) {
            String prefix = p.substring(0, p.length() - 3);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        }
        if (path.equals(p)) {
            return true;
        }
        return p.endsWith("/") && path.equals(p.substring(0, p.length() - 1));
    }
}
