package ru.aritmos.clusterreceiver.security;

import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;

import java.util.List;

/**
 * Аутентифицированный контекст запрашивающего API.
 *
 * @param userId пользователь
 * @param projectId проект (область видимости receiver'ов)
 * @param domainId домен
 * @param roles роли пользователя в проекте
 * @param token токен пользователя; нужен для делегирования и обращения к реестру кластеров, не логируется
 */
public record RequesterIdentity(String userId,
                                String projectId,
                                String domainId,
                                List<String> roles,
                                String token) {

    public RequesterIdentity {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * Operator-scope: глобальный листинг и операции над чужими проектами.
     */
    public boolean isOperator(ClusterReceiverSecurityProperties.Rbac rbac) {
        return hasRole(rbac.getAdminRole());
    }

    /**
     * Право изменять receiver'ы своего проекта (create/delete/notify).
     */
    public boolean canWrite(ClusterReceiverSecurityProperties.Rbac rbac) {
        return isOperator(rbac) || hasRole(rbac.getMemberRole());
    }

    /**
     * Право читать receiver'ы своего проекта (list/show).
     */
    public boolean canRead(ClusterReceiverSecurityProperties.Rbac rbac) {
        return canWrite(rbac) || hasRole(rbac.getReadonlyRole());
    }

    public boolean hasRole(String role) {
        if (role == null) {
            return false;
        }
        for (String r : roles) {
            if (r.equalsIgnoreCase(role)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "RequesterIdentity[userId=" + userId + ", projectId=" + projectId + ", domainId=" + domainId
                + ", roles=" + roles + "]";
    }
}
