package ru.aritmos.clusterreceiver.credential;

/**
 * Идентичность, от имени которой действие передаётся в action engine.
 *
 * @param userId пользователь (для webhook: владелец trust)
 * @param projectId проект
 * @param token токен для вызова action engine, не логируется
 * @param delegated true, если получена через impersonation делегированного trust
 */
public record ActingIdentity(String userId, String projectId, String token, boolean delegated) {

    @Override
    public String toString() {
        return "ActingIdentity[userId=" + userId + ", projectId=" + projectId + ", delegated=" + delegated + "]";
    }
}
