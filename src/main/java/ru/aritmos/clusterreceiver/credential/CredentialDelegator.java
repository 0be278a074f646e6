package ru.aritmos.clusterreceiver.credential;

import ru.aritmos.clusterreceiver.security.RequesterIdentity;

/**
 * Адаптер к identity-сервису для делегированных credential'ов.
 * <p>
 * Вынесен в интерфейс, чтобы менеджер жизненного цикла и диспетчер триггеров тестировались
 * без реального identity-сервиса.
 */
public interface CredentialDelegator {

    /**
     * Выпустить делегированный credential, позволяющий действовать от имени запрашивающего
     * в пределах области {@code scope} до явного отзыва.
     *
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException DELEGATION_FAILED
     */
    CredentialHandle issue(RequesterIdentity requester, DelegationScope scope);

    /**
     * Отозвать credential.
     *
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException ALREADY_REVOKED (не фатально)
     *                                                           или REVOCATION_FAILED (временная ошибка)
     */
    void revoke(CredentialHandle handle);

    /**
     * Получить идентичность владельца credential'а.
     *
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException CREDENTIAL_INVALID, если credential отозван или истёк
     */
    ActingIdentity impersonate(CredentialHandle handle);

    /**
     * Забыть закэшированный токен credential'а, если внешний сервис его отверг.
     * Следующий {@link #impersonate} заново спросит identity-сервис.
     */
    void evict(CredentialHandle handle);
}
