package ru.aritmos.clusterreceiver.identity;

import java.util.Optional;

/**
 * Проверка пользовательского токена в identity-сервисе.
 */
@FunctionalInterface
public interface TokenValidator {

    /**
     * @return разобранный токен или empty, если токен недействителен
     * @throws IdentityCallException если identity-сервис недоступен
     */
    Optional<TokenInfo> validateToken(String subjectToken);
}
