package ru.aritmos.clusterreceiver.identity;

import ru.aritmos.clusterreceiver.core.SensitiveDataSanitizer;

/**
 * Ошибка обращения к identity-сервису.
 * <p>
 * {@link #httpStatus()} равен {@code -1}, если ответ не был получен (таймаут, обрыв соединения).
 * Перевод в доменные ошибки (DelegationFailed, RevocationFailed, CredentialInvalid) выполняет вызывающий код.
 */
public class IdentityCallException extends RuntimeException {

    private final int httpStatus;

    public IdentityCallException(int httpStatus, String message) {
        super(SensitiveDataSanitizer.sanitizeText(message));
        this.httpStatus = httpStatus;
    }

    public IdentityCallException(String message, Throwable cause) {
        super(SensitiveDataSanitizer.sanitizeText(message), cause);
        this.httpStatus = -1;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean isTransport() {
        return httpStatus < 0;
    }

    public boolean isNotFound() {
        return httpStatus == 404;
    }

    public boolean isAuthRejected() {
        return httpStatus == 401 || httpStatus == 403;
    }
}
