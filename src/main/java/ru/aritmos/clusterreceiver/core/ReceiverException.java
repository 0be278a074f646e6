package ru.aritmos.clusterreceiver.core;

/**
 * Единое исключение подсистемы receiver'ов.
 * <p>
 * Вид ошибки ({@link ErrorKind}) определяет HTTP-статус и политику повторов.
 * Сообщение всегда проходит через {@link SensitiveDataSanitizer}: токены и идентификаторы trust не должны попадать
 * ни в ответ клиенту, ни в логи.
 */
public class ReceiverException extends RuntimeException {

    /**
     * Таксономия ошибок.
     */
    public enum ErrorKind {
        /** Некорректный запрос (тип, action, ссылка на кластер, параметры). Без побочных эффектов. */
        VALIDATION(400),
        /** Не прошла аутентификация вызова (webhook/signal) или запроса API. */
        UNAUTHORIZED(401),
        /** Аутентифицирован, но недостаточно прав. */
        FORBIDDEN(403),
        /** Объект не найден или невидим запрашивающему. */
        NOT_FOUND(404),
        /** Запрошенная микроверсия API вне поддерживаемого диапазона. */
        VERSION_NOT_ACCEPTABLE(406),
        /** Конфликт имени или неоднозначный поиск. */
        CONFLICT(409),
        /** Action engine отклонил постановку действия. */
        DISPATCH_REJECTED(409),
        /** Identity-сервис не выдал делегированный trust. */
        DELEGATION_FAILED(500),
        /** Identity-сервис не отозвал trust (временная ошибка, можно повторить). */
        REVOCATION_FAILED(500),
        /** Trust уже отозван или не существует (не фатально). */
        ALREADY_REVOKED(500),
        /** Делегированный trust отозван или истёк. */
        CREDENTIAL_INVALID(401),
        /** Внутренняя ошибка. */
        INTERNAL(500),
        /** Временная недоступность зависимости, безопасно повторить с backoff. */
        UNAVAILABLE(503);

        private final int httpStatus;

        ErrorKind(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final ErrorKind kind;

    public ReceiverException(ErrorKind kind, String message) {
        super(SensitiveDataSanitizer.sanitizeText(message));
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
    }

    public ReceiverException(ErrorKind kind, String message, Throwable cause) {
        super(SensitiveDataSanitizer.sanitizeText(message), cause);
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static ReceiverException validation(String message) {
        return new ReceiverException(ErrorKind.VALIDATION, message);
    }

    public static ReceiverException notFound(String message) {
        return new ReceiverException(ErrorKind.NOT_FOUND, message);
    }

    public static ReceiverException forbidden(String message) {
        return new ReceiverException(ErrorKind.FORBIDDEN, message);
    }

    public static ReceiverException unauthorized(String message) {
        return new ReceiverException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ReceiverException conflict(String message) {
        return new ReceiverException(ErrorKind.CONFLICT, message);
    }

    public static ReceiverException unavailable(String message, Throwable cause) {
        return new ReceiverException(ErrorKind.UNAVAILABLE, message, cause);
    }

    public boolean is(ErrorKind expected) {
        return kind == expected;
    }
}
