package ru.aritmos.clusterreceiver.trigger;

/**
 * Учётные данные, предъявленные при вызове receiver'а.
 * <p>
 * Webhook вызывается анонимно; signal требует токен вызывающего.
 *
 * @param token токен из {@code X-Auth-Token} или null
 */
public record InvocationCredentials(String token) {

    private static final InvocationCredentials ANONYMOUS = new InvocationCredentials(null);

    public static InvocationCredentials anonymous() {
        return ANONYMOUS;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    @Override
    public String toString() {
        return hasToken() ? "InvocationCredentials[token=***]" : "InvocationCredentials[anonymous]";
    }
}
