package ru.aritmos.clusterreceiver.api;

import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Микроверсия API ({@code OpenStack-API-Version: clustering X.Y}).
 *
 * @param major мажорная часть
 * @param minor минорная часть
 */
public record ApiVersion(int major, int minor) implements Comparable<ApiVersion> {

    public static final String HEADER = "OpenStack-API-Version";
    public static final String SERVICE = "clustering";
    public static final String ATTRIBUTE = "clusterreceiver.api-version";

    private static final Pattern VERSION = Pattern.compile("^([1-9]\\d*)\\.(0|[1-9]\\d*)$");

    /**
     * Разобрать строку вида {@code 1.10}.
     *
     * @throws ReceiverException VALIDATION для некорректной строки
     */
    public static ApiVersion parse(String value) {
        Matcher m = VERSION.matcher(value == null ? "" : value.trim());
        if (!m.matches()) {
            throw ReceiverException.validation("Некорректная версия API: '" + value + "'");
        }
        try {
            return new ApiVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            throw ReceiverException.validation("Некорректная версия API: '" + value + "'");
        }
    }

    /**
     * Выбрать версию для запроса.
     * <p>
     * Без заголовка используется минимальная версия, {@code latest} означает максимальную.
     * Заголовок может перечислять версии нескольких сервисов через запятую, учитывается только {@code clustering}.
     *
     * @throws ReceiverException VALIDATION для некорректного заголовка, VERSION_NOT_ACCEPTABLE вне диапазона
     */
    public static ApiVersion negotiate(String header, ApiVersion min, ApiVersion max) {
        if (header == null || header.isBlank()) {
            return min;
        }
        String requested = null;
        for (String item : header.split(",")) {
            String[] parts = item.trim().split("\\s+");
            if (parts.length == 2 && parts[0].toLowerCase(Locale.ROOT).equals(SERVICE)) {
                requested = parts[1];
                break;
            }
            if (parts.length != 2) {
                throw ReceiverException.validation("Некорректный заголовок " + HEADER + ": '" + header + "'");
            }
        }
        if (requested == null) {
            return min;
        }
        if (requested.equalsIgnoreCase("latest")) {
            return max;
        }
        ApiVersion v = parse(requested);
        if (v.compareTo(min) < 0 || v.compareTo(max) > 0) {
            throw new ReceiverException(ReceiverException.ErrorKind.VERSION_NOT_ACCEPTABLE,
                    "Версия API " + v + " не поддерживается, допустимо от " + min + " до " + max);
        }
        return v;
    }

    @Override
    public int compareTo(ApiVersion o) {
        int c = Integer.compare(major, o.major);
        return c != 0 ? c : Integer.compare(minor, o.minor);
    }

    public String headerValue() {
        return SERVICE + " " + this;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
