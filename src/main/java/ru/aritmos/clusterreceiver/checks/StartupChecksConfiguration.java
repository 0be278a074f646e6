package ru.aritmos.clusterreceiver.checks;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

/**
 * Конфигурация стартовых проверок зависимостей (fail-fast).
 * <p>
 * Без identity-сервиса нельзя ни создать webhook-receiver, ни вызвать его, поэтому его проверку
 * обычно делают критичной. Action engine и реестр кластеров допускают «degraded mode»: листинг и удаление
 * receiver'ов работают и без них.
 */
@Introspected
@ConfigurationProperties("clusterreceiver.startup-checks")
public class StartupChecksConfiguration {

    /**
     * Глобальный флаг включения стартовых проверок.
     */
    private boolean enabled = true;

    private CheckConfig identity = new CheckConfig();
    private CheckConfig actionEngine = new CheckConfig();
    private CheckConfig clusterRegistry = new CheckConfig();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CheckConfig getIdentity() {
        return identity;
    }

    public void setIdentity(CheckConfig identity) {
        this.identity = identity;
    }

    public CheckConfig getActionEngine() {
        return actionEngine;
    }

    public void setActionEngine(CheckConfig actionEngine) {
        this.actionEngine = actionEngine;
    }

    public CheckConfig getClusterRegistry() {
        return clusterRegistry;
    }

    public void setClusterRegistry(CheckConfig clusterRegistry) {
        this.clusterRegistry = clusterRegistry;
    }

    /**
     * Конфигурация проверки одной зависимости.
     */
    @Introspected
    public static class CheckConfig {
        /** включена ли проверка */
        private boolean enabled = false;
        /** считать ли зависимость критичной */
        private boolean critical = false;
        /** «ронять» ли сервис при ошибке (если зависимость критична) */
        private boolean failFast = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isCritical() {
            return critical;
        }

        public void setCritical(boolean critical) {
            this.critical = critical;
        }

        public boolean isFailFast() {
            return failFast;
        }

        public void setFailFast(boolean failFast) {
            this.failFast = failFast;
        }
    }
}
