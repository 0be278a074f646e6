package ru.aritmos.clusterreceiver.checks;

import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.event.ApplicationStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.engine.ActionEngineClient;
import ru.aritmos.clusterreceiver.identity.IdentityServiceClient;
import ru.aritmos.clusterreceiver.registry.ClusterRegistryClient;

/**
 * Исполнитель стартовых проверок зависимостей.
 * <p>
 * Если проверка помечена как critical и failFast=true, сервис падает на старте.
 * Если critical=false, ошибка логируется как предупреждение, и запуск продолжается.
 */
@Singleton
public class StartupChecksRunner implements ApplicationEventListener<ApplicationStartupEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupChecksRunner.class);

    private final StartupChecksConfiguration cfg;
    private final IdentityServiceClient identity;
    private final ActionEngineClient actionEngine;
    private final ClusterRegistryClient clusterRegistry;

    public StartupChecksRunner(StartupChecksConfiguration cfg,
                               IdentityServiceClient identity,
                               ActionEngineClient actionEngine,
                               ClusterRegistryClient clusterRegistry) {
        this.cfg = cfg;
        this.identity = identity;
        this.actionEngine = actionEngine;
        this.clusterRegistry = clusterRegistry;
    }

    @Override
    public void onApplicationEvent(ApplicationStartupEvent event) {
        runAll();
    }

    void runAll() {
        if (!cfg.isEnabled()) {
            log.info("Стартовые проверки зависимостей отключены настройкой clusterreceiver.startup-checks.enabled=false");
            return;
        }
        runOne("identity", cfg.getIdentity(), identity::ping);
        runOne("action-engine", cfg.getActionEngine(), actionEngine::ping);
        runOne("cluster-registry", cfg.getClusterRegistry(), clusterRegistry::ping);
    }

    static void runOne(String name, StartupChecksConfiguration.CheckConfig c, Runnable action) {
        if (c == null || !c.isEnabled()) {
            return;
        }
        try {
            action.run();
            log.info("Стартовая проверка '{}' успешно пройдена", name);
        } catch (RuntimeException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (c.isCritical() && c.isFailFast()) {
                throw new IllegalStateException("Критичная зависимость недоступна (" + name + "): " + msg, e);
            }
            if (c.isCritical()) {
                log.error("Критичная зависимость недоступна ({}), но fail-fast выключен: {}", name, msg);
            } else {
                log.warn("Некритичная зависимость недоступна ({}): {}", name, msg);
            }
        }
    }
}
