package ru.aritmos.clusterreceiver.lifecycle;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.channel.ChannelAllocator;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.CredentialDelegator;
import ru.aritmos.clusterreceiver.credential.CredentialHandle;
import ru.aritmos.clusterreceiver.credential.DelegationScope;
import ru.aritmos.clusterreceiver.engine.ClusterAction;
import ru.aritmos.clusterreceiver.event.EventJournal;
import ru.aritmos.clusterreceiver.event.EventLevel;
import ru.aritmos.clusterreceiver.event.ReceiverEvent;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverQuery;
import ru.aritmos.clusterreceiver.receiver.ReceiverSpec;
import ru.aritmos.clusterreceiver.receiver.ReceiverStore;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;
import ru.aritmos.clusterreceiver.registry.ClusterRef;
import ru.aritmos.clusterreceiver.registry.ClusterRegistryClient;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Жизненный цикл receiver'ов: создание, удаление, листинг, поиск.
 * <p>
 * Порядок создания webhook-receiver'а: проверки → делегирование trust → запись в хранилище.
 * Если запись не удалась, только что выпущенный trust отзывается, чтобы не оставлять «висящих» прав.
 * <p>
 * Порядок удаления: отзыв trust → CAS-очистка actor → удаление записи. Повторное удаление после частичного
 * сбоя видит пустой actor и только удаляет запись.
 */
@Singleton
public class ReceiverLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ReceiverLifecycleManager.class);

    static final int MAX_NAME_LENGTH = 255;
    static final String ACTOR_ROLES = "roles";

    private final ReceiverStore store;
    private final CredentialDelegator delegator;
    private final ClusterRegistryClient registry;
    private final ChannelAllocator channels;
    private final EventJournal journal;
    private final ClusterReceiverSecurityProperties.Rbac rbac;
    private final Clock clock;

    @Inject
    public ReceiverLifecycleManager(ReceiverStore store,
                                    CredentialDelegator delegator,
                                    ClusterRegistryClient registry,
                                    ChannelAllocator channels,
                                    EventJournal journal,
                                    ClusterReceiverSecurityProperties securityProperties) {
        this(store, delegator, registry, channels, journal, securityProperties.getRbac(), Clock.systemUTC());
    }

    public ReceiverLifecycleManager(ReceiverStore store,
                                    CredentialDelegator delegator,
                                    ClusterRegistryClient registry,
                                    ChannelAllocator channels,
                                    EventJournal journal,
                                    ClusterReceiverSecurityProperties.Rbac rbac,
                                    Clock clock) {
        this.store = store;
        this.delegator = delegator;
        this.registry = registry;
        this.channels = channels;
        this.journal = journal;
        this.rbac = rbac;
        this.clock = clock;
    }

    /**
     * Создать receiver.
     *
     * @throws ReceiverException VALIDATION, FORBIDDEN, CONFLICT, DELEGATION_FAILED, UNAVAILABLE
     */
    public ReceiverView create(ReceiverSpec spec, RequesterIdentity requester) {
        if (!requester.canWrite(rbac)) {
            throw ReceiverException.forbidden("Недостаточно прав для создания receiver'а");
        }

        String name = spec.name() == null ? null : spec.name().trim();
        if (name == null || name.isEmpty()) {
            throw ReceiverException.validation("Не задано имя receiver'а");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw ReceiverException.validation("Имя receiver'а длиннее " + MAX_NAME_LENGTH + " символов");
        }
        if (spec.type() == null) {
            throw ReceiverException.validation("Не задан тип receiver'а");
        }
        ReceiverType type = ReceiverType.fromWire(spec.type());

        ClusterAction action = ClusterAction.fromName(spec.action())
                .filter(ClusterAction::allowedForReceiver)
                .orElseThrow(() -> ReceiverException.validation("Недопустимое действие receiver'а: '" + spec.action() + "'"));

        if (spec.clusterRef() == null || spec.clusterRef().isBlank()) {
            throw ReceiverException.validation("Не задан cluster_id");
        }
        List<String> delegatedRoles = type == ReceiverType.WEBHOOK ? rolesHint(spec.actorHint(), requester) : List.of();

        if (!store.findByName(requester.projectId(), name).isEmpty()) {
            throw ReceiverException.conflict("Receiver с именем '" + name + "' уже существует в проекте");
        }

        ClusterRef cluster = registry.find(spec.clusterRef().trim(), requester)
                .orElseThrow(() -> ReceiverException.validation("Кластер '" + spec.clusterRef() + "' не найден"));

        CredentialHandle handle = null;
        if (type == ReceiverType.WEBHOOK) {
            handle = delegator.issue(requester, new DelegationScope(cluster.id(), action.name(), delegatedRoles));
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Receiver receiver = new Receiver(
                UUID.randomUUID().toString(),
                name,
                type,
                cluster.id(),
                action,
                handle == null ? Map.of() : handle.toActor(),
                spec.params(),
                requester.projectId(),
                requester.domainId(),
                requester.userId(),
                now,
                now
        );

        try {
            store.insert(receiver);
        } catch (RuntimeException e) {
            if (handle != null) {
                compensate(handle, receiver);
            }
            throw e;
        }

        log.info("[RECEIVER] Создан receiver {} '{}' type={} cluster={} action={} project={}",
                receiver.id(), name, type.wire(), cluster.id(), action, requester.projectId());
        journal.record(ReceiverEvent.of(clock.instant(), receiver.id(), name, cluster.id(),
                ReceiverEvent.RECEIVER_CREATE, EventLevel.INFO, "CREATED", "Receiver создан",
                requester.userId(), requester.projectId()));
        return view(receiver);
    }

    /**
     * Удалить receiver вместе с его делегированными правами.
     *
     * @throws ReceiverException NOT_FOUND, FORBIDDEN, CONFLICT, UNAVAILABLE
     */
    public void delete(String idOrName, RequesterIdentity requester) {
        Receiver receiver = find(idOrName, requester);
        if (!requester.canWrite(rbac)
                || (!requester.isOperator(rbac) && !receiver.project().equals(requester.projectId()))) {
            throw ReceiverException.forbidden("Недостаточно прав для удаления receiver'а");
        }

        Optional<CredentialHandle> credential = receiver.credential();
        String revokeNote = "без делегированных прав";
        boolean revokeFailed = false;
        if (credential.isPresent()) {
            boolean released;
            try {
                delegator.revoke(credential.get());
                released = true;
                revokeNote = "trust отозван";
            } catch (ReceiverException e) {
                if (e.is(ReceiverException.ErrorKind.ALREADY_REVOKED)) {
                    log.info("[RECEIVER] Trust receiver'а {} уже был отозван", receiver.id());
                    released = true;
                    revokeNote = "trust уже был отозван";
                } else {
                    log.warn("[RECEIVER] Не удалось отозвать trust receiver'а {}: {} {}", receiver.id(), e.kind(), e.getMessage());
                    released = false;
                    revokeFailed = true;
                    revokeNote = "trust не отозван: " + e.kind();
                }
            }
            if (released && !store.clearActor(receiver.id(), receiver.actor())) {
                log.debug("[RECEIVER] actor receiver'а {} уже очищен параллельным удалением", receiver.id());
            }
        }

        if (!store.delete(receiver.id())) {
            throw ReceiverException.notFound("Receiver '" + idOrName + "' не найден");
        }
        log.info("[RECEIVER] Удалён receiver {} '{}' ({})", receiver.id(), receiver.name(), revokeNote);
        journal.record(ReceiverEvent.of(clock.instant(), receiver.id(), receiver.name(), receiver.clusterId(),
                ReceiverEvent.RECEIVER_DELETE, revokeFailed ? EventLevel.WARNING : EventLevel.INFO,
                "DELETED", "Receiver удалён, " + revokeNote, requester.userId(), receiver.project()));
    }

    /**
     * Листинг receiver'ов. Без {@code global_project} ограничен проектом запрашивающего.
     */
    public List<ReceiverView> list(ReceiverQuery query, RequesterIdentity requester) {
        if (!requester.canRead(rbac)) {
            throw ReceiverException.forbidden("Недостаточно прав для просмотра receiver'ов");
        }
        if (query.globalProject() && !requester.isOperator(rbac)) {
            throw ReceiverException.forbidden("Листинг по всем проектам доступен только оператору");
        }
        String project = query.globalProject() ? null : requester.projectId();
        List<ReceiverView> out = new ArrayList<>();
        for (Receiver r : store.list(query, project)) {
            out.add(view(r));
        }
        return out;
    }

    public ReceiverView show(String idOrName, RequesterIdentity requester) {
        if (!requester.canRead(rbac)) {
            throw ReceiverException.forbidden("Недостаточно прав для просмотра receiver'а");
        }
        return view(find(idOrName, requester));
    }

    /**
     * Поиск в области видимости запрашивающего: точный id → уникальное имя → уникальный префикс id.
     *
     * @throws ReceiverException NOT_FOUND, CONFLICT при неоднозначности
     */
    public Receiver find(String idOrName, RequesterIdentity requester) {
        if (idOrName == null || idOrName.isBlank()) {
            throw ReceiverException.notFound("Receiver не найден");
        }
        String ref = idOrName.trim();
        String project = requester.isOperator(rbac) ? null : requester.projectId();

        Optional<Receiver> exact = store.findById(ref).filter(r -> project == null || project.equals(r.project()));
        if (exact.isPresent()) {
            return exact.get();
        }
        Optional<Receiver> byName = unique(store.findByName(project, ref), ref);
        if (byName.isPresent()) {
            return byName.get();
        }
        return unique(store.findByShortId(project, ref), ref)
                .orElseThrow(() -> ReceiverException.notFound("Receiver '" + ref + "' не найден"));
    }

    public ReceiverView view(Receiver receiver) {
        return new ReceiverView(receiver, channels.channel(receiver.id(), receiver.type()).orElse(null));
    }

    private void compensate(CredentialHandle handle, Receiver receiver) {
        try {
            delegator.revoke(handle);
            log.info("[RECEIVER] Trust для несохранённого receiver'а '{}' отозван", receiver.name());
        } catch (ReceiverException e) {
            if (e.is(ReceiverException.ErrorKind.ALREADY_REVOKED)) {
                return;
            }
            log.error("[RECEIVER] Не удалось отозвать trust несохранённого receiver'а '{}' (project={}): {} {}",
                    receiver.name(), receiver.project(), e.kind(), e.getMessage());
        }
    }

    private static Optional<Receiver> unique(List<Receiver> matches, String ref) {
        if (matches.size() > 1) {
            throw ReceiverException.conflict("Найдено несколько receiver'ов по '" + ref + "'");
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private static List<String> rolesHint(Map<String, Object> hint, RequesterIdentity requester) {
        if (hint == null || hint.isEmpty()) {
            return List.of();
        }
        for (String key : hint.keySet()) {
            if (!ACTOR_ROLES.equals(key)) {
                throw ReceiverException.validation("Поле actor допускает только '" + ACTOR_ROLES + "'");
            }
        }
        Object raw = hint.get(ACTOR_ROLES);
        if (!(raw instanceof List<?> list)) {
            throw ReceiverException.validation("actor.roles должен быть списком строк");
        }
        List<String> roles = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof String role) || role.isBlank()) {
                throw ReceiverException.validation("actor.roles должен быть списком строк");
            }
            if (!requester.hasRole(role.trim())) {
                throw ReceiverException.validation("Нельзя делегировать роль, которой нет у пользователя: '" + role + "'");
            }
            roles.add(role.trim());
        }
        return roles;
    }
}
