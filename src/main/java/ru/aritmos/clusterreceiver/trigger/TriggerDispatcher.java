package ru.aritmos.clusterreceiver.trigger;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.ActingIdentity;
import ru.aritmos.clusterreceiver.engine.ActionEngineClient;
import ru.aritmos.clusterreceiver.engine.ActionHandle;
import ru.aritmos.clusterreceiver.engine.ActionRequest;
import ru.aritmos.clusterreceiver.event.EventJournal;
import ru.aritmos.clusterreceiver.event.EventLevel;
import ru.aritmos.clusterreceiver.event.ReceiverEvent;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverStore;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Обработка вызова receiver'а: аутентификация по типу, слияние параметров, постановка действия.
 * <p>
 * Диспетчер не хранит состояния и не берёт блокировок: параллельные вызовы одного receiver'а независимы
 * и каждый ставит своё действие. Итог каждого вызова (SUBMITTED или REJECTED) пишется в журнал событий.
 */
@Singleton
public class TriggerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerDispatcher.class);

    private final ReceiverStore store;
    private final TriggerAuthenticatorRegistry authenticators;
    private final ActionEngineClient engine;
    private final EventJournal journal;
    private final Clock clock;

    @Inject
    public TriggerDispatcher(ReceiverStore store,
                             TriggerAuthenticatorRegistry authenticators,
                             ActionEngineClient engine,
                             EventJournal journal) {
        this(store, authenticators, engine, journal, Clock.systemUTC());
    }

    public TriggerDispatcher(ReceiverStore store,
                             TriggerAuthenticatorRegistry authenticators,
                             ActionEngineClient engine,
                             EventJournal journal,
                             Clock clock) {
        this.store = store;
        this.authenticators = authenticators;
        this.engine = engine;
        this.journal = journal;
        this.clock = clock;
    }

    /**
     * Вызвать receiver.
     *
     * @param receiverId точный id receiver'а
     * @param expectedType тип, допустимый для точки входа (webhook URL или notify)
     * @param invocationParams параметры вызова; перекрывают сохранённые по ключу
     * @param credentials учётные данные вызывающего
     * @param requestId идентификатор корреляции
     * @return итог вызова в состоянии SUBMITTED
     * @throws ReceiverException NOT_FOUND, UNAUTHORIZED, DISPATCH_REJECTED, UNAVAILABLE.
     *                           UNAUTHORIZED от action engine сбрасывает закэшированные права receiver'а
     */
    public TriggerOutcome invoke(String receiverId,
                                 ReceiverType expectedType,
                                 Map<String, Object> invocationParams,
                                 InvocationCredentials credentials,
                                 String requestId) {
        InvocationState state = InvocationState.RECEIVED;
        Receiver receiver = store.findById(receiverId)
                .filter(r -> expectedType == null || r.type() == expectedType)
                .orElseThrow(() -> ReceiverException.notFound("Receiver '" + receiverId + "' не найден"));

        TriggerAuthenticator authenticator = authenticators.forType(receiver.type());
        ActingIdentity actor;
        try {
            state = InvocationState.AUTHENTICATING;
            actor = authenticator.authenticate(receiver, credentials);
            state = InvocationState.AUTHORIZED;
        } catch (ReceiverException e) {
            reject(receiver, state, e, requestId);
            throw e;
        }

        Map<String, Object> effective = mergeParams(receiver.params(), invocationParams);
        try {
            ActionHandle handle = engine.submit(new ActionRequest(
                    receiver.action(),
                    receiver.clusterId(),
                    effective,
                    actor,
                    "Receiver " + receiver.id(),
                    requestId
            ));
            log.info("[TRIGGER] Receiver {} ({}): действие {} поставлено для кластера {}, requestId={}",
                    receiver.id(), receiver.type().wire(), handle.actionId(), receiver.clusterId(), requestId);
            journal.record(ReceiverEvent.of(clock.instant(), receiver.id(), receiver.name(), receiver.clusterId(),
                    ReceiverEvent.RECEIVER_TRIGGER, EventLevel.INFO, InvocationState.SUBMITTED.name(),
                    "Действие " + receiver.action() + " поставлено: " + handle.actionId(), actor.userId(), receiver.project()));
            return new TriggerOutcome(receiver.id(), InvocationState.SUBMITTED, handle.actionId(), effective);
        } catch (ReceiverException e) {
            if (e.is(ReceiverException.ErrorKind.UNAUTHORIZED)) {
                authenticator.rejectedDownstream(receiver);
            }
            reject(receiver, state, e, requestId);
            throw e;
        }
    }

    /**
     * Эффективные параметры: сохранённые, перекрытые параметрами вызова (вызов побеждает по ключу).
     */
    static Map<String, Object> mergeParams(Map<String, Object> stored, Map<String, Object> invocation) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (stored != null) {
            out.putAll(stored);
        }
        if (invocation != null) {
            out.putAll(invocation);
        }
        return out;
    }

    private void reject(Receiver receiver, InvocationState at, ReceiverException e, String requestId) {
        log.warn("[TRIGGER] Вызов receiver'а {} отклонён на шаге {}: {} {}, requestId={}",
                receiver.id(), at, e.kind(), e.getMessage(), requestId);
        EventLevel level = e.is(ReceiverException.ErrorKind.UNAVAILABLE) ? EventLevel.ERROR : EventLevel.WARNING;
        journal.record(ReceiverEvent.of(clock.instant(), receiver.id(), receiver.name(), receiver.clusterId(),
                ReceiverEvent.RECEIVER_TRIGGER, level, InvocationState.REJECTED.name(),
                e.kind() + ": " + e.getMessage(), null, receiver.project()));
    }
}
