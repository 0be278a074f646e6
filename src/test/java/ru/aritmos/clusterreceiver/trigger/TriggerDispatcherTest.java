package ru.aritmos.clusterreceiver.trigger;

import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.CredentialHandle;
import ru.aritmos.clusterreceiver.credential.FakeCredentialDelegator;
import ru.aritmos.clusterreceiver.engine.ActionRequest;
import ru.aritmos.clusterreceiver.engine.ClusterAction;
import ru.aritmos.clusterreceiver.engine.RecordingActionEngine;
import ru.aritmos.clusterreceiver.event.EventLevel;
import ru.aritmos.clusterreceiver.event.ReceiverEvent;
import ru.aritmos.clusterreceiver.event.RecordingEventJournal;
import ru.aritmos.clusterreceiver.identity.IdentityCallException;
import ru.aritmos.clusterreceiver.identity.TokenInfo;
import ru.aritmos.clusterreceiver.identity.TokenValidator;
import ru.aritmos.clusterreceiver.receiver.InMemoryReceiverStore;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TriggerDispatcherTest {

    private static final RequesterIdentity OWNER = new RequesterIdentity("u1", "p1", "default", List.of("member"), "user-token");

    private final InMemoryReceiverStore store = new InMemoryReceiverStore();
    private final FakeCredentialDelegator delegator = new FakeCredentialDelegator();
    private final RecordingActionEngine engine = new RecordingActionEngine();
    private final RecordingEventJournal journal = new RecordingEventJournal();

    private TokenValidator tokens = token -> {
        if ("tok-p1".equals(token)) {
            return Optional.of(new TokenInfo(token, "caller", "p1", null, List.of("member"), null, null));
        }
        if ("tok-reader".equals(token)) {
            return Optional.of(new TokenInfo(token, "viewer", "p1", null, List.of("reader"), null, null));
        }
        if ("tok-admin".equals(token)) {
            return Optional.of(new TokenInfo(token, "operator", "p1", null, List.of("Admin"), null, null));
        }
        if ("tok-p2".equals(token)) {
            return Optional.of(new TokenInfo(token, "stranger", "p2", null, List.of("member"), null, null));
        }
        return Optional.empty();
    };

    private TriggerDispatcher dispatcher() {
        TriggerAuthenticatorRegistry registry = new TriggerAuthenticatorRegistry(List.of(
                new WebhookTriggerAuthenticator(delegator),
                new SignalTriggerAuthenticator(token -> tokens.validateToken(token), new ClusterReceiverSecurityProperties.Rbac())
        ));
        return new TriggerDispatcher(store, registry, engine, journal);
    }

    private Receiver webhook(String id, Map<String, Object> params) {
        CredentialHandle handle = delegator.issue(OWNER, null);
        Receiver r = new Receiver(id, "hook-" + id, ReceiverType.WEBHOOK, "c-1", ClusterAction.CLUSTER_SCALE_OUT,
                handle.toActor(), params, "p1", "default", "u1", Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-01-01T00:00:00Z"));
        return store.insert(r);
    }

    private Receiver signal(String id) {
        Receiver r = new Receiver(id, "signal-" + id, ReceiverType.SIGNAL, "c-1", ClusterAction.CLUSTER_SCALE_IN,
                Map.of(), Map.of("count", "1"), "p1", "default", "u1", Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-01-01T00:00:00Z"));
        return store.insert(r);
    }

    @Test
    void webhookShouldSubmitWithDelegatedIdentityAndMergedParams() {
        webhook("r-1", Map.of("count", "1", "policy", "p"));

        TriggerOutcome outcome = dispatcher().invoke("r-1", ReceiverType.WEBHOOK, Map.of("count", "3"),
                InvocationCredentials.anonymous(), "req-1");

        assertEquals(InvocationState.SUBMITTED, outcome.state());
        assertEquals("act-1", outcome.actionId());
        assertEquals(Map.of("count", "3", "policy", "p"), outcome.effectiveParams());

        ActionRequest sent = engine.submitted.get(0);
        assertEquals(ClusterAction.CLUSTER_SCALE_OUT, sent.action());
        assertEquals("c-1", sent.clusterId());
        assertEquals("u1", sent.actor().userId(), "TEST_EXPECTED: action runs as receiver owner");
        assertTrue(sent.actor().delegated());
        assertEquals("req-1", sent.requestId());

        List<ReceiverEvent> events = journal.byAction(ReceiverEvent.RECEIVER_TRIGGER);
        assertEquals(1, events.size());
        assertEquals(InvocationState.SUBMITTED.name(), events.get(0).status());
        assertEquals(EventLevel.INFO, events.get(0).level());
    }

    @Test
    void invocationWithoutParamsShouldUseStoredParams() {
        webhook("r-1", Map.of("count", "1"));

        TriggerOutcome outcome = dispatcher().invoke("r-1", ReceiverType.WEBHOOK, Map.of(), InvocationCredentials.anonymous(), "req-1");

        assertEquals(Map.of("count", "1"), outcome.effectiveParams());
    }

    @Test
    void revokedCredentialShouldBeUnauthorizedAndJournaled() {
        Receiver r = webhook("r-1", Map.of());
        delegator.revoke(r.credential().orElseThrow());

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher().invoke("r-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));

        assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, e.kind());
        assertTrue(engine.submitted.isEmpty(), "TEST_EXPECTED: nothing submitted");
        ReceiverEvent event = journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).get(0);
        assertEquals(InvocationState.REJECTED.name(), event.status());
        assertEquals(EventLevel.WARNING, event.level());
    }

    @Test
    void webhookWithClearedActorShouldBeUnauthorized() {
        Receiver r = webhook("r-1", Map.of());
        store.clearActor(r.id(), r.actor());

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher().invoke("r-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));
        assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, e.kind());
    }

    @Test
    void unknownOrMistypedReceiverShouldBeNotFound() {
        signal("s-1");

        ReceiverException unknown = assertThrows(ReceiverException.class, () -> dispatcher().invoke("nope", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));
        ReceiverException mistyped = assertThrows(ReceiverException.class, () -> dispatcher().invoke("s-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));

        assertEquals(ReceiverException.ErrorKind.NOT_FOUND, unknown.kind());
        assertEquals(ReceiverException.ErrorKind.NOT_FOUND, mistyped.kind());
        assertTrue(journal.events().isEmpty());
    }

    @Test
    void signalShouldRunAsCallerFromSameProject() {
        signal("s-1");

        TriggerOutcome outcome = dispatcher().invoke("s-1", ReceiverType.SIGNAL, Map.of("count", "2"),
                new InvocationCredentials("tok-p1"), "req-2");

        assertEquals(InvocationState.SUBMITTED, outcome.state());
        ActionRequest sent = engine.submitted.get(0);
        assertEquals("caller", sent.actor().userId());
        assertFalse(sent.actor().delegated());
        assertEquals("tok-p1", sent.actor().token());
        assertEquals(Map.of("count", "2"), sent.params());
    }

    @Test
    void signalShouldRejectMissingInvalidAndForeignTokens() {
        signal("s-1");
        TriggerDispatcher dispatcher = dispatcher();

        for (InvocationCredentials c : List.of(InvocationCredentials.anonymous(), new InvocationCredentials("bogus"),
                new InvocationCredentials("tok-p2"))) {
            ReceiverException e = assertThrows(ReceiverException.class,
                    () -> dispatcher.invoke("s-1", ReceiverType.SIGNAL, Map.of(), c, "req"));
            assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, e.kind(), "TEST_EXPECTED: " + c);
        }
        assertTrue(engine.submitted.isEmpty());
        assertEquals(3, journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).size());
    }

    @Test
    void signalShouldRequireMemberOrAdminRole() {
        signal("s-1");
        TriggerDispatcher dispatcher = dispatcher();

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher.invoke("s-1", ReceiverType.SIGNAL,
                Map.of(), new InvocationCredentials("tok-reader"), "req"));

        assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, e.kind(), "TEST_EXPECTED: reader cannot mutate the cluster");
        assertTrue(engine.submitted.isEmpty());
        assertEquals(InvocationState.REJECTED.name(), journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).get(0).status());

        TriggerOutcome admin = dispatcher.invoke("s-1", ReceiverType.SIGNAL, Map.of(), new InvocationCredentials("tok-admin"), "req");
        assertEquals(InvocationState.SUBMITTED, admin.state());
        assertEquals("operator", engine.submitted.get(0).actor().userId());
    }

    @Test
    void identityOutageDuringSignalShouldBeUnavailable() {
        signal("s-1");
        tokens = token -> {
            throw new IdentityCallException("Identity-сервис недоступен", null);
        };

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher().invoke("s-1", ReceiverType.SIGNAL,
                Map.of(), new InvocationCredentials("tok-p1"), "req"));
        assertEquals(ReceiverException.ErrorKind.UNAVAILABLE, e.kind());
        assertEquals(EventLevel.ERROR, journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).get(0).level());
    }

    @Test
    void engineRejectionShouldPropagate() {
        webhook("r-1", Map.of());
        engine.failure.set(ReceiverException.ErrorKind.DISPATCH_REJECTED);

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher().invoke("r-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));

        assertEquals(ReceiverException.ErrorKind.DISPATCH_REJECTED, e.kind());
        assertEquals(InvocationState.REJECTED.name(), journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).get(0).status());
    }

    @Test
    void engineRefusingDelegatedTokenShouldEvictItAndBeUnauthorized() {
        Receiver r = webhook("r-1", Map.of());
        engine.failure.set(ReceiverException.ErrorKind.UNAUTHORIZED);

        ReceiverException e = assertThrows(ReceiverException.class, () -> dispatcher().invoke("r-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));

        assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, e.kind());
        assertTrue(delegator.isEvicted(r.credential().orElseThrow().trustId()), "TEST_EXPECTED: cached trust token dropped");
        ReceiverEvent event = journal.byAction(ReceiverEvent.RECEIVER_TRIGGER).get(0);
        assertEquals(InvocationState.REJECTED.name(), event.status());
        assertEquals(EventLevel.WARNING, event.level());
    }

    @Test
    void engineRefusalOfOtherKindShouldKeepCachedToken() {
        Receiver r = webhook("r-1", Map.of());
        engine.failure.set(ReceiverException.ErrorKind.DISPATCH_REJECTED);

        assertThrows(ReceiverException.class, () -> dispatcher().invoke("r-1", ReceiverType.WEBHOOK,
                Map.of(), InvocationCredentials.anonymous(), "req-1"));

        assertFalse(delegator.isEvicted(r.credential().orElseThrow().trustId()));
    }

    @Test
    void concurrentInvocationsShouldEachSubmit() throws Exception {
        webhook("r-1", Map.of("count", "1"));
        TriggerDispatcher dispatcher = dispatcher();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<TriggerOutcome> call = () -> {
                start.await(2, TimeUnit.SECONDS);
                return dispatcher.invoke("r-1", ReceiverType.WEBHOOK, Map.of(), InvocationCredentials.anonymous(), "req");
            };
            Future<TriggerOutcome> a = pool.submit(call);
            Future<TriggerOutcome> b = pool.submit(call);
            start.countDown();

            Set<String> actionIds = new HashSet<>();
            actionIds.add(a.get(5, TimeUnit.SECONDS).actionId());
            actionIds.add(b.get(5, TimeUnit.SECONDS).actionId());

            assertEquals(2, actionIds.size(), "TEST_EXPECTED: two independent actions");
            assertEquals(2, engine.submitted.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void mergeParamsShouldLetInvocationWin() {
        assertEquals(Map.of("count", "3"), TriggerDispatcher.mergeParams(Map.of("count", "1"), Map.of("count", "3")));
        assertEquals(Map.of("count", "1"), TriggerDispatcher.mergeParams(Map.of("count", "1"), Map.of()));
        assertEquals(Map.of(), TriggerDispatcher.mergeParams(null, null));
    }

    @Test
    void registryShouldRejectDuplicateAuthenticators() {
        assertThrows(IllegalStateException.class, () -> new TriggerAuthenticatorRegistry(List.of(
                new WebhookTriggerAuthenticator(delegator), new WebhookTriggerAuthenticator(delegator))));
        ReceiverException e = assertThrows(ReceiverException.class,
                () -> new TriggerAuthenticatorRegistry(List.of()).forType(ReceiverType.SIGNAL));
        assertEquals(ReceiverException.ErrorKind.INTERNAL, e.kind());
    }
}
