package ru.aritmos.clusterreceiver.credential;

import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Делегирование без identity-сервиса: trust'ы живут в памяти.
 * <p>
 * {@link #revokeFailure} задаёт вид ошибки для следующего отзыва.
 */
public class FakeCredentialDelegator implements CredentialDelegator {

    public final AtomicInteger issued = new AtomicInteger();
    public final AtomicInteger revokeCalls = new AtomicInteger();
    public final AtomicReference<DelegationScope> lastScope = new AtomicReference<>();
    public final AtomicReference<ReceiverException.ErrorKind> issueFailure = new AtomicReference<>();
    public final AtomicReference<ReceiverException.ErrorKind> revokeFailure = new AtomicReference<>();

    private final Map<String, RequesterIdentity> active = new ConcurrentHashMap<>();
    private final Set<String> revoked = ConcurrentHashMap.newKeySet();
    private final Set<String> evicted = ConcurrentHashMap.newKeySet();

    @Override
    public CredentialHandle issue(RequesterIdentity requester, DelegationScope scope) {
        ReceiverException.ErrorKind failure = issueFailure.get();
        if (failure != null) {
            throw new ReceiverException(failure, "Не удалось делегировать права");
        }
        String trustId = "trust-" + issued.incrementAndGet();
        active.put(trustId, requester);
        lastScope.set(scope);
        return new CredentialHandle(trustId);
    }

    @Override
    public void revoke(CredentialHandle handle) {
        revokeCalls.incrementAndGet();
        ReceiverException.ErrorKind failure = revokeFailure.getAndSet(null);
        if (failure != null) {
            throw new ReceiverException(failure, "Отзыв trust не выполнен");
        }
        if (active.remove(handle.trustId()) == null) {
            throw new ReceiverException(ReceiverException.ErrorKind.ALREADY_REVOKED, "Trust уже отозван");
        }
        revoked.add(handle.trustId());
    }

    @Override
    public ActingIdentity impersonate(CredentialHandle handle) {
        RequesterIdentity owner = active.get(handle.trustId());
        if (owner == null) {
            throw new ReceiverException(ReceiverException.ErrorKind.CREDENTIAL_INVALID, "Делегированные права отозваны или истекли");
        }
        return new ActingIdentity(owner.userId(), owner.projectId(), "trust-token:" + handle.trustId(), true);
    }

    @Override
    public void evict(CredentialHandle handle) {
        evicted.add(handle.trustId());
    }

    public boolean isEvicted(String trustId) {
        return evicted.contains(trustId);
    }

    public boolean isActive(String trustId) {
        return active.containsKey(trustId);
    }

    public boolean isRevoked(String trustId) {
        return revoked.contains(trustId);
    }

    public int activeCount() {
        return active.size();
    }
}
