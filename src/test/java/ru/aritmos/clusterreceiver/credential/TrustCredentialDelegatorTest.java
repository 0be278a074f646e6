package ru.aritmos.clusterreceiver.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.identity.IdentityServerStub;
import ru.aritmos.clusterreceiver.identity.IdentityServiceClient;
import ru.aritmos.clusterreceiver.identity.ServiceTokenProvider;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrustCredentialDelegatorTest {

    private static final RequesterIdentity OWNER =
            new RequesterIdentity("u1", "p1", "default", List.of("member"), "user-good");

    private static TrustCredentialDelegator delegator(IdentityServerStub stub) {
        ClusterReceiverProperties props = stub.properties();
        ObjectMapper mapper = new ObjectMapper();
        IdentityServiceClient client = new IdentityServiceClient(props, new ServiceTokenProvider(props, mapper), mapper);
        return new TrustCredentialDelegator(client, Clock.systemUTC(), 100);
    }

    @Test
    void issueShouldDelegateRequesterRoles() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            CredentialHandle handle = delegator(stub).issue(OWNER, new DelegationScope("c-1", "CLUSTER_SCALE_OUT", List.of()));

            assertEquals("trust-1", handle.trustId());
            assertTrue(stub.lastCreateTrustBody.get().contains("\"name\":\"member\""));
            assertFalse(handle.toString().contains("trust-1"), "TEST_EXPECTED: trust id not printed");
        }
    }

    @Test
    void issueFailureShouldBeDelegationFailed() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            stub.createTrustStatus = 403;

            ReceiverException e = assertThrows(ReceiverException.class,
                    () -> delegator(stub).issue(OWNER, new DelegationScope("c-1", "CLUSTER_SCALE_OUT", List.of())));
            assertEquals(ReceiverException.ErrorKind.DELEGATION_FAILED, e.kind());
        }
    }

    @Test
    void impersonateShouldCacheTokenUntilRevoked() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            TrustCredentialDelegator delegator = delegator(stub);
            CredentialHandle handle = new CredentialHandle("trust-1");

            ActingIdentity a1 = delegator.impersonate(handle);
            ActingIdentity a2 = delegator.impersonate(handle);

            assertEquals("trustor-user", a1.userId());
            assertEquals("p1", a1.projectId());
            assertTrue(a1.delegated());
            assertEquals(a1.token(), a2.token());
            assertEquals(1, stub.trustTokenCalls.get(), "TEST_EXPECTED: trust token cached");

            delegator.revoke(handle);
            stub.trustTokenStatus = 404;

            ReceiverException e = assertThrows(ReceiverException.class, () -> delegator.impersonate(handle));
            assertEquals(ReceiverException.ErrorKind.CREDENTIAL_INVALID, e.kind());
            assertEquals(2, stub.trustTokenCalls.get(), "TEST_EXPECTED: cache dropped on revoke");
        }
    }

    @Test
    void evictShouldForceRecheckOfExternallyRevokedTrust() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            TrustCredentialDelegator delegator = delegator(stub);
            CredentialHandle handle = new CredentialHandle("trust-1");
            delegator.impersonate(handle);

            stub.trustTokenStatus = 404;
            assertEquals("trustor-user", delegator.impersonate(handle).userId(), "TEST_EXPECTED: served from cache");

            delegator.evict(handle);
            ReceiverException e = assertThrows(ReceiverException.class, () -> delegator.impersonate(handle));

            assertEquals(ReceiverException.ErrorKind.CREDENTIAL_INVALID, e.kind());
            assertEquals(2, stub.trustTokenCalls.get());
            assertEquals(0, stub.deleteTrustCalls.get(), "TEST_EXPECTED: evict does not touch the trust itself");
        }
    }

    @Test
    void revokeShouldDistinguishAlreadyRevokedFromFailure() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            TrustCredentialDelegator delegator = delegator(stub);
            CredentialHandle handle = new CredentialHandle("trust-1");

            stub.deleteTrustStatus = 404;
            ReceiverException gone = assertThrows(ReceiverException.class, () -> delegator.revoke(handle));
            assertEquals(ReceiverException.ErrorKind.ALREADY_REVOKED, gone.kind());

            stub.deleteTrustStatus = 500;
            ReceiverException failed = assertThrows(ReceiverException.class, () -> delegator.revoke(handle));
            assertEquals(ReceiverException.ErrorKind.REVOCATION_FAILED, failed.kind());
        }
    }

    @Test
    void impersonateShouldMapIdentityFailures() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            TrustCredentialDelegator delegator = delegator(stub);
            CredentialHandle handle = new CredentialHandle("trust-1");

            stub.trustTokenStatus = 503;
            ReceiverException unavailable = assertThrows(ReceiverException.class, () -> delegator.impersonate(handle));
            assertEquals(ReceiverException.ErrorKind.UNAVAILABLE, unavailable.kind());

            stub.trustTokenStatus = 401;
            ReceiverException invalid = assertThrows(ReceiverException.class, () -> delegator.impersonate(handle));
            assertEquals(ReceiverException.ErrorKind.CREDENTIAL_INVALID, invalid.kind());
        }
    }

    @Test
    void expiredTrustTokenShouldBeInvalid() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            stub.trustExpiresAt = "2000-01-01T00:00:00Z";

            ReceiverException e = assertThrows(ReceiverException.class,
                    () -> delegator(stub).impersonate(new CredentialHandle("trust-1")));
            assertEquals(ReceiverException.ErrorKind.CREDENTIAL_INVALID, e.kind());
        }
    }

    @Test
    void handleShouldRoundTripThroughActor() {
        CredentialHandle handle = new CredentialHandle("trust-9");

        assertEquals(handle, CredentialHandle.fromActor(handle.toActor()).orElseThrow());
        assertTrue(CredentialHandle.fromActor(Map.of()).isEmpty());
    }
}
