package ru.aritmos.clusterreceiver.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ServiceTokenProviderTest {

    @Test
    void shouldCacheServiceTokenUntilRefreshMargin() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            ServiceTokenProvider provider = new ServiceTokenProvider(stub.properties(), new ObjectMapper());

            TokenInfo t1 = provider.serviceToken();
            TokenInfo t2 = provider.serviceToken();

            assertEquals("service-token-1", t1.token());
            assertEquals(t1.token(), t2.token());
            assertEquals("svc-user", t1.userId());
            assertEquals(1, stub.serviceAuthCalls.get());
        }
    }

    @Test
    void shouldRefreshTokenCloseToExpiry() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            stub.serviceExpiresAt = "2026-01-01T00:00:10Z";
            ServiceTokenProvider provider = new ServiceTokenProvider(stub.properties().getIdentity(), new ObjectMapper(), clock);

            provider.serviceToken();
            provider.serviceToken();

            assertEquals(2, stub.serviceAuthCalls.get(), "TEST_EXPECTED: token expiring within margin is refreshed");
        }
    }

    @Test
    void trustScopedTokenShouldCarryTrustorAndTrust() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            ServiceTokenProvider provider = new ServiceTokenProvider(stub.properties(), new ObjectMapper());

            TokenInfo token = provider.trustScopedToken("trust-1");

            assertEquals("trustor-user", token.userId());
            assertEquals("p1", token.projectId());
            assertEquals("trust-1", token.trustId());
            assertEquals(Instant.parse("2099-01-01T00:00:00Z"), token.expiresAt());
        }
    }

    @Test
    void rejectedTrustShouldSurfaceStatus() throws Exception {
        try (IdentityServerStub stub = IdentityServerStub.start()) {
            stub.trustTokenStatus = 401;
            ServiceTokenProvider provider = new ServiceTokenProvider(stub.properties(), new ObjectMapper());

            IdentityCallException e = assertThrows(IdentityCallException.class, () -> provider.trustScopedToken("trust-1"));
            assertTrue(e.isAuthRejected());
        }
    }
}
