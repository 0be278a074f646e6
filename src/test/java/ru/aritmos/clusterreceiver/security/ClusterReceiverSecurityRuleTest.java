package ru.aritmos.clusterreceiver.security;

import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecurityRuleResult;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClusterReceiverSecurityRuleTest {

    @Test
    void shouldAllowWebhookTriggerWithoutAuthentication() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);

        ClusterReceiverSecurityRule rule = new ClusterReceiverSecurityRule(props, new SecurityModeAccessEvaluator());

        SecurityRuleResult result = single(rule.check(HttpRequest.POST("/v1/webhooks/abc/trigger?V=1", "{}"), null));
        assertEquals(SecurityRuleResult.ALLOWED, result);
    }

    @Test
    void shouldRejectProtectedPathWithoutAuthentication() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);

        ClusterReceiverSecurityRule rule = new ClusterReceiverSecurityRule(props, new SecurityModeAccessEvaluator());

        SecurityRuleResult result = single(rule.check(HttpRequest.GET("/v1/receivers"), null));
        assertEquals(SecurityRuleResult.REJECTED, result);
    }

    @Test
    void shouldAllowProtectedPathWhenAuthenticated() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);

        ClusterReceiverSecurityRule rule = new ClusterReceiverSecurityRule(props, new SecurityModeAccessEvaluator());

        SecurityRuleResult result = single(rule.check(HttpRequest.GET("/v1/receivers"), Authentication.build("u1", List.of("member"))));
        assertEquals(SecurityRuleResult.ALLOWED, result);
    }

    private SecurityRuleResult single(Publisher<SecurityRuleResult> publisher) {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<SecurityRuleResult> ref = new AtomicReference<>();

        publisher.subscribe(new Subscriber<>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(1);
            }

            @Override
            public void onNext(SecurityRuleResult securityRuleResult) {
                ref.set(securityRuleResult);
            }

            @Override
            public void onError(Throwable t) {
                latch.countDown();
            }

            @Override
            public void onComplete() {
                latch.countDown();
            }
        });

        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            throw new IllegalStateException("Interrupted while waiting SecurityRule result", e);
        }
        return ref.get();
    }
}
