package ru.aritmos.clusterreceiver.security;

import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SecurityModeAccessEvaluatorTest {

    private final SecurityModeAccessEvaluator evaluator = new SecurityModeAccessEvaluator();

    @Test
    void shouldAllowEverythingInOpenMode() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.OPEN);

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/v1/receivers", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/v1/events", props));
    }

    @Test
    void shouldKeepWebhookTriggerAnonymousInRequiredMode() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW,
                evaluator.evaluate("/v1/webhooks/0b5e5a3c-2c49-4c8e-9a1f-1f2d3c4b5a69/trigger", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/v1/receivers", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/v1/receivers/r1/notify", props));
    }

    @Test
    void shouldRequireAuthForWebhooksWhenAnonymousDisabled() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_OPTIONAL);
        props.getAnonymous().setEnabled(false);

        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/v1/webhooks/x/trigger", props));
    }

    @Test
    void shouldKeepTechnicalEndpointsOpen() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);
        props.getAnonymous().setAllowPaths(List.of());

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/health", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/health/liveness", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/swagger/cluster-receiver.yml", props));
    }

    @Test
    void shouldNotTreatLookalikePathAsAnonymous() {
        ClusterReceiverSecurityProperties props = new ClusterReceiverSecurityProperties();
        props.setMode(ClusterReceiverSecurityProperties.Mode.TOKEN_REQUIRED);

        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/v1/webhooksx/trigger", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/swaggered/internal", props));
    }
}
