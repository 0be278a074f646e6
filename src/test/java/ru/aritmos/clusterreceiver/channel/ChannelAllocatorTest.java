package ru.aritmos.clusterreceiver.channel;

import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

import static org.junit.jupiter.api.Assertions.*;

class ChannelAllocatorTest {

    @Test
    void webhookChannelShouldBeDerivedFromIdAndBaseUrl() {
        ClusterReceiverProperties props = new ClusterReceiverProperties();
        props.getChannel().setPublicBaseUrl("https://clustering.example.org/");
        ChannelAllocator allocator = new ChannelAllocator(props);

        ChannelInfo first = allocator.channel("r-1", ReceiverType.WEBHOOK).orElseThrow();
        ChannelInfo second = allocator.channel("r-1", ReceiverType.WEBHOOK).orElseThrow();

        assertEquals("https://clustering.example.org/v1/webhooks/r-1/trigger?V=1", first.alarmUrl());
        assertEquals(first, second, "TEST_EXPECTED: channel is deterministic");
        assertEquals(first.alarmUrl(), first.toWire().get("alarm_url"));
    }

    @Test
    void signalShouldHaveNoChannel() {
        ChannelAllocator allocator = new ChannelAllocator("http://localhost:8778");

        assertTrue(allocator.channel("r-1", ReceiverType.SIGNAL).isEmpty());
    }

    @Test
    void baseUrlChangeShouldChangeChannel() {
        ChannelInfo before = new ChannelAllocator("http://a:1").channel("r-1", ReceiverType.WEBHOOK).orElseThrow();
        ChannelInfo after = new ChannelAllocator("http://b:2").channel("r-1", ReceiverType.WEBHOOK).orElseThrow();

        assertNotEquals(before.alarmUrl(), after.alarmUrl());
    }
}
