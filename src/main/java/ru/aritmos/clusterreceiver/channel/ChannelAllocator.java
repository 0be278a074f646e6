package ru.aritmos.clusterreceiver.channel;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Вычисление канала receiver'а.
 * <p>
 * Канал не хранится: он детерминированно выводится из id и публичного адреса сервиса,
 * поэтому смена {@code clusterreceiver.channel.public-base-url} сразу отражается во всех представлениях.
 */
@Singleton
public class ChannelAllocator {

    /** Версия формата webhook URL. */
    public static final String WEBHOOK_VERSION = "1";

    private final String publicBaseUrl;

    @Inject
    public ChannelAllocator(ClusterReceiverProperties properties) {
        this(properties.getChannel().getPublicBaseUrl());
    }

    ChannelAllocator(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    /**
     * @return для webhook {@code <base>/v1/webhooks/<id>/trigger?V=1}, для signal empty
     */
    public Optional<ChannelInfo> channel(String receiverId, ReceiverType type) {
        if (type != ReceiverType.WEBHOOK) {
            return Optional.empty();
        }
        String url = publicBaseUrl + "/v1/webhooks/" + URLEncoder.encode(receiverId, StandardCharsets.UTF_8)
                + "/trigger?V=" + WEBHOOK_VERSION;
        return Optional.of(new ChannelInfo(url));
    }
}
