package ru.aritmos.clusterreceiver.lifecycle;

import ru.aritmos.clusterreceiver.channel.ChannelInfo;
import ru.aritmos.clusterreceiver.receiver.Receiver;

/**
 * Receiver вместе с вычисленным каналом.
 *
 * @param receiver запись хранилища
 * @param channel канал; null для signal
 */
public record ReceiverView(Receiver receiver, ChannelInfo channel) {
}
