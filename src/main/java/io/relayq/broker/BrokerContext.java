package io.relayq.broker;

import io.relayq.broker.deadletter.DeadLetterSink;
import io.relayq.broker.queue.IngressQueue;
import io.relayq.broker.queue.ReadyConsumerQueue;
import io.relayq.config.impl.BrokerConfig;
import lombok.Getter;

import java.util.Objects;

/**
 * Shared state of one broker instance, handed to every component at construction.
 */
@Getter
public final class BrokerContext {
    private final BrokerConfig config;
    private final IngressQueue ingress = new IngressQueue();
    private final ReadyConsumerQueue readyConsumers = new ReadyConsumerQueue();
    private final DeadLetterSink deadLetters = new DeadLetterSink();

    public BrokerContext(final BrokerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public boolean isDeadLetterEnabled() {
        return config.isDeadLetterEnabled();
    }
}
