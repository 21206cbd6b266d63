package io.relayq.broker;

import io.relayq.broker.delivery.DeliveryRegistry;
import io.relayq.broker.dispatch.Dispatcher;
import io.relayq.config.impl.BrokerConfig;
import io.relayq.transport.type.NettyTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Wires the listener, the dispatcher and the delivery registry around one {@link BrokerContext}.
 */
@Slf4j
public final class Broker implements AutoCloseable {

    @Getter private final BrokerContext context;
    @Getter private final DeliveryRegistry deliveries;
    private final Dispatcher dispatcher;
    private final NettyTransport transport;

    private volatile boolean closed;

    public Broker(final BrokerConfig config) {
        this.context = new BrokerContext(config);
        this.deliveries = new DeliveryRegistry();
        this.dispatcher = new Dispatcher(context, deliveries);
        this.transport = new NettyTransport(config.getHost(), config.getPort(), context);
    }

    public void start() throws InterruptedException {
        transport.start();
        dispatcher.start();
        log.info("Broker started (dead-letter queue {})", context.isDeadLetterEnabled() ? "enabled" : "disabled");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return transport.getPort();
    }

    /**
     * Stops accepting connections and stops the dispatcher, then gives in-flight deliveries the
     * configured grace period to be confirmed before the remaining connections are closed.
     */
    @Override
    public void close() throws InterruptedException {
        if (closed) return;
        closed = true;

        transport.stopAccepting();
        dispatcher.close();

        final Duration grace = Duration.ofMillis(context.getConfig().getShutdownGraceMillis());
        if (!deliveries.awaitQuiescence(grace)) {
            log.warn("Gave up waiting for {} in-flight deliveries after {}", deliveries.inFlightCount(), grace);
        }
        deliveries.close();
        transport.stop();
        log.info("Broker stopped. {} messages queued, {} dead-lettered",
                context.getIngress().size(), context.getDeadLetters().size());
    }
}
