package io.relayq.broker.dispatch;

import io.relayq.broker.BrokerContext;
import io.relayq.broker.client.Client;
import io.relayq.broker.delivery.DeliveryRegistry;
import io.relayq.broker.delivery.DeliveryTask;
import io.relayq.core.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Pairs queued messages with ready consumers.
 * <p>
 * A single thread takes one message, then takes clients until a connected one shows up, and
 * launches a {@link DeliveryTask} for the pair without waiting for it. Disconnected clients are
 * simply dropped from consideration; the message was not bound to them yet.
 * </p>
 */
@Slf4j
public final class Dispatcher implements AutoCloseable {

    private final BrokerContext context;
    private final DeliveryRegistry deliveries;

    private volatile boolean running;
    private volatile Thread worker;

    public Dispatcher(final BrokerContext context, final DeliveryRegistry deliveries) {
        this.context = Objects.requireNonNull(context, "context");
        this.deliveries = Objects.requireNonNull(deliveries, "deliveries");
    }

    public synchronized void start() {
        if (running) return;

        running = true;
        final Thread t = new Thread(this::loop, "relayq-dispatcher");
        t.setDaemon(false);
        worker = t;
        t.start();
        log.debug("Dispatcher started");
    }

    private void loop() {
        while (running) {
            final Message message;
            try {
                message = context.getIngress().take();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            final Client client;
            try {
                client = nextConnectedClient();
            } catch (final InterruptedException e) {
                context.getIngress().restore(message);
                Thread.currentThread().interrupt();
                break;
            }

            log.debug("Dispatching {} to {}", message, client);
            deliveries.launch(new DeliveryTask(message, client, context));
        }
        log.debug("Dispatcher stopped");
    }

    private Client nextConnectedClient() throws InterruptedException {
        Client client = context.getReadyConsumers().take();
        while (!client.isConnected()) {
            log.debug("Skipping disconnected {}", client);
            client = context.getReadyConsumers().take();
        }
        return client;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops the loop. A message taken but not yet paired is put back at the head of the ingress
     * queue. Deliveries already launched are left alone.
     */
    @Override
    public void close() throws InterruptedException {
        final Thread t;
        synchronized (this) {
            if (!running) return;
            running = false;
            t = worker;
            worker = null;
        }
        if (t != null) {
            t.interrupt();
            t.join(TimeUnit.SECONDS.toMillis(5));
        }
    }
}
