package io.relayq.broker.queue;

import io.relayq.broker.client.Client;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of clients that asked to receive and hold no in-flight message.
 * Entries may have disconnected since they were queued; the dispatcher filters them.
 */
public final class ReadyConsumerQueue {
    private final BlockingQueue<Client> queue = new LinkedBlockingQueue<>();

    public void push(final Client client) {
        queue.offer(Objects.requireNonNull(client, "client"));
    }

    public Client take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
