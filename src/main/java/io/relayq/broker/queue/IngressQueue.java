package io.relayq.broker.queue;

import io.relayq.core.model.Message;

import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * Unbounded FIFO of messages awaiting delivery. Fed by connection handlers on SEND and by
 * delivery tasks on retry; drained by the dispatcher.
 */
public final class IngressQueue {
    private final BlockingDeque<Message> deque = new LinkedBlockingDeque<>();

    /** Appends to the tail. Never blocks. */
    public void push(final Message message) {
        deque.offerLast(Objects.requireNonNull(message, "message"));
    }

    /** Puts a message that was taken but never bound to a client back at the head. */
    public void restore(final Message message) {
        deque.offerFirst(Objects.requireNonNull(message, "message"));
    }

    /** Blocks until a message is available. */
    public Message take() throws InterruptedException {
        return deque.takeFirst();
    }

    public int size() {
        return deque.size();
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }
}
