package io.relayq.broker.deadletter;

import io.relayq.core.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Terminal FIFO for messages whose retries ran out. The broker only pushes; whoever drains it
 * lives outside the delivery engine.
 */
@Slf4j
public final class DeadLetterSink {
    private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();

    public void push(final Message message) {
        queue.offer(Objects.requireNonNull(message, "message"));
        log.debug("Dead-lettered {} (sink size {})", message, queue.size());
    }

    public Message poll() {
        return queue.poll();
    }

    /** Removes and returns everything currently in the sink, oldest first. */
    public List<Message> drain() {
        final List<Message> out = new ArrayList<>(queue.size());
        queue.drainTo(out);
        return out;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
