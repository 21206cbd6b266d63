package io.relayq.core.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One unit of protocol traffic: a type tag, an opaque payload and an 8-bit retry counter.
 * <p>
 * The retry counter is mutated only by the delivery task currently owning the message, so
 * a plain volatile field is enough; it is never decremented below zero and the sentinel
 * {@link #UNLIMITED_RETRIES} is never decremented at all.
 * </p>
 */
public final class Message {

    public static final int MAX_RETRIES = 255;
    public static final int UNLIMITED_RETRIES = MAX_RETRIES;

    private static final byte[] EMPTY = new byte[0];

    @Getter private final MessageType type;
    private final byte[] payload;
    private volatile int retries;

    public Message(final MessageType type, final byte[] payload, final int retries) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload == null ? EMPTY : payload;
        if (retries < 0 || retries > MAX_RETRIES) {
            throw new IllegalArgumentException("retries must be within 0.." + MAX_RETRIES + " but was " + retries);
        }
        this.retries = retries;
    }

    public static Message send(final byte[] payload, final int retries) {
        return new Message(MessageType.SEND, payload, retries);
    }

    public static Message receive() {
        return new Message(MessageType.RECEIVE, EMPTY, 0);
    }

    public static Message confirm() {
        return new Message(MessageType.CONFIRM, EMPTY, 0);
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadLength() {
        return payload.length;
    }

    public int getRetries() {
        return retries;
    }

    public boolean hasUnlimitedRetries() {
        return retries == UNLIMITED_RETRIES;
    }

    public boolean isExhausted() {
        return retries == 0;
    }

    /**
     * Consumes one retry. No-op for exhausted messages and for the unlimited sentinel.
     */
    public void consumeRetry() {
        if (!isExhausted() && !hasUnlimitedRetries()) {
            retries--;
        }
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Message{type=" + type + ", retries=" + retries + ", payloadBytes=" + payload.length + '}';
    }
}
