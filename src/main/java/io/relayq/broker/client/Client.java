package io.relayq.broker.client;

import io.relayq.core.model.Message;
import io.relayq.core.signal.ReadySignal;
import lombok.Getter;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broker-side state of one connected peer.
 * <p>
 * The pending slot and the flags are only touched by the client's own connection handler and
 * by the single delivery task currently holding the client. Every transition goes through an
 * atomic so a disconnect and a delivery task's final check never see a torn state.
 * </p>
 */
public final class Client {

    @Getter private final SocketAddress address;
    @Getter private final ClientChannel channel;
    @Getter private final ReadySignal readySignal = new ReadySignal();

    private final AtomicReference<Message> pending = new AtomicReference<>();
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicBoolean queued = new AtomicBoolean(false);

    public Client(final ClientChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.address = channel.remoteAddress();
    }

    public boolean isConnected() {
        return connected.get();
    }

    public boolean isQueued() {
        return queued.get();
    }

    public Message getPending() {
        return pending.get();
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    /**
     * Marks the client as waiting in the ready-consumer queue.
     *
     * @return {@code false} if it is already queued
     */
    public boolean markQueued() {
        return queued.compareAndSet(false, true);
    }

    /**
     * Binds {@code message} to this client. The slot is filled before the queued flag drops, so a
     * RECEIVE that reads {@code queued} first and {@code pending} second always sees one of the two.
     * The client has left the ready queue either way, so the flag drops even when binding fails.
     *
     * @return {@code false} if another message is still in flight
     */
    public boolean beginDelivery(final Message message) {
        final boolean bound = pending.compareAndSet(null, message);
        queued.set(false);
        return bound;
    }

    /**
     * Releases {@code message} from the pending slot if it is still there.
     *
     * @return {@code true} if the slot still held the message, i.e. it was never confirmed
     */
    public boolean releaseUnconfirmed(final Message message) {
        return pending.compareAndSet(message, null);
    }

    /**
     * Clears the pending slot and wakes the waiting delivery task.
     *
     * @return the confirmed message, or {@code null} if nothing was in flight
     */
    public Message confirm() {
        final Message confirmed = pending.getAndSet(null);
        if (confirmed != null) {
            readySignal.set();
        }
        return confirmed;
    }

    /**
     * Transitions to disconnected and wakes any waiting delivery task.
     *
     * @return {@code false} if the client was already disconnected
     */
    public boolean disconnect() {
        if (!connected.compareAndSet(true, false)) return false;
        readySignal.set();
        return true;
    }

    @Override
    public String toString() {
        return "Client[" + address + "]";
    }
}
