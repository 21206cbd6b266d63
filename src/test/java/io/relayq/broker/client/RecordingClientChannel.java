package io.relayq.broker.client;

import io.relayq.core.model.Message;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link ClientChannel} that records writes. Closing it disconnects the bound client,
 * the way the connection handler would on channel close.
 */
public final class RecordingClientChannel implements ClientChannel {

    private final BlockingQueue<Message> written = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final SocketAddress address;

    private volatile boolean failWrites;
    private volatile Runnable afterWrite = () -> { };
    private volatile Client client;

    public RecordingClientChannel(final int port) {
        this.address = new InetSocketAddress("127.0.0.1", port);
    }

    /** Creates a client on a fresh recording channel. */
    public static Client newClient(final int port) {
        final RecordingClientChannel channel = new RecordingClientChannel(port);
        final Client client = new Client(channel);
        channel.client = client;
        return client;
    }

    public static RecordingClientChannel of(final Client client) {
        return (RecordingClientChannel) client.getChannel();
    }

    public void failWrites() {
        this.failWrites = true;
    }

    /** Runs {@code action} on the writing thread after each recorded write, before it returns. */
    public void afterWrite(final Runnable action) {
        this.afterWrite = action;
    }

    @Override
    public boolean write(final Message message) {
        if (failWrites || closed.get()) return false;
        written.add(message);
        afterWrite.run();
        return true;
    }

    /** Next recorded write, or {@code null} if none arrives in time. */
    public Message nextWrite(final Duration timeout) throws InterruptedException {
        return written.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int writeCount() {
        return written.size();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && client != null) {
            client.disconnect();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public SocketAddress remoteAddress() {
        return address;
    }
}
