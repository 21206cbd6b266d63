package io.relayq.broker.client;

import io.relayq.core.model.Message;

import java.net.SocketAddress;

/**
 * Outbound side of one client connection, as seen by a delivery task.
 */
public interface ClientChannel {

    /**
     * Writes one frame and blocks until the write completed or failed.
     * Must not be called from the connection's own I/O thread.
     *
     * @return {@code true} if the frame reached the socket
     */
    boolean write(Message message);

    /**
     * Closes the underlying stream. The connection handler observes the close and runs
     * the disconnect path.
     */
    void close();

    SocketAddress remoteAddress();
}
