package io.relayq.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.relayq.core.model.Message;
import io.relayq.transport.codec.Framing;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer/consumer connection to a broker.
 * <p>
 * Producers call {@link #send(byte[], int)}. Consumers call {@link #receive()}, wait for the
 * delivery with {@link #poll(Duration)} and acknowledge it with {@link #confirm()}; a consumer
 * that closes without confirming hands the message back to the broker's retry logic.
 * </p>
 */
@Slf4j
public final class BrokerClient implements AutoCloseable {

    private final Channel channel;
    private final EventLoopGroup group;
    private final BlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BrokerClient(final String host, final int port) throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();
        this.group = new MultiThreadIoEventLoopGroup(1, factory);

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        Framing.install(ch.pipeline())
                                .addLast(new InboxHandler());
                    }
                });

        try {
            this.channel = bootstrap.connect(new InetSocketAddress(host, port))
                    .sync()
                    .channel();
        } catch (final InterruptedException | RuntimeException e) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            throw e;
        }

        log.debug("BrokerClient connected to {}:{}", host, port);
    }

    /** Publishes {@code payload}; the broker retries it up to {@code retries} times (255 = forever). */
    public void send(final byte[] payload, final int retries) throws IOException {
        write(Message.send(payload, retries));
    }

    /** Asks the broker for the next message. */
    public void receive() throws IOException {
        write(Message.receive());
    }

    /** Acknowledges the message currently held. */
    public void confirm() throws IOException {
        write(Message.confirm());
    }

    /** Sends a raw frame, bypassing the convenience methods. */
    public void write(final Message message) throws IOException {
        if (closed.get()) throw new IllegalStateException("BrokerClient is closed");

        final ChannelFuture f = channel.writeAndFlush(message).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("write failed: " + f.cause().getMessage(), f.cause());
        }
    }

    /**
     * Waits for the next frame pushed by the broker.
     *
     * @return the delivered message, or {@code null} on timeout
     */
    public Message poll(final Duration timeout) throws InterruptedException {
        return inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isConnected() {
        return channel.isActive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        try {
            channel.close().syncUninterruptibly();
        } finally {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        log.debug("BrokerClient closed.");
    }

    private final class InboxHandler extends SimpleChannelInboundHandler<Message> {
        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final Message msg) {
            inbox.offer(msg);
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.warn("Closing broker connection: {}", String.valueOf(cause));
            ctx.close();
        }
    }
}
