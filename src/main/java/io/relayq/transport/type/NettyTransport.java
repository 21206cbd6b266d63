package io.relayq.transport.type;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.relayq.broker.BrokerContext;
import io.relayq.transport.codec.Framing;
import io.relayq.transport.impl.NettyConnectionHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

@Slf4j
public class NettyTransport {
    @Getter private final String host;
    @Getter private int port;
    private final BrokerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public NettyTransport(final String host, final int port, final BrokerContext context) {
        this.host = host;
        this.port = port;
        this.context = context;
    }

    public void start() throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * Netty Threading Model:
         * 1 Boss thread for accepting connections.
         * 0 (Default) Worker threads for connection I/O and frame routing.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(0, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        Framing.install(ch.pipeline())
                                .addLast(new NettyConnectionHandler(context));
                    }
                })

                /*
                 * TCP Tuning:
                 * TCP_NODELAY: deliveries and confirms are tiny, do not batch them.
                 * SO_KEEPALIVE: detect dead peers so their in-flight message gets retried.
                 */
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f;
        try {
            f = b.bind(host, port).sync();
        } catch (final InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Serving on {}:{}", host, port);
    }

    /** Closes the listening socket. Established connections stay open. */
    public void stopAccepting() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully();
    }

    /** Stops accepting and closes every connection. */
    public void stop() {
        stopAccepting();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
