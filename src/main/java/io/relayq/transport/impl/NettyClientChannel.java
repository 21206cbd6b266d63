package io.relayq.transport.impl;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.relayq.broker.client.ClientChannel;
import io.relayq.core.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;

@Slf4j
@RequiredArgsConstructor
public final class NettyClientChannel implements ClientChannel {

    private final Channel channel;

    @Override
    public boolean write(final Message message) {
        if (!channel.isActive()) return false;

        final ChannelFuture f = channel.writeAndFlush(message).awaitUninterruptibly();
        if (!f.isSuccess()) {
            log.debug("Write to {} failed: {}", channel.remoteAddress(), String.valueOf(f.cause()));
        }
        return f.isSuccess();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }
}
