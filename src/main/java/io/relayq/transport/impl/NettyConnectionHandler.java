package io.relayq.transport.impl;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.relayq.broker.BrokerContext;
import io.relayq.broker.client.Client;
import io.relayq.core.model.Message;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-connection handler. Owns the {@link Client} for the lifetime of the channel and routes
 * each decoded frame by type. It never delivers anything itself; all effects go through the
 * shared queues and the client's pending slot / ready signal.
 */
@Slf4j
@RequiredArgsConstructor
public class NettyConnectionHandler extends SimpleChannelInboundHandler<Message> {

    private final BrokerContext context;

    @Getter private Client client;

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        client = new Client(new NettyClientChannel(ctx.channel()));
        log.info("{} connected", client);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Message msg) {
        switch (msg.getType()) {
            case SEND -> {
                if (log.isDebugEnabled()) {
                    log.debug("Received from {}: {}", client, msg.payloadAsString());
                }
                context.getIngress().push(msg);
            }

            case RECEIVE -> {
                // read in the reverse of beginDelivery's write order (pending, then queued)
                if (client.isQueued()) {
                    log.warn("Receive from {} dropped, it is already waiting for a message", client);
                    return;
                }
                if (client.hasPending()) {
                    log.warn("Receive from {} dropped, it must confirm its current message first", client);
                    return;
                }
                if (!client.markQueued()) {
                    log.warn("Receive from {} dropped, it is already waiting for a message", client);
                    return;
                }
                log.debug("{} wants to receive", client);
                client.getReadySignal().clear();
                context.getReadyConsumers().push(client);
            }

            case CONFIRM -> {
                final Message confirmed = client.confirm();
                if (confirmed == null) {
                    log.warn("Confirm from {} dropped, it has no message to confirm", client);
                    return;
                }
                log.debug("{} confirms {}", client, confirmed);
            }

            default -> log.warn("Received unknown frame from {}: {}", client, msg);
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (client != null && client.disconnect()) {
            log.info("{} disconnected", client);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (client != null && client.disconnect()) {
            if (cause instanceof DecoderException) {
                log.warn("{} disconnected because: {}", client, cause.getMessage());
            } else {
                log.warn("{} disconnected because of an I/O error: {}", client, String.valueOf(cause));
            }
        }
        ctx.close();
    }
}
