package io.relayq.transport.codec;

import com.google.protobuf.UnsafeByteOperations;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageCodec;
import io.relayq.api.BrokerApi;
import io.relayq.core.model.Message;
import io.relayq.core.model.MessageType;

import java.util.List;

/**
 * Translates between protobuf {@link BrokerApi.Envelope} frames and broker {@link Message}s.
 * Unknown frame types decode to {@link MessageType#UNKNOWN}; a retry counter that does not fit
 * in 8 bits is a framing error.
 */
@ChannelHandler.Sharable
public final class EnvelopeCodec extends MessageToMessageCodec<BrokerApi.Envelope, Message> {

    public static final EnvelopeCodec INSTANCE = new EnvelopeCodec();

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Message msg, final List<Object> out) {
        out.add(toEnvelope(msg));
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final BrokerApi.Envelope env, final List<Object> out) {
        out.add(fromEnvelope(env));
    }

    public static BrokerApi.Envelope toEnvelope(final Message msg) {
        return BrokerApi.Envelope.newBuilder()
                .setType(frameType(msg.getType()))
                .setPayload(UnsafeByteOperations.unsafeWrap(msg.getPayload()))
                .setRetries(msg.getRetries())
                .build();
    }

    public static Message fromEnvelope(final BrokerApi.Envelope env) {
        final int retries = env.getRetries();
        if (retries < 0 || retries > Message.MAX_RETRIES) {
            // uint32 arrives as a signed int, so huge values show up negative
            throw new CorruptedFrameException("retries out of range: " + Integer.toUnsignedString(retries));
        }
        return new Message(messageType(env.getType()), env.getPayload().toByteArray(), retries);
    }

    private static MessageType messageType(final BrokerApi.FrameType type) {
        return switch (type) {
            case SEND -> MessageType.SEND;
            case RECEIVE -> MessageType.RECEIVE;
            case CONFIRM -> MessageType.CONFIRM;
            default -> MessageType.UNKNOWN;
        };
    }

    private static BrokerApi.FrameType frameType(final MessageType type) {
        return switch (type) {
            case SEND -> BrokerApi.FrameType.SEND;
            case RECEIVE -> BrokerApi.FrameType.RECEIVE;
            case CONFIRM -> BrokerApi.FrameType.CONFIRM;
            case UNKNOWN -> BrokerApi.FrameType.FRAME_TYPE_UNSPECIFIED;
        };
    }
}
