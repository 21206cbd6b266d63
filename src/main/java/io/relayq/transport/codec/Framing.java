package io.relayq.transport.codec;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.relayq.api.BrokerApi;

/**
 * Installs the wire codec shared by the broker and its clients: varint32 length prefix,
 * protobuf {@link BrokerApi.Envelope}, then {@link EnvelopeCodec}.
 */
public final class Framing {

    private Framing() {
    }

    public static ChannelPipeline install(final ChannelPipeline p) {
        /* Inbound: split by varint32 length prefix, then parse Envelope */
        p.addLast(new ProtobufVarint32FrameDecoder());
        p.addLast(new ProtobufDecoder(BrokerApi.Envelope.getDefaultInstance()));

        /* Outbound: serialize Envelope, then prepend varint32 length */
        p.addLast(new ProtobufVarint32LengthFieldPrepender());
        p.addLast(new ProtobufEncoder());

        p.addLast(EnvelopeCodec.INSTANCE);
        return p;
    }
}
