package io.relayq.transport.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.relayq.api.BrokerApi;
import io.relayq.core.model.Message;
import io.relayq.core.model.MessageType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class EnvelopeCodecTest {

    @Test
    void deliveryTravelsThroughTheFullPipeline() {
        final EmbeddedChannel out = new EmbeddedChannel();
        Framing.install(out.pipeline());
        final EmbeddedChannel in = new EmbeddedChannel();
        Framing.install(in.pipeline());

        assertTrue(out.writeOutbound(Message.send("hello".getBytes(StandardCharsets.UTF_8), 7)));
        final ByteBuf wire = out.readOutbound();
        assertTrue(in.writeInbound(wire));

        final Message decoded = in.readInbound();
        assertEquals(MessageType.SEND, decoded.getType());
        assertEquals("hello", decoded.payloadAsString());
        assertEquals(7, decoded.getRetries());
    }

    @Test
    void unrecognisedFrameTypeDecodesAsUnknown() {
        final BrokerApi.Envelope env = BrokerApi.Envelope.newBuilder()
                .setTypeValue(42)
                .build();

        assertEquals(MessageType.UNKNOWN, EnvelopeCodec.fromEnvelope(env).getType());
        assertEquals(MessageType.UNKNOWN, EnvelopeCodec.fromEnvelope(BrokerApi.Envelope.getDefaultInstance()).getType());
    }

    @Test
    void retriesAboveEightBitsAreRejected() {
        final BrokerApi.Envelope tooMany = BrokerApi.Envelope.newBuilder()
                .setType(BrokerApi.FrameType.SEND)
                .setRetries(256)
                .build();
        final BrokerApi.Envelope wrapped = BrokerApi.Envelope.newBuilder()
                .setType(BrokerApi.FrameType.SEND)
                .setRetries(-1)
                .build();

        assertThrows(CorruptedFrameException.class, () -> EnvelopeCodec.fromEnvelope(tooMany));
        assertThrows(CorruptedFrameException.class, () -> EnvelopeCodec.fromEnvelope(wrapped));
        assertEquals(255, EnvelopeCodec.fromEnvelope(tooMany.toBuilder().setRetries(255).build()).getRetries());
    }

    @Test
    void unknownMessagesEncodeAsUnspecified() {
        final BrokerApi.Envelope env = EnvelopeCodec.toEnvelope(new Message(MessageType.UNKNOWN, null, 0));
        assertEquals(BrokerApi.FrameType.FRAME_TYPE_UNSPECIFIED, env.getType());
    }
}
