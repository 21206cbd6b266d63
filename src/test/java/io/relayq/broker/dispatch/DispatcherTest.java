package io.relayq.broker.dispatch;

import io.relayq.broker.BrokerContext;
import io.relayq.broker.client.Client;
import io.relayq.broker.client.RecordingClientChannel;
import io.relayq.broker.delivery.DeliveryRegistry;
import io.relayq.config.impl.BrokerConfig;
import io.relayq.core.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

final class DispatcherTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private BrokerContext context;
    private DeliveryRegistry deliveries;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        context = new BrokerContext(BrokerConfig.defaults());
        deliveries = new DeliveryRegistry();
        dispatcher = new Dispatcher(context, deliveries);
        dispatcher.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        dispatcher.close();
        deliveries.close();
    }

    private static void eventually(final BooleanSupplier condition, final String what) throws InterruptedException {
        final long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "timed out waiting for " + what);
            Thread.sleep(5);
        }
    }

    private Client readyClient(final int port) {
        final Client c = RecordingClientChannel.newClient(port);
        assertTrue(c.markQueued());
        context.getReadyConsumers().push(c);
        return c;
    }

    private static Message message(final String payload, final int retries) {
        return Message.send(payload.getBytes(StandardCharsets.UTF_8), retries);
    }

    @Test
    void skipsDisconnectedClients() throws Exception {
        final Client gone = readyClient(1);
        gone.disconnect();
        final Client alive = readyClient(2);

        final Message m = message("A", 0);
        context.getIngress().push(m);

        assertSame(m, RecordingClientChannel.of(alive).nextWrite(WAIT));
        assertEquals(0, RecordingClientChannel.of(gone).writeCount());
        assertNull(gone.getPending());
        assertEquals(0, context.getReadyConsumers().size());
    }

    @Test
    void waitsForAConsumerBeforeBindingTheMessage() throws Exception {
        final Message m = message("A", 0);
        context.getIngress().push(m);

        eventually(() -> context.getIngress().isEmpty(), "dispatcher to take the message");
        Thread.sleep(50);
        assertEquals(0, deliveries.inFlightCount());

        final Client c = readyClient(1);
        assertSame(m, RecordingClientChannel.of(c).nextWrite(WAIT));
        assertEquals(1, deliveries.inFlightCount());
        assertFalse(c.isQueued(), "a bound client leaves the queued state");
    }

    @Test
    void eachMessageGoesToExactlyOneClient() throws Exception {
        final List<Client> clients = List.of(readyClient(1), readyClient(2), readyClient(3));
        for (int i = 0; i < 3; i++) {
            context.getIngress().push(message("m" + i, 0));
        }

        final Set<String> seen = new HashSet<>();
        for (final Client c : clients) {
            final Message m = RecordingClientChannel.of(c).nextWrite(WAIT);
            assertNotNull(m);
            assertTrue(seen.add(m.payloadAsString()), "duplicate delivery of " + m.payloadAsString());
        }
        Thread.sleep(50);
        for (final Client c : clients) {
            assertEquals(0, RecordingClientChannel.of(c).writeCount(), "second message delivered to " + c);
        }
        assertEquals(Set.of("m0", "m1", "m2"), seen);
    }

    @Test
    void retriedMessageReachesAnotherConsumer() throws Exception {
        final Message m = message("A", 1);
        final Client first = readyClient(1);
        context.getIngress().push(m);

        assertSame(m, RecordingClientChannel.of(first).nextWrite(WAIT));
        RecordingClientChannel.of(first).close();

        final Client second = readyClient(2);
        final Message again = RecordingClientChannel.of(second).nextWrite(WAIT);
        assertSame(m, again);
        assertEquals(0, again.getRetries());

        second.confirm();
        eventually(() -> deliveries.inFlightCount() == 0, "deliveries to resolve");
        assertTrue(context.getIngress().isEmpty());
        assertTrue(context.getDeadLetters().isEmpty());
    }

    @Test
    void stoppingRestoresAnUnboundMessage() throws Exception {
        final Message m = message("A", 0);
        context.getIngress().push(m);
        eventually(() -> context.getIngress().isEmpty(), "dispatcher to take the message");

        dispatcher.close();

        assertFalse(dispatcher.isRunning());
        assertEquals(1, context.getIngress().size());
    }
}
