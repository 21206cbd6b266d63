package io.relayq.broker.delivery;

import io.relayq.broker.BrokerContext;
import io.relayq.broker.client.Client;
import io.relayq.core.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One delivery attempt of a message to a client.
 * <p>
 * The message is placed in the client's pending slot and written out, then the task parks on
 * the client's ready signal. Only a CONFIRM (which empties the slot) or a disconnect (which
 * leaves it filled) raises that signal, so the slot tells the two apart on wake-up. Both a
 * disconnect and a consumer that simply never confirms end up on the retry path; there is no
 * timeout.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class DeliveryTask {

    private final Message message;
    private final Client client;
    private final BrokerContext context;

    public DeliveryOutcome deliver() {
        // captured before binding: a CONFIRM plus follow-up RECEIVE may both run before we park
        final long observed = client.getReadySignal().generation();

        if (!client.beginDelivery(message)) {
            // single-flight guard: hand the message back untouched
            log.warn("{} still holds an unconfirmed message, returning {} to the ingress queue", client, message);
            context.getIngress().push(message);
            return DeliveryOutcome.RETRY;
        }

        if (!client.getChannel().write(message)) {
            log.debug("Write to {} failed, closing its stream", client);
            client.getChannel().close();
        }

        try {
            client.getReadySignal().await(observed);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            if (client.releaseUnconfirmed(message)) {
                log.warn("Interrupted while awaiting confirmation from {}, requeueing {}", client, message);
                context.getIngress().push(message);
                return DeliveryOutcome.RETRY;
            }
            return DeliveryOutcome.CONFIRMED;
        }

        if (!client.releaseUnconfirmed(message)) {
            log.debug("{} confirmed {}", client, message);
            return DeliveryOutcome.CONFIRMED;
        }

        return resolveUnconfirmed();
    }

    private DeliveryOutcome resolveUnconfirmed() {
        if (message.isExhausted()) {
            if (context.isDeadLetterEnabled()) {
                context.getDeadLetters().push(message);
                log.info("{} was not confirmed by {} and has no retries left, moved to dead-letter queue", message, client);
                return DeliveryOutcome.DEAD_LETTER;
            }
            log.info("{} was not confirmed by {} and has no retries left, dropped", message, client);
            return DeliveryOutcome.DROP;
        }

        message.consumeRetry();
        context.getIngress().push(message);
        log.debug("{} was not confirmed by {}, requeued", message, client);
        return DeliveryOutcome.RETRY;
    }
}
