package io.relayq.broker.delivery;

/**
 * Terminal states of one delivery attempt.
 */
public enum DeliveryOutcome {
    /** The consumer confirmed; the message is done. */
    CONFIRMED,
    /** Not confirmed; the message went back to the ingress queue. */
    RETRY,
    /** Not confirmed and out of retries; the message went to the dead-letter sink. */
    DEAD_LETTER,
    /** Not confirmed, out of retries, dead-lettering disabled; the message is gone. */
    DROP
}
