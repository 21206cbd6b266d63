package io.relayq.core.model;

/**
 * Kind of a frame exchanged between a client and the broker.
 */
public enum MessageType {
    /**
     * Producer hands a payload to the broker; also used for deliveries to consumers.
     */
    SEND,
    /**
     * Consumer asks for the next message.
     */
    RECEIVE,
    /**
     * Consumer acknowledges the message it currently holds.
     */
    CONFIRM,
    /**
     * Any frame the broker does not recognise.
     */
    UNKNOWN
}
