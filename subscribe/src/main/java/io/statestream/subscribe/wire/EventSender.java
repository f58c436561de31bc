package io.statestream.subscribe.wire;

/**
 * Server side of a subscribe call: sends events to the client.
 */
@FunctionalInterface
public interface EventSender {

    /**
     * Sends one event to the client.
     *
     * @param event the event to send
     * @throws StatusException if the event cannot be delivered; the call ends with this error
     */
    void send(EventMessage event) throws StatusException;
}
