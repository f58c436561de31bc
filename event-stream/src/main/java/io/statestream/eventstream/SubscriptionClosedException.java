package io.statestream.eventstream;

/**
 * Thrown when a subscription was closed by the server side: the publisher shut down, the topic
 * buffer was torn down, or the subscription was reset after an authorization change.
 *
 * <p>Subscribers react by subscribing again from scratch. This is distinct from the
 * {@link InterruptedException} thrown when the caller cancels its own wait.
 */
public class SubscriptionClosedException extends EventStreamException {

    private static final long serialVersionUID = 1L;

    public SubscriptionClosedException() {
        super("subscription closed by server, client should resubscribe");
    }

    public SubscriptionClosedException(String message) {
        super(message);
    }
}
