package io.statestream.eventstream;

/**
 * Exception thrown when an error occurs while publishing or subscribing to events.
 */
public class EventStreamException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventStreamException(String message) {
        super(message);
    }

    public EventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
