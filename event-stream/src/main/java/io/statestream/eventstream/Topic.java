package io.statestream.eventstream;

/**
 * Identifies a class of events a subscriber can watch, for example health changes of services.
 *
 * <p>Topics are defined by the surrounding system, usually as an enum. Implementations must be
 * immutable and provide consistent {@code equals}/{@code hashCode}, since topics are used as map
 * keys by the {@link EventPublisher}.
 */
public interface Topic {

    /**
     * Returns the display name of this topic, used in logs and error messages.
     *
     * @return the topic name
     */
    String name();
}
