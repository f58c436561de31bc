package io.statestream.subscribe.wire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * An event as sent to a client.
 *
 * <p>Exactly one payload is set, identified by {@link #getPayloadCase()}. Top-level events carry
 * the subscribed topic; members of a batch only carry their key and index.
 */
public final class EventMessage {

    /**
     * The payload held by an event message.
     */
    public enum PayloadCase {
        SERVICE_HEALTH,
        EVENT_BATCH,
        END_OF_SNAPSHOT,
        END_OF_EMPTY_SNAPSHOT
    }

    private final SubscribeTopic topic;
    private final String key;
    private final long index;
    private final PayloadCase payloadCase;
    private final ServiceHealthUpdate serviceHealth;
    private final List<EventMessage> eventBatch;

    private EventMessage(@Nullable SubscribeTopic topic, String key, long index, PayloadCase payloadCase,
                         @Nullable ServiceHealthUpdate serviceHealth, @Nullable List<EventMessage> eventBatch) {
        this.topic = topic;
        this.key = Objects.requireNonNull(key, "Key must not be null");
        this.index = index;
        this.payloadCase = payloadCase;
        this.serviceHealth = serviceHealth;
        this.eventBatch = eventBatch;
    }

    public static EventMessage serviceHealth(@Nullable SubscribeTopic topic, String key, long index,
                                             ServiceHealthUpdate update) {
        Objects.requireNonNull(update, "Update must not be null");
        return new EventMessage(topic, key, index, PayloadCase.SERVICE_HEALTH, update, null);
    }

    public static EventMessage eventBatch(@Nullable SubscribeTopic topic, String key, long index,
                                          List<EventMessage> events) {
        Objects.requireNonNull(events, "Events must not be null");
        return new EventMessage(topic, key, index, PayloadCase.EVENT_BATCH, null,
                Collections.unmodifiableList(new ArrayList<>(events)));
    }

    public static EventMessage endOfSnapshot(SubscribeTopic topic, String key, long index) {
        return new EventMessage(topic, key, index, PayloadCase.END_OF_SNAPSHOT, null, null);
    }

    public static EventMessage endOfEmptySnapshot(SubscribeTopic topic, String key, long index) {
        return new EventMessage(topic, key, index, PayloadCase.END_OF_EMPTY_SNAPSHOT, null, null);
    }

    /**
     * @return the topic, or null for members of a batch
     */
    @Nullable
    public SubscribeTopic getTopic() {
        return topic;
    }

    public String getKey() {
        return key;
    }

    public long getIndex() {
        return index;
    }

    public PayloadCase getPayloadCase() {
        return payloadCase;
    }

    /**
     * @throws IllegalStateException if the payload is not a service health update
     */
    public ServiceHealthUpdate getServiceHealth() {
        if (payloadCase != PayloadCase.SERVICE_HEALTH) {
            throw new IllegalStateException("Payload is " + payloadCase + ", not " + PayloadCase.SERVICE_HEALTH);
        }
        return serviceHealth;
    }

    /**
     * @throws IllegalStateException if the payload is not a batch
     */
    public List<EventMessage> getEventBatch() {
        if (payloadCase != PayloadCase.EVENT_BATCH) {
            throw new IllegalStateException("Payload is " + payloadCase + ", not " + PayloadCase.EVENT_BATCH);
        }
        return eventBatch;
    }

    public boolean isEndOfSnapshot() {
        return payloadCase == PayloadCase.END_OF_SNAPSHOT;
    }

    public boolean isEndOfEmptySnapshot() {
        return payloadCase == PayloadCase.END_OF_EMPTY_SNAPSHOT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMessage)) return false;
        EventMessage that = (EventMessage) o;
        return index == that.index
                && topic == that.topic
                && key.equals(that.key)
                && payloadCase == that.payloadCase
                && Objects.equals(serviceHealth, that.serviceHealth)
                && Objects.equals(eventBatch, that.eventBatch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, key, index, payloadCase, serviceHealth, eventBatch);
    }

    @Override
    public String toString() {
        return "EventMessage{" +
                "topic=" + topic +
                ", key='" + key + '\'' +
                ", index=" + index +
                ", payloadCase=" + payloadCase +
                '}';
    }
}
