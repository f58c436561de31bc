package io.statestream.eventstream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import javax.annotation.Nonnull;

/**
 * An immutable unit of change published on a {@link Topic}.
 *
 * <p>Every event carries the index at which the change happened, the topic and key it belongs
 * to, and a {@link Payload}. Events are never modified after creation; {@link #filter(Predicate)}
 * produces a reduced copy instead.
 */
public final class Event {

    private final Topic topic;
    private final String key;
    private final long index;
    private final Payload payload;

    public Event(@Nonnull Topic topic, @Nonnull String key, long index, @Nonnull Payload payload) {
        this.topic = Objects.requireNonNull(topic, "Topic must not be null");
        this.key = Objects.requireNonNull(key, "Key must not be null");
        this.payload = Objects.requireNonNull(payload, "Payload must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        this.index = index;
    }

    public static Event update(Topic topic, String key, long index, Object record) {
        return new Event(topic, key, index, Payload.update(record));
    }

    public static Event batch(Topic topic, String key, long index, List<Event> events) {
        return new Event(topic, key, index, Payload.batch(events));
    }

    public static Event endOfSnapshot(Topic topic, String key, long index) {
        return new Event(topic, key, index, Payload.endOfSnapshot());
    }

    public static Event endOfEmptySnapshot(Topic topic, String key, long index) {
        return new Event(topic, key, index, Payload.endOfEmptySnapshot());
    }

    public Topic getTopic() {
        return topic;
    }

    public String getKey() {
        return key;
    }

    public long getIndex() {
        return index;
    }

    public Payload getPayload() {
        return payload;
    }

    public boolean isEndOfSnapshot() {
        return payload instanceof Payload.EndOfSnapshot;
    }

    public boolean isEndOfEmptySnapshot() {
        return payload instanceof Payload.EndOfEmptySnapshot;
    }

    /**
     * Checks whether this event is one of the snapshot sentinels.
     *
     * @return true for end-of-snapshot and end-of-empty-snapshot events
     */
    public boolean isSentinel() {
        return isEndOfSnapshot() || isEndOfEmptySnapshot();
    }

    /**
     * Returns the number of domain records carried by this event.
     *
     * @return the record count, see {@link Payload#size()}
     */
    public int size() {
        return payload.size();
    }

    /**
     * Filters this event with the given predicate without modifying it.
     *
     * <p>Sentinel events are always returned unchanged. A single update is kept if the predicate
     * accepts it. A batch is reduced to the events the predicate accepts; the same instance is
     * returned when nothing was removed and an empty result when everything was.
     *
     * @param accept predicate applied to single events and to each member of a batch
     * @return the event, a reduced copy, or empty if nothing is left
     */
    public Optional<Event> filter(@Nonnull Predicate<Event> accept) {
        Objects.requireNonNull(accept, "Filter must not be null");
        return payload.accept(new Payload.Visitor<Optional<Event>>() {
            @Override
            public Optional<Event> visitUpdate(Payload.Update update) {
                return accept.test(Event.this) ? Optional.of(Event.this) : Optional.empty();
            }

            @Override
            public Optional<Event> visitBatch(Payload.Batch batch) {
                List<Event> kept = new ArrayList<>(batch.size());
                for (Event member : batch.getEvents()) {
                    if (accept.test(member)) {
                        kept.add(member);
                    }
                }
                if (kept.isEmpty()) {
                    return Optional.empty();
                }
                if (kept.size() == batch.size()) {
                    return Optional.of(Event.this);
                }
                return Optional.of(new Event(topic, key, index, Payload.batch(kept)));
            }

            @Override
            public Optional<Event> visitEndOfSnapshot(Payload.EndOfSnapshot endOfSnapshot) {
                return Optional.of(Event.this);
            }

            @Override
            public Optional<Event> visitEndOfEmptySnapshot(Payload.EndOfEmptySnapshot endOfEmptySnapshot) {
                return Optional.of(Event.this);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event that = (Event) o;
        return index == that.index
                && topic.equals(that.topic)
                && key.equals(that.key)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, key, index, payload);
    }

    @Override
    public String toString() {
        return "Event{" +
                "topic=" + topic.name() +
                ", key='" + key + '\'' +
                ", index=" + index +
                ", payload=" + payload +
                '}';
    }
}
