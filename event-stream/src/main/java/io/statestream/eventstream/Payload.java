package io.statestream.eventstream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The content carried by an {@link Event}.
 *
 * <p>A payload is exactly one of four cases:
 * <ul>
 *   <li>{@link Update} - a single domain record</li>
 *   <li>{@link Batch} - an ordered list of events, used for snapshot bulk delivery and coalesced
 *       updates</li>
 *   <li>{@link EndOfSnapshot} - marks the end of a non-empty snapshot</li>
 *   <li>{@link EndOfEmptySnapshot} - marks a snapshot that contained no events</li>
 * </ul>
 *
 * <p>The set of cases is closed: the constructor is private, so no other subclass can exist.
 * Consumers dispatch through {@link #accept(Visitor)}, which makes the compiler check that every
 * case is handled.
 */
public abstract class Payload {

    private Payload() {
    }

    /**
     * Handles each payload case. Adding a case to {@link Payload} breaks every visitor at compile
     * time.
     *
     * @param <R> the result type
     */
    public interface Visitor<R> {

        R visitUpdate(Update update);

        R visitBatch(Batch batch);

        R visitEndOfSnapshot(EndOfSnapshot endOfSnapshot);

        R visitEndOfEmptySnapshot(EndOfEmptySnapshot endOfEmptySnapshot);
    }

    /**
     * Dispatches to the visitor method matching this payload's case.
     *
     * @param visitor the visitor
     * @param <R> the result type
     * @return the visitor's result
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Returns the number of domain records carried by this payload.
     *
     * @return 1 for an update, the batch length for a batch, 0 for sentinels
     */
    public abstract int size();

    public static Update update(Object record) {
        return new Update(record);
    }

    public static Batch batch(List<Event> events) {
        return new Batch(events);
    }

    public static EndOfSnapshot endOfSnapshot() {
        return EndOfSnapshot.INSTANCE;
    }

    public static EndOfEmptySnapshot endOfEmptySnapshot() {
        return EndOfEmptySnapshot.INSTANCE;
    }

    /**
     * A single domain record.
     */
    public static final class Update extends Payload {

        private final Object record;

        private Update(Object record) {
            this.record = Objects.requireNonNull(record, "Record must not be null");
        }

        public Object getRecord() {
            return record;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpdate(this);
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Update)) return false;
            return record.equals(((Update) o).record);
        }

        @Override
        public int hashCode() {
            return record.hashCode();
        }

        @Override
        public String toString() {
            return "Update{" + record + '}';
        }
    }

    /**
     * An ordered, immutable list of events.
     */
    public static final class Batch extends Payload {

        private final List<Event> events;

        private Batch(List<Event> events) {
            Objects.requireNonNull(events, "Events must not be null");
            List<Event> copy = new ArrayList<>(events.size());
            for (Event event : events) {
                copy.add(Objects.requireNonNull(event, "Batch must not contain null events"));
            }
            this.events = Collections.unmodifiableList(copy);
        }

        public List<Event> getEvents() {
            return events;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBatch(this);
        }

        @Override
        public int size() {
            return events.size();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Batch)) return false;
            return events.equals(((Batch) o).events);
        }

        @Override
        public int hashCode() {
            return events.hashCode();
        }

        @Override
        public String toString() {
            return "Batch{size=" + events.size() + '}';
        }
    }

    /**
     * Sentinel sent after the last event of a non-empty snapshot.
     */
    public static final class EndOfSnapshot extends Payload {

        private static final EndOfSnapshot INSTANCE = new EndOfSnapshot();

        private EndOfSnapshot() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEndOfSnapshot(this);
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public String toString() {
            return "EndOfSnapshot";
        }
    }

    /**
     * Sentinel sent in place of a snapshot that contained no events.
     */
    public static final class EndOfEmptySnapshot extends Payload {

        private static final EndOfEmptySnapshot INSTANCE = new EndOfEmptySnapshot();

        private EndOfEmptySnapshot() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEndOfEmptySnapshot(this);
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public String toString() {
            return "EndOfEmptySnapshot";
        }
    }
}
