package io.statestream.eventstream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Events returned by a {@link SnapshotProvider} together with the index they are consistent at.
 */
public final class SnapshotResult {

    private final List<Event> events;
    private final long index;

    public SnapshotResult(List<Event> events, long index) {
        Objects.requireNonNull(events, "Events must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        List<Event> copy = new ArrayList<>(events.size());
        for (Event event : events) {
            copy.add(Objects.requireNonNull(event, "Snapshot must not contain null events"));
        }
        this.events = Collections.unmodifiableList(copy);
        this.index = index;
    }

    public static SnapshotResult empty(long index) {
        return new SnapshotResult(Collections.emptyList(), index);
    }

    public List<Event> getEvents() {
        return events;
    }

    public long getIndex() {
        return index;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
