package io.statestream.eventstream;

import java.util.List;

/**
 * The snapshot part of a subscription: a private chain holding the provider's events and a
 * closing sentinel, whose last link is the topic buffer's tail link at the time it was built.
 *
 * <p>A subscription starting at {@link #head()} therefore reads the snapshot, the sentinel, and
 * then every event the topic buffer appended after the snapshot was taken. Snapshots are cached
 * per key by their {@link TopicBuffer} and shared by later subscriptions with the same key.
 */
final class EventSnapshot {

    private final BufferItem head;
    private final long index;
    private final int size;

    private EventSnapshot(BufferItem head, long index, int size) {
        this.head = head;
        this.index = index;
        this.size = size;
    }

    /**
     * Builds the snapshot chain and splices it onto the topic buffer.
     *
     * @param request the request the snapshot was built for
     * @param result the provider's events and index
     * @param tailLink the topic buffer's current tail link
     * @return the snapshot
     */
    static EventSnapshot splice(SubscribeRequest request, SnapshotResult result, BufferItem.Link tailLink) {
        BufferItem head = BufferItem.head();
        BufferItem last = head;
        List<Event> events = result.getEvents();
        for (Event event : events) {
            BufferItem item = new BufferItem(event);
            last.link().setNext(item);
            last = item;
        }

        Event sentinel = result.isEmpty()
                ? Event.endOfEmptySnapshot(request.getTopic(), request.getKey(), result.getIndex())
                : Event.endOfSnapshot(request.getTopic(), request.getKey(), result.getIndex());
        last.link().setNext(new BufferItem(sentinel, tailLink));
        return new EventSnapshot(head, result.getIndex(), events.size());
    }

    BufferItem head() {
        return head;
    }

    long getIndex() {
        return index;
    }

    int size() {
        return size;
    }
}
