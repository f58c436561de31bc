package io.statestream.eventstream;

/**
 * One position in a {@link TopicBuffer}: an event plus the link to the next position.
 *
 * <p>The link is a separate object so that a snapshot can end on the same link as the topic
 * buffer's tail: whatever the buffer appends next becomes visible to readers of both.
 */
final class BufferItem {

    private final Event event;
    private final Link link;

    BufferItem(Event event) {
        this(event, new Link());
    }

    BufferItem(Event event, Link link) {
        this.event = event;
        this.link = link;
    }

    /**
     * Creates the empty item a chain starts from. Readers begin here and never return its event.
     */
    static BufferItem head() {
        return new BufferItem(null);
    }

    Event event() {
        return event;
    }

    Link link() {
        return link;
    }

    /**
     * Pointer to the next item, set exactly once.
     */
    static final class Link {

        private volatile BufferItem next;

        BufferItem next() {
            return next;
        }

        void setNext(BufferItem item) {
            if (next != null) {
                throw new IllegalStateException("Buffer link already set");
            }
            next = item;
        }
    }
}
