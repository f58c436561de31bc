package io.statestream.eventstream;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A live cursor into a {@link TopicBuffer}, created by {@link EventPublisher#subscribe}.
 *
 * <p>A subscription first returns its snapshot, then an end-of-snapshot sentinel, then every
 * event appended to the topic afterwards. Events for other keys are skipped when the request
 * names a key.
 *
 * <p>A subscription belongs to a single consumer: {@link #next()} must not be called
 * concurrently. {@link #unsubscribe()} and server-side closing may happen from any thread.
 */
public final class Subscription {

    private final SubscribeRequest request;
    private final TopicBuffer buffer;
    private final Consumer<Subscription> onUnsubscribe;
    private final AtomicBoolean unsubscribed = new AtomicBoolean(false);

    private volatile boolean closed = false;
    private BufferItem current;

    Subscription(SubscribeRequest request, TopicBuffer buffer, BufferItem start,
                 Consumer<Subscription> onUnsubscribe) {
        this.request = Objects.requireNonNull(request);
        this.buffer = Objects.requireNonNull(buffer);
        this.current = Objects.requireNonNull(start);
        this.onUnsubscribe = Objects.requireNonNull(onUnsubscribe);
    }

    /**
     * Returns the next event for this subscription, blocking until one is available.
     *
     * <p>Closing is checked before every read, so a closed subscription fails even if events are
     * still buffered ahead of it.
     *
     * @return the next event
     * @throws SubscriptionClosedException if the subscription or its topic buffer was closed by
     *         the server side
     * @throws InterruptedException if the calling thread is interrupted before an event arrives
     */
    public Event next() throws InterruptedException {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Waiting for the next event was cancelled");
            }
            ensureOpen();

            BufferItem.Link link = current.link();
            BufferItem nextItem = link.next();
            if (nextItem == null) {
                buffer.awaitNext(link, this);
                continue;
            }
            current = nextItem;

            Event event = nextItem.event();
            if (matchesKey(event)) {
                return event;
            }
        }
    }

    /**
     * Detaches this subscription from its topic buffer. Subsequent calls to {@link #next()} fail
     * with {@link SubscriptionClosedException}.
     *
     * <p>This method is idempotent - calling it multiple times has no additional effect.
     */
    public void unsubscribe() {
        if (unsubscribed.compareAndSet(false, true)) {
            closed = true;
            buffer.wakeReaders();
            onUnsubscribe.accept(this);
        }
    }

    /**
     * Checks if this subscription can still deliver events.
     *
     * @return false once unsubscribed, reset, or its buffer has been closed
     */
    public boolean isActive() {
        return !closed && !buffer.isClosed();
    }

    public SubscribeRequest getRequest() {
        return request;
    }

    /**
     * Closes the subscription from the server side. A blocked {@link #next()} wakes up and fails
     * with {@link SubscriptionClosedException}. The subscriber is still expected to call
     * {@link #unsubscribe()} to release the buffer.
     */
    void forceClose() {
        closed = true;
        buffer.wakeReaders();
    }

    boolean isClosed() {
        return closed;
    }

    TopicBuffer getBuffer() {
        return buffer;
    }

    private void ensureOpen() {
        if (closed || buffer.isClosed()) {
            throw new SubscriptionClosedException();
        }
    }

    private boolean matchesKey(Event event) {
        String key = request.getKey();
        return key.isEmpty() || key.equals(event.getKey());
    }
}
