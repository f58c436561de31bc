package io.statestream.eventstream;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Append-only sequence of events for one topic, read concurrently by many subscriptions.
 *
 * <p>The buffer is a singly-linked chain of {@link BufferItem}s. Each reader holds its own
 * position in the chain, so nothing is copied per reader and an item never moves once appended.
 * Items nobody references any more are reclaimed by the garbage collector.
 *
 * <p>Threading model:
 * <ul>
 *   <li>{@link #append(List)} is only called by the {@link EventPublisher} while it holds its
 *       lock, so there is a single writer at any time</li>
 *   <li>readers follow already-set links without locking and only enter the buffer's monitor to
 *       wait at the tail</li>
 *   <li>reader counting, the snapshot cache and the eviction task are guarded by the publisher's
 *       lock</li>
 * </ul>
 */
final class TopicBuffer {

    private final Topic topic;
    private final Object monitor = new Object();

    private volatile BufferItem tail = BufferItem.head();
    private volatile boolean closed;
    private long lastIndex;

    // Guarded by the publisher's lock.
    private final Map<String, EventSnapshot> snapshots = new HashMap<>();
    private final Map<String, Integer> readersByKey = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> snapshotExpiryTasks = new HashMap<>();
    private int readers;
    private ScheduledFuture<?> evictionTask;

    TopicBuffer(Topic topic) {
        this.topic = Objects.requireNonNull(topic, "Topic must not be null");
    }

    Topic getTopic() {
        return topic;
    }

    /**
     * Returns the link readers will follow to see the next appended event.
     */
    BufferItem.Link tailLink() {
        return tail.link();
    }

    /**
     * Appends events to the tail and wakes every reader waiting there.
     *
     * <p>The events become visible to readers all at once, in list order.
     *
     * @param events events to append, all for this buffer's topic
     * @throws IllegalArgumentException if an event's index is lower than the last appended one
     * @throws IllegalStateException if the buffer has been closed
     */
    void append(List<Event> events) {
        if (closed) {
            throw new IllegalStateException("Topic buffer " + topic.name() + " has been closed");
        }
        if (events.isEmpty()) {
            return;
        }
        long previous = lastIndex;
        for (Event event : events) {
            if (event.getIndex() < previous) {
                throw new IllegalArgumentException(String.format(
                        "Index %d on topic %s is lower than previously appended index %d",
                        event.getIndex(), topic.name(), previous));
            }
            previous = event.getIndex();
        }

        BufferItem first = new BufferItem(events.get(0));
        BufferItem last = first;
        for (int i = 1; i < events.size(); i++) {
            BufferItem item = new BufferItem(events.get(i));
            last.link().setNext(item);
            last = item;
        }

        synchronized (monitor) {
            tail.link().setNext(first);
            tail = last;
            lastIndex = previous;
            monitor.notifyAll();
        }
    }

    /**
     * Blocks until the given link is set, the buffer is closed, or the subscription is closed.
     *
     * @param link the link the subscription is waiting on
     * @param subscription the waiting subscription
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void awaitNext(BufferItem.Link link, Subscription subscription) throws InterruptedException {
        synchronized (monitor) {
            while (link.next() == null && !closed && !subscription.isClosed()) {
                monitor.wait();
            }
        }
    }

    /**
     * Wakes every reader waiting at the tail so that it re-checks its closed state.
     */
    void wakeReaders() {
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * Closes the buffer. Waiting and future reads fail with {@link SubscriptionClosedException}.
     */
    void close() {
        closed = true;
        cancelEviction();
        for (ScheduledFuture<?> task : snapshotExpiryTasks.values()) {
            task.cancel(false);
        }
        snapshotExpiryTasks.clear();
        snapshots.clear();
        wakeReaders();
    }

    EventSnapshot getSnapshot(String key) {
        return snapshots.get(key);
    }

    void putSnapshot(String key, EventSnapshot snapshot) {
        snapshots.put(key, snapshot);
    }

    int getReaderCount() {
        return readers;
    }

    int getReaderCount(String key) {
        return readersByKey.getOrDefault(key, 0);
    }

    /**
     * Registers a new reader for a key and cancels any pending eviction of the buffer or of the
     * key's snapshot.
     */
    void attach(String key) {
        readers++;
        readersByKey.merge(key, 1, Integer::sum);
        cancelEviction();
        ScheduledFuture<?> expiry = snapshotExpiryTasks.remove(key);
        if (expiry != null) {
            expiry.cancel(false);
        }
    }

    /**
     * Unregisters a reader of a key.
     *
     * @return the number of readers still attached to the buffer
     */
    int detach(String key) {
        readersByKey.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
        if (readers > 0) {
            readers--;
        }
        return readers;
    }

    /**
     * Schedules the buffer's eviction, replacing any eviction already pending.
     *
     * @param scheduler the scheduler running the eviction
     * @param gracePeriod how long the buffer may stay idle
     * @param eviction the action removing the buffer from its publisher
     */
    void scheduleEviction(ScheduledExecutorService scheduler, Duration gracePeriod, Runnable eviction) {
        cancelEviction();
        evictionTask = scheduler.schedule(eviction, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean isEvictionPending() {
        return evictionTask != null && !evictionTask.isDone();
    }

    /**
     * Schedules dropping the cached snapshot of a key nobody reads any more, replacing any expiry
     * already pending for that key. Does nothing when no snapshot is cached for the key.
     *
     * @param scheduler the scheduler running the expiry
     * @param gracePeriod how long the snapshot is kept without readers
     * @param key the snapshot's key
     * @param expiry the action calling {@link #expireSnapshot(String)} under the publisher's lock
     */
    void scheduleSnapshotExpiry(ScheduledExecutorService scheduler, Duration gracePeriod, String key,
                                Runnable expiry) {
        if (!snapshots.containsKey(key)) {
            return;
        }
        ScheduledFuture<?> previous = snapshotExpiryTasks.put(key,
                scheduler.schedule(expiry, gracePeriod.toMillis(), TimeUnit.MILLISECONDS));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    boolean isSnapshotExpiryPending(String key) {
        ScheduledFuture<?> task = snapshotExpiryTasks.get(key);
        return task != null && !task.isDone();
    }

    /**
     * Drops the cached snapshot of a key if it still has no readers.
     *
     * @return true if the snapshot was dropped
     */
    boolean expireSnapshot(String key) {
        snapshotExpiryTasks.remove(key);
        if (getReaderCount(key) > 0) {
            return false;
        }
        return snapshots.remove(key) != null;
    }

    private void cancelEviction() {
        if (evictionTask != null) {
            evictionTask.cancel(false);
            evictionTask = null;
        }
    }
}
