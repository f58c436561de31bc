package io.statestream.eventstream;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every {@link TopicBuffer}, accepts published events and creates {@link Subscription}s.
 *
 * <p>A subscription starts with a snapshot of the topic, produced by the topic's
 * {@link SnapshotProvider}, followed by every event published afterwards. Snapshots are cached
 * per topic and key, so subscribers arriving later reuse them instead of calling the provider
 * again.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #run()} is the coordination loop: it appends published events to their buffers.
 *       It must be running for published events to reach subscribers, typically on a dedicated
 *       thread</li>
 *   <li>interrupting the thread running {@link #run()}, or calling {@link #close()}, shuts the
 *       publisher down: every subscription is closed and new subscriptions are refused</li>
 *   <li>a topic buffer without subscriptions is evicted, with its snapshots, once it has been
 *       idle for the eviction grace period</li>
 *   <li>a cached snapshot whose key has no subscriptions left is dropped after the same grace
 *       period, even while other keys keep the buffer alive</li>
 * </ul>
 *
 * <p>Thread-safety guarantees:
 * <ul>
 *   <li>{@link #publish(List)}, {@link #subscribe(SubscribeRequest)} and
 *       {@link #closeSubscriptionsForTokens(Collection)} may be called from any thread</li>
 *   <li>appends, snapshot creation and eviction are serialized by a single lock, so within a
 *       topic every subscriber observes the same order, and a snapshot's sentinel always comes
 *       before events appended after it was taken</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * EventPublisher publisher = new EventPublisher(providers, Duration.ofSeconds(10));
 * executor.submit(publisher);
 *
 * Subscription subscription = publisher.subscribe(new SubscribeRequest(topic, "web"));
 * Event event = subscription.next();
 * }</pre>
 */
public class EventPublisher implements Runnable, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventPublisher.class);

    /**
     * Default time an idle topic buffer is kept before it is evicted.
     */
    public static final Duration DEFAULT_EVICTION_GRACE_PERIOD = Duration.ofSeconds(10);

    // Wakes the coordination loop on close; compared by identity.
    private static final List<Event> SHUTDOWN = Collections.unmodifiableList(new ArrayList<>());

    private final Map<Topic, SnapshotProvider> snapshotProviders;
    private final Duration evictionGracePeriod;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    // Guarded by lock.
    private final Map<Topic, TopicBuffer> topicBuffers = new HashMap<>();

    private final BlockingQueue<List<Event>> publishQueue = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, Set<Subscription>> subscriptionsByToken = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong totalEventsPublished = new AtomicLong(0);
    private final AtomicLong snapshotCount = new AtomicLong(0);

    /**
     * Creates a new EventPublisher with the default eviction grace period.
     *
     * @param snapshotProviders snapshot provider per topic
     */
    public EventPublisher(@Nonnull Map<? extends Topic, SnapshotProvider> snapshotProviders) {
        this(snapshotProviders, DEFAULT_EVICTION_GRACE_PERIOD);
    }

    /**
     * Creates a new EventPublisher evicting idle buffers on its own daemon scheduler thread.
     *
     * @param snapshotProviders snapshot provider per topic
     * @param evictionGracePeriod how long a topic buffer without subscriptions is kept
     */
    public EventPublisher(@Nonnull Map<? extends Topic, SnapshotProvider> snapshotProviders,
                          @Nonnull Duration evictionGracePeriod) {
        this(snapshotProviders, evictionGracePeriod, createDefaultScheduler(), true);
    }

    /**
     * Creates a new EventPublisher with a specific scheduler, mainly for testing purposes. The
     * scheduler is not shut down by {@link #close()}.
     *
     * @param snapshotProviders snapshot provider per topic
     * @param evictionGracePeriod how long a topic buffer without subscriptions is kept
     * @param scheduler the scheduler running buffer evictions
     */
    public EventPublisher(@Nonnull Map<? extends Topic, SnapshotProvider> snapshotProviders,
                          @Nonnull Duration evictionGracePeriod,
                          @Nonnull ScheduledExecutorService scheduler) {
        this(snapshotProviders, evictionGracePeriod, scheduler, false);
    }

    private EventPublisher(Map<? extends Topic, SnapshotProvider> snapshotProviders,
                           Duration evictionGracePeriod,
                           ScheduledExecutorService scheduler,
                           boolean ownsScheduler) {
        Objects.requireNonNull(snapshotProviders, "Snapshot providers must not be null");
        Objects.requireNonNull(evictionGracePeriod, "Eviction grace period must not be null");
        if (evictionGracePeriod.isNegative()) {
            throw new IllegalArgumentException("evictionGracePeriod must not be negative");
        }
        Map<Topic, SnapshotProvider> providers = new HashMap<>();
        snapshotProviders.forEach((topic, provider) -> providers.put(
                Objects.requireNonNull(topic, "Topic must not be null"),
                Objects.requireNonNull(provider, "Snapshot provider must not be null")));
        this.snapshotProviders = Collections.unmodifiableMap(providers);
        this.evictionGracePeriod = evictionGracePeriod;
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must not be null");
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Publishes events to the subscribers of their topics.
     *
     * <p>Events are handed to the coordination loop and appended in call order. Events for a
     * topic nobody subscribed to are dropped: a later subscriber gets them through its snapshot.
     * No authorization filtering happens here.
     *
     * @param events the events to publish, in order
     * @throws NullPointerException if events or any event is null
     * @throws IllegalArgumentException if the indices of one topic decrease within the list
     * @throws IllegalStateException if the publisher has been closed
     */
    public void publish(@Nonnull List<Event> events) {
        Objects.requireNonNull(events, "Events must not be null");
        ensureNotClosed();

        Map<Topic, Long> lastIndexByTopic = new HashMap<>();
        for (Event event : events) {
            Objects.requireNonNull(event, "Event must not be null");
            Long previous = lastIndexByTopic.put(event.getTopic(), event.getIndex());
            if (previous != null && event.getIndex() < previous) {
                throw new IllegalArgumentException(String.format(
                        "Index %d on topic %s is lower than preceding index %d",
                        event.getIndex(), event.getTopic().name(), previous));
            }
        }
        if (events.isEmpty()) {
            return;
        }
        totalEventsPublished.addAndGet(events.size());
        publishQueue.add(new ArrayList<>(events));
    }

    /**
     * Creates a subscription positioned at the start of a snapshot of the requested topic.
     *
     * <p>The snapshot is taken from the cache of the topic's buffer when one exists for the
     * request's key, otherwise the topic's {@link SnapshotProvider} is called synchronously.
     * Concurrent subscribers for the same key never compute the snapshot twice.
     *
     * @param request the subscription parameters
     * @return a new subscription; the caller must {@link Subscription#unsubscribe()} it
     * @throws EventStreamException if no provider is registered for the topic, or the provider
     *         failed
     * @throws SubscriptionClosedException if the publisher has been closed
     */
    public Subscription subscribe(@Nonnull SubscribeRequest request) {
        Objects.requireNonNull(request, "Subscribe request must not be null");
        Topic topic = request.getTopic();
        SnapshotProvider provider = snapshotProviders.get(topic);
        if (provider == null) {
            throw new EventStreamException("No snapshot provider registered for topic " + topic.name());
        }

        Subscription subscription;
        synchronized (lock) {
            if (closed.get()) {
                throw new SubscriptionClosedException("EventPublisher has been closed");
            }
            TopicBuffer buffer = topicBuffers.get(topic);
            boolean created = buffer == null;
            if (created) {
                buffer = new TopicBuffer(topic);
                topicBuffers.put(topic, buffer);
                LOGGER.debug("Created topic buffer for {}", topic.name());
            }

            EventSnapshot snapshot = buffer.getSnapshot(request.getKey());
            if (snapshot == null) {
                try {
                    snapshot = createSnapshot(request, provider, buffer);
                } catch (RuntimeException e) {
                    if (created) {
                        topicBuffers.remove(topic);
                    }
                    throw e;
                }
                buffer.putSnapshot(request.getKey(), snapshot);
            } else {
                LOGGER.trace("Reusing cached snapshot at index {} for {}", snapshot.getIndex(), request);
            }

            subscription = new Subscription(request, buffer, snapshot.head(), this::unsubscribe);
            buffer.attach(request.getKey());
            registerToken(subscription);
        }
        return subscription;
    }

    /**
     * Closes every live subscription created with one of the given tokens.
     *
     * <p>Called when the permissions behind a token change: the affected subscribers receive
     * {@link SubscriptionClosedException} and must subscribe again, which re-evaluates their
     * authorization.
     *
     * @param tokens the tokens whose subscriptions to close
     * @return the number of subscriptions closed
     */
    public int closeSubscriptionsForTokens(@Nonnull Collection<String> tokens) {
        Objects.requireNonNull(tokens, "Tokens must not be null");
        int count = 0;
        for (String token : tokens) {
            Set<Subscription> subscriptions = subscriptionsByToken.get(token);
            if (subscriptions == null) {
                continue;
            }
            for (Subscription subscription : subscriptions) {
                if (subscription.isActive()) {
                    subscription.forceClose();
                    count++;
                }
            }
        }
        if (count > 0) {
            LOGGER.debug("Closed {} subscriptions for {} tokens", count, tokens.size());
        }
        return count;
    }

    /**
     * Runs the coordination loop until the publisher is closed or the running thread is
     * interrupted, then closes the publisher.
     */
    @Override
    public void run() {
        LOGGER.info("EventPublisher started - topics: {}", snapshotProviders.size());
        try {
            while (!closed.get()) {
                List<Event> events = publishQueue.take();
                if (events == SHUTDOWN) {
                    break;
                }
                dispatch(events);
            }
        } catch (InterruptedException e) {
            LOGGER.debug("EventPublisher interrupted, shutting down");
            Thread.currentThread().interrupt();
        } finally {
            close();
        }
    }

    /**
     * Groups events by topic and appends each group to its topic's buffer.
     *
     * <p>A failure on one topic is logged and does not prevent delivery on the others.
     */
    private void dispatch(List<Event> events) {
        Map<Topic, List<Event>> byTopic = new LinkedHashMap<>();
        for (Event event : events) {
            byTopic.computeIfAbsent(event.getTopic(), topic -> new ArrayList<>()).add(event);
        }

        synchronized (lock) {
            for (Map.Entry<Topic, List<Event>> entry : byTopic.entrySet()) {
                TopicBuffer buffer = topicBuffers.get(entry.getKey());
                if (buffer == null) {
                    LOGGER.trace("No subscribers for topic {}, dropping {} events",
                            entry.getKey().name(), entry.getValue().size());
                    continue;
                }
                try {
                    buffer.append(entry.getValue());
                } catch (RuntimeException e) {
                    LOGGER.error("Failed to append {} events to topic {}",
                            entry.getValue().size(), entry.getKey().name(), e);
                }
            }
        }
    }

    private EventSnapshot createSnapshot(SubscribeRequest request, SnapshotProvider provider, TopicBuffer buffer) {
        SnapshotResult result;
        try {
            result = provider.snapshot(request);
        } catch (RuntimeException e) {
            throw new EventStreamException("Failed to build snapshot for " + request, e);
        }
        if (result == null) {
            throw new EventStreamException("Snapshot provider returned no result for " + request);
        }
        EventSnapshot snapshot = EventSnapshot.splice(request, result, buffer.tailLink());
        snapshotCount.incrementAndGet();
        LOGGER.debug("Created snapshot with {} events at index {} for {}",
                snapshot.size(), snapshot.getIndex(), request);
        return snapshot;
    }

    // The set is only modified inside compute calls, so a set is never mutated after it left the map.
    private void registerToken(Subscription subscription) {
        subscriptionsByToken.compute(subscription.getRequest().getToken(), (token, current) -> {
            Set<Subscription> subscriptions = current != null ? current : ConcurrentHashMap.newKeySet();
            subscriptions.add(subscription);
            return subscriptions;
        });
    }

    private void unregisterToken(Subscription subscription) {
        subscriptionsByToken.computeIfPresent(subscription.getRequest().getToken(), (token, current) -> {
            current.remove(subscription);
            return current.isEmpty() ? null : current;
        });
    }

    private void unsubscribe(Subscription subscription) {
        unregisterToken(subscription);

        synchronized (lock) {
            TopicBuffer buffer = subscription.getBuffer();
            String key = subscription.getRequest().getKey();
            int remaining = buffer.detach(key);
            if (closed.get() || topicBuffers.get(buffer.getTopic()) != buffer) {
                return;
            }
            if (buffer.getReaderCount(key) == 0) {
                try {
                    buffer.scheduleSnapshotExpiry(scheduler, evictionGracePeriod, key,
                            () -> expireSnapshot(buffer, key));
                } catch (RejectedExecutionException e) {
                    LOGGER.warn("Could not schedule expiry of snapshot {} on topic {}, expiring now",
                            key, buffer.getTopic().name(), e);
                    buffer.expireSnapshot(key);
                }
            }
            if (remaining > 0) {
                return;
            }
            try {
                buffer.scheduleEviction(scheduler, evictionGracePeriod, () -> evict(buffer));
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Could not schedule eviction of topic buffer {}, evicting now",
                        buffer.getTopic().name(), e);
                evict(buffer);
            }
        }
    }

    private void expireSnapshot(TopicBuffer buffer, String key) {
        synchronized (lock) {
            if (topicBuffers.get(buffer.getTopic()) != buffer) {
                return;
            }
            if (buffer.expireSnapshot(key)) {
                LOGGER.debug("Dropped unused snapshot for key '{}' on topic {}", key, buffer.getTopic().name());
            }
        }
    }

    private void evict(TopicBuffer buffer) {
        synchronized (lock) {
            Topic topic = buffer.getTopic();
            if (topicBuffers.get(topic) != buffer || buffer.getReaderCount() > 0) {
                return;
            }
            topicBuffers.remove(topic);
            buffer.close();
            LOGGER.debug("Evicted idle topic buffer for {}", topic.name());
        }
    }

    // Metrics and debugging methods

    /**
     * Gets the total number of events accepted by {@link #publish(List)}.
     *
     * @return the event count
     */
    public long getTotalEventsPublished() {
        return totalEventsPublished.get();
    }

    /**
     * Gets the number of snapshots built by snapshot providers.
     *
     * @return the snapshot count
     */
    public long getSnapshotCount() {
        return snapshotCount.get();
    }

    /**
     * Gets the number of live topic buffers.
     *
     * @return the topic buffer count
     */
    public int getTopicBufferCount() {
        synchronized (lock) {
            return topicBuffers.size();
        }
    }

    /**
     * Gets the number of subscriptions attached to topic buffers.
     *
     * @return the subscription count
     */
    public int getSubscriptionCount() {
        synchronized (lock) {
            int count = 0;
            for (TopicBuffer buffer : topicBuffers.values()) {
                count += buffer.getReaderCount();
            }
            return count;
        }
    }

    /**
     * Shuts the publisher down: closes every topic buffer, which fails all waiting and future
     * {@link Subscription#next()} calls with {@link SubscriptionClosedException}, and refuses new
     * subscriptions. Stops the coordination loop if it is running.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            LOGGER.debug("EventPublisher already closed");
            return;
        }

        int bufferCount;
        synchronized (lock) {
            bufferCount = topicBuffers.size();
            for (TopicBuffer buffer : topicBuffers.values()) {
                buffer.close();
            }
            topicBuffers.clear();
        }
        subscriptionsByToken.clear();
        publishQueue.clear();
        publishQueue.add(SHUTDOWN);
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }

        LOGGER.info("EventPublisher closed - Total events published: {}, Snapshots: {}, Closed topic buffers: {}",
                getTotalEventsPublished(), getSnapshotCount(), bufferCount);
    }

    /**
     * Checks if this EventPublisher has been closed.
     *
     * @return true if the EventPublisher has been closed, false otherwise
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Ensures the EventPublisher is not closed before performing operations.
     *
     * @throws IllegalStateException if the EventPublisher has been closed
     */
    protected void ensureNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("EventPublisher has been closed");
        }
    }

    /**
     * Creates the default single-threaded scheduler used for buffer eviction.
     *
     * @return a daemon {@link ScheduledExecutorService} named {@code EventPublisher-eviction}
     */
    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "EventPublisher-eviction");
            t.setDaemon(true);
            return t;
        });
    }
}
