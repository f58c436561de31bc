package io.statestream.eventstream;

/**
 * Produces the current state of a topic as a list of events.
 *
 * <p>One provider is registered per topic when the {@link EventPublisher} is constructed. The
 * publisher calls it synchronously while holding its lock, so it must not call back into the
 * publisher. It may block, for example on a database scan; callers bound the overall wait
 * through interruption.
 */
@FunctionalInterface
public interface SnapshotProvider {

    /**
     * Builds a snapshot for the given request.
     *
     * @param request the subscription being created
     * @return the snapshot events, in delivery order, and the index they represent
     * @throws RuntimeException if the snapshot cannot be built; the subscribe call fails and no
     *         partial snapshot is delivered
     */
    SnapshotResult snapshot(SubscribeRequest request);
}
