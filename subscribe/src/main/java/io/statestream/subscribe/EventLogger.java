package io.statestream.subscribe;

import io.statestream.eventstream.Event;
import io.statestream.subscribe.wire.SubscribeMessage;
import org.slf4j.Logger;

/**
 * Traces the events sent on one subscribe call without logging every snapshot event.
 *
 * <p>Snapshot events are only counted; the end of the snapshot is logged with the number of
 * records sent so far, and each later send is logged with its index and batch size.
 */
final class EventLogger {

    private final Logger logger;
    private final SubscribeMessage request;
    private boolean snapshotDone;
    private long count;

    EventLogger(Logger logger, SubscribeMessage request) {
        this.logger = logger;
        this.request = request;
    }

    void trace(Event event) {
        if (event.isSentinel()) {
            snapshotDone = true;
            logger.trace("snapshot complete: index={}, sent={}, request={}", event.getIndex(), count, request);
        } else if (snapshotDone) {
            logger.trace("sending events: index={}, sent={}, batch_size={}, request={}",
                    event.getIndex(), count, event.size(), request);
        }
        count += event.size();
    }

    long getCount() {
        return count;
    }

    boolean isSnapshotDone() {
        return snapshotDone;
    }
}
