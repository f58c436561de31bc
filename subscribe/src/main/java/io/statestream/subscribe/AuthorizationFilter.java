package io.statestream.subscribe;

import io.statestream.eventstream.Event;
import io.statestream.eventstream.Payload;
import io.statestream.subscribe.state.CheckServiceNode;
import io.statestream.subscribe.state.ServiceHealthChange;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Removes the records a caller may not read from the events sent to it.
 *
 * <p>Filtering has no side effects and never modifies the event it is given.
 */
public final class AuthorizationFilter {

    private AuthorizationFilter() {
    }

    /**
     * Filters an event by the caller's permissions.
     *
     * <ul>
     *   <li>without an authorizer every event is kept unchanged</li>
     *   <li>a single update is kept if it is readable</li>
     *   <li>a batch keeps only its readable members and is dropped when none is</li>
     *   <li>snapshot sentinels are always kept</li>
     * </ul>
     *
     * @param authorizer the caller's permissions, null when authorization is disabled
     * @param event the event to filter
     * @return the event or a reduced copy, or empty if nothing may be sent
     */
    public static Optional<Event> filter(@Nullable Authorizer authorizer, @Nonnull Event event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (authorizer == null) {
            return Optional.of(event);
        }
        return event.filter(candidate -> canRead(authorizer, candidate));
    }

    private static boolean canRead(Authorizer authorizer, Event event) {
        return event.getPayload().accept(new Payload.Visitor<Boolean>() {
            @Override
            public Boolean visitUpdate(Payload.Update update) {
                return canRead(authorizer, update.getRecord());
            }

            // Batches are not nested.
            @Override
            public Boolean visitBatch(Payload.Batch batch) {
                return false;
            }

            @Override
            public Boolean visitEndOfSnapshot(Payload.EndOfSnapshot endOfSnapshot) {
                return true;
            }

            @Override
            public Boolean visitEndOfEmptySnapshot(Payload.EndOfEmptySnapshot endOfEmptySnapshot) {
                return true;
            }
        });
    }

    /**
     * Checks whether a record may be read. A service instance needs read access on both its
     * service and its node; records of any other type are denied.
     *
     * @param authorizer the caller's permissions
     * @param record the record
     * @return true if the record may be sent to the caller
     */
    public static boolean canRead(@Nonnull Authorizer authorizer, @Nonnull Object record) {
        if (record instanceof ServiceHealthChange) {
            CheckServiceNode csn = ((ServiceHealthChange) record).getValue();
            return authorizer.serviceRead(csn.getServiceName()) && authorizer.nodeRead(csn.getNode());
        }
        return false;
    }
}
