package io.statestream.subscribe;

import io.statestream.eventstream.Event;
import io.statestream.eventstream.EventStreamException;
import io.statestream.eventstream.SubscribeRequest;
import io.statestream.eventstream.Subscription;
import io.statestream.eventstream.SubscriptionClosedException;
import io.statestream.subscribe.wire.EventMessage;
import io.statestream.subscribe.wire.EventReceiver;
import io.statestream.subscribe.wire.EventSender;
import io.statestream.subscribe.wire.StatusException;
import io.statestream.subscribe.wire.SubscribeMessage;
import io.statestream.subscribe.wire.SubscriptionClient;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves subscribe calls: streams a snapshot and then every change of a topic to the caller,
 * filtered by the caller's permissions.
 *
 * <p>Each call goes through these steps:
 * <ol>
 *   <li>if another datacenter is responsible for the request, the call is forwarded there and
 *       its events and errors are relayed unchanged. Forwarded events are not filtered here:
 *       the responsible server filters them with the same token. A remote stream ending without
 *       an error fails the call with {@link StatusException.Code#UNAVAILABLE}</li>
 *   <li>otherwise the token is resolved into an {@link Authorizer}; an invalid token ends the
 *       call with {@link StatusException.Code#PERMISSION_DENIED}</li>
 *   <li>a subscription is created and each event is filtered, converted and sent. Events with
 *       nothing left after filtering are skipped</li>
 * </ol>
 *
 * <p>A call never completes normally. It ends with {@link StatusException.Code#ABORTED} when the
 * subscription is closed on the server side, telling the client to subscribe again, with
 * {@link InterruptedException} when the serving thread is interrupted, or with the error that
 * stopped it.
 */
public class SubscriptionServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionServer.class);

    private final Backend backend;

    public SubscriptionServer(@Nonnull Backend backend) {
        this.backend = Objects.requireNonNull(backend, "Backend must not be null");
    }

    /**
     * Serves one subscribe call on the calling thread until it ends.
     *
     * @param request the client's request
     * @param stream the stream events are sent on
     * @throws StatusException the error the call ends with
     * @throws InterruptedException if the serving thread is interrupted
     */
    public void subscribe(@Nonnull SubscribeMessage request, @Nonnull EventSender stream)
            throws StatusException, InterruptedException {
        Objects.requireNonNull(request, "Request must not be null");
        Objects.requireNonNull(stream, "Stream must not be null");

        boolean handled = backend.forward(request.getDatacenter(), client -> forwardToDatacenter(client, request, stream));
        if (handled) {
            return;
        }

        LOGGER.trace("new subscription: {}", request);
        try {
            serveLocally(request, stream);
        } finally {
            LOGGER.trace("subscription closed: {}", request);
        }
    }

    private void serveLocally(SubscribeMessage request, EventSender stream)
            throws StatusException, InterruptedException {
        Authorizer authorizer = resolveToken(request);
        Subscription subscription = subscribe(request);
        try {
            EventLogger eventLogger = new EventLogger(LOGGER, request);
            while (true) {
                Event event;
                try {
                    event = subscription.next();
                } catch (SubscriptionClosedException e) {
                    LOGGER.trace("subscription reset by server: {}", request);
                    throw new StatusException(StatusException.Code.ABORTED, e.getMessage(), e);
                }

                Optional<Event> filtered = AuthorizationFilter.filter(authorizer, event);
                if (!filtered.isPresent()) {
                    continue;
                }

                eventLogger.trace(filtered.get());
                stream.send(EventMessageConverter.toMessage(request, filtered.get()));
            }
        } finally {
            subscription.unsubscribe();
        }
    }

    private Authorizer resolveToken(SubscribeMessage request) throws StatusException {
        try {
            return backend.resolveToken(request.getToken());
        } catch (TokenResolutionException e) {
            LOGGER.debug("token resolution failed for {}: {}", request, e.getMessage());
            throw new StatusException(StatusException.Code.PERMISSION_DENIED, e.getMessage(), e);
        }
    }

    private Subscription subscribe(SubscribeMessage request) throws StatusException {
        try {
            return backend.subscribe(toSubscribeRequest(request));
        } catch (SubscriptionClosedException e) {
            throw new StatusException(StatusException.Code.ABORTED, e.getMessage(), e);
        } catch (EventStreamException e) {
            throw new StatusException(StatusException.Code.UNKNOWN, e.getMessage(), e);
        }
    }

    private static SubscribeRequest toSubscribeRequest(SubscribeMessage request) {
        return new SubscribeRequest(request.getTopic(), request.getKey(), request.getToken(), request.getIndex());
    }

    private static void forwardToDatacenter(SubscriptionClient client, SubscribeMessage request, EventSender stream)
            throws StatusException, InterruptedException {
        LOGGER.trace("forwarding to another DC: {}", request);
        try (EventReceiver receiver = client.subscribe(request)) {
            while (true) {
                EventMessage event = receiver.receive();
                if (event == null) {
                    throw new StatusException(StatusException.Code.UNAVAILABLE, "forwarded stream ended");
                }
                stream.send(event);
            }
        } finally {
            LOGGER.trace("forwarded stream closed: {}", request);
        }
    }
}
