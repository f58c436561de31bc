package io.statestream.subscribe;

import io.statestream.eventstream.SubscribeRequest;
import io.statestream.eventstream.Subscription;
import io.statestream.subscribe.wire.StatusException;
import io.statestream.subscribe.wire.SubscriptionClient;
import javax.annotation.Nullable;

/**
 * Services the {@link SubscriptionServer} depends on.
 */
public interface Backend {

    /**
     * Resolves a token into the permissions it grants.
     *
     * @param token the caller's token
     * @return the permissions, or null when authorization is disabled
     * @throws TokenResolutionException if the token is not valid
     */
    @Nullable
    Authorizer resolveToken(String token) throws TokenResolutionException;

    /**
     * Runs the forward function against the server responsible for the datacenter, unless this
     * node serves it.
     *
     * @param datacenter the requested datacenter, empty for the local one
     * @param forward the function relaying the call
     * @return true if the call was forwarded and has completed, false if it must be served locally
     * @throws StatusException if forwarding failed; the call ends with this error
     * @throws InterruptedException if the calling thread is interrupted
     */
    boolean forward(String datacenter, ForwardFunction forward) throws StatusException, InterruptedException;

    /**
     * Subscribes to the local event publisher.
     *
     * @param request the subscription parameters
     * @return the new subscription
     */
    Subscription subscribe(SubscribeRequest request);

    /**
     * Relays a call through a client connected to another server.
     */
    @FunctionalInterface
    interface ForwardFunction {

        void forward(SubscriptionClient client) throws StatusException, InterruptedException;
    }
}
