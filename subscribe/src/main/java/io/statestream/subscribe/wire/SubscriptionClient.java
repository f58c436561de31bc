package io.statestream.subscribe.wire;

/**
 * Opens subscribe calls on a remote server.
 */
@FunctionalInterface
public interface SubscriptionClient {

    /**
     * Starts a subscribe call.
     *
     * @param request the request to send
     * @return the receiving end of the call; the caller closes it
     * @throws StatusException if the call cannot be opened
     */
    EventReceiver subscribe(SubscribeMessage request) throws StatusException;
}
