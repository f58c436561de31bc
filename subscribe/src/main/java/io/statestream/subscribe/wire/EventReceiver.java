package io.statestream.subscribe.wire;

import javax.annotation.Nullable;

/**
 * Client side of an outbound subscribe call: receives the events sent by a remote server.
 */
public interface EventReceiver extends AutoCloseable {

    /**
     * Blocks until the next event arrives.
     *
     * @return the next event, or null once the remote server ended the stream
     * @throws StatusException the error the remote server ended the call with
     * @throws InterruptedException if the calling thread is interrupted
     */
    @Nullable
    EventMessage receive() throws StatusException, InterruptedException;

    /**
     * Cancels the call if it is still open.
     */
    @Override
    void close();
}
