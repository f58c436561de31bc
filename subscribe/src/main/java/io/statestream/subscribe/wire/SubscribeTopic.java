package io.statestream.subscribe.wire;

import io.statestream.eventstream.Topic;

/**
 * Topics a client can subscribe to.
 */
public enum SubscribeTopic implements Topic {
    /**
     * Health of every instance of one service, keyed by service name.
     */
    SERVICE_HEALTH,
    /**
     * Health of the connect-capable instances of one service, keyed by service name.
     */
    SERVICE_HEALTH_CONNECT
}
