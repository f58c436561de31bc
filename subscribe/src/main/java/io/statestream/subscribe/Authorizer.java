package io.statestream.subscribe;

/**
 * Permissions resolved from a caller's token.
 *
 * <p>Instances are immutable once resolved and may be shared by concurrent filter invocations.
 */
public interface Authorizer {

    /**
     * @param serviceName name of the service
     * @return true if the token may read the service
     */
    boolean serviceRead(String serviceName);

    /**
     * @param nodeName name of the node
     * @return true if the token may read the node
     */
    boolean nodeRead(String nodeName);
}
