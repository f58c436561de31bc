package io.statestream.subscribe.state;

/**
 * Aggregated health of a service instance.
 */
public enum HealthStatus {
    PASSING,
    WARNING,
    CRITICAL
}
