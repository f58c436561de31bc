package io.statestream.subscribe.state;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A service instance registered on a node, with its aggregated health.
 */
public final class CheckServiceNode {

    private final String node;
    private final String serviceId;
    private final String serviceName;
    private final HealthStatus status;

    public CheckServiceNode(@Nonnull String node, @Nonnull String serviceId, @Nonnull String serviceName,
                            @Nonnull HealthStatus status) {
        this.node = Objects.requireNonNull(node, "Node must not be null");
        this.serviceId = Objects.requireNonNull(serviceId, "Service id must not be null");
        this.serviceName = Objects.requireNonNull(serviceName, "Service name must not be null");
        this.status = Objects.requireNonNull(status, "Status must not be null");
    }

    public String getNode() {
        return node;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getServiceName() {
        return serviceName;
    }

    public HealthStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckServiceNode)) return false;
        CheckServiceNode that = (CheckServiceNode) o;
        return node.equals(that.node)
                && serviceId.equals(that.serviceId)
                && serviceName.equals(that.serviceName)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, serviceId, serviceName, status);
    }

    @Override
    public String toString() {
        return "CheckServiceNode{" +
                "node='" + node + '\'' +
                ", serviceId='" + serviceId + '\'' +
                ", serviceName='" + serviceName + '\'' +
                ", status=" + status +
                '}';
    }
}
