package io.statestream.subscribe.wire;

import io.statestream.subscribe.state.CatalogOp;
import io.statestream.subscribe.state.CheckServiceNode;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Wire form of a service health change.
 */
public final class ServiceHealthUpdate {

    private final CatalogOp op;
    private final CheckServiceNode checkServiceNode;

    public ServiceHealthUpdate(@Nonnull CatalogOp op, @Nonnull CheckServiceNode checkServiceNode) {
        this.op = Objects.requireNonNull(op, "Op must not be null");
        this.checkServiceNode = Objects.requireNonNull(checkServiceNode, "CheckServiceNode must not be null");
    }

    public CatalogOp getOp() {
        return op;
    }

    public CheckServiceNode getCheckServiceNode() {
        return checkServiceNode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceHealthUpdate)) return false;
        ServiceHealthUpdate that = (ServiceHealthUpdate) o;
        return op == that.op && checkServiceNode.equals(that.checkServiceNode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, checkServiceNode);
    }

    @Override
    public String toString() {
        return "ServiceHealthUpdate{op=" + op + ", checkServiceNode=" + checkServiceNode + '}';
    }
}
