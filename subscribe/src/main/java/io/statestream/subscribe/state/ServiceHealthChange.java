package io.statestream.subscribe.state;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Record carried by events of the service health topics: a service instance was registered,
 * changed health, or was deregistered.
 */
public final class ServiceHealthChange {

    private final CatalogOp op;
    private final CheckServiceNode value;

    public ServiceHealthChange(@Nonnull CatalogOp op, @Nonnull CheckServiceNode value) {
        this.op = Objects.requireNonNull(op, "Op must not be null");
        this.value = Objects.requireNonNull(value, "Value must not be null");
    }

    public CatalogOp getOp() {
        return op;
    }

    public CheckServiceNode getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceHealthChange)) return false;
        ServiceHealthChange that = (ServiceHealthChange) o;
        return op == that.op && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, value);
    }

    @Override
    public String toString() {
        return "ServiceHealthChange{op=" + op + ", value=" + value + '}';
    }
}
