package io.statestream.subscribe.wire;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A subscribe call as received from a client.
 *
 * <p>An empty datacenter means the local one.
 */
public final class SubscribeMessage {

    private final SubscribeTopic topic;
    private final String key;
    private final String token;
    private final long index;
    private final String datacenter;

    public SubscribeMessage(@Nonnull SubscribeTopic topic, @Nonnull String key, @Nonnull String token,
                            long index, @Nonnull String datacenter) {
        this.topic = Objects.requireNonNull(topic, "Topic must not be null");
        this.key = Objects.requireNonNull(key, "Key must not be null");
        this.token = Objects.requireNonNull(token, "Token must not be null");
        this.datacenter = Objects.requireNonNull(datacenter, "Datacenter must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        this.index = index;
    }

    public SubscribeTopic getTopic() {
        return topic;
    }

    public String getKey() {
        return key;
    }

    public String getToken() {
        return token;
    }

    public long getIndex() {
        return index;
    }

    public String getDatacenter() {
        return datacenter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscribeMessage)) return false;
        SubscribeMessage that = (SubscribeMessage) o;
        return index == that.index
                && topic == that.topic
                && key.equals(that.key)
                && token.equals(that.token)
                && datacenter.equals(that.datacenter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, key, token, index, datacenter);
    }

    @Override
    public String toString() {
        return "SubscribeMessage{" +
                "topic=" + topic +
                ", key='" + key + '\'' +
                ", index=" + index +
                ", datacenter='" + datacenter + '\'' +
                '}';
    }
}
