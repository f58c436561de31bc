package io.statestream.eventstream;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Parameters of a subscription to an {@link EventPublisher}.
 *
 * <p>An empty key subscribes to every key of the topic. The token identifies the caller's
 * credential; the publisher only uses it to find subscriptions to reset when that credential
 * changes. An index of 0 means the caller has not seen any event yet.
 */
public final class SubscribeRequest {

    private final Topic topic;
    private final String key;
    private final String token;
    private final long index;

    public SubscribeRequest(@Nonnull Topic topic, @Nonnull String key, @Nonnull String token, long index) {
        this.topic = Objects.requireNonNull(topic, "Topic must not be null");
        this.key = Objects.requireNonNull(key, "Key must not be null");
        this.token = Objects.requireNonNull(token, "Token must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        this.index = index;
    }

    /**
     * Creates a request for a full snapshot without a token.
     */
    public SubscribeRequest(@Nonnull Topic topic, @Nonnull String key) {
        this(topic, key, "", 0);
    }

    public Topic getTopic() {
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscribeRequest)) return false;
        SubscribeRequest that = (SubscribeRequest) o;
        return index == that.index
                && topic.equals(that.topic)
                && key.equals(that.key)
                && token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, key, token, index);
    }

    // Token deliberately left out.
    @Override
    public String toString() {
        return "SubscribeRequest{" +
                "topic=" + topic.name() +
                ", key='" + key + '\'' +
                ", index=" + index +
                '}';
    }
}
