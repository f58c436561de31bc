package io.statestream.subscribe;

import io.statestream.eventstream.Event;
import io.statestream.subscribe.state.ServiceHealthChange;
import io.statestream.subscribe.wire.EventMessage;
import io.statestream.subscribe.wire.SubscribeMessage;
import io.statestream.subscribe.wire.SubscribeTopic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.statestream.subscribe.FakeBackend.change;
import static org.assertj.core.api.Assertions.*;

@DisplayName("EventMessageConverter Tests")
class EventMessageConverterTest {

    private static final SubscribeTopic TOPIC = SubscribeTopic.SERVICE_HEALTH;

    private final SubscribeMessage request = new SubscribeMessage(TOPIC, "web", "token", 0, "");

    @Test
    @DisplayName("Update should carry the request's topic and key and the event's index")
    void shouldConvertUpdate() {
        ServiceHealthChange record = change("web", "node1");

        EventMessage message = EventMessageConverter.toMessage(request, Event.update(TOPIC, "web", 12, record));

        assertThat(message.getPayloadCase()).isEqualTo(EventMessage.PayloadCase.SERVICE_HEALTH);
        assertThat(message.getTopic()).isEqualTo(TOPIC);
        assertThat(message.getKey()).isEqualTo("web");
        assertThat(message.getIndex()).isEqualTo(12);
        assertThat(message.getServiceHealth().getOp()).isEqualTo(record.getOp());
        assertThat(message.getServiceHealth().getCheckServiceNode()).isEqualTo(record.getValue());
    }

    @Test
    @DisplayName("Batch members should carry no topic and their own key and index")
    void shouldConvertBatch() {
        Event batch = Event.batch(TOPIC, "", 8, Arrays.asList(
                Event.update(TOPIC, "web", 7, change("web", "node1")),
                Event.update(TOPIC, "api", 8, change("api", "node2"))));

        EventMessage message = EventMessageConverter.toMessage(request, batch);

        assertThat(message.getPayloadCase()).isEqualTo(EventMessage.PayloadCase.EVENT_BATCH);
        assertThat(message.getIndex()).isEqualTo(8);
        assertThat(message.getEventBatch()).hasSize(2);
        EventMessage second = message.getEventBatch().get(1);
        assertThat(second.getTopic()).isNull();
        assertThat(second.getKey()).isEqualTo("api");
        assertThat(second.getIndex()).isEqualTo(8);
        assertThat(message.getEventBatch().get(0).getIndex()).isEqualTo(7);
        assertThatThrownBy(message::getServiceHealth).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Sentinels should be converted to their snapshot markers")
    void shouldConvertSentinels() {
        EventMessage end = EventMessageConverter.toMessage(request, Event.endOfSnapshot(TOPIC, "web", 20));
        EventMessage empty = EventMessageConverter.toMessage(request, Event.endOfEmptySnapshot(TOPIC, "web", 21));

        assertThat(end).isEqualTo(EventMessage.endOfSnapshot(TOPIC, "web", 20));
        assertThat(end.isEndOfSnapshot()).isTrue();
        assertThat(empty).isEqualTo(EventMessage.endOfEmptySnapshot(TOPIC, "web", 21));
        assertThat(empty.isEndOfEmptySnapshot()).isTrue();
    }

    // ========== Unexpected payloads ==========

    @Test
    @DisplayName("Unknown record type should fail the conversion")
    void shouldRejectUnknownRecord() {
        Event event = Event.update(TOPIC, "web", 3, 42);

        assertThatThrownBy(() -> EventMessageConverter.toMessage(request, event))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unexpected payload: java.lang.Integer: 42");
    }

    @Test
    @DisplayName("Sentinel inside a batch should fail the conversion")
    void shouldRejectSentinelInBatch() {
        Event batch = Event.batch(TOPIC, "", 3, Arrays.asList(
                Event.update(TOPIC, "web", 3, change("web", "node1")),
                Event.endOfSnapshot(TOPIC, "web", 3)));

        assertThatThrownBy(() -> EventMessageConverter.toMessage(request, batch))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("unexpected payload:");
    }
}
