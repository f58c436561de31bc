package io.statestream.eventstream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Event Tests")
class EventTest {

    private static Event update(String key, long index, String record) {
        return Event.update(TestTopic.HEALTH, key, index, record);
    }

    static Stream<Event> sentinels() {
        return Stream.of(
                Event.endOfSnapshot(TestTopic.HEALTH, "web", 7),
                Event.endOfEmptySnapshot(TestTopic.HEALTH, "web", 7));
    }

    @Test
    @DisplayName("Should reject missing fields and negative indices")
    void shouldValidateConstruction() {
        assertThatThrownBy(() -> new Event(null, "k", 1, Payload.update("r")))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Topic must not be null");
        assertThatThrownBy(() -> new Event(TestTopic.HEALTH, null, 1, Payload.update("r")))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Key must not be null");
        assertThatThrownBy(() -> new Event(TestTopic.HEALTH, "k", 1, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Payload must not be null");
        assertThatThrownBy(() -> update("k", -1, "r"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index");
        assertThatThrownBy(() -> Payload.update(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Batch payload should be an immutable copy")
    void batchShouldBeImmutableCopy() {
        List<Event> members = new ArrayList<>(Arrays.asList(update("a", 1, "r1"), update("b", 2, "r2")));
        Event batch = Event.batch(TestTopic.HEALTH, "", 2, members);

        members.clear();

        Payload.Batch payload = (Payload.Batch) batch.getPayload();
        assertThat(payload.getEvents()).hasSize(2);
        assertThatThrownBy(() -> payload.getEvents().add(update("c", 3, "r3")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should report the number of records carried")
    void shouldReportSize() {
        assertThat(update("a", 1, "r").size()).isEqualTo(1);
        assertThat(Event.batch(TestTopic.HEALTH, "", 2,
                Arrays.asList(update("a", 1, "r1"), update("b", 2, "r2"))).size()).isEqualTo(2);
        assertThat(Event.endOfSnapshot(TestTopic.HEALTH, "", 2).size()).isZero();
    }

    @Test
    @DisplayName("Visitor should dispatch to the matching payload case")
    void visitorShouldDispatchByCase() {
        Payload.Visitor<String> describe = new Payload.Visitor<String>() {
            @Override
            public String visitUpdate(Payload.Update update) {
                return "update:" + update.getRecord();
            }

            @Override
            public String visitBatch(Payload.Batch batch) {
                return "batch:" + batch.size();
            }

            @Override
            public String visitEndOfSnapshot(Payload.EndOfSnapshot endOfSnapshot) {
                return "end";
            }

            @Override
            public String visitEndOfEmptySnapshot(Payload.EndOfEmptySnapshot endOfEmptySnapshot) {
                return "empty";
            }
        };

        assertThat(Payload.update("r").accept(describe)).isEqualTo("update:r");
        assertThat(Payload.batch(Arrays.asList(update("a", 1, "r"))).accept(describe)).isEqualTo("batch:1");
        assertThat(Payload.endOfSnapshot().accept(describe)).isEqualTo("end");
        assertThat(Payload.endOfEmptySnapshot().accept(describe)).isEqualTo("empty");
    }

    // ========== Filtering ==========

    @Test
    @DisplayName("Single update should be kept only if the predicate accepts it")
    void shouldFilterSingleUpdate() {
        Event event = update("web", 5, "allowed");

        assertThat(event.filter(e -> true)).containsSame(event);
        assertThat(event.filter(e -> false)).isEmpty();
    }

    @Test
    @DisplayName("Batch should be reduced to accepted members without modifying the original")
    void shouldReduceBatch() {
        Event keep1 = update("web", 1, "keep");
        Event drop = update("db", 2, "drop");
        Event keep2 = update("web", 3, "keep");
        Event batch = Event.batch(TestTopic.HEALTH, "", 3, Arrays.asList(keep1, drop, keep2));

        Optional<Event> filtered = batch.filter(e -> e.getKey().equals("web"));

        assertThat(filtered).isPresent();
        Event reduced = filtered.get();
        assertThat(reduced).isNotSameAs(batch);
        assertThat(reduced.getIndex()).isEqualTo(3);
        assertThat(reduced.getTopic()).isEqualTo(TestTopic.HEALTH);
        assertThat(((Payload.Batch) reduced.getPayload()).getEvents()).containsExactly(keep1, keep2);
        assertThat(((Payload.Batch) batch.getPayload()).getEvents()).containsExactly(keep1, drop, keep2);
    }

    @Test
    @DisplayName("Batch with every member accepted should be returned as is")
    void shouldReturnSameBatchWhenNothingDropped() {
        Event batch = Event.batch(TestTopic.HEALTH, "", 2, Arrays.asList(update("a", 1, "r1"), update("b", 2, "r2")));

        assertThat(batch.filter(e -> true)).containsSame(batch);
    }

    @Test
    @DisplayName("Batch with no member accepted should be dropped")
    void shouldDropEmptyBatch() {
        Event batch = Event.batch(TestTopic.HEALTH, "", 2, Arrays.asList(update("a", 1, "r1"), update("b", 2, "r2")));

        assertThat(batch.filter(e -> false)).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("sentinels")
    @DisplayName("Sentinels should always be kept and never passed to the predicate")
    void shouldAlwaysKeepSentinels(Event sentinel) {
        assertThat(sentinel.isSentinel()).isTrue();
        assertThat(sentinel.filter(e -> {
            throw new AssertionError("predicate must not be called for " + e);
        })).containsSame(sentinel);
    }

    @Test
    @DisplayName("Should identify sentinel kinds")
    void shouldIdentifySentinels() {
        assertThat(Event.endOfSnapshot(TestTopic.HEALTH, "", 1).isEndOfSnapshot()).isTrue();
        assertThat(Event.endOfSnapshot(TestTopic.HEALTH, "", 1).isEndOfEmptySnapshot()).isFalse();
        assertThat(Event.endOfEmptySnapshot(TestTopic.HEALTH, "", 1).isEndOfEmptySnapshot()).isTrue();
        assertThat(update("a", 1, "r").isSentinel()).isFalse();
    }

    @Test
    @DisplayName("Events with equal fields should be equal")
    void shouldImplementValueEquality() {
        assertThat(update("web", 4, "r")).isEqualTo(update("web", 4, "r"))
                .hasSameHashCodeAs(update("web", 4, "r"));
        assertThat(update("web", 4, "r")).isNotEqualTo(update("web", 5, "r"));
        assertThat(Event.endOfSnapshot(TestTopic.HEALTH, "web", 4))
                .isEqualTo(Event.endOfSnapshot(TestTopic.HEALTH, "web", 4));
    }
}
