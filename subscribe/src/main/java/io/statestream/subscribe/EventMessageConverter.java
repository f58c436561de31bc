package io.statestream.subscribe;

import io.statestream.eventstream.Event;
import io.statestream.eventstream.Payload;
import io.statestream.subscribe.state.ServiceHealthChange;
import io.statestream.subscribe.wire.EventMessage;
import io.statestream.subscribe.wire.ServiceHealthUpdate;
import io.statestream.subscribe.wire.SubscribeMessage;
import io.statestream.subscribe.wire.SubscribeTopic;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts published events into the messages sent to clients.
 */
public final class EventMessageConverter {

    private EventMessageConverter() {
    }

    /**
     * Converts an event for the subscriber that made the request. The message carries the
     * request's topic and key and the event's index.
     *
     * @param request the subscriber's request
     * @param event the event to send
     * @return the message
     * @throws IllegalStateException if the event carries a record of an unknown type
     */
    public static EventMessage toMessage(SubscribeMessage request, Event event) {
        SubscribeTopic topic = request.getTopic();
        String key = request.getKey();
        long index = event.getIndex();
        return event.getPayload().accept(new Payload.Visitor<EventMessage>() {
            @Override
            public EventMessage visitUpdate(Payload.Update update) {
                return EventMessage.serviceHealth(topic, key, index, toServiceHealthUpdate(update.getRecord()));
            }

            @Override
            public EventMessage visitBatch(Payload.Batch batch) {
                return EventMessage.eventBatch(topic, key, index, toBatchMembers(batch));
            }

            @Override
            public EventMessage visitEndOfSnapshot(Payload.EndOfSnapshot endOfSnapshot) {
                return EventMessage.endOfSnapshot(topic, key, index);
            }

            @Override
            public EventMessage visitEndOfEmptySnapshot(Payload.EndOfEmptySnapshot endOfEmptySnapshot) {
                return EventMessage.endOfEmptySnapshot(topic, key, index);
            }
        });
    }

    private static List<EventMessage> toBatchMembers(Payload.Batch batch) {
        List<EventMessage> members = new ArrayList<>(batch.size());
        for (Event member : batch.getEvents()) {
            members.add(toBatchMember(member));
        }
        return members;
    }

    private static EventMessage toBatchMember(Event member) {
        String key = member.getKey();
        long index = member.getIndex();
        return member.getPayload().accept(new Payload.Visitor<EventMessage>() {
            @Override
            public EventMessage visitUpdate(Payload.Update update) {
                return EventMessage.serviceHealth(null, key, index, toServiceHealthUpdate(update.getRecord()));
            }

            @Override
            public EventMessage visitBatch(Payload.Batch batch) {
                return EventMessage.eventBatch(null, key, index, toBatchMembers(batch));
            }

            @Override
            public EventMessage visitEndOfSnapshot(Payload.EndOfSnapshot endOfSnapshot) {
                throw unexpectedPayload(endOfSnapshot);
            }

            @Override
            public EventMessage visitEndOfEmptySnapshot(Payload.EndOfEmptySnapshot endOfEmptySnapshot) {
                throw unexpectedPayload(endOfEmptySnapshot);
            }
        });
    }

    private static ServiceHealthUpdate toServiceHealthUpdate(Object record) {
        if (record instanceof ServiceHealthChange) {
            ServiceHealthChange change = (ServiceHealthChange) record;
            return new ServiceHealthUpdate(change.getOp(), change.getValue());
        }
        throw unexpectedPayload(record);
    }

    private static IllegalStateException unexpectedPayload(Object payload) {
        return new IllegalStateException(String.format("unexpected payload: %s: %s",
                payload.getClass().getName(), payload));
    }
}
