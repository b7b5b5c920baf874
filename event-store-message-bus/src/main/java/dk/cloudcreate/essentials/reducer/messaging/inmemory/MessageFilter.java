package dk.cloudcreate.essentials.reducer.messaging.inmemory;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import dk.cloudcreate.essentials.reducer.messaging.EventStoreMessage;

import java.util.*;
import java.util.function.Predicate;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Matches messages by event store id and/or event type. An empty filter matches every message.
 */
public final class MessageFilter implements Predicate<EventStoreMessage<?>> {
    private static final MessageFilter ALL = new MessageFilter(null, null);

    private final EventStoreId eventStoreId;
    private final String       eventType;

    private MessageFilter(EventStoreId eventStoreId, String eventType) {
        this.eventStoreId = eventStoreId;
        this.eventType = eventType;
    }

    public static MessageFilter all() {
        return ALL;
    }

    public static MessageFilter eventStoreId(EventStoreId eventStoreId) {
        return new MessageFilter(requireNonNull(eventStoreId, "No eventStoreId provided"), null);
    }

    public static MessageFilter of(EventStoreId eventStoreId, String eventType) {
        return new MessageFilter(requireNonNull(eventStoreId, "No eventStoreId provided"),
                                 requireNonNull(eventType, "No eventType provided"));
    }

    public Optional<EventStoreId> getEventStoreId() {
        return Optional.ofNullable(eventStoreId);
    }

    public Optional<String> getEventType() {
        return Optional.ofNullable(eventType);
    }

    @Override
    public boolean test(EventStoreMessage<?> message) {
        return (eventStoreId == null || eventStoreId.equals(message.eventStoreId())) &&
                (eventType == null || eventType.equals(message.event().type()));
    }

    @Override
    public String toString() {
        return "MessageFilter{" +
                "eventStoreId=" + eventStoreId +
                ", eventType='" + eventType + '\'' +
                '}';
    }
}
