package dk.cloudcreate.essentials.reducer.eventstore.types;

import dk.cloudcreate.essentials.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Identifies an {@link dk.cloudcreate.essentials.reducer.eventstore.EventStore}.<br>
 * The id MUST be unique across the event stores that take part in the same grouped push
 * and is used by the storage adapters to separate the events of different stores.
 */
public class EventStoreId extends CharSequenceType<EventStoreId> implements Identifier {
    public EventStoreId(CharSequence value) {
        super(requireNonBlankValue(value));
    }

    public static EventStoreId of(CharSequence value) {
        return new EventStoreId(value);
    }

    private static CharSequence requireNonBlankValue(CharSequence value) {
        requireNonNull(value, "No value provided");
        requireTrue(!value.toString().isBlank(), "EventStoreId value cannot be blank");
        return value;
    }
}
