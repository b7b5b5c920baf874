package dk.cloudcreate.essentials.reducer.eventstore;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an operation that requires storage is called on an {@link EventStore} without an
 * {@link dk.cloudcreate.essentials.reducer.eventstore.storage.EventStorageAdapter}
 */
public class UndefinedEventStorageAdapterException extends EventStoreException {
    public final EventStoreId eventStoreId;

    public UndefinedEventStorageAdapterException(EventStoreId eventStoreId) {
        super(msg("No event storage adapter has been set on event store '{}'", eventStoreId));
        this.eventStoreId = eventStoreId;
    }
}
