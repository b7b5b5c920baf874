package dk.cloudcreate.essentials.reducer.eventstore;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException {
    public final String       aggregateId;
    public final EventStoreId eventStoreId;

    public AggregateNotFoundException(String aggregateId, EventStoreId eventStoreId) {
        super(generateMessage(aggregateId, eventStoreId));
        this.aggregateId = aggregateId;
        this.eventStoreId = eventStoreId;
    }

    private static String generateMessage(String aggregateId, EventStoreId eventStoreId) {
        return msg("Couldn't find aggregate with id '{}' in event store '{}'", aggregateId, eventStoreId);
    }
}
