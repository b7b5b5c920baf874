package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.EventStoreException;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a {@link MessageChannel} is asked about an event store that isn't one of its source event stores
 */
public class EventStoreNotFoundException extends EventStoreException {
    public final EventStoreId eventStoreId;
    public final String       messageChannelId;

    public EventStoreNotFoundException(EventStoreId eventStoreId, String messageChannelId) {
        super(msg("Event store '{}' isn't a source event store of message channel '{}'", eventStoreId, messageChannelId));
        this.eventStoreId = eventStoreId;
        this.messageChannelId = messageChannelId;
    }
}
