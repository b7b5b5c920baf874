package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.EventDetail;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

/**
 * Common shape of the messages published by a {@link MessageChannel}: the event that was pushed and the id of the event store it was pushed to
 *
 * @param <PAYLOAD> the event payload type
 */
public interface EventStoreMessage<PAYLOAD> {
    EventStoreId eventStoreId();

    EventDetail<PAYLOAD> event();

    /**
     * Identifies the event across all event stores: <code>eventStoreId#aggregateId#version</code>
     */
    default String messageDeduplicationId() {
        return messageGroupId() + "#" + event().version();
    }

    /**
     * Messages about the same aggregate share a group id: <code>eventStoreId#aggregateId</code>
     */
    default String messageGroupId() {
        return eventStoreId() + "#" + event().aggregateId();
    }
}
