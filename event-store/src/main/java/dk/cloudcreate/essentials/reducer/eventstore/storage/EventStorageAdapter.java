package dk.cloudcreate.essentials.reducer.eventstore.storage;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.List;

/**
 * Durable, append-only storage of {@link EventDetail}'s used by an {@link EventStore}.<br>
 * The events of different event stores are separated by {@link EventStoreId}, and inside an event store by aggregate id.<br>
 * <br>
 * Implementations MUST guarantee:
 * <ul>
 *     <li>concurrent pushes of the same <code>(eventStoreId, aggregateId, version)</code> can't both succeed</li>
 *     <li>{@link #pushEventGroup(List)} is all-or-nothing</li>
 * </ul>
 */
public interface EventStorageAdapter {
    /**
     * Store a single event
     *
     * @param event   the event to store
     * @param context the event store the event belongs to and whether an existing event may be overwritten
     * @param <PAYLOAD> the payload type
     * @return the stored event
     * @throws EventAlreadyExistsException if an event with the same aggregate id and version exists and {@link PushEventContext#force()} is false
     */
    <PAYLOAD> EventDetail<PAYLOAD> pushEvent(EventDetail<PAYLOAD> event, PushEventContext context);

    /**
     * Store all the grouped events in one atomic operation. The grouped events may belong to different event stores.
     *
     * @param groupedEvents the grouped events, at least one
     * @return the stored events in the same order as <code>groupedEvents</code>
     * @throws EventAlreadyExistsException if any of the events already exists, in which case none of the events are stored
     */
    List<EventDetail<?>> pushEventGroup(List<GroupedEvent<?, ?>> groupedEvents);

    /**
     * Get the events of an aggregate
     *
     * @param aggregateId  the aggregate id
     * @param eventStoreId the event store the aggregate belongs to
     * @param options      version range, limit and ordering
     * @param <PAYLOAD>    the payload type
     * @return the matching events ordered by version (ascending, or descending if {@link EventsQueryOptions#reverse()})
     */
    <PAYLOAD> List<EventDetail<PAYLOAD>> getEvents(String aggregateId, EventStoreId eventStoreId, EventsQueryOptions options);

    /**
     * List the ids of the aggregates in an event store ordered by the timestamp of their first event
     *
     * @param eventStoreId the event store
     * @param options      filtering and paging
     * @return a page of aggregate ids
     */
    ListAggregateIdsResult listAggregateIds(EventStoreId eventStoreId, ListAggregateIdsOptions options);

    /**
     * Is the calling thread inside a transaction that this adapter will join, and whose uncommitted events are invisible to other threads?<br>
     * When true, {@link EventStore#pushEventGroup(List)} calls the {@link OnEventPushed} callbacks on the calling thread, so callbacks that
     * read from the event store see the events that were just pushed.
     *
     * @return true if the calling thread has an active transaction
     */
    default boolean isTransactionActiveOnCurrentThread() {
        return false;
    }
}
