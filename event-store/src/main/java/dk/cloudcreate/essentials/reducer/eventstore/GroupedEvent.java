package dk.cloudcreate.essentials.reducer.eventstore;

import dk.cloudcreate.essentials.reducer.eventstore.storage.EventStorageAdapter;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A pending event bound to the {@link EventStore} that owns it, created using {@link EventStore#groupEvent(EventDetail, Object)}
 * and consumed by a single {@link EventStore#pushEventGroup(java.util.List)} call.
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public final class GroupedEvent<PAYLOAD, AGGREGATE> {
    private final EventStore<PAYLOAD, AGGREGATE> eventStore;
    private final EventDetail<PAYLOAD>           event;
    private final AGGREGATE                      prevAggregate;

    GroupedEvent(EventStore<PAYLOAD, AGGREGATE> eventStore, EventDetail<PAYLOAD> event, AGGREGATE prevAggregate) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.event = requireNonNull(event, "No event provided");
        this.prevAggregate = prevAggregate;
    }

    public EventStore<PAYLOAD, AGGREGATE> eventStore() {
        return eventStore;
    }

    public EventStoreId eventStoreId() {
        return eventStore.getEventStoreId();
    }

    /**
     * @throws UndefinedEventStorageAdapterException if the owning event store has no storage adapter
     */
    public EventStorageAdapter eventStorageAdapter() {
        return eventStore.requireEventStorageAdapter();
    }

    public EventDetail<PAYLOAD> event() {
        return event;
    }

    public Optional<AGGREGATE> prevAggregate() {
        return Optional.ofNullable(prevAggregate);
    }

    @Override
    public String toString() {
        return "GroupedEvent{" +
                "eventStoreId=" + eventStoreId() +
                ", aggregateId='" + event.aggregateId() + '\'' +
                ", version=" + event.version() +
                ", type='" + event.type() + '\'' +
                '}';
    }
}
