package dk.cloudcreate.essentials.reducer.commands;

import dk.cloudcreate.essentials.reducer.eventstore.EventStore;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The ordered event stores a {@link Command} operates on
 */
public final class RequiredEventStores {
    private final List<EventStore<?, ?>> eventStores;

    public RequiredEventStores(List<? extends EventStore<?, ?>> eventStores) {
        this.eventStores = List.copyOf(requireNonNull(eventStores, "No eventStores provided"));
        var eventStoreIds = new HashSet<EventStoreId>();
        this.eventStores.forEach(eventStore -> {
            if (!eventStoreIds.add(eventStore.getEventStoreId())) {
                throw new IllegalArgumentException(msg("Event store '{}' is required more than once", eventStore.getEventStoreId()));
            }
        });
    }

    /**
     * Typed access to the event store at <code>index</code>
     */
    @SuppressWarnings("unchecked")
    public <PAYLOAD, AGGREGATE> EventStore<PAYLOAD, AGGREGATE> get(int index) {
        return (EventStore<PAYLOAD, AGGREGATE>) eventStores.get(index);
    }

    /**
     * Typed access to the event store with the given id
     *
     * @throws IllegalArgumentException if the event store isn't one of the required event stores
     */
    @SuppressWarnings("unchecked")
    public <PAYLOAD, AGGREGATE> EventStore<PAYLOAD, AGGREGATE> get(EventStoreId eventStoreId) {
        requireNonNull(eventStoreId, "No eventStoreId provided");
        return (EventStore<PAYLOAD, AGGREGATE>) eventStores.stream()
                                                           .filter(eventStore -> eventStore.getEventStoreId().equals(eventStoreId))
                                                           .findFirst()
                                                           .orElseThrow(() -> new IllegalArgumentException(msg("Event store '{}' isn't a required event store", eventStoreId)));
    }

    public List<EventStore<?, ?>> asList() {
        return eventStores;
    }

    public int size() {
        return eventStores.size();
    }

    @Override
    public String toString() {
        var eventStoreIds = new ArrayList<EventStoreId>();
        eventStores.forEach(eventStore -> eventStoreIds.add(eventStore.getEventStoreId()));
        return eventStoreIds.toString();
    }
}
