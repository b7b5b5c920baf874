package dk.cloudcreate.essentials.reducer.eventstore.storage;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The context an {@link dk.cloudcreate.essentials.reducer.eventstore.EventStore} passes to {@link EventStorageAdapter#pushEvent(dk.cloudcreate.essentials.reducer.eventstore.EventDetail, PushEventContext)}
 */
public final class PushEventContext {
    private final EventStoreId eventStoreId;
    private final boolean      force;

    public PushEventContext(EventStoreId eventStoreId, boolean force) {
        this.eventStoreId = requireNonNull(eventStoreId, "No eventStoreId provided");
        this.force = force;
    }

    public static PushEventContext of(EventStoreId eventStoreId) {
        return new PushEventContext(eventStoreId, false);
    }

    public EventStoreId eventStoreId() {
        return eventStoreId;
    }

    /**
     * @return true if an existing event with the same aggregate id and version should be overwritten
     */
    public boolean force() {
        return force;
    }

    @Override
    public String toString() {
        return "PushEventContext{" +
                "eventStoreId=" + eventStoreId +
                ", force=" + force +
                '}';
    }
}
