package dk.cloudcreate.essentials.reducer.eventstore;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Raised by storage adapters when an event with the same aggregate id and version already exists
 * in the event store and the push wasn't forced.<br>
 * The {@link EventStore} passes it on to the caller unchanged, which typically reloads the aggregate and retries.
 */
public class EventAlreadyExistsException extends EventStoreException {
    public final EventStoreId eventStoreId;
    public final String       aggregateId;
    public final long         version;

    public EventAlreadyExistsException(EventStoreId eventStoreId, String aggregateId, long version) {
        super(generateMessage(eventStoreId, aggregateId, version));
        this.eventStoreId = eventStoreId;
        this.aggregateId = aggregateId;
        this.version = version;
    }

    public EventAlreadyExistsException(EventStoreId eventStoreId, String aggregateId, long version, Throwable cause) {
        super(generateMessage(eventStoreId, aggregateId, version), cause);
        this.eventStoreId = eventStoreId;
        this.aggregateId = aggregateId;
        this.version = version;
    }

    private static String generateMessage(EventStoreId eventStoreId, String aggregateId, long version) {
        return msg("Event already exists for aggregate '{}' with version {} in event store '{}'", aggregateId, version, eventStoreId);
    }

    /**
     * Check if the <code>throwable</code> is, or was caused by, an {@link EventAlreadyExistsException}
     */
    public static boolean isEventAlreadyExistsException(Throwable throwable) {
        return findEventAlreadyExistsException(throwable).isPresent();
    }

    /**
     * Find the first {@link EventAlreadyExistsException} in the cause chain of <code>throwable</code> (including <code>throwable</code> itself)
     */
    public static Optional<EventAlreadyExistsException> findEventAlreadyExistsException(Throwable throwable) {
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        var current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof EventAlreadyExistsException) {
                return Optional.of((EventAlreadyExistsException) current);
            }
            current = current.getCause();
        }
        return Optional.empty();
    }
}
