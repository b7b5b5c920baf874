package dk.cloudcreate.essentials.reducer.eventstore;

/**
 * Base class for the exceptions raised by an {@link EventStore} and its storage adapters
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
