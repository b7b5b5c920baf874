package dk.cloudcreate.essentials.reducer.eventstore.postgresql;

import dk.cloudcreate.essentials.reducer.eventstore.EventStoreException;

/**
 * Thrown when an event couldn't be appended to the events table for any other reason than an already existing event
 */
public class AppendEventException extends EventStoreException {
    public AppendEventException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
