package dk.cloudcreate.essentials.reducer.eventstore.postgresql.serializer.json;

import dk.cloudcreate.essentials.reducer.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
