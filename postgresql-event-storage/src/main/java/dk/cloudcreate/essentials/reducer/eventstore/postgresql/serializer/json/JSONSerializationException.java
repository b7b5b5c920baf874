package dk.cloudcreate.essentials.reducer.eventstore.postgresql.serializer.json;

import dk.cloudcreate.essentials.reducer.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
