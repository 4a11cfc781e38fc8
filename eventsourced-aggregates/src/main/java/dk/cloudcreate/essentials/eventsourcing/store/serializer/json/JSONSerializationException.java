package dk.cloudcreate.essentials.eventsourcing.store.serializer.json;

import dk.cloudcreate.essentials.eventsourcing.store.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
