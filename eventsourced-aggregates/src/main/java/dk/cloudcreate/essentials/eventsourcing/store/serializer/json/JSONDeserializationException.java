package dk.cloudcreate.essentials.eventsourcing.store.serializer.json;

import dk.cloudcreate.essentials.eventsourcing.store.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
