package dk.cloudcreate.essentials.eventsourcing.store;

/**
 * Base exception for errors related to loading or persisting aggregate event streams
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
