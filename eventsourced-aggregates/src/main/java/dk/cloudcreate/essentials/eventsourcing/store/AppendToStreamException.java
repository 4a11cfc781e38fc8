package dk.cloudcreate.essentials.eventsourcing.store;

/**
 * Thrown when events (and snapshot) couldn't be appended to an aggregates event stream.
 * When this exception is thrown, nothing has been appended.
 */
public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
