package dk.cloudcreate.essentials.eventsourcing.aggregates;

/**
 * Base exception for errors raised by an {@link Aggregate}, both modeling errors and business rule violations
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
