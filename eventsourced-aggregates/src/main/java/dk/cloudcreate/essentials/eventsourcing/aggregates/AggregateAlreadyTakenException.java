package dk.cloudcreate.essentials.eventsourcing.aggregates;

/**
 * Thrown when an {@link Aggregate} is used after its changes have been taken using {@link Aggregate#take()}
 */
public class AggregateAlreadyTakenException extends AggregateException {
    public AggregateAlreadyTakenException(String message) {
        super(message);
    }
}
