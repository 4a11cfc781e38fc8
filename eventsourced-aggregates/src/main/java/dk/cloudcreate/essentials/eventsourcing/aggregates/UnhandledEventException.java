package dk.cloudcreate.essentials.eventsourcing.aggregates;

/**
 * Thrown when an {@link AggregateState} has no {@link EventHandler} method that matches an event
 */
public class UnhandledEventException extends AggregateException {
    public final transient Object event;

    public UnhandledEventException(String message, Object event) {
        super(message);
        this.event = event;
    }
}
