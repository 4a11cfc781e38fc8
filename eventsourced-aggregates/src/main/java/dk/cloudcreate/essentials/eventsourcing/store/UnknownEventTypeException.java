package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.EventName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an {@link EventName} hasn't been registered with {@link EventTypes}
 */
public class UnknownEventTypeException extends EventStoreException {
    public final EventName eventName;

    public UnknownEventTypeException(EventName eventName) {
        super(msg("No event type has been registered for event name '{}'", eventName));
        this.eventName = eventName;
    }
}
