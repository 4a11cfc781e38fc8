package dk.cloudcreate.essentials.eventsourcing.aggregates;

import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The stable type tag of an {@link Event}, e.g. "OrderCreated"
 */
public class EventName extends CharSequenceType<EventName> {
    public EventName(CharSequence value) {
        super(value);
    }

    public static EventName of(CharSequence value) {
        return new EventName(value);
    }

    /**
     * Resolve the {@link EventName} declared using {@link EventTypeName} on the event class
     *
     * @param eventType the event class
     * @return the event name
     * @throws IllegalArgumentException in case the event class isn't annotated with {@link EventTypeName}
     *                                  or the annotation value is blank
     */
    public static EventName of(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        var eventTypeName = eventType.getAnnotation(EventTypeName.class);
        if (eventTypeName == null) {
            throw new IllegalArgumentException(msg("Event type '{}' isn't annotated with @{}",
                                                   eventType.getName(),
                                                   EventTypeName.class.getSimpleName()));
        }
        if (eventTypeName.value().isBlank()) {
            throw new IllegalArgumentException(msg("Event type '{}' has a blank @{} value",
                                                   eventType.getName(),
                                                   EventTypeName.class.getSimpleName()));
        }
        return of(eventTypeName.value());
    }
}
