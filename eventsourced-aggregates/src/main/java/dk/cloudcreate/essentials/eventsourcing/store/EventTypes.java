package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Registry of the {@link Event} types an aggregate store can read, keyed by their {@link EventName}.<br>
 * Persisted events only carry their {@link EventName}, so every event type that is persisted must be registered
 * in order to be deserialized again.
 */
public final class EventTypes {
    private final ConcurrentMap<EventName, Class<? extends Event>> eventTypes = new ConcurrentHashMap<>();

    @SafeVarargs
    public static EventTypes of(Class<? extends Event>... eventTypes) {
        requireNonNull(eventTypes, "No eventTypes provided");
        var registry = new EventTypes();
        for (var eventType : eventTypes) {
            registry.register(eventType);
        }
        return registry;
    }

    /**
     * Register an event type under the {@link EventName} declared by its {@link EventTypeName} annotation
     *
     * @param eventType the event type
     * @return this registry
     * @throws IllegalArgumentException if the event type isn't annotated with {@link EventTypeName} or if
     *                                  another event type is already registered under the same name
     */
    public EventTypes register(Class<? extends Event> eventType) {
        requireNonNull(eventType, "No eventType provided");
        var eventName = EventName.of(eventType);
        var existing = eventTypes.putIfAbsent(eventName, eventType);
        if (existing != null && !existing.equals(eventType)) {
            throw new IllegalArgumentException(msg("Event name '{}' of '{}' is already registered for '{}'",
                                                   eventName,
                                                   eventType.getName(),
                                                   existing.getName()));
        }
        return this;
    }

    /**
     * @param eventName the event name
     * @return the event type registered under the event name
     * @throws UnknownEventTypeException if no event type is registered under the event name
     */
    public Class<? extends Event> resolve(EventName eventName) {
        requireNonNull(eventName, "No eventName provided");
        var eventType = eventTypes.get(eventName);
        if (eventType == null) {
            throw new UnknownEventTypeException(eventName);
        }
        return eventType;
    }

    /**
     * Verify that the event's type is the type registered under the event's {@link EventName}
     *
     * @param event the event
     * @throws UnknownEventTypeException if the event name isn't registered or is registered for another type
     */
    public void requireRegistered(Event event) {
        requireNonNull(event, "No event provided");
        var eventName = event.eventName();
        if (!event.getClass().equals(resolve(eventName))) {
            throw new UnknownEventTypeException(eventName);
        }
    }

    public boolean isRegistered(EventName eventName) {
        return eventTypes.containsKey(requireNonNull(eventName, "No eventName provided"));
    }

    public Set<EventName> eventNames() {
        return Collections.unmodifiableSet(eventTypes.keySet());
    }

    @Override
    public String toString() {
        return "EventTypes" + eventTypes.keySet();
    }
}
