package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.types.LongType;

/**
 * The position of a persisted event within its aggregates event stream.<br>
 * The first event has event order 0 ({@link #FIRST_EVENT_ORDER}) and every following event has the event order of the
 * previous event + 1. The event order of an event equals the {@link StreamVersion} of the stream before the event was appended.
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * The {@link EventOrder} of the FIRST Event persisted in context of a given aggregate id
     */
    public static final EventOrder FIRST_EVENT_ORDER = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    /**
     * @param streamVersion the stream version before an event is appended
     * @return the event order of the appended event
     */
    public static EventOrder of(StreamVersion streamVersion) {
        return new EventOrder(streamVersion.value());
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }
}
