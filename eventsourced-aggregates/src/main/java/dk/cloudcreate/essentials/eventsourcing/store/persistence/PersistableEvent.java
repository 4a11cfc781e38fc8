package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A serialized event that hasn't yet been appended to an aggregates event stream (as opposed to a {@link PersistedEvent})
 */
public final class PersistableEvent {
    public final EventOrder     eventOrder;
    public final EventName      eventName;
    /**
     * The event serialized as JSON
     */
    public final String         eventPayload;
    public final OffsetDateTime timestamp;

    public PersistableEvent(EventOrder eventOrder, EventName eventName, String eventPayload, OffsetDateTime timestamp) {
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.eventName = requireNonNull(eventName, "No eventName provided");
        this.eventPayload = requireNonNull(eventPayload, "No eventPayload provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    /**
     * Verify that the event orders of <code>events</code> start at <code>expectedStreamVersion</code> and are consecutive
     *
     * @throws IllegalArgumentException if they aren't
     */
    public static void requireConsecutiveEventOrders(StreamVersion expectedStreamVersion, List<PersistableEvent> events) {
        requireNonNull(expectedStreamVersion, "No expectedStreamVersion provided");
        requireNonNull(events, "No events provided");
        var expectedEventOrder = EventOrder.of(expectedStreamVersion);
        for (var event : events) {
            if (!expectedEventOrder.equals(event.eventOrder)) {
                throw new IllegalArgumentException(msg("Expected event '{}' to have eventOrder {} but it had eventOrder {}",
                                                       event.eventName,
                                                       expectedEventOrder,
                                                       event.eventOrder));
            }
            expectedEventOrder = expectedEventOrder.increaseAndGet();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistableEvent)) return false;
        var that = (PersistableEvent) o;
        return eventOrder.equals(that.eventOrder) && eventName.equals(that.eventName) && eventPayload.equals(that.eventPayload) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventOrder, eventName);
    }

    @Override
    public String toString() {
        return "PersistableEvent{" +
                "eventOrder=" + eventOrder +
                ", eventName=" + eventName +
                ", timestamp=" + timestamp +
                '}';
    }
}
