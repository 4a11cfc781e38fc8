package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.eventsourcing.aggregates.EventName;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A serialized event that has been appended to an aggregates event stream
 *
 * @see PersistableEvent
 */
public interface PersistedEvent {
    static PersistedEvent from(AggregateType aggregateType,
                               String aggregateId,
                               EventOrder eventOrder,
                               EventName eventName,
                               String eventPayload,
                               OffsetDateTime timestamp) {
        return new DefaultPersistedEvent(aggregateType,
                                         aggregateId,
                                         eventOrder,
                                         eventName,
                                         eventPayload,
                                         timestamp);
    }

    static PersistedEvent from(AggregateType aggregateType,
                               String aggregateId,
                               PersistableEvent persistableEvent) {
        requireNonNull(persistableEvent, "No persistableEvent provided");
        return from(aggregateType,
                    aggregateId,
                    persistableEvent.eventOrder,
                    persistableEvent.eventName,
                    persistableEvent.eventPayload,
                    persistableEvent.timestamp);
    }

    /**
     * The type of aggregate the event stream belongs to
     */
    AggregateType aggregateType();

    /**
     * The textual aggregate id, i.e. the id of the event stream
     */
    String aggregateId();

    /**
     * The position of the event in the event stream
     */
    EventOrder eventOrder();

    /**
     * The type tag the event was persisted under
     */
    EventName eventName();

    /**
     * The event serialized as JSON
     */
    String eventPayload();

    /**
     * When the event was persisted
     */
    OffsetDateTime timestamp();

    final class DefaultPersistedEvent implements PersistedEvent {
        private final AggregateType  aggregateType;
        private final String         aggregateId;
        private final EventOrder     eventOrder;
        private final EventName      eventName;
        private final String         eventPayload;
        private final OffsetDateTime timestamp;

        public DefaultPersistedEvent(AggregateType aggregateType,
                                     String aggregateId,
                                     EventOrder eventOrder,
                                     EventName eventName,
                                     String eventPayload,
                                     OffsetDateTime timestamp) {
            this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
            this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
            this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
            this.eventName = requireNonNull(eventName, "No eventName provided");
            this.eventPayload = requireNonNull(eventPayload, "No eventPayload provided");
            this.timestamp = requireNonNull(timestamp, "No timestamp provided");
        }

        @Override
        public AggregateType aggregateType() {
            return aggregateType;
        }

        @Override
        public String aggregateId() {
            return aggregateId;
        }

        @Override
        public EventOrder eventOrder() {
            return eventOrder;
        }

        @Override
        public EventName eventName() {
            return eventName;
        }

        @Override
        public String eventPayload() {
            return eventPayload;
        }

        @Override
        public OffsetDateTime timestamp() {
            return timestamp;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PersistedEvent)) return false;
            var that = (PersistedEvent) o;
            return aggregateType.equals(that.aggregateType()) && aggregateId.equals(that.aggregateId()) && eventOrder.equals(that.eventOrder());
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateType, aggregateId, eventOrder);
        }

        @Override
        public String toString() {
            return "PersistedEvent{" +
                    "aggregateType=" + aggregateType +
                    ", aggregateId='" + aggregateId + '\'' +
                    ", eventOrder=" + eventOrder +
                    ", eventName=" + eventName +
                    ", timestamp=" + timestamp +
                    '}';
        }
    }
}
