package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.eventsourcing.store.*;

import java.util.*;

/**
 * Storage backend for aggregate event streams and their latest snapshot.<br>
 * Every aggregate instance has one event stream, identified by its {@link AggregateType} and textual aggregate id.
 * Events are immutable once appended and are numbered from {@link EventOrder#FIRST_EVENT_ORDER} without gaps.<br>
 * Implementations must be thread safe and every {@link #appendToStream(AggregateType, String, StreamVersion, List, Optional)}
 * must be an atomic compare-and-append.
 */
public interface EventStreamPersistence {
    /**
     * Prepare the storage for the streams of the given aggregate type. Calling it more than once is a no-op
     *
     * @param aggregateType the aggregate type
     * @return this persistence instance
     */
    EventStreamPersistence addAggregateType(AggregateType aggregateType);

    /**
     * Load the latest snapshot of an aggregate
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the textual aggregate id
     * @return the latest snapshot or {@link Optional#empty()} if no snapshot has been persisted
     * @throws EventStoreException in case of a storage error
     */
    Optional<AggregateSnapshot> loadSnapshot(AggregateType aggregateType, String aggregateId);

    /**
     * Load the events of an aggregates event stream, ordered by their {@link EventOrder}
     *
     * @param aggregateType        the aggregate type
     * @param aggregateId          the textual aggregate id
     * @param fromEventOrderInclusive the event order of the first event to load
     * @return the events (an empty list if the stream doesn't exist or has no events from the given event order)
     * @throws EventStoreException in case of a storage error
     */
    List<PersistedEvent> loadEvents(AggregateType aggregateType, String aggregateId, EventOrder fromEventOrderInclusive);

    /**
     * The current version of an aggregates event stream
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the textual aggregate id
     * @return the number of events in the stream ({@link StreamVersion#ZERO} if the stream doesn't exist)
     * @throws EventStoreException in case of a storage error
     */
    StreamVersion currentStreamVersion(AggregateType aggregateType, String aggregateId);

    /**
     * Atomically append events to an aggregates event stream, and optionally replace its snapshot, provided the stream
     * has the expected version. Either all events (and the snapshot) are persisted or nothing is.<br>
     * An existing snapshot is only replaced by a snapshot with a newer {@link AggregateSnapshot#streamVersion}.
     *
     * @param aggregateType         the aggregate type
     * @param aggregateId           the textual aggregate id
     * @param expectedStreamVersion the version the stream must have
     * @param events                the events to append. Their event orders must start at <code>expectedStreamVersion</code> and be consecutive
     * @param snapshot              optional snapshot of the state after the events have been applied
     * @return the new stream version
     * @throws OptimisticAppendToStreamException if the stream didn't have the expected version
     * @throws AppendToStreamException           in case of any other storage error
     */
    StreamVersion appendToStream(AggregateType aggregateType,
                                 String aggregateId,
                                 StreamVersion expectedStreamVersion,
                                 List<PersistableEvent> events,
                                 Optional<AggregateSnapshot> snapshot);
}
