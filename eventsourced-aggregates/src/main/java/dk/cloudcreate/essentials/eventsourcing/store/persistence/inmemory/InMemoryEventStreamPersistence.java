package dk.cloudcreate.essentials.eventsourcing.store.persistence.inmemory;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.eventsourcing.store.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStreamPersistence} that keeps the event streams in memory.<br>
 * Each event stream is an immutable value that's replaced using {@link ConcurrentMap#compute(Object, java.util.function.BiFunction)},
 * which makes the stream version check and the append a single atomic operation.
 * Events and snapshots are stored in their serialized form.
 */
public class InMemoryEventStreamPersistence implements EventStreamPersistence {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStreamPersistence.class);

    private final ConcurrentMap<AggregateType, ConcurrentMap<String, EventStream>> eventStreams = new ConcurrentHashMap<>();

    @Override
    public InMemoryEventStreamPersistence addAggregateType(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        eventStreams.computeIfAbsent(aggregateType, type -> {
            log.info("[{}] Initializing in-memory EventStream storage", type);
            return new ConcurrentHashMap<>();
        });
        return this;
    }

    /**
     * Remove all event streams and snapshots stored for the aggregate type
     *
     * @param aggregateType the aggregate type
     */
    public void resetStorageFor(AggregateType aggregateType) {
        log.info("[{}] Resetting in-memory EventStream storage", aggregateType);
        streamsFor(aggregateType).clear();
    }

    @Override
    public Optional<AggregateSnapshot> loadSnapshot(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var eventStream = streamsFor(aggregateType).get(aggregateId);
        return eventStream != null ? eventStream.snapshot : Optional.empty();
    }

    @Override
    public List<PersistedEvent> loadEvents(AggregateType aggregateType, String aggregateId, EventOrder fromEventOrderInclusive) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(fromEventOrderInclusive, "No fromEventOrderInclusive provided");
        var eventStream = streamsFor(aggregateType).get(aggregateId);
        if (eventStream == null) {
            return List.of();
        }
        return eventStream.events.stream()
                                 .filter(event -> event.eventOrder().value() >= fromEventOrderInclusive.value())
                                 .collect(Collectors.toList());
    }

    @Override
    public StreamVersion currentStreamVersion(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var eventStream = streamsFor(aggregateType).get(aggregateId);
        return eventStream != null ? eventStream.streamVersion() : StreamVersion.ZERO;
    }

    @Override
    public StreamVersion appendToStream(AggregateType aggregateType,
                                        String aggregateId,
                                        StreamVersion expectedStreamVersion,
                                        List<PersistableEvent> events,
                                        Optional<AggregateSnapshot> snapshot) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedStreamVersion, "No expectedStreamVersion provided");
        requireNonNull(events, "No events provided");
        requireNonNull(snapshot, "No snapshot option provided");
        var streams = streamsFor(aggregateType);
        if (events.isEmpty()) {
            return currentStreamVersion(aggregateType, aggregateId);
        }
        PersistableEvent.requireConsecutiveEventOrders(expectedStreamVersion, events);

        var appendedTo = streams.compute(aggregateId, (id, existingStream) -> {
            var eventStream         = existingStream != null ? existingStream : EventStream.EMPTY;
            var actualStreamVersion = eventStream.streamVersion();
            if (!actualStreamVersion.equals(expectedStreamVersion)) {
                throw new OptimisticAppendToStreamException(aggregateType,
                                                            aggregateId,
                                                            expectedStreamVersion,
                                                            actualStreamVersion);
            }
            return eventStream.append(aggregateType, aggregateId, events, snapshot);
        });
        log.trace("[{}] Appended {} event(s) to stream '{}'. Stream version is now {}",
                  aggregateType,
                  events.size(),
                  aggregateId,
                  appendedTo.streamVersion());
        return appendedTo.streamVersion();
    }

    private ConcurrentMap<String, EventStream> streamsFor(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        var streams = eventStreams.get(aggregateType);
        if (streams == null) {
            throw new EventStoreException(msg("[{}] EventStream storage hasn't been initialized. Please call addAggregateType first",
                                              aggregateType));
        }
        return streams;
    }

    /**
     * Immutable event stream value
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private static final class EventStream {
        static final EventStream EMPTY = new EventStream(List.of(), Optional.empty());

        final List<PersistedEvent>        events;
        final Optional<AggregateSnapshot> snapshot;

        private EventStream(List<PersistedEvent> events, Optional<AggregateSnapshot> snapshot) {
            this.events = events;
            this.snapshot = snapshot;
        }

        StreamVersion streamVersion() {
            return StreamVersion.of(events.size());
        }

        EventStream append(AggregateType aggregateType,
                           String aggregateId,
                           List<PersistableEvent> newEvents,
                           Optional<AggregateSnapshot> newSnapshot) {
            var appendedEvents = new ArrayList<PersistedEvent>(events.size() + newEvents.size());
            appendedEvents.addAll(events);
            newEvents.forEach(event -> appendedEvents.add(PersistedEvent.from(aggregateType, aggregateId, event)));
            var latestSnapshot = newSnapshot.filter(candidate -> snapshot.map(existing -> candidate.streamVersion.isAfter(existing.streamVersion))
                                                                         .orElse(true))
                                            .or(() -> snapshot);
            return new EventStream(Collections.unmodifiableList(appendedEvents), latestSnapshot);
        }
    }
}
