package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import org.slf4j.*;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.*;
import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads and saves event sourced {@link Aggregate}s of a single {@link AggregateType}.<br>
 * All operations are asynchronous and return a {@link Mono}; the blocking {@link EventStreamPersistence} calls run
 * on the {@link AggregateStoreConfiguration#scheduler}.<br>
 * Typical command flow:
 * <pre>{@code
 * var store = AggregateStore.from(persistence,
 *                                 AggregateStoreConfiguration.from(AggregateType.of("Orders"),
 *                                                                  OrderState.class,
 *                                                                  OrderState::new,
 *                                                                  Order::new,
 *                                                                  EventTypes.of(OrderCreated.class, OrderPaymentReceived.class, OrderPaidOff.class)));
 *
 * store.save(Order.createNewOrder(orderId, "Coffee", new BigDecimal("100"))).block();
 *
 * var order = store.get(orderId).block();
 * order.makePayment(new BigDecimal("40"));
 * store.save(order).block();
 * }</pre>
 * Concurrent commands against the same aggregate are resolved using optimistic concurrency: only one
 * {@link #save(Aggregate)} per stream version succeeds, the others fail with {@link OptimisticAppendToStreamException}
 * (see {@link #update(Object, Consumer, long)} for a command retry loop).
 *
 * @param <ID>             the type of aggregate id
 * @param <EVENT_TYPE>     the type of event
 * @param <STATE_TYPE>     the type of aggregate state
 * @param <AGGREGATE_TYPE> the type of aggregate
 */
public interface AggregateStore<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>> {
    /**
     * Create an {@link AggregateStore} that stores its aggregates in the <code>persistence</code>.<br>
     * The storage for {@link AggregateStoreConfiguration#aggregateType} is initialized as part of the call
     *
     * @param persistence   the event stream persistence
     * @param configuration the store configuration
     * @return the {@link AggregateStore}
     */
    static <ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>>
    AggregateStore<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> from(EventStreamPersistence persistence,
                                                                    AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> configuration) {
        return new DefaultAggregateStore<>(persistence, configuration);
    }

    /**
     * The type of aggregate this store handles
     */
    AggregateType aggregateType();

    /**
     * Load the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return a {@link Mono} with the aggregate, or an empty {@link Mono} if the aggregate doesn't exist
     */
    Mono<AGGREGATE_TYPE> tryGet(ID aggregateId);

    /**
     * Load the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return a {@link Mono} with the aggregate, which fails with {@link AggregateNotFoundException} if the aggregate doesn't exist
     */
    default Mono<AGGREGATE_TYPE> get(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return tryGet(aggregateId).switchIfEmpty(Mono.error(() -> new AggregateNotFoundException(aggregateId, aggregateType())));
    }

    /**
     * Save the aggregate's pending events, and optionally a snapshot of its state, in one atomic append.<br>
     * The aggregate is taken ({@link Aggregate#take()}) when this method is called, regardless of whether the
     * returned {@link Mono} is subscribed. Nothing is written until the {@link Mono} is subscribed.
     *
     * @param aggregate the aggregate to save
     * @return a {@link Mono} with the new stream version (or the unchanged version if there were no pending events).
     * The {@link Mono} fails with {@link OptimisticAppendToStreamException} if the stream has been changed since the aggregate was
     * loaded, or with another {@link EventStoreException} if the events couldn't be serialized or persisted
     * @throws AggregateAlreadyTakenException if the aggregate has already been taken
     */
    Mono<StreamVersion> save(AGGREGATE_TYPE aggregate);

    /**
     * Load the aggregate, run the command on it and save it. If the save fails because of an optimistic concurrency
     * conflict the whole sequence is retried, at most <code>maxRetries</code> times. Other errors, including exceptions
     * thrown by the command, fail the {@link Mono} at once
     *
     * @param aggregateId the aggregate id
     * @param command     the command to run against the loaded aggregate
     * @param maxRetries  the maximum number of retries
     * @return a {@link Mono} with the new stream version. When retries are exhausted it fails with the last {@link OptimisticAppendToStreamException}
     */
    default Mono<StreamVersion> update(ID aggregateId, Consumer<AGGREGATE_TYPE> command, long maxRetries) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(command, "No command provided");
        requireTrue(maxRetries >= 0, msg("maxRetries cannot be negative. Got {}", maxRetries));
        return Mono.defer(() -> get(aggregateId).flatMap(aggregate -> {
                       command.accept(aggregate);
                       return save(aggregate);
                   }))
                   .retryWhen(Retry.max(maxRetries)
                                   .filter(OptimisticAppendToStreamException.class::isInstance)
                                   .onRetryExhaustedThrow((retrySpec, retrySignal) -> retrySignal.failure()));
    }

    /**
     * Default {@link AggregateStore} implementation, which loads an aggregate from its latest compatible snapshot
     * (if any) followed by the events persisted after the snapshot.<br>
     * A snapshot is only compatible if it was written by a state type with the same {@link LogicalVersion} as the
     * configured {@link AggregateStoreConfiguration#stateType}; otherwise it is ignored and the full event stream is replayed.
     */
    class DefaultAggregateStore<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>> implements AggregateStore<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateStore.class);

        private final EventStreamPersistence                                                persistence;
        private final AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> configuration;
        private final AggregateType                                                         aggregateType;
        private final int                                                                   logicalVersion;

        public DefaultAggregateStore(EventStreamPersistence persistence,
                                     AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> configuration) {
            this.persistence = requireNonNull(persistence, "No persistence provided");
            this.configuration = requireNonNull(configuration, "No configuration provided");
            this.aggregateType = configuration.aggregateType;
            this.logicalVersion = configuration.logicalVersion();
            persistence.addAggregateType(aggregateType);
            log.info("[{}] Created {} for state '{}' with logical version {}",
                     aggregateType,
                     this.getClass().getSimpleName(),
                     configuration.stateType.getName(),
                     logicalVersion);
        }

        @Override
        public AggregateType aggregateType() {
            return aggregateType;
        }

        @Override
        public Mono<AGGREGATE_TYPE> tryGet(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return Mono.fromCallable(() -> load(aggregateId).orElse(null))
                       .subscribeOn(configuration.scheduler);
        }

        @Override
        public Mono<StreamVersion> save(AGGREGATE_TYPE aggregate) {
            requireNonNull(aggregate, "No aggregate provided");
            var changes = aggregate.take();
            return Mono.fromCallable(() -> persist(changes))
                       .subscribeOn(configuration.scheduler);
        }

        private Optional<AGGREGATE_TYPE> load(ID aggregateId) {
            var streamId = streamIdOf(aggregateId);
            log.trace("[{}] Trying to load '{}' with id '{}'", aggregateType, configuration.stateType.getName(), streamId);

            STATE_TYPE    state;
            StreamVersion streamVersion;
            var           snapshot    = persistence.loadSnapshot(aggregateType, streamId);
            var           useSnapshot = snapshot.isPresent() && snapshot.get().isCompatibleWith(logicalVersion);
            if (useSnapshot) {
                state = configuration.jsonSerializer.deserialize(snapshot.get().statePayload, configuration.stateType);
                streamVersion = snapshot.get().streamVersion;
                log.trace("[{}] Using snapshot of '{}' at stream version {}", aggregateType, streamId, streamVersion);
            } else {
                snapshot.ifPresent(staleSnapshot -> log.debug("[{}] Ignoring snapshot of '{}' at stream version {} with logical version {} since '{}' has logical version {}. Replaying the full event stream",
                                                              aggregateType,
                                                              streamId,
                                                              staleSnapshot.streamVersion,
                                                              staleSnapshot.logicalVersion,
                                                              configuration.stateType.getName(),
                                                              logicalVersion));
                state = configuration.defaultState.get();
                streamVersion = StreamVersion.ZERO;
            }

            var events = persistence.loadEvents(aggregateType, streamId, EventOrder.of(streamVersion));
            if (!useSnapshot && events.isEmpty()) {
                log.trace("[{}] Didn't find '{}' with id '{}'", aggregateType, configuration.stateType.getName(), streamId);
                return Optional.empty();
            }
            for (var persistedEvent : events) {
                if (!persistedEvent.eventOrder().equals(EventOrder.of(streamVersion))) {
                    throw new EventStoreException(msg("[{}] Event stream '{}' is inconsistent. Expected event with eventOrder {} but found eventOrder {}",
                                                      aggregateType,
                                                      streamId,
                                                      streamVersion,
                                                      persistedEvent.eventOrder()));
                }
                state.apply(deserialize(persistedEvent));
                streamVersion = streamVersion.next();
            }
            log.debug("[{}] Found '{}' with id '{}' at stream version {} after replaying {} event(s)",
                      aggregateType,
                      configuration.stateType.getName(),
                      streamId,
                      streamVersion,
                      events.size());
            return Optional.of(configuration.aggregateFactory.fromState(state, streamVersion));
        }

        @SuppressWarnings("unchecked")
        private EVENT_TYPE deserialize(PersistedEvent persistedEvent) {
            var eventType = configuration.eventTypes.resolve(persistedEvent.eventName());
            return (EVENT_TYPE) configuration.jsonSerializer.deserialize(persistedEvent.eventPayload(), eventType);
        }

        private StreamVersion persist(AggregateChanges<ID, EVENT_TYPE, STATE_TYPE> changes) {
            if (changes.isEmpty()) {
                log.trace("[{}] No changes detected for '{}' with id '{}'", aggregateType, configuration.stateType.getName(), changes.aggregateId);
                return changes.nextVersion;
            }
            var streamId              = streamIdOf(changes.aggregateId);
            var expectedStreamVersion = changes.expectedStreamVersion();
            var timestamp             = OffsetDateTime.now(Clock.systemUTC());

            var persistableEvents = new ArrayList<PersistableEvent>(changes.events.size());
            var eventOrder        = EventOrder.of(expectedStreamVersion);
            for (var event : changes.events) {
                configuration.eventTypes.requireRegistered(event);
                persistableEvents.add(new PersistableEvent(eventOrder,
                                                           event.eventName(),
                                                           configuration.jsonSerializer.serialize(event),
                                                           timestamp));
                eventOrder = eventOrder.increaseAndGet();
            }

            Optional<AggregateSnapshot> snapshot = Optional.empty();
            if (configuration.snapshotPolicy.shouldTakeSnapshot(expectedStreamVersion, changes.nextVersion)) {
                snapshot = Optional.of(new AggregateSnapshot(configuration.jsonSerializer.serialize(changes.state),
                                                             changes.nextVersion,
                                                             logicalVersion,
                                                             timestamp));
            }

            log.debug("[{}] Persisting {} event(s) for '{}' with id '{}' at expected stream version {} {} snapshot",
                      aggregateType,
                      persistableEvents.size(),
                      configuration.stateType.getName(),
                      streamId,
                      expectedStreamVersion,
                      snapshot.isPresent() ? "with" : "without");
            var newStreamVersion = persistence.appendToStream(aggregateType,
                                                              streamId,
                                                              expectedStreamVersion,
                                                              persistableEvents,
                                                              snapshot);
            log.debug("[{}] Persisted '{}' with id '{}'. Stream version is now {}", aggregateType, configuration.stateType.getName(), streamId, newStreamVersion);
            return newStreamVersion;
        }

        private String streamIdOf(ID aggregateId) {
            return String.valueOf(requireNonNull(aggregateId, "No aggregateId provided"));
        }

        @Override
        public String toString() {
            return "DefaultAggregateStore{" +
                    "aggregateType=" + aggregateType +
                    ", stateType=" + configuration.stateType.getName() +
                    ", logicalVersion=" + logicalVersion +
                    ", persistence=" + persistence.getClass().getSimpleName() +
                    '}';
        }
    }
}
