package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.AggregateType;
import dk.cloudcreate.essentials.eventsourcing.store.serializer.json.*;
import reactor.core.scheduler.*;

import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configuration of an {@link AggregateStore} for a single {@link AggregateType}
 *
 * @param <ID>             the type of aggregate id
 * @param <EVENT_TYPE>     the type of event
 * @param <STATE_TYPE>     the type of aggregate state
 * @param <AGGREGATE_TYPE> the type of aggregate
 */
public final class AggregateStoreConfiguration<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>> {
    public final AggregateType                                              aggregateType;
    public final Class<STATE_TYPE>                                          stateType;
    /**
     * Supplies the state a new aggregate starts from and the state a full stream replay starts from
     */
    public final Supplier<STATE_TYPE>                                       defaultState;
    public final AggregateFactory<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> aggregateFactory;
    public final EventTypes                                                 eventTypes;
    public final SnapshotPolicy                                             snapshotPolicy;
    public final JSONSerializer                                             jsonSerializer;
    /**
     * The scheduler the (blocking) {@link dk.cloudcreate.essentials.eventsourcing.store.persistence.EventStreamPersistence} calls run on
     */
    public final Scheduler                                                  scheduler;

    public AggregateStoreConfiguration(AggregateType aggregateType,
                                       Class<STATE_TYPE> stateType,
                                       Supplier<STATE_TYPE> defaultState,
                                       AggregateFactory<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> aggregateFactory,
                                       EventTypes eventTypes,
                                       SnapshotPolicy snapshotPolicy,
                                       JSONSerializer jsonSerializer,
                                       Scheduler scheduler) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.stateType = requireNonNull(stateType, "No stateType provided");
        this.defaultState = requireNonNull(defaultState, "No defaultState supplier provided");
        this.aggregateFactory = requireNonNull(aggregateFactory, "No aggregateFactory provided");
        this.eventTypes = requireNonNull(eventTypes, "No eventTypes provided");
        this.snapshotPolicy = requireNonNull(snapshotPolicy, "No snapshotPolicy provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.scheduler = requireNonNull(scheduler, "No scheduler provided");
    }

    /**
     * Create a configuration that snapshots on every save ({@link SnapshotPolicy#always()}), uses the default
     * {@link JacksonJSONSerializer} and runs persistence calls on {@link Schedulers#boundedElastic()}
     */
    public static <ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>>
    AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> from(AggregateType aggregateType,
                                                                                 Class<STATE_TYPE> stateType,
                                                                                 Supplier<STATE_TYPE> defaultState,
                                                                                 AggregateFactory<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> aggregateFactory,
                                                                                 EventTypes eventTypes) {
        return new AggregateStoreConfiguration<>(aggregateType,
                                                 stateType,
                                                 defaultState,
                                                 aggregateFactory,
                                                 eventTypes,
                                                 SnapshotPolicy.always(),
                                                 new JacksonJSONSerializer(),
                                                 Schedulers.boundedElastic());
    }

    public AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> withSnapshotPolicy(SnapshotPolicy snapshotPolicy) {
        return new AggregateStoreConfiguration<>(aggregateType, stateType, defaultState, aggregateFactory, eventTypes, snapshotPolicy, jsonSerializer, scheduler);
    }

    public AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> withJsonSerializer(JSONSerializer jsonSerializer) {
        return new AggregateStoreConfiguration<>(aggregateType, stateType, defaultState, aggregateFactory, eventTypes, snapshotPolicy, jsonSerializer, scheduler);
    }

    public AggregateStoreConfiguration<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> withScheduler(Scheduler scheduler) {
        return new AggregateStoreConfiguration<>(aggregateType, stateType, defaultState, aggregateFactory, eventTypes, snapshotPolicy, jsonSerializer, scheduler);
    }

    /**
     * The logical version of the {@link #stateType}
     *
     * @see AggregateState#logicalVersionOf(Class)
     */
    public int logicalVersion() {
        return AggregateState.logicalVersionOf(stateType);
    }

    @Override
    public String toString() {
        return "AggregateStoreConfiguration{" +
                "aggregateType=" + aggregateType +
                ", stateType=" + stateType.getName() +
                ", logicalVersion=" + logicalVersion() +
                ", eventTypes=" + eventTypes +
                '}';
    }
}
