package dk.cloudcreate.essentials.eventsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates an {@link Aggregate} instance from a loaded state and the stream version that state corresponds to
 *
 * @param <ID>             the type of aggregate id
 * @param <EVENT_TYPE>     the type of event
 * @param <STATE_TYPE>     the type of aggregate state
 * @param <AGGREGATE_TYPE> the type of aggregate
 */
@FunctionalInterface
public interface AggregateFactory<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>> {
    /**
     * @param state       the loaded state
     * @param nextVersion the stream version of the loaded state
     * @return the aggregate instance
     */
    AGGREGATE_TYPE fromState(STATE_TYPE state, StreamVersion nextVersion);

    /**
     * Factory that calls the aggregate type's public <code>(STATE_TYPE, StreamVersion)</code> constructor
     *
     * @param aggregateType the type of aggregate
     * @return the factory
     */
    static <ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>, AGGREGATE_TYPE extends Aggregate<ID, EVENT_TYPE, STATE_TYPE>> AggregateFactory<ID, EVENT_TYPE, STATE_TYPE, AGGREGATE_TYPE> reflectionBased(Class<AGGREGATE_TYPE> aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        var reflector = Reflector.reflectOn(aggregateType);
        return (state, nextVersion) -> reflector.newInstance(state, nextVersion);
    }
}
