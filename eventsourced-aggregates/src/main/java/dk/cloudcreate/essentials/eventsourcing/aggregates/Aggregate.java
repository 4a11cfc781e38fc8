package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.util.List;

/**
 * Common interface for all event sourced aggregates.<br>
 * An aggregate wraps its {@link AggregateState}, the events applied since it was loaded or created (the pending events)
 * and the {@link StreamVersion} the aggregate will have once the pending events have been committed.<br>
 * An aggregate instance is single writer and not thread safe. Once {@link #take()} has been called the instance is
 * consumed and every method, except {@link #isTaken()}, throws {@link AggregateAlreadyTakenException}.
 *
 * @param <ID>         the type of aggregate id
 * @param <EVENT_TYPE> the type of event
 * @param <STATE_TYPE> the type of aggregate state
 * @see AggregateRoot
 */
public interface Aggregate<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>> {
    /**
     * The id of the aggregate
     */
    ID aggregateId();

    /**
     * @return an independent copy of the current state
     */
    STATE_TYPE cloneState();

    /**
     * The stream version the aggregate has when all {@link #pendingEvents()} have been committed
     */
    StreamVersion nextVersion();

    /**
     * The events applied to the aggregate that haven't been committed yet
     *
     * @return read-only view of the pending events
     */
    List<EVENT_TYPE> pendingEvents();

    /**
     * Consume the aggregate and hand over its state, its next version and its pending events
     *
     * @return the changes that should be persisted
     * @throws AggregateAlreadyTakenException if the aggregate has already been taken
     */
    AggregateChanges<ID, EVENT_TYPE, STATE_TYPE> take();

    /**
     * Has {@link #take()} been called
     */
    boolean isTaken();
}
