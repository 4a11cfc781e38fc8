package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The result of {@link Aggregate#take()}: the aggregates current state, its next stream version and the pending
 * events that must be appended at {@link #expectedStreamVersion()}
 *
 * @param <ID>         the type of aggregate id
 * @param <EVENT_TYPE> the type of event
 * @param <STATE_TYPE> the type of aggregate state
 */
public class AggregateChanges<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>> {
    /**
     * The id of the aggregate. A <code>null</code> value is only allowed if {@link #events} is empty
     */
    public final ID               aggregateId;
    public final STATE_TYPE       state;
    public final StreamVersion    nextVersion;
    public final List<EVENT_TYPE> events;

    public AggregateChanges(ID aggregateId,
                            STATE_TYPE state,
                            StreamVersion nextVersion,
                            List<EVENT_TYPE> events) {
        this.state = requireNonNull(state, "No state provided");
        this.nextVersion = requireNonNull(nextVersion, "No nextVersion provided");
        this.events = Collections.unmodifiableList(new ArrayList<>(requireNonNull(events, "No events provided")));
        requireTrue(nextVersion.value() >= this.events.size(),
                    msg("nextVersion {} is lower than the number of events {}", nextVersion, this.events.size()));
        if (!this.events.isEmpty()) {
            requireNonNull(aggregateId, msg("No aggregateId provided. The state '{}' didn't resolve an aggregateId after {} event(s) were applied",
                                            state.getClass().getName(),
                                            this.events.size()));
        }
        this.aggregateId = aggregateId;
    }

    /**
     * The stream version the event stream must have for the {@link #events} to be appended
     */
    public StreamVersion expectedStreamVersion() {
        return StreamVersion.of(nextVersion.value() - events.size());
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregateChanges{" +
                "aggregateId=" + aggregateId +
                ", stateType=" + state.getClass().getSimpleName() +
                ", expectedStreamVersion=" + expectedStreamVersion() +
                ", nextVersion=" + nextVersion +
                ", events=" + events.size() +
                '}';
    }
}
