package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Decides whether a state snapshot is written together with the events of an {@link AggregateStore#save(dk.cloudcreate.essentials.eventsourcing.aggregates.Aggregate)}
 */
@FunctionalInterface
public interface SnapshotPolicy {
    /**
     * @param streamVersionBeforeAppend the stream version before the events are appended
     * @param streamVersionAfterAppend  the stream version after the events are appended
     * @return true if a snapshot of the state at <code>streamVersionAfterAppend</code> should be written
     */
    boolean shouldTakeSnapshot(StreamVersion streamVersionBeforeAppend, StreamVersion streamVersionAfterAppend);

    /**
     * Snapshot on every save, which means loading never needs to replay events
     */
    static SnapshotPolicy always() {
        return (before, after) -> true;
    }

    /**
     * Never snapshot, i.e. always replay the full event stream
     */
    static SnapshotPolicy never() {
        return (before, after) -> false;
    }

    /**
     * Snapshot when the stream version crosses a multiple of <code>numberOfEvents</code>
     *
     * @param numberOfEvents the snapshot interval
     */
    static SnapshotPolicy everyNthEvent(long numberOfEvents) {
        requireTrue(numberOfEvents > 0, msg("numberOfEvents must be positive. Got {}", numberOfEvents));
        return (before, after) -> before.value() / numberOfEvents != after.value() / numberOfEvents;
    }
}
