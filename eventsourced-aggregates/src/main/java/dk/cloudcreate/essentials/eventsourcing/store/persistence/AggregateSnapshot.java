package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A serialized {@link AggregateState} together with the {@link StreamVersion} it corresponds to and the
 * {@link LogicalVersion} of the state type it was serialized from.<br>
 * A snapshot can only be used, instead of replaying the stream, by a state type with the same logical version.
 */
public final class AggregateSnapshot {
    /**
     * The state serialized as JSON
     */
    public final String         statePayload;
    /**
     * The stream version the state corresponds to, i.e. the number of events folded into the state
     */
    public final StreamVersion  streamVersion;
    public final int            logicalVersion;
    public final OffsetDateTime timestamp;

    public AggregateSnapshot(String statePayload, StreamVersion streamVersion, int logicalVersion, OffsetDateTime timestamp) {
        this.statePayload = requireNonNull(statePayload, "No statePayload provided");
        this.streamVersion = requireNonNull(streamVersion, "No streamVersion provided");
        this.logicalVersion = logicalVersion;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    /**
     * Can this snapshot be used by a state type with the given logical version
     */
    public boolean isCompatibleWith(int currentLogicalVersion) {
        return logicalVersion == currentLogicalVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateSnapshot)) return false;
        var that = (AggregateSnapshot) o;
        return logicalVersion == that.logicalVersion && statePayload.equals(that.statePayload) && streamVersion.equals(that.streamVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamVersion, logicalVersion);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "streamVersion=" + streamVersion +
                ", logicalVersion=" + logicalVersion +
                ", timestamp=" + timestamp +
                '}';
    }
}
