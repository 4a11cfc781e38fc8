package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.AggregateType;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Optimistic concurrency conflict: the aggregates event stream didn't have the expected {@link StreamVersion}
 * when the events were appended, i.e. another writer committed events in the meantime.<br>
 * The operation can be retried by loading the aggregate again and re-running the command.
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final AggregateType aggregateType;
    public final String        aggregateId;
    public final StreamVersion expectedStreamVersion;
    /**
     * The actual stream version, if known by the backend
     */
    private final StreamVersion actualStreamVersion;

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             String aggregateId,
                                             StreamVersion expectedStreamVersion,
                                             StreamVersion actualStreamVersion) {
        super(msg("[{}] Concurrent modification of aggregate with id '{}'. Expected stream version {} but the actual stream version is {}",
                  aggregateType,
                  aggregateId,
                  expectedStreamVersion,
                  actualStreamVersion));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedStreamVersion = expectedStreamVersion;
        this.actualStreamVersion = actualStreamVersion;
    }

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             String aggregateId,
                                             StreamVersion expectedStreamVersion,
                                             Throwable cause) {
        super(msg("[{}] Concurrent modification of aggregate with id '{}'. Another writer appended events at stream version {}",
                  aggregateType,
                  aggregateId,
                  expectedStreamVersion),
              cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedStreamVersion = expectedStreamVersion;
        this.actualStreamVersion = null;
    }

    public Optional<StreamVersion> actualStreamVersion() {
        return Optional.ofNullable(actualStreamVersion);
    }
}
