package dk.cloudcreate.essentials.eventsourcing.store;

import dk.cloudcreate.essentials.eventsourcing.store.persistence.AggregateType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException {
    public final Object        aggregateId;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(Object aggregateId, AggregateType aggregateType) {
        super(msg("Couldn't find a '{}' aggregate with id '{}'",
                  requireNonNull(aggregateType, "No aggregateType provided"),
                  requireNonNull(aggregateId, "No aggregateId provided")));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
