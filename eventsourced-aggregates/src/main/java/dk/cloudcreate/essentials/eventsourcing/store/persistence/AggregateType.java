package dk.cloudcreate.essentials.eventsourcing.store.persistence;

import dk.cloudcreate.essentials.types.*;

/**
 * Names the family of event streams that belong to the same type of aggregate, e.g. "Orders".<br>
 * The {@link AggregateType} is only a name and shouldn't be confused with the Fully Qualified Class Name of an
 * aggregate class. Backends use it to group the storage of streams, e.g. in a table per {@link AggregateType}.
 */
public class AggregateType extends CharSequenceType<AggregateType> implements Identifier {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
