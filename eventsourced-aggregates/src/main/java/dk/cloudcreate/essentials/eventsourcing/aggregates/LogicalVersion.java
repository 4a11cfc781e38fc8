package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Declares the logical version of an {@link AggregateState} type.<br>
 * The logical version must be increased whenever the way the state folds events changes (new fields, changed
 * {@link EventHandler} semantics, etc.), as snapshots persisted under a different logical version are
 * ignored and the state is rebuilt by replaying the full event stream.<br>
 * A state class without this annotation has logical version 0.
 *
 * @see AggregateState#logicalVersionOf(Class)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
public @interface LogicalVersion {
    int value();
}
