package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is applied to, or replayed on to,
 * an {@link AggregateState} instance
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
