package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Declares the stable type tag ({@link EventName}) that an {@link Event} class is persisted under
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventTypeName {
    String value();
}
