package dk.cloudcreate.essentials.eventsourcing.aggregates;

/**
 * Marker interface for an immutable fact that happened to a single aggregate instance.<br>
 * Every concrete event class must be annotated with {@link EventTypeName}, which provides the stable
 * type tag that the event is persisted under:
 * <pre>{@code
 * @EventTypeName("OrderPaymentReceived")
 * public class OrderPaymentReceived extends OrderEvent {
 *     public final BigDecimal amount;
 *     ...
 * }
 * }</pre>
 * Once an event has been persisted under a given type tag, the meaning of that tag must never change.
 */
public interface Event {
    /**
     * The stable type tag of this event
     *
     * @return the name resolved from the {@link EventTypeName} annotation on the concrete event class
     * @throws IllegalArgumentException in case the event class isn't annotated with {@link EventTypeName}
     */
    default EventName eventName() {
        return EventName.of(getClass());
    }
}
