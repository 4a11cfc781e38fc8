package dk.cloudcreate.essentials.eventsourcing.aggregates;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import dk.cloudcreate.essentials.shared.types.GenericType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The state of an aggregate, which is derived by folding the aggregates events, in order, starting from the
 * default state instance (normally created using the no-args constructor).<br>
 * Events are folded by the state's {@link EventHandler} annotated methods, where the method that matches the
 * event type most specifically is called. The fold is total: an event without a matching {@link EventHandler} is a
 * modeling error and will cause an {@link UnhandledEventException}.<br>
 * Example:
 * <pre>{@code
 * @LogicalVersion(1)
 * public class OrderState extends AggregateState<OrderId, OrderEvent, OrderState> {
 *     private OrderId    orderId;
 *     private BigDecimal balanceOwing;
 *
 *     @Override
 *     public OrderId aggregateId() {
 *         return orderId;
 *     }
 *
 *     @EventHandler
 *     private void on(OrderCreated e) {
 *         orderId = e.orderId;
 *         balanceOwing = e.balanceOwing;
 *     }
 *
 *     @EventHandler
 *     private void on(OrderPaymentReceived e) {
 *         balanceOwing = balanceOwing.subtract(e.amount);
 *     }
 *     ...
 * }
 * }</pre>
 * The state is persisted as a snapshot together with its {@link LogicalVersion}, so all state fields must be
 * JSON serializable.
 *
 * @param <ID>         the type of aggregate id
 * @param <EVENT_TYPE> the type of event
 * @param <STATE_TYPE> the concrete state type (self type)
 */
public abstract class AggregateState<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>> {
    public static final int DEFAULT_LOGICAL_VERSION = 0;

    @JsonIgnore
    private transient PatternMatchingMethodInvoker<Event> invoker;

    /**
     * The id of the aggregate this state belongs to
     *
     * @return the aggregate id or <code>null</code> if the creation event hasn't been applied yet
     */
    public abstract ID aggregateId();

    /**
     * Create an independent (deep) copy of this state, which can be inspected or modified without affecting this instance
     *
     * @return a copy of this state
     */
    public abstract STATE_TYPE copy();

    /**
     * Fold the event into this state instance by calling the most specific matching {@link EventHandler} method
     *
     * @param event the event to fold
     * @throws UnhandledEventException in case no {@link EventHandler} method matches the event
     */
    public void apply(EVENT_TYPE event) {
        requireNonNull(event, "You must supply an event");
        if (invoker == null) {
            // Instance was created by the default state supplier or deserialized from a snapshot
            invoker = new PatternMatchingMethodInvoker<>(this,
                                                         new SingleArgumentAnnotatedMethodPatternMatcher<>(EventHandler.class,
                                                                                                           new GenericType<Event>() {
                                                                                                           }),
                                                         InvocationStrategy.InvokeMostSpecificTypeMatched);
        }
        invoker.invoke(event, unmatchedEvent -> {
            throw new UnhandledEventException(msg("No @{} method in '{}' matches event '{}'",
                                                  EventHandler.class.getSimpleName(),
                                                  this.getClass().getName(),
                                                  unmatchedEvent.getClass().getName()),
                                              unmatchedEvent);
        });
    }

    /**
     * The logical version of this state type
     *
     * @see #logicalVersionOf(Class)
     */
    public final int logicalVersion() {
        return logicalVersionOf(getClass());
    }

    /**
     * Resolve the logical version of a state type, as declared by its {@link LogicalVersion} annotation
     *
     * @param stateType the state type
     * @return the declared logical version or {@link #DEFAULT_LOGICAL_VERSION} if the state type isn't annotated
     */
    public static int logicalVersionOf(Class<?> stateType) {
        requireNonNull(stateType, "No stateType provided");
        var logicalVersion = stateType.getAnnotation(LogicalVersion.class);
        return logicalVersion != null ? logicalVersion.value() : DEFAULT_LOGICAL_VERSION;
    }
}
