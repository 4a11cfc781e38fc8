package dk.cloudcreate.essentials.eventsourcing.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for event sourced aggregates that keep their state in an {@link AggregateState} object.<br>
 * Command methods validate their input against the current {@link #state()}, build the resulting event and
 * {@link #apply(Event)} it. A failed validation throws before any event is applied, so the aggregate isn't changed:
 * <pre>{@code
 * public class Order extends AggregateRoot<OrderId, OrderEvent, OrderState> {
 *     public Order(OrderState state, StreamVersion nextVersion) {
 *         super(state, nextVersion);
 *     }
 *
 *     public void makePayment(BigDecimal amount) {
 *         if (amount.compareTo(state().balanceOwing()) > 0) {
 *             throw new OverpaymentException(...);
 *         }
 *         apply(new OrderPaymentReceived(aggregateId(), amount));
 *     }
 * }
 * }</pre>
 * The <code>(STATE_TYPE, StreamVersion)</code> constructor is used when the aggregate is loaded
 * (see {@link AggregateFactory}) as well as when a new aggregate is created, using the default state and
 * {@link StreamVersion#ZERO}.
 *
 * @param <ID>         the type of aggregate id
 * @param <EVENT_TYPE> the type of event
 * @param <STATE_TYPE> the type of aggregate state
 */
public abstract class AggregateRoot<ID, EVENT_TYPE extends Event, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, STATE_TYPE>> implements Aggregate<ID, EVENT_TYPE, STATE_TYPE> {
    private STATE_TYPE       state;
    private StreamVersion    nextVersion;
    private List<EVENT_TYPE> pendingEvents;
    private boolean          taken;

    /**
     * @param state       the (loaded or default) state of the aggregate
     * @param nextVersion the stream version matching <code>state</code>
     */
    protected AggregateRoot(STATE_TYPE state, StreamVersion nextVersion) {
        this.state = requireNonNull(state, "You must supply a state");
        this.nextVersion = requireNonNull(nextVersion, "You must supply a nextVersion");
        this.pendingEvents = new ArrayList<>();
    }

    /**
     * Apply a new event to the aggregate: the event is folded into the {@link #state()}, appended to the
     * {@link #pendingEvents()} and {@link #nextVersion()} is increased by one.<br>
     * If folding the event fails, or it doesn't result in an aggregate id, the aggregate is left unchanged
     *
     * @param event the event to apply
     */
    protected void apply(EVENT_TYPE event) {
        requireNonNull(event, "You must supply an event");
        requireNotTaken();
        // A rejected event must leave the state untouched
        var newState = state.copy();
        newState.apply(event);
        if (newState.aggregateId() == null) {
            throw new AggregateException(msg("Applying Event '{}' to Aggregate '{}' didn't result in an aggregateId. The first event applied MUST provide the aggregateId",
                                             event.getClass().getName(),
                                             this.getClass().getName()));
        }
        state = newState;
        pendingEvents.add(event);
        nextVersion = nextVersion.next();
    }

    /**
     * The current state of the aggregate, for use by command methods
     */
    protected STATE_TYPE state() {
        requireNotTaken();
        return state;
    }

    @Override
    public ID aggregateId() {
        requireNotTaken();
        return state.aggregateId();
    }

    @Override
    public STATE_TYPE cloneState() {
        requireNotTaken();
        return state.copy();
    }

    @Override
    public StreamVersion nextVersion() {
        requireNotTaken();
        return nextVersion;
    }

    @Override
    public List<EVENT_TYPE> pendingEvents() {
        requireNotTaken();
        return Collections.unmodifiableList(pendingEvents);
    }

    @Override
    public AggregateChanges<ID, EVENT_TYPE, STATE_TYPE> take() {
        requireNotTaken();
        var changes = new AggregateChanges<>(state.aggregateId(),
                                             state,
                                             nextVersion,
                                             pendingEvents);
        taken = true;
        state = null;
        pendingEvents = null;
        return changes;
    }

    @Override
    public boolean isTaken() {
        return taken;
    }

    private void requireNotTaken() {
        if (taken) {
            throw new AggregateAlreadyTakenException(msg("Aggregate '{}' has already been taken and can no longer be used",
                                                         this.getClass().getName()));
        }
    }

    @Override
    public String toString() {
        if (taken) {
            return this.getClass().getSimpleName() + "{taken}";
        }
        return this.getClass().getSimpleName() + "{" +
                "aggregateId=" + state.aggregateId() +
                ", nextVersion=" + nextVersion +
                ", pendingEvents=" + pendingEvents.size() +
                '}';
    }
}
