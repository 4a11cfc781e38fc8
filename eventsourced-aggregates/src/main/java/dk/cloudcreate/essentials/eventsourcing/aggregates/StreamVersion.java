package dk.cloudcreate.essentials.eventsourcing.aggregates;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The version of an aggregate's event stream, which is the number of events committed to the stream.<br>
 * An empty stream has version 0 ({@link #ZERO}) and each appended event increases the version by one,
 * i.e. the event appended at stream version <code>n</code> has event order <code>n</code>.
 */
public class StreamVersion extends LongType<StreamVersion> {
    /**
     * The version of an empty stream and of a brand-new aggregate
     */
    public static final StreamVersion ZERO = StreamVersion.of(0);

    public StreamVersion(Long value) {
        super(value);
        requireTrue(value >= 0, msg("A StreamVersion cannot be negative. Got {}", value));
    }

    public static StreamVersion of(long value) {
        return new StreamVersion(value);
    }

    /**
     * @return the stream version after one more event
     */
    public StreamVersion next() {
        return advancedBy(1);
    }

    /**
     * @param numberOfEvents the number of events added to the stream
     * @return the stream version after <code>numberOfEvents</code> more events
     */
    public StreamVersion advancedBy(long numberOfEvents) {
        return new StreamVersion(value() + numberOfEvents);
    }

    public boolean isAfter(StreamVersion other) {
        return value() > other.value();
    }
}
