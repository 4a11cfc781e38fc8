package dk.cloudcreate.essentials.eventsourcing.postgresql;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.eventsourcing.store.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import dk.cloudcreate.essentials.shared.Exceptions;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * {@link EventStreamPersistence} that uses a separate pair of tables per {@link AggregateType}:
 * <ul>
 *     <li><code>&lt;aggregate-type&gt;_events</code> which holds the events of all event streams of the aggregate type.
 *     The primary key <code>(aggregate_id, event_order)</code> guarantees that two writers can never append an event with the same event order</li>
 *     <li><code>&lt;aggregate-type&gt;_snapshots</code> which holds the latest snapshot per aggregate</li>
 * </ul>
 * Table names are the lower cased {@link AggregateType}, which must therefore be a valid PostgreSQL identifier
 * (letters, digits and underscores).<br>
 * Event and state payloads are stored as <code>jsonb</code>.
 */
public class PostgresqlEventStreamPersistence implements EventStreamPersistence {
    private static final Logger  log                          = LoggerFactory.getLogger(PostgresqlEventStreamPersistence.class);
    private static final Pattern VALID_TABLE_NAME             = Pattern.compile("[a-z_][a-z0-9_]{0,53}");
    private static final String  UNIQUE_VIOLATION_SQL_STATE   = "23505";

    /**
     * Key: {@link AggregateType}<br>
     * Value: the tables the event streams and snapshots of the aggregate type are persisted to
     */
    private final ConcurrentMap<AggregateType, AggregateTypeTables> aggregateTypeTables = new ConcurrentHashMap<>();
    private final Jdbi                                              jdbi;

    public PostgresqlEventStreamPersistence(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    @Override
    public PostgresqlEventStreamPersistence addAggregateType(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        aggregateTypeTables.computeIfAbsent(aggregateType, type -> {
            var tables = AggregateTypeTables.of(type);
            initializeStorageFor(tables);
            return tables;
        });
        return this;
    }

    /**
     * Drop and recreate the tables of the given aggregate type, which removes all of its event streams and snapshots
     *
     * @param aggregateType the aggregate type
     */
    public void resetStorageFor(AggregateType aggregateType) {
        var tables = tablesFor(aggregateType);
        log.info("[{}] Resetting EventStream storage", aggregateType);
        jdbi.useTransaction(handle -> {
            handle.execute("DROP TABLE IF EXISTS " + tables.eventsTableName);
            handle.execute("DROP TABLE IF EXISTS " + tables.snapshotsTableName);
        });
        initializeStorageFor(tables);
    }

    private void initializeStorageFor(AggregateTypeTables tables) {
        log.info("[{}] Initializing EventStream storage using tables '{}' and '{}'",
                 tables.aggregateType,
                 tables.eventsTableName,
                 tables.snapshotsTableName);
        jdbi.useTransaction(handle -> {
            handle.createUpdate(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                             "            aggregate_id text NOT NULL,\n" +
                                             "            event_order bigint NOT NULL,\n" +
                                             "            event_name text NOT NULL,\n" +
                                             "            event_payload jsonb NOT NULL,\n" +
                                             "            event_timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                             "          PRIMARY KEY (aggregate_id, event_order)\n" +
                                             "        )",
                                     arg("tableName", tables.eventsTableName)))
                  .execute();
            handle.createUpdate(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                             "            aggregate_id text PRIMARY KEY,\n" +
                                             "            stream_version bigint NOT NULL,\n" +
                                             "            logical_version integer NOT NULL,\n" +
                                             "            state_payload jsonb NOT NULL,\n" +
                                             "            snapshot_timestamp TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                             "        )",
                                     arg("tableName", tables.snapshotsTableName)))
                  .execute();
        });
    }

    @Override
    public Optional<AggregateSnapshot> loadSnapshot(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var tables = tablesFor(aggregateType);
        try {
            return jdbi.withHandle(handle -> handle.createQuery(bind("SELECT stream_version, logical_version, CAST(state_payload AS text) AS state_payload, snapshot_timestamp\n" +
                                                                             "FROM {:tableName} WHERE aggregate_id = :aggregateId",
                                                                     arg("tableName", tables.snapshotsTableName)))
                                                   .bind("aggregateId", aggregateId)
                                                   .map(new AggregateSnapshotRowMapper())
                                                   .findOne());
        } catch (JdbiException e) {
            throw new EventStoreException(msg("[{}] Failed to load the snapshot of aggregate with id '{}'",
                                              aggregateType,
                                              aggregateId), e);
        }
    }

    @Override
    public List<PersistedEvent> loadEvents(AggregateType aggregateType, String aggregateId, EventOrder fromEventOrderInclusive) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(fromEventOrderInclusive, "No fromEventOrderInclusive provided");
        var tables = tablesFor(aggregateType);
        try {
            return jdbi.withHandle(handle -> handle.createQuery(bind("SELECT aggregate_id, event_order, event_name, CAST(event_payload AS text) AS event_payload, event_timestamp\n" +
                                                                             "FROM {:tableName}\n" +
                                                                             "WHERE aggregate_id = :aggregateId AND event_order >= :fromEventOrder\n" +
                                                                             "ORDER BY event_order",
                                                                     arg("tableName", tables.eventsTableName)))
                                                   .bind("aggregateId", aggregateId)
                                                   .bind("fromEventOrder", fromEventOrderInclusive.longValue())
                                                   .map(new PersistedEventRowMapper(aggregateType))
                                                   .list());
        } catch (JdbiException e) {
            throw new EventStoreException(msg("[{}] Failed to load the events of aggregate with id '{}' from eventOrder {}",
                                              aggregateType,
                                              aggregateId,
                                              fromEventOrderInclusive), e);
        }
    }

    @Override
    public StreamVersion currentStreamVersion(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var tables = tablesFor(aggregateType);
        try {
            return jdbi.withHandle(handle -> currentStreamVersion(handle, tables, aggregateId));
        } catch (JdbiException e) {
            throw new EventStoreException(msg("[{}] Failed to resolve the stream version of aggregate with id '{}'",
                                              aggregateType,
                                              aggregateId), e);
        }
    }

    private StreamVersion currentStreamVersion(Handle handle, AggregateTypeTables tables, String aggregateId) {
        var streamVersion = handle.createQuery(bind("SELECT COALESCE(MAX(event_order) + 1, 0) FROM {:tableName} WHERE aggregate_id = :aggregateId",
                                                    arg("tableName", tables.eventsTableName)))
                                  .bind("aggregateId", aggregateId)
                                  .mapTo(Long.class)
                                  .one();
        return StreamVersion.of(streamVersion);
    }

    @Override
    public StreamVersion appendToStream(AggregateType aggregateType,
                                        String aggregateId,
                                        StreamVersion expectedStreamVersion,
                                        List<PersistableEvent> events,
                                        Optional<AggregateSnapshot> snapshot) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedStreamVersion, "No expectedStreamVersion provided");
        requireNonNull(events, "No events provided");
        requireNonNull(snapshot, "No snapshot option provided");
        var tables = tablesFor(aggregateType);
        if (events.isEmpty()) {
            return currentStreamVersion(aggregateType, aggregateId);
        }
        PersistableEvent.requireConsecutiveEventOrders(expectedStreamVersion, events);

        try {
            var newStreamVersion = jdbi.inTransaction(handle -> {
                var actualStreamVersion = currentStreamVersion(handle, tables, aggregateId);
                if (!actualStreamVersion.equals(expectedStreamVersion)) {
                    throw new OptimisticAppendToStreamException(aggregateType,
                                                                aggregateId,
                                                                expectedStreamVersion,
                                                                actualStreamVersion);
                }

                var batch = handle.prepareBatch(bind("INSERT INTO {:tableName} (aggregate_id, event_order, event_name, event_payload, event_timestamp)\n" +
                                                             "VALUES (:aggregateId, :eventOrder, :eventName, CAST(:eventPayload AS jsonb), :timestamp)",
                                                     arg("tableName", tables.eventsTableName)));
                events.forEach(event -> batch.bind("aggregateId", aggregateId)
                                             .bind("eventOrder", event.eventOrder.longValue())
                                             .bind("eventName", event.eventName.toString())
                                             .bind("eventPayload", event.eventPayload)
                                             .bind("timestamp", event.timestamp)
                                             .add());
                batch.execute();

                snapshot.ifPresent(aggregateSnapshot -> saveSnapshot(handle, tables, aggregateId, aggregateSnapshot));
                return expectedStreamVersion.advancedBy(events.size());
            });
            log.trace("[{}] Appended {} event(s) to stream '{}'. Stream version is now {}",
                      aggregateType,
                      events.size(),
                      aggregateId,
                      newStreamVersion);
            return newStreamVersion;
        } catch (JdbiException e) {
            if (isUniqueViolation(e)) {
                throw new OptimisticAppendToStreamException(aggregateType,
                                                            aggregateId,
                                                            expectedStreamVersion,
                                                            e);
            }
            throw new AppendToStreamException(msg("[{}] Failed to append {} event(s) to stream related to aggregate with id '{}'. Root cause: {}",
                                                  aggregateType,
                                                  events.size(),
                                                  aggregateId,
                                                  Exceptions.getRootCause(e).getMessage()), e);
        }
    }

    /**
     * Upsert the snapshot, unless the already persisted snapshot covers a newer stream version
     */
    private void saveSnapshot(Handle handle, AggregateTypeTables tables, String aggregateId, AggregateSnapshot snapshot) {
        var numberOfChanges = handle.createUpdate(bind("INSERT INTO {:tableName} (aggregate_id, stream_version, logical_version, state_payload, snapshot_timestamp)\n" +
                                                               "VALUES (:aggregateId, :streamVersion, :logicalVersion, CAST(:statePayload AS jsonb), :timestamp)\n" +
                                                               "ON CONFLICT (aggregate_id) DO UPDATE SET\n" +
                                                               "    stream_version = EXCLUDED.stream_version,\n" +
                                                               "    logical_version = EXCLUDED.logical_version,\n" +
                                                               "    state_payload = EXCLUDED.state_payload,\n" +
                                                               "    snapshot_timestamp = EXCLUDED.snapshot_timestamp\n" +
                                                               "WHERE {:tableName}.stream_version < EXCLUDED.stream_version",
                                                       arg("tableName", tables.snapshotsTableName)))
                                    .bind("aggregateId", aggregateId)
                                    .bind("streamVersion", snapshot.streamVersion.longValue())
                                    .bind("logicalVersion", snapshot.logicalVersion)
                                    .bind("statePayload", snapshot.statePayload)
                                    .bind("timestamp", snapshot.timestamp)
                                    .execute();
        if (numberOfChanges == 0) {
            log.debug("[{}] Kept the existing snapshot of aggregate with id '{}' as it's newer than stream version {}",
                      tables.aggregateType,
                      aggregateId,
                      snapshot.streamVersion);
        }
    }

    private static boolean isUniqueViolation(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
            cause = cause.getCause() != cause ? cause.getCause() : null;
        }
        return false;
    }

    private AggregateTypeTables tablesFor(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        var tables = aggregateTypeTables.get(aggregateType);
        if (tables == null) {
            throw new EventStoreException(msg("[{}] EventStream storage hasn't been initialized. Please call addAggregateType first",
                                              aggregateType));
        }
        return tables;
    }

    private static final class AggregateTypeTables {
        final AggregateType aggregateType;
        final String        eventsTableName;
        final String        snapshotsTableName;

        private AggregateTypeTables(AggregateType aggregateType, String eventsTableName, String snapshotsTableName) {
            this.aggregateType = aggregateType;
            this.eventsTableName = eventsTableName;
            this.snapshotsTableName = snapshotsTableName;
        }

        static AggregateTypeTables of(AggregateType aggregateType) {
            var baseName = aggregateType.toString().toLowerCase(Locale.ROOT);
            requireTrue(VALID_TABLE_NAME.matcher(baseName).matches(),
                        msg("AggregateType '{}' can't be used as a table name. Only letters, digits and underscores are allowed", aggregateType));
            return new AggregateTypeTables(aggregateType,
                                           baseName + "_events",
                                           baseName + "_snapshots");
        }
    }
}
