package dk.cloudcreate.essentials.eventsourcing.postgresql;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;
import dk.cloudcreate.essentials.eventsourcing.postgresql.test_data.*;
import dk.cloudcreate.essentials.eventsourcing.store.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlEventStreamPersistenceIT {
    private static final AggregateType ACCOUNTS = AggregateType.of("Accounts");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                             jdbi;
    private PostgresqlEventStreamPersistence persistence;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        persistence = new PostgresqlEventStreamPersistence(jdbi).addAggregateType(ACCOUNTS);
    }

    private static PersistableEvent event(long eventOrder, String payload) {
        return new PersistableEvent(EventOrder.of(eventOrder),
                                    EventName.of("AmountDeposited"),
                                    payload,
                                    OffsetDateTime.now(Clock.systemUTC()));
    }

    private static AggregateSnapshot snapshot(long streamVersion, int logicalVersion) {
        return new AggregateSnapshot("{\"balance\": " + streamVersion + "}",
                                     StreamVersion.of(streamVersion),
                                     logicalVersion,
                                     OffsetDateTime.now(Clock.systemUTC()));
    }

    @Test
    void adding_the_same_aggregate_type_twice_keeps_the_tables() {
        // Given
        persistence.appendToStream(ACCOUNTS, "account-1", StreamVersion.ZERO, List.of(event(0, "{\"amount\": 1}")), Optional.empty());

        // When
        persistence.addAggregateType(ACCOUNTS);
        new PostgresqlEventStreamPersistence(jdbi).addAggregateType(ACCOUNTS);

        // Then
        var tables = jdbi.withHandle(handle -> handle.createQuery("SELECT table_name FROM information_schema.tables WHERE table_name LIKE 'accounts_%' ORDER BY table_name")
                                                     .mapTo(String.class)
                                                     .list());
        assertThat(tables).containsExactly("accounts_events", "accounts_snapshots");
        assertThat(persistence.currentStreamVersion(ACCOUNTS, "account-1").value()).isEqualTo(1L);
    }

    @Test
    void adding_a_new_aggregate_type_from_concurrent_threads_creates_its_tables_once() {
        // Given
        var invoices = AggregateType.of("Invoices");

        // When
        var added = Flux.range(0, 8)
                        .parallel()
                        .runOn(Schedulers.boundedElastic())
                        .map(i -> persistence.addAggregateType(invoices))
                        .sequential()
                        .collectList()
                        .block();

        // Then
        assertThat(added).hasSize(8).allMatch(p -> p == persistence);
        var tables = jdbi.withHandle(handle -> handle.createQuery("SELECT table_name FROM information_schema.tables WHERE table_name LIKE 'invoices_%' ORDER BY table_name")
                                                     .mapTo(String.class)
                                                     .list());
        assertThat(tables).containsExactly("invoices_events", "invoices_snapshots");
        var streamVersion = persistence.appendToStream(invoices, "invoice-1", StreamVersion.ZERO, List.of(event(0, "{}")), Optional.empty());
        assertThat(streamVersion.value()).isEqualTo(1L);
        assertThat(persistence.loadEvents(invoices, "invoice-1", EventOrder.FIRST_EVENT_ORDER)).hasSize(1);
    }

    @Test
    void appended_events_are_loaded_in_event_order() {
        // Given
        var aggregateId = "account-1";

        // When
        var streamVersion = persistence.appendToStream(ACCOUNTS,
                                                       aggregateId,
                                                       StreamVersion.ZERO,
                                                       List.of(event(0, "{\"amount\": 10}"),
                                                               event(1, "{\"amount\": 20}"),
                                                               event(2, "{\"amount\": 30}")),
                                                       Optional.empty());

        // Then
        assertThat(streamVersion.value()).isEqualTo(3L);
        assertThat(persistence.currentStreamVersion(ACCOUNTS, aggregateId).value()).isEqualTo(3L);
        var events = persistence.loadEvents(ACCOUNTS, aggregateId, EventOrder.FIRST_EVENT_ORDER);
        assertThat(events).hasSize(3);
        assertThat(events.get(0).eventOrder().value()).isEqualTo(0L);
        assertThat(events.get(2).eventOrder().value()).isEqualTo(2L);
        assertThat((CharSequence) events.get(1).eventName()).isEqualTo(EventName.of("AmountDeposited"));
        assertThat((CharSequence) events.get(1).aggregateType()).isEqualTo(ACCOUNTS);
        assertThat(events.get(1).aggregateId()).isEqualTo(aggregateId);
        assertThat(events.get(1).eventPayload()).contains("20");
        assertThat(events.get(1).timestamp()).isNotNull();

        var tail = persistence.loadEvents(ACCOUNTS, aggregateId, EventOrder.of(2));
        assertThat(tail).hasSize(1);
        assertThat(tail.get(0).eventOrder().value()).isEqualTo(2L);
    }

    @Test
    void an_unknown_stream_has_no_events_no_snapshot_and_version_zero() {
        assertThat(persistence.loadEvents(ACCOUNTS, "unknown", EventOrder.FIRST_EVENT_ORDER)).isEmpty();
        assertThat(persistence.loadSnapshot(ACCOUNTS, "unknown")).isEmpty();
        assertThat(persistence.currentStreamVersion(ACCOUNTS, "unknown").value()).isEqualTo(0L);
    }

    @Test
    void appending_with_a_stale_expected_version_fails_and_appends_nothing() {
        // Given
        var aggregateId = "account-1";
        persistence.appendToStream(ACCOUNTS, aggregateId, StreamVersion.ZERO, List.of(event(0, "{}"), event(1, "{}")), Optional.empty());

        // When
        var thrown = catchThrowable(() -> persistence.appendToStream(ACCOUNTS,
                                                                     aggregateId,
                                                                     StreamVersion.of(1),
                                                                     List.of(event(1, "{}")),
                                                                     Optional.of(snapshot(2, 1))));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        var conflict = (OptimisticAppendToStreamException) thrown;
        assertThat(conflict.expectedStreamVersion.value()).isEqualTo(1L);
        assertThat(conflict.actualStreamVersion()).isPresent();
        assertThat(conflict.actualStreamVersion().get().value()).isEqualTo(2L);
        assertThat(persistence.currentStreamVersion(ACCOUNTS, aggregateId).value()).isEqualTo(2L);
        assertThat(persistence.loadSnapshot(ACCOUNTS, aggregateId)).isEmpty();
    }

    @Test
    void appending_events_with_gaps_in_their_event_order_is_rejected() {
        assertThatThrownBy(() -> persistence.appendToStream(ACCOUNTS,
                                                            "account-1",
                                                            StreamVersion.ZERO,
                                                            List.of(event(0, "{}"), event(2, "{}")),
                                                            Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(persistence.currentStreamVersion(ACCOUNTS, "account-1").value()).isEqualTo(0L);
    }

    @Test
    void appending_no_events_returns_the_current_version() {
        // Given
        persistence.appendToStream(ACCOUNTS, "account-1", StreamVersion.ZERO, List.of(event(0, "{}")), Optional.empty());

        // When
        var streamVersion = persistence.appendToStream(ACCOUNTS, "account-1", StreamVersion.ZERO, List.of(), Optional.of(snapshot(1, 1)));

        // Then
        assertThat(streamVersion.value()).isEqualTo(1L);
        assertThat(persistence.loadSnapshot(ACCOUNTS, "account-1")).isEmpty();
    }

    @Test
    void a_snapshot_is_only_replaced_by_a_snapshot_of_a_newer_stream_version() {
        // Given
        var aggregateId = "account-1";
        persistence.appendToStream(ACCOUNTS, aggregateId, StreamVersion.ZERO, List.of(event(0, "{}"), event(1, "{}")), Optional.of(snapshot(2, 1)));

        // When
        persistence.appendToStream(ACCOUNTS, aggregateId, StreamVersion.of(2), List.of(event(2, "{}")), Optional.of(snapshot(1, 1)));

        // Then
        var snapshot = persistence.loadSnapshot(ACCOUNTS, aggregateId);
        assertThat(snapshot).isPresent();
        assertThat(snapshot.get().streamVersion.value()).isEqualTo(2L);
        assertThat(snapshot.get().logicalVersion).isEqualTo(1);
        assertThat(snapshot.get().statePayload).contains("2");

        // When
        persistence.appendToStream(ACCOUNTS, aggregateId, StreamVersion.of(3), List.of(event(3, "{}")), Optional.of(snapshot(4, 2)));

        // Then
        snapshot = persistence.loadSnapshot(ACCOUNTS, aggregateId);
        assertThat(snapshot.get().streamVersion.value()).isEqualTo(4L);
        assertThat(snapshot.get().logicalVersion).isEqualTo(2);
    }

    @Test
    void using_an_aggregate_type_that_was_not_added_fails() {
        assertThatThrownBy(() -> persistence.loadEvents(AggregateType.of("Unknown"), "id", EventOrder.FIRST_EVENT_ORDER))
                .isInstanceOf(EventStoreException.class);
    }

    @Test
    void an_aggregate_type_that_is_not_a_valid_table_name_is_rejected() {
        assertThatThrownBy(() -> persistence.addAggregateType(AggregateType.of("Accounts; DROP TABLE accounts_events")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetting_the_storage_removes_all_streams_and_snapshots() {
        // Given
        persistence.appendToStream(ACCOUNTS, "account-1", StreamVersion.ZERO, List.of(event(0, "{}")), Optional.of(snapshot(1, 1)));

        // When
        persistence.resetStorageFor(ACCOUNTS);

        // Then
        assertThat(persistence.currentStreamVersion(ACCOUNTS, "account-1").value()).isEqualTo(0L);
        assertThat(persistence.loadSnapshot(ACCOUNTS, "account-1")).isEmpty();
        var streamVersion = persistence.appendToStream(ACCOUNTS, "account-1", StreamVersion.ZERO, List.of(event(0, "{}")), Optional.empty());
        assertThat(streamVersion.value()).isEqualTo(1L);
    }
}
