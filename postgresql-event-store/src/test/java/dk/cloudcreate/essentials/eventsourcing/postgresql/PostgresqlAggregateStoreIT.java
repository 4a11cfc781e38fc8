package dk.cloudcreate.essentials.eventsourcing.postgresql;

import dk.cloudcreate.essentials.eventsourcing.aggregates.*;
import dk.cloudcreate.essentials.eventsourcing.postgresql.test_data.*;
import dk.cloudcreate.essentials.eventsourcing.postgresql.test_data.AccountEvent.*;
import dk.cloudcreate.essentials.eventsourcing.store.*;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;
import reactor.core.publisher.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlAggregateStoreIT {
    private static final AggregateType ACCOUNTS = AggregateType.of("Accounts");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                                                               jdbi;
    private PostgresqlEventStreamPersistence                                   persistence;
    private AggregateStore<AccountId, AccountEvent, AccountState, BankAccount> accounts;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        persistence = new PostgresqlEventStreamPersistence(jdbi);
        accounts = createStore(SnapshotPolicy.always());
    }

    private AggregateStore<AccountId, AccountEvent, AccountState, BankAccount> createStore(SnapshotPolicy snapshotPolicy) {
        AggregateStoreConfiguration<AccountId, AccountEvent, AccountState, BankAccount> configuration = AggregateStoreConfiguration.from(ACCOUNTS,
                                                                                                                                         AccountState.class,
                                                                                                                                         AccountState::new,
                                                                                                                                         BankAccount::new,
                                                                                                                                         AccountEvent.eventTypes());
        return AggregateStore.from(persistence, configuration.withSnapshotPolicy(snapshotPolicy));
    }

    private AccountId openAccount(BigDecimal initialDeposit) {
        var accountId = AccountId.random();
        var account   = BankAccount.open(accountId, "Jane");
        account.deposit(initialDeposit);
        accounts.save(account).block();
        return accountId;
    }

    @Test
    void an_account_survives_a_roundtrip_through_the_database() {
        // Given
        var accountId = AccountId.random();
        var account   = BankAccount.open(accountId, "Jane");
        account.deposit(new BigDecimal("100.50"));

        // When
        var streamVersion = accounts.save(account).block();
        var loaded        = accounts.get(accountId).block();

        // Then
        assertThat(streamVersion.value()).isEqualTo(2L);
        assertThat((CharSequence) loaded.aggregateId()).isEqualTo(accountId);
        assertThat(loaded.state().owner()).isEqualTo("Jane");
        assertThat(loaded.state().balance()).isEqualByComparingTo("100.50");
        assertThat(loaded.nextVersion().value()).isEqualTo(2L);

        var events = persistence.loadEvents(ACCOUNTS, accountId.toString(), EventOrder.FIRST_EVENT_ORDER);
        assertThat(events).hasSize(2);
        assertThat((CharSequence) events.get(0).eventName()).isEqualTo(EventName.of(AccountOpened.class));
        assertThat((CharSequence) events.get(1).eventName()).isEqualTo(EventName.of(AmountDeposited.class));
    }

    @Test
    void snapshot_and_replay_produce_the_same_state() {
        // Given
        var accountId = openAccount(new BigDecimal("100"));
        for (var i = 0; i < 4; i++) {
            var account = accounts.get(accountId).block();
            account.withdraw(new BigDecimal("10"));
            accounts.save(account).block();
        }
        assertThat(persistence.loadSnapshot(ACCOUNTS, accountId.toString())).isPresent();

        // When
        var fromSnapshot = accounts.get(accountId).block();
        jdbi.useHandle(handle -> handle.execute("DELETE FROM accounts_snapshots"));
        var fromReplay = accounts.get(accountId).block();

        // Then
        assertThat(persistence.loadSnapshot(ACCOUNTS, accountId.toString())).isEmpty();
        assertThat(fromSnapshot.nextVersion().value()).isEqualTo(6L);
        assertThat(fromReplay.nextVersion().value()).isEqualTo(6L);
        assertThat(fromSnapshot.state().balance()).isEqualByComparingTo("60");
        assertThat(fromReplay.state().balance()).isEqualByComparingTo("60");
        assertThat(fromSnapshot.state().numberOfTransactions()).isEqualTo(fromReplay.state().numberOfTransactions());
        assertThat(fromSnapshot.state().owner()).isEqualTo(fromReplay.state().owner());
    }

    @Test
    void no_snapshot_is_written_when_the_policy_declines() {
        // Given
        var neverSnapshot = createStore(SnapshotPolicy.never());
        var accountId     = AccountId.random();

        // When
        neverSnapshot.save(BankAccount.open(accountId, "Jane")).block();

        // Then
        assertThat(persistence.loadSnapshot(ACCOUNTS, accountId.toString())).isEmpty();
        assertThat(neverSnapshot.get(accountId).block().state().owner()).isEqualTo("Jane");
    }

    @Test
    void a_snapshot_from_an_older_logical_version_is_ignored_and_the_stream_is_replayed() {
        // Given
        var accountId = openAccount(new BigDecimal("100"));
        var staleSnapshot = new AggregateSnapshot("{\"accountId\":\"" + accountId + "\",\"owner\":\"Stale\",\"balance\":999,\"numberOfTransactions\":0}",
                                                  StreamVersion.of(3),
                                                  0,
                                                  OffsetDateTime.now(Clock.systemUTC()));
        persistence.appendToStream(ACCOUNTS,
                                   accountId.toString(),
                                   StreamVersion.of(2),
                                   List.of(new PersistableEvent(EventOrder.of(2),
                                                                EventName.of(AmountDeposited.class),
                                                                "{\"accountId\":\"" + accountId + "\",\"amount\":50}",
                                                                OffsetDateTime.now(Clock.systemUTC()))),
                                   Optional.of(staleSnapshot));

        // When
        var account = accounts.get(accountId).block();

        // Then
        assertThat(account.state().owner()).isEqualTo("Jane");
        assertThat(account.state().balance()).isEqualByComparingTo("150");
        assertThat(account.state().numberOfTransactions()).isEqualTo(2);
        assertThat(account.nextVersion().value()).isEqualTo(3L);
    }

    @Test
    void two_concurrent_saves_of_the_same_version_result_in_exactly_one_conflict() {
        // Given
        var accountId = openAccount(new BigDecimal("100"));
        var first     = accounts.get(accountId).block();
        var second    = accounts.get(accountId).block();

        // When
        first.withdraw(new BigDecimal("30"));
        second.deposit(new BigDecimal("5"));
        var outcomes = Flux.merge(outcomeOf(accounts.save(first)),
                                  outcomeOf(accounts.save(second)))
                           .collectList()
                           .block();

        // Then
        assertThat(outcomes).filteredOn(StreamVersion.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(OptimisticAppendToStreamException.class::isInstance).hasSize(1);
        var reloaded = accounts.get(accountId).block();
        assertThat(reloaded.nextVersion().value()).isEqualTo(3L);
        assertThat(reloaded.state().balance()).isIn(new BigDecimal("70"), new BigDecimal("105"));
    }

    @Test
    void concurrent_updates_with_retries_are_all_applied() {
        // Given
        var accountId        = openAccount(new BigDecimal("100"));
        var numberOfUpdaters = 5;

        // When
        var streamVersions = Flux.fromStream(IntStream.range(0, numberOfUpdaters).boxed())
                                 .flatMap(i -> accounts.update(accountId, account -> account.deposit(BigDecimal.TEN), 20))
                                 .collectList()
                                 .block();

        // Then
        assertThat(streamVersions.stream().map(StreamVersion::value).collect(Collectors.toSet()))
                .containsExactlyInAnyOrder(3L, 4L, 5L, 6L, 7L);
        var account = accounts.get(accountId).block();
        assertThat(account.state().balance()).isEqualByComparingTo("150");
        assertThat(account.nextVersion().value()).isEqualTo(7L);
    }

    @Test
    void a_rejected_command_is_not_retried_and_appends_nothing() {
        // Given
        var accountId = openAccount(new BigDecimal("10"));

        // When
        var thrown = catchThrowable(() -> accounts.update(accountId, account -> account.withdraw(new BigDecimal("20")), 5).block());

        // Then
        assertThat(thrown).isInstanceOf(InsufficientFundsException.class);
        assertThat(persistence.currentStreamVersion(ACCOUNTS, accountId.toString()).value()).isEqualTo(2L);
    }

    @Test
    void loading_an_unknown_account() {
        var accountId = AccountId.random();

        assertThat(accounts.tryGet(accountId).blockOptional()).isEmpty();
        assertThatThrownBy(() -> accounts.get(accountId).block())
                .isInstanceOf(AggregateNotFoundException.class);
    }

    private static Mono<Object> outcomeOf(Mono<StreamVersion> save) {
        return save.<Object>map(streamVersion -> streamVersion)
                   .onErrorResume(error -> Mono.just(error));
    }
}
