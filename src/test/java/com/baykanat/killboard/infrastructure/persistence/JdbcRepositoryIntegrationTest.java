package com.baykanat.killboard.infrastructure.persistence;

import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.EntityType;
import com.baykanat.killboard.domain.model.GameEntity;
import com.baykanat.killboard.domain.model.KillmailReference;
import com.baykanat.killboard.domain.model.KillmailStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration test for the JDBC repositories against a real PostgreSQL (via Testcontainers),
 * with the schema applied by Flyway.
 *
 * <p>Validates the idempotency contract of every write:
 * <ul>
 *   <li>Account upsert keeps one row per character and replaces tokens</li>
 *   <li>Killmail insert ignores a repeated killmail_id</li>
 *   <li>Entity insert ignores a repeated (id, type)</li>
 * </ul>
 *
 * <p>Scheduler and processor are disabled by the test profile, so nothing else writes meanwhile.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class JdbcRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("killboard_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private AccountJdbcRepository accountRepository;

    @Autowired
    private KillmailJdbcRepository killmailRepository;

    @Autowired
    private EntityJdbcRepository entityRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("TRUNCATE users, killmails, entities");
    }

    @Test
    @DisplayName("Account upsert keeps one row per character and replaces the tokens")
    void accountUpsertIsIdempotent() {
        Instant firstExpiry = Instant.now().plus(20, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.SECONDS);
        Account first = account(2112625428L, "access-1", "refresh-1", firstExpiry);
        Account second = account(2112625428L, "access-2", "refresh-2", firstExpiry.plus(20, ChronoUnit.MINUTES));

        accountRepository.upsert(first);
        accountRepository.upsert(second);

        List<Account> accounts = accountRepository.findAll();
        assertThat(accounts).hasSize(1);
        Account stored = accounts.get(0);
        assertThat(stored.getAccessToken()).isEqualTo("access-2");
        assertThat(stored.getRefreshToken()).isEqualTo("refresh-2");
        assertThat(stored.getExpiresAt()).isEqualTo(second.getExpiresAt());
        assertThat(stored.getLastFetched()).isNull();
    }

    @Test
    @DisplayName("Only accounts expiring before the cutoff are due for refresh")
    void findExpiringBeforeFilters() {
        Instant now = Instant.now();
        accountRepository.upsert(account(1L, "a", "r", now.plus(5, ChronoUnit.MINUTES)));
        accountRepository.upsert(account(2L, "a", "r", now.plus(60, ChronoUnit.MINUTES)));

        List<Account> due = accountRepository.findExpiringBefore(now.plus(10, ChronoUnit.MINUTES));

        assertThat(due).extracting(Account::getCharacterId).containsExactly(1L);
    }

    @Test
    @DisplayName("last_fetched is recorded per character")
    void updateLastFetched() {
        accountRepository.upsert(account(1L, "a", "r", Instant.now().plusSeconds(600)));
        Instant fetchedAt = Instant.parse("2024-01-15T10:00:00Z");

        assertThat(accountRepository.updateLastFetched(1L, fetchedAt)).isEqualTo(1);
        assertThat(accountRepository.updateLastFetched(99L, fetchedAt)).isZero();

        assertThat(accountRepository.findAll().get(0).getLastFetched()).isEqualTo(fetchedAt);
    }

    @Test
    @DisplayName("Repeated killmail_id is ignored and resolved killmails leave the pending set")
    void killmailInsertIsIdempotent() {
        assertThat(killmailRepository.insertIfAbsent(100L, "abc", KillmailStatus.NEW)).isEqualTo(1);
        assertThat(killmailRepository.insertIfAbsent(100L, "abc", KillmailStatus.NEW)).isZero();
        killmailRepository.insertIfAbsent(101L, "def", KillmailStatus.NEW);

        assertThat(killmailRepository.findPending())
                .extracting(KillmailReference::getKillmailId)
                .containsExactly(100L, 101L);

        killmailRepository.updateStatus(100L, KillmailStatus.RESOLVED);

        assertThat(killmailRepository.findPending())
                .extracting(KillmailReference::getKillmailId)
                .containsExactly(101L);
    }

    @Test
    @DisplayName("Repeated (id, type) entity is ignored; same id with another type is a separate row")
    void entityInsertIsIdempotent() {
        assertThat(entityRepository.insertIfAbsent(GameEntity.of(30000142L, EntityType.SOLAR_SYSTEM))).isEqualTo(1);
        assertThat(entityRepository.insertIfAbsent(GameEntity.of(30000142L, EntityType.SOLAR_SYSTEM))).isZero();
        assertThat(entityRepository.insertIfAbsent(GameEntity.of(30000142L, EntityType.CHARACTER))).isEqualTo(1);

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM entities", Integer.class);
        assertThat(rows).isEqualTo(2);
    }

    @Test
    @DisplayName("Sentinel entity is never written")
    void sentinelEntityIsRejected() {
        assertThatThrownBy(() -> entityRepository.insertIfAbsent(GameEntity.of(0L, EntityType.SOLAR_SYSTEM)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Account account(long characterId, String accessToken, String refreshToken, Instant expiresAt) {
        return Account.builder()
                .characterId(characterId)
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(expiresAt)
                .build();
    }
}
