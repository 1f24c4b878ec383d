package com.baykanat.killboard.infrastructure.persistence;

import com.baykanat.killboard.domain.model.Account;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** users tablosu: character_id üzerinden upsert; refresh ve fetch job'ları için sorgular. */
@Repository
@RequiredArgsConstructor
public class AccountJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_COLUMNS = """
            SELECT character_id, access_token, refresh_token, expires_at, created_at, updated_at, last_fetched
            FROM users
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO users (character_id, access_token, refresh_token, expires_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (character_id) DO UPDATE
            SET access_token = EXCLUDED.access_token,
                refresh_token = EXCLUDED.refresh_token,
                expires_at = EXCLUDED.expires_at,
                updated_at = NOW()
            """;

    private static final RowMapper<Account> ROW_MAPPER = AccountJdbcRepository::mapRow;

    /** Yoksa ekler; varsa token'ları, expiry'yi ve updated_at'i günceller. Etkilenen satır sayısı. */
    public int upsert(Account account) {
        return jdbcTemplate.update(UPSERT_SQL,
                account.getCharacterId(),
                account.getAccessToken(),
                account.getRefreshToken(),
                Timestamp.from(account.getExpiresAt()));
    }

    public List<Account> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY character_id", ROW_MAPPER);
    }

    /** Access token'ı verilen andan önce dolan (ya da dolmuş) hesaplar. */
    public List<Account> findExpiringBefore(Instant threshold) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE expires_at < ? ORDER BY character_id",
                ROW_MAPPER, Timestamp.from(threshold));
    }

    /** Başarılı killmail listesinden sonra If-Modified-Since için kullanılan zamanı ilerletir. */
    public int updateLastFetched(long characterId, Instant lastFetched) {
        return jdbcTemplate.update("UPDATE users SET last_fetched = ? WHERE character_id = ?",
                Timestamp.from(lastFetched), characterId);
    }

    private static Account mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp lastFetched = rs.getTimestamp("last_fetched");
        return Account.builder()
                .characterId(rs.getLong("character_id"))
                .accessToken(rs.getString("access_token"))
                .refreshToken(rs.getString("refresh_token"))
                .expiresAt(rs.getTimestamp("expires_at").toInstant())
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .lastFetched(lastFetched != null ? lastFetched.toInstant() : null)
                .build();
    }
}
