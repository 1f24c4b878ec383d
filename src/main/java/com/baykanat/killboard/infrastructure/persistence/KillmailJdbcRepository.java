package com.baykanat.killboard.infrastructure.persistence;

import com.baykanat.killboard.domain.model.KillmailReference;
import com.baykanat.killboard.domain.model.KillmailStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/** killmails tablosu: killmail_id doğal anahtar; ON CONFLICT DO NOTHING ile idempotency. */
@Repository
@RequiredArgsConstructor
public class KillmailJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO killmails (killmail_id, killmail_hash, status)
            VALUES (?, ?, ?)
            ON CONFLICT (killmail_id) DO NOTHING
            """;

    /** Tekrar eklemede satır atlanır; eklenen satır sayısı (0 veya 1). */
    public int insertIfAbsent(long killmailId, String killmailHash, KillmailStatus status) {
        return jdbcTemplate.update(INSERT_SQL, killmailId, killmailHash, status.getCode());
    }

    public int updateStatus(long killmailId, KillmailStatus status) {
        return jdbcTemplate.update("UPDATE killmails SET status = ? WHERE killmail_id = ?",
                status.getCode(), killmailId);
    }

    /** Çözümlenmeyi bekleyen (new) killmail'ler. */
    public List<KillmailReference> findPending() {
        return jdbcTemplate.query(
                "SELECT killmail_id, killmail_hash, status FROM killmails WHERE status = ? ORDER BY killmail_id",
                (rs, rowNum) -> KillmailReference.builder()
                        .killmailId(rs.getLong("killmail_id"))
                        .killmailHash(rs.getString("killmail_hash"))
                        .status(KillmailStatus.fromCode(rs.getString("status")))
                        .build(),
                KillmailStatus.NEW.getCode());
    }
}
