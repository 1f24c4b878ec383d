package com.baykanat.killboard.infrastructure.persistence;

import com.baykanat.killboard.domain.model.GameEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** entities tablosu: (id, type) üzerinden insert-if-absent; mevcut isimler güncellenmez. */
@Repository
@RequiredArgsConstructor
public class EntityJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO entities (id, name, type)
            VALUES (?, ?, ?)
            ON CONFLICT (id, type) DO NOTHING
            """;

    /** Sentinel (0) kabul edilmez; çakışmada satır atlanır. */
    public int insertIfAbsent(GameEntity entity) {
        if (entity.isSentinel()) {
            throw new IllegalArgumentException("Sentinel entity id 0 must not be persisted (type=" + entity.getType() + ")");
        }
        return jdbcTemplate.update(INSERT_SQL, entity.getId(), entity.getName(), entity.getType().getCode());
    }
}
