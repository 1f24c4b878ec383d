package com.baykanat.killboard.domain.service;

import com.baykanat.killboard.domain.model.EntityType;
import com.baykanat.killboard.domain.model.GameEntity;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Killmail detay dokümanından varlık adaylarını çıkarır. Saf ve deterministik; tekilleştirme yapmaz
 * (idempotent insert bunu üstlenir).
 *
 * <p>Sıra: solar system, victim alanları, ardından attacker'lar dizi sırasıyla.
 */
@Slf4j
@Component
public class EntityExtractor {

    private static final List<Map.Entry<String, EntityType>> VICTIM_FIELDS = List.of(
            Map.entry("character_id", EntityType.CHARACTER),
            Map.entry("corporation_id", EntityType.CORPORATION),
            Map.entry("alliance_id", EntityType.ALLIANCE),
            Map.entry("weapon_type_id", EntityType.WEAPON_TYPE),
            Map.entry("ship_type_id", EntityType.SHIP_TYPE));

    private static final List<Map.Entry<String, EntityType>> ATTACKER_FIELDS = List.of(
            Map.entry("character_id", EntityType.CHARACTER),
            Map.entry("corporation_id", EntityType.CORPORATION),
            Map.entry("alliance_id", EntityType.ALLIANCE),
            Map.entry("ship_type_id", EntityType.SHIP_TYPE));

    /** Tüm adaylar; solar_system_id yoksa sentinel (0) dahil. */
    public List<GameEntity> extract(JsonNode killmail) {
        List<GameEntity> entities = new ArrayList<>();

        Optional<Long> systemId = longField(killmail, "solar_system_id");
        if (systemId.isEmpty()) {
            log.warn("Killmail {} is missing solar_system_id", killmail.path("killmail_id").asText("?"));
        }
        entities.add(GameEntity.of(systemId.orElse(GameEntity.SENTINEL_ID), EntityType.SOLAR_SYSTEM));

        JsonNode victim = killmail.get("victim");
        if (victim != null && victim.isObject()) {
            collect(victim, VICTIM_FIELDS, entities);
        }

        JsonNode attackers = killmail.get("attackers");
        if (attackers != null && attackers.isArray()) {
            for (JsonNode attacker : attackers) {
                collect(attacker, ATTACKER_FIELDS, entities);
            }
        }
        return entities;
    }

    /** Kuyruğa gidecek liste: sentinel (id 0) elenmiş hali. */
    public List<GameEntity> extractPersistable(JsonNode killmail) {
        return extract(killmail).stream()
                .filter(entity -> !entity.isSentinel())
                .toList();
    }

    private static void collect(JsonNode node, List<Map.Entry<String, EntityType>> fields, List<GameEntity> into) {
        for (Map.Entry<String, EntityType> field : fields) {
            longField(node, field.getKey()).ifPresent(id -> into.add(GameEntity.of(id, field.getValue())));
        }
    }

    private static Optional<Long> longField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
            return Optional.empty();
        }
        return Optional.of(value.asLong());
    }
}
