package com.baykanat.killboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** entities tablosu satırı. id 0 = alan yok (sentinel), asla kaydedilmez. İsim burada çözülmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEntity {

    public static final long SENTINEL_ID = 0L;

    private long id;
    @Builder.Default
    private String name = "";
    private EntityType type;

    public static GameEntity of(long id, EntityType type) {
        return GameEntity.builder().id(id).type(type).build();
    }

    public boolean isSentinel() {
        return id == SENTINEL_ID;
    }
}
