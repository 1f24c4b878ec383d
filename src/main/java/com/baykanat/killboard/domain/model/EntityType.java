package com.baykanat.killboard.domain.model;

/** Killmail'den çıkarılan varlık türleri; code DB'deki type sütunu. */
public enum EntityType {

    SOLAR_SYSTEM("solar_system"),
    CHARACTER("character"),
    CORPORATION("corporation"),
    ALLIANCE("alliance"),
    SHIP_TYPE("ship_type"),
    WEAPON_TYPE("weapon_type");

    private final String code;

    EntityType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
