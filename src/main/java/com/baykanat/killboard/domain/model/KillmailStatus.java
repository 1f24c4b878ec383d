package com.baykanat.killboard.domain.model;

import java.util.Arrays;

/** Killmail işleme durumu; DB'de küçük harfli kod olarak tutulur. */
public enum KillmailStatus {

    NEW("new"),
    RESOLVED("resolved"),
    FAILED("failed");

    private final String code;

    KillmailStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static KillmailStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown killmail status: " + code));
    }
}
