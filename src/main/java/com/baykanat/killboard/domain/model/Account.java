package com.baykanat.killboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** users tablosu satırı: yetkilendirilmiş karakterin token'ları ve süre bilgisi (JDBC, JPA değil). */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private long characterId;
    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastFetched; // null: henüz listelenmedi

    /** Claims + token çiftinden yeni Account; character_id subject'ten, expiry exp'ten. */
    public static Account fromClaims(AuthClaims claims, String accessToken, String refreshToken) {
        Instant now = Instant.now();
        return Account.builder()
                .characterId(claims.characterId())
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(claims.getExpiresAt())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
