package com.baykanat.killboard.domain.model;

import com.baykanat.killboard.domain.exception.TokenValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Doğrulanmış access token içeriği. Kalıcı değil; Account üretmek için kaynak. */
@Value
@Builder
public class AuthClaims {

    public static final String SUBJECT_PREFIX = "CHARACTER:EVE:";

    String subject;
    List<String> audience;
    String issuer;
    Instant expiresAt;

    /** "CHARACTER:EVE:&lt;id&gt;" formatındaki subject'ten karakter id'si. */
    public long characterId() {
        if (subject == null || !subject.startsWith(SUBJECT_PREFIX)) {
            throw new TokenValidationException("Unexpected token subject: " + subject);
        }
        try {
            return Long.parseLong(subject.substring(SUBJECT_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new TokenValidationException("Token subject does not carry a character id: " + subject, e);
        }
    }
}
