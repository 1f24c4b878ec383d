package com.baykanat.killboard.domain.exception;

/** Token imza/claim/issuer doğrulaması veya OAuth state kontrolü başarısız; token'a güvenilmez. */
public class TokenValidationException extends KillboardException {

    public TokenValidationException(String message) {
        super(message);
    }

    public TokenValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
