package com.baykanat.killboard.domain.exception;

/** OAuth callback'i bu tarayıcının başlattığı denemeye ait değil (state/nonce uyuşmuyor) ya da code eksik. */
public class AuthorizationStateException extends TokenValidationException {

    public AuthorizationStateException(String message) {
        super(message);
    }
}
