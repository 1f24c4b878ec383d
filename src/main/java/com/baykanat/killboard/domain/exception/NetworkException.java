package com.baykanat.killboard.domain.exception;

/** Bağlantı/transport hatası veya kesilen (interrupt) istek. */
public class NetworkException extends KillboardException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
