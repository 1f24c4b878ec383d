package com.baykanat.killboard.domain.exception;

/** Bozuk JSON ya da beklenen alan eksik. */
public class DecodeException extends KillboardException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
