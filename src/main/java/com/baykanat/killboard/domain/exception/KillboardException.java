package com.baykanat.killboard.domain.exception;

/** Uygulama hatalarının kökü; unchecked, çağırana kadar taşınır ve job seviyesinde loglanır. */
public abstract class KillboardException extends RuntimeException {

    protected KillboardException(String message) {
        super(message);
    }

    protected KillboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
