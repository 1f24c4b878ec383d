package com.baykanat.killboard.domain.exception;

/** Uzak servis 2xx dışı yanıt döndü; mesaj gövdeyi içerir. */
public class HttpStatusException extends KillboardException {

    private final int statusCode;
    private final String body;

    public HttpStatusException(String uri, int statusCode, String body) {
        super("Request to " + uri + " failed with status " + statusCode + ": " + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
