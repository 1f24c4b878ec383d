package com.baykanat.killboard.api.exception;

import com.baykanat.killboard.domain.exception.AuthorizationStateException;
import com.baykanat.killboard.domain.exception.DecodeException;
import com.baykanat.killboard.domain.exception.HttpStatusException;
import com.baykanat.killboard.domain.exception.NetworkException;
import com.baykanat.killboard.domain.exception.QueueFullException;
import com.baykanat.killboard.domain.exception.TokenValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** REST hatalarını tek yerde toplar: 400 state/parametre, 502 ESI/SSO, 503 kuyruk dolu, 500 diğer. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final int QUEUE_FULL_RETRY_AFTER_SECONDS = 5;

    /** Callback state'i cookie ile uyuşmuyor ya da code eksik → 400. */
    @ExceptionHandler(AuthorizationStateException.class)
    public ResponseEntity<Map<String, Object>> handleAuthorizationState(AuthorizationStateException ex) {
        log.warn("Rejected authorization callback: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Invalid authorization state", null));
    }

    /** Eksik zorunlu parametre → 400. */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Missing required parameter: " + ex.getParameterName(), null));
    }

    /** SSO/ESI tarafında başarısızlık → 502; ayrıntı yalnızca logda. */
    @ExceptionHandler({
            TokenValidationException.class,
            HttpStatusException.class,
            NetworkException.class,
            DecodeException.class
    })
    public ResponseEntity<Map<String, Object>> handleUpstreamFailure(RuntimeException ex) {
        log.error("Upstream authorization failure: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(errorBody(HttpStatus.BAD_GATEWAY, "Authorization with EVE Online failed", null));
    }

    /** Kuyruk dolu, job düştü → 503 + Retry-After. */
    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<Map<String, Object>> handleQueueFull(QueueFullException ex) {
        log.warn("Rejected request: {}", ex.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.set("Retry-After", String.valueOf(QUEUE_FULL_RETRY_AFTER_SECONDS));

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .headers(headers)
                .body(errorBody(HttpStatus.SERVICE_UNAVAILABLE, "Job queue is full, try again later", null));
    }

    /** Beklenmeyen hatalar → 500, istemciye jenerik mesaj. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null));
    }

    /** Ortak hata gövdesi oluşturur. */
    private Map<String, Object> errorBody(HttpStatus status, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
