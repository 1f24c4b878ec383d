package com.baykanat.killboard.infrastructure.esi;

import com.baykanat.killboard.domain.exception.DecodeException;
import com.baykanat.killboard.domain.exception.HttpStatusException;
import com.baykanat.killboard.domain.exception.NetworkException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Set;

/** ESI ve login sunucusuna giden tüm istekler: transport → NetworkException, 2xx dışı → HttpStatusException. */
@Slf4j
@Component
@RequiredArgsConstructor
public class EsiHttpExecutor {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /** İsteği gönderir; 2xx dışı yanıtlarda gövdeyle birlikte hata fırlatır. */
    public HttpResponse<String> send(HttpRequest request) {
        return send(request, Set.of());
    }

    /** 2xx dışında kabul edilen durum kodlarıyla (örn. 304) gönderir. */
    public HttpResponse<String> send(HttpRequest request, Set<Integer> acceptedStatuses) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NetworkException("Failed to send request to " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Request to " + request.uri() + " was interrupted", e);
        }

        int status = response.statusCode();
        if ((status < 200 || status > 299) && !acceptedStatuses.contains(status)) {
            log.debug("{} {} -> {}", request.method(), request.uri(), status);
            throw new HttpStatusException(String.valueOf(request.uri()), status, response.body());
        }
        return response;
    }

    /** Yanıt gövdesini JsonNode'a çevirir. */
    public JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new DecodeException("Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new DecodeException("Failed to decode JSON: " + e.getMessage(), e);
        }
    }

    /** Yanıt gövdesini verilen tipe çevirir. */
    public <T> T read(String body, Class<T> type) {
        return convert(readTree(body), type);
    }

    /** JsonNode'u verilen tipe çevirir. */
    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new DecodeException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
