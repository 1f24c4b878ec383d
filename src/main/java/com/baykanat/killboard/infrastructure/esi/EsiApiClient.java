package com.baykanat.killboard.infrastructure.esi;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.exception.DecodeException;
import com.baykanat.killboard.domain.mapper.KillmailMapper;
import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.KillmailReference;
import com.baykanat.killboard.infrastructure.esi.dto.KillmailSummary;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** ESI veri API'si: hesap başına son killmail listesi (Bearer) ve killmail detayı (anonim). */
@Slf4j
@Component
@RequiredArgsConstructor
public class EsiApiClient {

    private static final int NOT_MODIFIED = 304;
    private static final DateTimeFormatter HTTP_DATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private final EsiHttpExecutor httpExecutor;
    private final KillmailMapper killmailMapper;
    private final AppProperties appProperties;

    /** Hesabın son killmail'lerini çeker; lastFetched varsa If-Modified-Since ile koşullu istek. */
    public KillmailListing fetchRecentKillmails(Account account) {
        log.debug("Fetching killmails for character_id={}, last_fetched={}",
                account.getCharacterId(), account.getLastFetched());

        URI uri = URI.create(baseUrl() + "/characters/" + account.getCharacterId() + "/killmails/recent/");
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer " + account.getAccessToken())
                .header("Accept", "application/json")
                .GET();
        if (account.getLastFetched() != null) {
            request.header("If-Modified-Since", HTTP_DATE.format(account.getLastFetched().atZone(ZoneOffset.UTC)));
        }

        HttpResponse<String> response = httpExecutor.send(request.build(), Set.of(NOT_MODIFIED));
        if (response.statusCode() == NOT_MODIFIED) {
            log.debug("Killmails not modified for character_id={}", account.getCharacterId());
            return KillmailListing.unchanged();
        }

        JsonNode body = httpExecutor.readTree(response.body());
        if (!body.isArray()) {
            throw new DecodeException("Killmail listing for character " + account.getCharacterId() + " is not an array");
        }
        List<KillmailSummary> summaries = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            KillmailSummary summary = httpExecutor.convert(item, KillmailSummary.class);
            if (summary.getKillmailId() == null || summary.getKillmailHash() == null) {
                throw new DecodeException("Killmail listing item is missing killmail_id or killmail_hash: " + item);
            }
            summaries.add(summary);
        }

        List<KillmailReference> references = killmailMapper.toReferences(summaries);
        Instant lastModified = response.headers().firstValue("Last-Modified")
                .flatMap(EsiApiClient::parseHttpDate)
                .orElse(null);
        return new KillmailListing(references, lastModified, false);
    }

    /** Killmail detay dokümanı (JSON); kimlik doğrulama gerekmez. */
    public JsonNode fetchKillmail(long killmailId, String killmailHash) {
        URI uri = URI.create(baseUrl() + "/killmails/" + killmailId + "/" + killmailHash + "/");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .GET()
                .build();
        JsonNode killmail = httpExecutor.readTree(httpExecutor.send(request).body());
        if (!killmail.isObject()) {
            throw new DecodeException("Killmail " + killmailId + " is not a JSON object");
        }
        return killmail;
    }

    private String baseUrl() {
        String baseUrl = appProperties.getEsi().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    static Optional<Instant> parseHttpDate(String value) {
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable Last-Modified header: {}", value);
            return Optional.empty();
        }
    }
}
