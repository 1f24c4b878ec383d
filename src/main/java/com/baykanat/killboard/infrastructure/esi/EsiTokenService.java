package com.baykanat.killboard.infrastructure.esi;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.exception.AuthorizationStateException;
import com.baykanat.killboard.domain.exception.DecodeException;
import com.baykanat.killboard.domain.exception.TokenValidationException;
import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.AuthClaims;
import com.baykanat.killboard.domain.model.AuthorizationRequest;
import com.baykanat.killboard.domain.model.TokenGrant;
import com.baykanat.killboard.infrastructure.esi.dto.TokenResponse;
import com.fasterxml.jackson.databind.JsonNode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.Jwks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * EVE SSO OAuth2 işlemleri: authorization URL, code/refresh exchange ve JWKS ile access token doğrulama.
 * Durum tutmaz; yalnızca configuration'daki uygulama kimliğine dayanır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EsiTokenService {

    static final String SIGNATURE_ALGORITHM = "RS256";
    static final String PROVIDER_AUDIENCE = "EVE Online";
    static final Set<String> ACCEPTED_ISSUERS = Set.of("login.eveonline.com", "https://login.eveonline.com");

    private final EsiHttpExecutor httpExecutor;
    private final AppProperties appProperties;

    /** Her denemeye özel rastgele nonce (state) ile authorization URL üretir; nonce'u saklamak çağıranın işi. */
    public AuthorizationRequest buildAuthorizationUrl() {
        AppProperties.EsiProperties esi = appProperties.getEsi();
        String nonce = UUID.randomUUID().toString();
        String url = UriComponentsBuilder.fromUriString(esi.getAuthorizeUrl())
                .queryParam("response_type", "code")
                .queryParam("client_id", esi.getApplicationId())
                .queryParam("redirect_uri", esi.getRedirectUri())
                .queryParam("scope", esi.getScope())
                .queryParam("state", nonce)
                .encode()
                .build()
                .toUriString();
        return new AuthorizationRequest(url, nonce);
    }

    /** Callback: önce state doğrulanır, uyuşmazlıkta ağa çıkmadan reddedilir; sonra code exchange. */
    public Account exchangeAuthorizationCode(String code, String expectedState, String returnedState) {
        if (expectedState == null || expectedState.isBlank() || !expectedState.equals(returnedState)) {
            throw new AuthorizationStateException("OAuth state mismatch");
        }
        if (code == null || code.isBlank()) {
            throw new AuthorizationStateException("Missing authorization code");
        }
        return exchange(new TokenGrant.AuthorizationCode(code));
    }

    /** Grant'i token endpoint'ine gönderir, access token'ı doğrular, Account üretir. */
    public Account exchange(TokenGrant grant) {
        AppProperties.EsiProperties esi = appProperties.getEsi();
        HttpRequest request = HttpRequest.newBuilder(URI.create(esi.getTokenUrl()))
                .header("Authorization", "Basic " + basicAuth())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(grant.formParameters())))
                .build();

        HttpResponse<String> response = httpExecutor.send(request);
        TokenResponse tokens = httpExecutor.read(response.body(), TokenResponse.class);
        if (tokens.getAccessToken() == null || tokens.getRefreshToken() == null) {
            throw new DecodeException("Token response is missing access_token or refresh_token");
        }

        AuthClaims claims = validate(tokens.getAccessToken());
        Account account = Account.fromClaims(claims, tokens.getAccessToken(), tokens.getRefreshToken());
        log.debug("Validated token for character_id={}, expires_at={}", account.getCharacterId(), account.getExpiresAt());
        return account;
    }

    /**
     * Access token'ı sağlayıcının güncel anahtar setiyle doğrular. Anahtar seti her çağrıda yeniden çekilir.
     * İmza, exp, sub, aud ve iss kontrollerinden biri tutmazsa TokenValidationException.
     */
    public AuthClaims validate(String accessToken) {
        PublicKey signingKey = fetchSigningKey();

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(accessToken)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException("Access token verification failed: " + e.getMessage(), e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenValidationException("Access token has no subject");
        }

        Set<String> audience = Objects.requireNonNullElse(claims.getAudience(), Set.of());
        String applicationId = appProperties.getEsi().getApplicationId();
        if (!audience.contains(applicationId) && !audience.contains(PROVIDER_AUDIENCE)) {
            throw new TokenValidationException("Access token audience " + audience + " is not accepted");
        }

        String issuer = claims.getIssuer();
        if (issuer == null || !ACCEPTED_ISSUERS.contains(issuer)) {
            throw new TokenValidationException("Access token issuer is incorrect: " + issuer);
        }

        if (claims.getExpiration() == null) {
            throw new TokenValidationException("Access token has no expiry");
        }

        AuthClaims authClaims = AuthClaims.builder()
                .subject(subject)
                .audience(List.copyOf(audience))
                .issuer(issuer)
                .expiresAt(claims.getExpiration().toInstant())
                .build();
        // subject formatı burada doğrulanır; hatalıysa fırlatır
        authClaims.characterId();
        return authClaims;
    }

    /** Hesapların refresh token'larını sırayla yeniler; hatalı hesap loglanıp atlanır. */
    public List<Account> refresh(List<Account> accounts) {
        log.debug("Refreshing {} characters", accounts.size());
        List<Account> refreshed = new ArrayList<>(accounts.size());
        for (Account account : accounts) {
            try {
                Account renewed = exchange(new TokenGrant.RefreshToken(account.getRefreshToken()));
                renewed.setCreatedAt(account.getCreatedAt());
                renewed.setLastFetched(account.getLastFetched());
                log.debug("Refreshed token for character_id={}, new expiry at {}",
                        account.getCharacterId(), renewed.getExpiresAt());
                refreshed.add(renewed);
            } catch (Exception e) {
                log.error("Failed to refresh token for character_id={}: {}", account.getCharacterId(), e.getMessage());
            }
        }
        return refreshed;
    }

    /** JWKS'ten RS256 anahtarını seçer; cache yok. */
    private PublicKey fetchSigningKey() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(appProperties.getEsi().getJwksUrl()))
                .header("Accept", "application/json")
                .GET()
                .build();
        JsonNode keySet = httpExecutor.readTree(httpExecutor.send(request).body());

        JsonNode keys = keySet.path("keys");
        if (!keys.isArray()) {
            throw new DecodeException("JWKS response has no keys array");
        }
        for (JsonNode key : keys) {
            if (SIGNATURE_ALGORITHM.equals(key.path("alg").asText())) {
                return toPublicKey(key);
            }
        }
        throw new TokenValidationException("No " + SIGNATURE_ALGORITHM + " key found in JWKS");
    }

    private PublicKey toPublicKey(JsonNode keyNode) {
        try {
            Jwk<?> jwk = Jwks.parser().build().parse(keyNode.toString());
            Key key = jwk.toKey();
            if (key instanceof PublicKey publicKey) {
                return publicKey;
            }
            throw new TokenValidationException("JWKS signing key is not a public key");
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException("Failed to read signing key: " + e.getMessage(), e);
        }
    }

    private String basicAuth() {
        AppProperties.EsiProperties esi = appProperties.getEsi();
        String credentials = esi.getApplicationId() + ":" + esi.getApplicationSecret();
        return Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String formBody(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
