package com.baykanat.killboard.infrastructure.esi;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.exception.AuthorizationStateException;
import com.baykanat.killboard.domain.exception.TokenValidationException;
import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.AuthorizationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.Deque;
import java.util.List;

import static com.baykanat.killboard.infrastructure.esi.EsiResponses.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for EsiTokenService.
 *
 * <p>The HTTP client is mocked: the token endpoint answers from a queue of prepared responses and
 * the JWKS endpoint serves the public half of a key pair generated per test run. Tokens are signed
 * locally with JJWT so signature, audience, issuer and expiry checks run for real.
 */
@ExtendWith(MockitoExtension.class)
class EsiTokenServiceTest {

    private static final String APP_ID = "test-app";
    private static final String APP_SECRET = "test-secret";
    private static final String ISSUER = "https://login.eveonline.com";
    private static final String SUBJECT = "CHARACTER:EVE:2112625428";

    private static KeyPair signingKeys;
    private static KeyPair otherKeys;

    @Mock
    private HttpClient httpClient;

    private final List<HttpRequest> requests = new ArrayList<>();
    private final Deque<HttpResponse<String>> tokenResponses = new ArrayDeque<>();
    private AppProperties appProperties;
    private EsiTokenService service;

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        signingKeys = generator.generateKeyPair();
        otherKeys = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getEsi().setApplicationId(APP_ID);
        appProperties.getEsi().setApplicationSecret(APP_SECRET);
        appProperties.getEsi().setRedirectUri("http://localhost:3000/auth/callback");
        service = new EsiTokenService(new EsiHttpExecutor(httpClient, new ObjectMapper()), appProperties);
    }

    @Test
    @DisplayName("Authorization URL carries client id, redirect and a fresh state")
    void buildsAuthorizationUrl() {
        AuthorizationRequest first = service.buildAuthorizationUrl();
        AuthorizationRequest second = service.buildAuthorizationUrl();

        assertThat(first.url())
                .startsWith("https://login.eveonline.com/v2/oauth/authorize?")
                .contains("response_type=code")
                .contains("client_id=" + APP_ID)
                .contains("state=" + first.nonce());
        assertThat(first.nonce()).isNotBlank().isNotEqualTo(second.nonce());
    }

    @Test
    @DisplayName("Code exchange validates the token and maps character id and expiry")
    void exchangeCodeReturnsAccount() throws Exception {
        Instant expiresAt = Instant.now().plusSeconds(1200).truncatedTo(ChronoUnit.SECONDS);
        String accessToken = token(SUBJECT, APP_ID, ISSUER, expiresAt, signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));
        tokenResponses.add(response(200, tokenBody(accessToken, "refresh-1")));

        Account account = service.exchangeAuthorizationCode("auth-code", "nonce-1", "nonce-1");

        assertThat(account.getCharacterId()).isEqualTo(2112625428L);
        assertThat(account.getExpiresAt()).isEqualTo(expiresAt);
        assertThat(account.getAccessToken()).isEqualTo(accessToken);
        assertThat(account.getRefreshToken()).isEqualTo("refresh-1");

        HttpRequest tokenRequest = requests.get(0);
        assertThat(tokenRequest.method()).isEqualTo("POST");
        assertThat(tokenRequest.uri().toString()).isEqualTo(appProperties.getEsi().getTokenUrl());
        assertThat(tokenRequest.headers().firstValue("Authorization")).contains("Basic "
                + Base64.getEncoder().encodeToString((APP_ID + ":" + APP_SECRET).getBytes(StandardCharsets.UTF_8)));
        assertThat(tokenRequest.headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded");
    }

    @Test
    @DisplayName("Provider audience is accepted alongside the application id")
    void acceptsProviderAudience() throws Exception {
        String accessToken = token(SUBJECT, "EVE Online", "login.eveonline.com",
                Instant.now().plusSeconds(600), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThat(service.validate(accessToken).characterId()).isEqualTo(2112625428L);
    }

    @Test
    @DisplayName("State mismatch is rejected before any network call")
    void stateMismatchMakesNoRequest() {
        assertThatThrownBy(() -> service.exchangeAuthorizationCode("auth-code", "nonce-1", "nonce-2"))
                .isInstanceOf(AuthorizationStateException.class);
        assertThatThrownBy(() -> service.exchangeAuthorizationCode("auth-code", null, "nonce-2"))
                .isInstanceOf(AuthorizationStateException.class);

        verifyNoInteractions(httpClient);
    }

    @Test
    @DisplayName("Token from an unexpected issuer is rejected")
    void rejectsWrongIssuer() throws Exception {
        String accessToken = token(SUBJECT, APP_ID, "https://evil.example.com",
                Instant.now().plusSeconds(600), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class)
                .hasMessageContaining("issuer");
    }

    @Test
    @DisplayName("Token for another application is rejected")
    void rejectsWrongAudience() throws Exception {
        String accessToken = token(SUBJECT, "someone-else", ISSUER,
                Instant.now().plusSeconds(600), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class)
                .hasMessageContaining("audience");
    }

    @Test
    @DisplayName("Token signed with a key outside the key set is rejected")
    void rejectsForeignSignature() throws Exception {
        String accessToken = token(SUBJECT, APP_ID, ISSUER, Instant.now().plusSeconds(600), otherKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class);
    }

    @Test
    @DisplayName("Expired token is rejected")
    void rejectsExpiredToken() throws Exception {
        String accessToken = token(SUBJECT, APP_ID, ISSUER, Instant.now().minusSeconds(3600), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class);
    }

    @Test
    @DisplayName("Subject without a numeric character id is rejected")
    void rejectsMalformedSubject() throws Exception {
        String accessToken = token("CHARACTER:EVE:abc", APP_ID, ISSUER,
                Instant.now().plusSeconds(600), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class)
                .hasMessageContaining("CHARACTER:EVE:abc");
    }

    @Test
    @DisplayName("Key set without an RS256 key is rejected")
    void rejectsKeySetWithoutRs256() throws Exception {
        String accessToken = token(SUBJECT, APP_ID, ISSUER, Instant.now().plusSeconds(600), signingKeys.getPrivate());
        stubEndpoints("{\"keys\":[{\"kty\":\"EC\",\"alg\":\"ES256\",\"kid\":\"ec\",\"crv\":\"P-256\"}]}");

        assertThatThrownBy(() -> service.validate(accessToken))
                .isInstanceOf(TokenValidationException.class)
                .hasMessageContaining("RS256");
    }

    @Test
    @DisplayName("Refresh skips failing accounts and keeps bookkeeping of the rest")
    void refreshSkipsFailures() throws Exception {
        Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");
        Instant lastFetched = Instant.parse("2024-01-15T10:00:00Z");
        Account revoked = Account.builder().characterId(1L).refreshToken("revoked").build();
        Account valid = Account.builder().characterId(2112625428L).refreshToken("refresh-1")
                .createdAt(createdAt).lastFetched(lastFetched).build();

        String accessToken = token(SUBJECT, APP_ID, ISSUER, Instant.now().plusSeconds(1200), signingKeys.getPrivate());
        stubEndpoints(jwks(signingKeys));
        tokenResponses.add(response(400, "{\"error\":\"invalid_grant\"}"));
        tokenResponses.add(response(200, tokenBody(accessToken, "refresh-2")));

        List<Account> refreshed = service.refresh(List.of(revoked, valid));

        assertThat(refreshed).hasSize(1);
        Account account = refreshed.get(0);
        assertThat(account.getCharacterId()).isEqualTo(2112625428L);
        assertThat(account.getRefreshToken()).isEqualTo("refresh-2");
        assertThat(account.getCreatedAt()).isEqualTo(createdAt);
        assertThat(account.getLastFetched()).isEqualTo(lastFetched);
    }

    private void stubEndpoints(String jwksBody) throws Exception {
        String jwksUrl = appProperties.getEsi().getJwksUrl();
        HttpResponse<String> jwksResponse = response(200, jwksBody);
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            requests.add(request);
            if (request.uri().toString().equals(jwksUrl)) {
                return jwksResponse;
            }
            return tokenResponses.removeFirst();
        }).when(httpClient).send(any(), any());
    }

    private static String token(String subject, String audience, String issuer, Instant expiresAt, PrivateKey key) {
        return Jwts.builder()
                .subject(subject)
                .audience().add(audience).and()
                .issuer(issuer)
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.RS256)
                .compact();
    }

    private static String tokenBody(String accessToken, String refreshToken) {
        return "{\"access_token\":\"" + accessToken + "\",\"token_type\":\"Bearer\",\"expires_in\":1199,"
                + "\"refresh_token\":\"" + refreshToken + "\"}";
    }

    /** ESI'deki gibi önce ES256, sonra RS256 anahtarı olan key set. */
    private static String jwks(KeyPair keyPair) {
        RSAPublicKey publicKey = (RSAPublicKey) keyPair.getPublic();
        return """
                {"keys":[
                  {"kty":"EC","alg":"ES256","kid":"JWT-Signature-Key-ec","crv":"P-256","use":"sig"},
                  {"kty":"RSA","alg":"RS256","kid":"JWT-Signature-Key","use":"sig","n":"%s","e":"%s"}
                ]}
                """.formatted(base64Url(publicKey.getModulus()), base64Url(publicKey.getPublicExponent()));
    }

    private static String base64Url(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
