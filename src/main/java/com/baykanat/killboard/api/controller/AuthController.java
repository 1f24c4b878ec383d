package com.baykanat.killboard.api.controller;

import com.baykanat.killboard.api.dto.AuthCallbackResponse;
import com.baykanat.killboard.domain.job.Job;
import com.baykanat.killboard.domain.job.JobQueue;
import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.AuthorizationRequest;
import com.baykanat.killboard.infrastructure.esi.EsiTokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;

/** GET /auth ve GET /auth/callback. EVE SSO ile karakter yetkilendirme; hesap kaydı kuyruk üzerinden. */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authorization", description = "EVE SSO login flow")
public class AuthController {

    static final String STATE_COOKIE = "mkb_state";
    private static final Duration STATE_COOKIE_MAX_AGE = Duration.ofMinutes(10);

    private final EsiTokenService tokenService;
    private final JobQueue jobQueue;

    /** Nonce'u cookie'ye yazar, SSO login linkini HTML olarak döner. */
    @GetMapping(produces = MediaType.TEXT_HTML_VALUE)
    @Operation(summary = "Start SSO login", description = "Stores a one-time state cookie and returns a login link")
    @ApiResponse(responseCode = "200", description = "Login page")
    public ResponseEntity<String> login() {
        AuthorizationRequest authorization = tokenService.buildAuthorizationUrl();

        ResponseCookie cookie = ResponseCookie.from(STATE_COOKIE, authorization.nonce())
                .path("/")
                .httpOnly(true)
                .sameSite("Lax")
                .maxAge(STATE_COOKIE_MAX_AGE)
                .build();

        String page = "<html><body><a href=\"" + HtmlUtils.htmlEscape(authorization.url())
                + "\">Log in with EVE Online</a></body></html>";

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .contentType(MediaType.TEXT_HTML)
                .body(page);
    }

    /** State cookie ile karşılaştırılır; uyuşmazlıkta ağa çıkılmadan 400. Geçerliyse code exchange + SaveAccount. */
    @GetMapping("/callback")
    @Operation(summary = "SSO callback", description = "Exchanges the authorization code and queues the account for saving")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Character authorized"),
            @ApiResponse(responseCode = "400", description = "State mismatch or missing parameters"),
            @ApiResponse(responseCode = "502", description = "Token exchange or validation failed"),
            @ApiResponse(responseCode = "503", description = "Job queue is full")
    })
    public ResponseEntity<AuthCallbackResponse> callback(
            @RequestParam String code,
            @RequestParam String state,
            @CookieValue(value = STATE_COOKIE, required = false) String expectedState) {
        Account account = tokenService.exchangeAuthorizationCode(code, expectedState, state);
        log.info("Authorized character_id={}", account.getCharacterId());

        jobQueue.trySubmit(new Job.SaveAccount(account));

        ResponseCookie cleared = ResponseCookie.from(STATE_COOKIE, "")
                .path("/")
                .httpOnly(true)
                .maxAge(0)
                .build();

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cleared.toString())
                .body(AuthCallbackResponse.builder()
                        .status("authorized")
                        .characterId(account.getCharacterId())
                        .expiresAt(account.getExpiresAt())
                        .message("Account queued for saving")
                        .build());
    }
}
