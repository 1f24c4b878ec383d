package com.baykanat.killboard.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** OAuth callback yanıtı. Token'lar asla dönmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of the SSO authorization callback")
public class AuthCallbackResponse {

    @Schema(description = "Status message", example = "authorized")
    private String status;

    @Schema(description = "Authorized character", example = "2112625428")
    private long characterId;

    @Schema(description = "Access token expiry", example = "2024-01-15T10:50:00Z")
    private Instant expiresAt;

    @Schema(description = "Additional message", example = "Account queued for saving")
    private String message;
}
