package com.baykanat.killboard.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Token endpoint'ine gönderilecek grant: authorization code veya refresh token. */
public sealed interface TokenGrant permits TokenGrant.AuthorizationCode, TokenGrant.RefreshToken {

    /** application/x-www-form-urlencoded gövde alanları. */
    Map<String, String> formParameters();

    record AuthorizationCode(String code) implements TokenGrant {
        @Override
        public Map<String, String> formParameters() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("grant_type", "authorization_code");
            params.put("code", code);
            return params;
        }
    }

    record RefreshToken(String refreshToken) implements TokenGrant {
        @Override
        public Map<String, String> formParameters() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("grant_type", "refresh_token");
            params.put("refresh_token", refreshToken);
            return params;
        }

        @Override
        public String toString() {
            return "RefreshToken[***]";
        }
    }
}
