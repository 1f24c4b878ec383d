package com.baykanat.killboard.domain.model;

/** Login başlatma çıktısı: yönlendirme URL'i ve callback'te doğrulanacak nonce (state). */
public record AuthorizationRequest(String url, String nonce) {
}
