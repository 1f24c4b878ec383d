package com.baykanat.killboard.infrastructure.esi;

import com.baykanat.killboard.domain.model.KillmailReference;

import java.time.Instant;
import java.util.List;

/**
 * Tek hesabın killmail listesi. notModified: sunucu 304 döndü (liste boş, bkz. {@link #unchanged()}).
 * lastModified: yanıttaki Last-Modified, yoksa null.
 */
public record KillmailListing(List<KillmailReference> killmails, Instant lastModified, boolean notModified) {

    public static KillmailListing unchanged() {
        return new KillmailListing(List.of(), null, true);
    }
}
