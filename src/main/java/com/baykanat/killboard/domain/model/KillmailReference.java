package com.baykanat.killboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** killmails tablosu satırı: id + hash çözümlemeye yeter; detay ayrıca çekilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KillmailReference {

    private long killmailId;
    private String killmailHash;
    private KillmailStatus status;
}
