package com.baykanat.killboard.infrastructure.esi.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** /characters/{id}/killmails/recent/ listesindeki tek öğe. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KillmailSummary {

    @JsonProperty("killmail_id")
    private Long killmailId;

    @JsonProperty("killmail_hash")
    private String killmailHash;
}
