package com.baykanat.killboard.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manuel job tetikleme yanıtı: 202 ile kuyruğa alınan job ve kuyruk doluluğu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response for manual job submission")
public class JobResponse {

    @Schema(description = "Status message", example = "accepted")
    private String status;

    @Schema(description = "Submitted job", example = "FetchKillmails")
    private String job;

    @Schema(description = "Jobs waiting in the queue after submission", example = "3")
    private int queueSize;

    @Schema(description = "Additional message", example = "Job queued for processing")
    private String message;
}
