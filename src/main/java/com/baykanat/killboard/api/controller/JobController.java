package com.baykanat.killboard.api.controller;

import com.baykanat.killboard.api.dto.JobResponse;
import com.baykanat.killboard.domain.job.Job;
import com.baykanat.killboard.domain.job.JobQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /jobs/*: scheduler'ı beklemeden job tetikler. Kuyruk doluysa job düşer, 503. */
@Slf4j
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Manual triggers for the background pipeline")
public class JobController {

    private final JobQueue jobQueue;

    @PostMapping("/refresh")
    @Operation(summary = "Refresh tokens", description = "Queues a token refresh for accounts close to expiry")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted"),
            @ApiResponse(responseCode = "503", description = "Job queue is full")
    })
    public ResponseEntity<JobResponse> refresh() {
        return submit(Job.REFRESH, "Refresh");
    }

    @PostMapping("/killmails")
    @Operation(summary = "Fetch killmails", description = "Queues killmail discovery for every account")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted"),
            @ApiResponse(responseCode = "503", description = "Job queue is full")
    })
    public ResponseEntity<JobResponse> fetchKillmails() {
        return submit(Job.FETCH_KILLMAILS, "FetchKillmails");
    }

    @PostMapping("/resolve")
    @Operation(summary = "Resolve killmails", description = "Queues detail resolution for pending killmails")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted"),
            @ApiResponse(responseCode = "503", description = "Job queue is full")
    })
    public ResponseEntity<JobResponse> resolveKillmails() {
        return submit(Job.RESOLVE_KILLMAILS, "ResolveKillmails");
    }

    private ResponseEntity<JobResponse> submit(Job job, String jobName) {
        log.debug("Manual trigger: {}", jobName);
        jobQueue.trySubmit(job);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(JobResponse.builder()
                        .status("accepted")
                        .job(jobName)
                        .queueSize(jobQueue.size())
                        .message("Job queued for processing")
                        .build());
    }
}
