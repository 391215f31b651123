package com.whereq.transcribe.controller;

import com.whereq.transcribe.dto.CreateTranscriptionJobRequest;
import com.whereq.transcribe.dto.CreateTranscriptionJobResponse;
import com.whereq.transcribe.dto.JobStatusResponse;
import com.whereq.transcribe.exception.InvalidResourceException;
import com.whereq.transcribe.exception.JobNotFoundException;
import com.whereq.transcribe.exception.PermissionDeniedException;
import com.whereq.transcribe.exception.ResourceNotFoundException;
import com.whereq.transcribe.exception.ResourceTooLargeException;
import com.whereq.transcribe.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for queued transcription jobs
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transcriptions/jobs")
@RequiredArgsConstructor
@Tag(name = "Transcription Jobs", description = "Queue recordings for transcription and track their jobs")
public class TranscriptionJobController {

    static final String OWNER_HEADER = "X-Owner";

    private final JobSubmissionService jobSubmissionService;

    /**
     * Queue a recording for transcription
     *
     * @param request job request
     * @param ownerRef owner email
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Create transcription job",
        description = "Queue an uploaded recording; the owner is notified when the transcript is ready or the job fails")
    public Mono<ResponseEntity<CreateTranscriptionJobResponse>> createJob(
            @Valid @RequestBody CreateTranscriptionJobRequest request,
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerRef) {

        log.info("Received transcription job for {} from {}: resource={}",
            request.getCorrelationRef(), ownerRef, request.getResourceId());

        return jobSubmissionService.createTranscriptionJob(request, ownerRef)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/transcriptions/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(PermissionDeniedException.class, e -> {
                log.warn("Permission denied: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.FORBIDDEN)
                    .body(CreateTranscriptionJobResponse.error(e.getMessage())));
            })
            .onErrorResume(ResourceNotFoundException.class, e -> {
                log.warn("Resource not found: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.NOT_FOUND)
                    .body(CreateTranscriptionJobResponse.error(e.getMessage())));
            })
            .onErrorResume(ResourceTooLargeException.class, e -> {
                log.warn("Resource too large: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(CreateTranscriptionJobResponse.error(e.getMessage())));
            })
            .onErrorResume(InvalidResourceException.class, e -> {
                log.warn("Invalid resource: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(CreateTranscriptionJobResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job creation", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(CreateTranscriptionJobResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Status, attempts, timestamps and the transcript reference once complete")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        log.debug("Job status request for {}", jobId);

        return jobSubmissionService.getJobStatus(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }
}
