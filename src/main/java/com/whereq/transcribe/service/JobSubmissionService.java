package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.dto.CreateTranscriptionJobRequest;
import com.whereq.transcribe.dto.CreateTranscriptionJobResponse;
import com.whereq.transcribe.dto.JobStatusResponse;
import com.whereq.transcribe.exception.PermissionDeniedException;
import com.whereq.transcribe.exception.ResourceTooLargeException;
import com.whereq.transcribe.model.DrainTrigger;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.resource.ResourceStore;
import com.whereq.transcribe.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Service for job creation and status queries
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmissionService {

    private final JobStore jobStore;
    private final ResourceStore resourceStore;
    private final DrainScheduler drainScheduler;
    private final TranscribeProperties properties;

    /**
     * Queue a resource for transcription
     *
     * @param request job request
     * @param ownerRef owner email, notified when the job ends
     * @return Mono with the new job id and estimated wait
     */
    public Mono<CreateTranscriptionJobResponse> createTranscriptionJob(CreateTranscriptionJobRequest request,
                                                                      String ownerRef) {
        return Mono.fromRunnable(() -> checkPermission(ownerRef))

            // 1. Resolve the resource
            .then(Mono.defer(() -> resourceStore.describe(request.getResourceId())))

            // 2. Reject what could never be submitted
            .flatMap(resource -> {
                long maxBytes = properties.getSubmission().getMaxResourceBytes();
                if (resource.getSizeBytes() > maxBytes) {
                    return Mono.error(new ResourceTooLargeException(String.format(
                        "Resource %s is %d bytes; recordings over %d MB must be transcribed manually",
                        resource.getResourceId(), resource.getSizeBytes(), maxBytes / (1024 * 1024))));
                }
                return Mono.just(resource);
            })

            // 3. Persist and enqueue
            .flatMap(resource -> jobStore.createJob(ownerRef, request.getCorrelationRef(), resource,
                request.getRequestPayload()))

            // 4. Estimate the wait from the depth including this job
            .flatMap(jobId -> jobStore.queueDepth()
                .map(depth -> CreateTranscriptionJobResponse.builder()
                    .jobId(jobId)
                    .status(JobStatus.PENDING)
                    .estimatedWaitMinutes(estimateWaitMinutes(depth))
                    .build()))

            .doOnSuccess(response -> log.info("Job {} queued for {} by {}",
                response.getJobId(), request.getCorrelationRef(), ownerRef))
            .doOnError(e -> log.warn("Job creation for {} rejected: {}", request.getCorrelationRef(), e.getMessage()));
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status, or {@link com.whereq.transcribe.exception.JobNotFoundException}
     */
    public Mono<JobStatusResponse> getJobStatus(String jobId) {
        return jobStore.getJob(jobId).map(JobStatusResponse::from);
    }

    int estimateWaitMinutes(long queueDepth) {
        int interval = drainScheduler.currentTrigger()
            .map(DrainTrigger::getInterval)
            .orElse(properties.getDrain().getInterval())
            .getMinutes();
        int batchSize = properties.getDrain().getBatchSize();
        long ticks = (queueDepth + batchSize - 1) / batchSize;
        return (int) (ticks * interval + interval);
    }

    private void checkPermission(String ownerRef) {
        if (ownerRef == null || ownerRef.isBlank()) {
            if (properties.getSubmission().isAllowAnonymous()) {
                return;
            }
            throw new PermissionDeniedException("Owner identity is required to queue transcriptions");
        }

        List<String> allowedDomains = properties.getSubmission().getAllowedOwnerDomains();
        if (allowedDomains == null || allowedDomains.isEmpty()) {
            return;
        }
        int at = ownerRef.lastIndexOf('@');
        String domain = at >= 0 ? ownerRef.substring(at + 1).toLowerCase(Locale.ROOT) : "";
        boolean allowed = allowedDomains.stream()
            .anyMatch(allowedDomain -> allowedDomain.toLowerCase(Locale.ROOT).equals(domain));
        if (!allowed) {
            throw new PermissionDeniedException("Owner " + ownerRef + " may not queue transcriptions");
        }
    }
}
