package com.whereq.transcribe.client;

import com.whereq.transcribe.model.RemoteJobStatus;
import com.whereq.transcribe.model.TranscriptionRequest;
import reactor.core.publisher.Mono;

/**
 * Asynchronous external transcription service
 */
public interface TranscriptionClient {

    /**
     * Submit a transcription request. Makes exactly one network call.
     *
     * @return Mono with the opaque remote handle, or
     *         {@link com.whereq.transcribe.exception.TransientSubmissionException} /
     *         {@link com.whereq.transcribe.exception.PermanentSubmissionException}
     */
    Mono<String> submit(TranscriptionRequest request);

    /**
     * Check the state of a submitted request
     *
     * @param handle handle returned by {@link #submit}
     * @return Mono with the remote status; errors when the service is unreachable
     */
    Mono<RemoteJobStatus> status(String handle);
}
