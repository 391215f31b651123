package com.whereq.transcribe.artifact;

import com.whereq.transcribe.model.ArtifactRef;
import com.whereq.transcribe.model.TranscriptionJob;
import reactor.core.publisher.Mono;

/**
 * Persists transcript documents linked to their business entity.
 */
public interface ArtifactStore {

    /**
     * Create (or replace) the transcript document of a job. The document identity
     * is derived from the job id, so repeating the call never yields a second document.
     *
     * @return Mono with the document reference, or {@link com.whereq.transcribe.exception.ArtifactCreationException}
     */
    Mono<ArtifactRef> createDocument(TranscriptionJob job, String content);
}
