package com.whereq.transcribe.resource;

import com.whereq.transcribe.model.ResourceRef;
import reactor.core.publisher.Mono;

/**
 * Access to uploaded media resources. Uploading itself happens elsewhere.
 */
public interface ResourceStore {

    /**
     * Resolve a resource id into a reference with size and mime type
     *
     * @return Mono with the reference, or {@link com.whereq.transcribe.exception.ResourceNotFoundException}
     */
    Mono<ResourceRef> describe(String resourceId);

    /**
     * Load the resource bytes
     *
     * @return Mono with the content, or {@link com.whereq.transcribe.exception.ResourceNotFoundException}
     */
    Mono<byte[]> load(ResourceRef resource);
}
