package com.whereq.transcribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to an uploaded media resource
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRef {
    /**
     * Resource identifier, relative to the resource store
     */
    private String resourceId;

    /**
     * Size in bytes
     */
    private long sizeBytes;

    /**
     * Declared mime type, sent to the transcription service
     */
    private String mimeType;
}
