package com.whereq.transcribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a persisted transcript document
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactRef {
    private String artifactId;

    /**
     * Where the document can be opened (URL or file URI)
     */
    private String location;

    /**
     * Business entity the document is linked to
     */
    private String correlationRef;
}
