package com.telemetry.domain.service.extract;

/**
 * Turns the bytes of one artifact into persisted metrics.
 */
public interface ArtifactExtractor {

    void extract(ExtractionContext context);
}
