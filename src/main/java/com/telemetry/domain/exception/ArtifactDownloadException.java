package com.telemetry.domain.exception;

/**
 * Transport or service failure while fetching an artifact. Retryable.
 */
public class ArtifactDownloadException extends RuntimeException {

    public ArtifactDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
