package com.telemetry.domain.exception;

/**
 * No usable storage endpoint or credentials for a project.
 */
public class StorageConfigurationException extends RuntimeException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
