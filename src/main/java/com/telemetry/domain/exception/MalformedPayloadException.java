package com.telemetry.domain.exception;

public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
