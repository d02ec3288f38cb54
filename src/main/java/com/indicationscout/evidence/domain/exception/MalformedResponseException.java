package com.indicationscout.evidence.domain.exception;

/**
 * The body could not be decoded, or lacks a field the contract requires.
 */
public class MalformedResponseException extends DataSourceException {

    public MalformedResponseException(String source, String operation, String message) {
        super(source, operation, message);
    }

    public MalformedResponseException(String source, String operation, String message, Throwable cause) {
        super(source, operation, message, cause);
    }
}
