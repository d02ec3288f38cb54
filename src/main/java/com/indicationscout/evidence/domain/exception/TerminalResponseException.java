package com.indicationscout.evidence.domain.exception;

/**
 * The source answered with a non-retryable status (e.g. 404) or reported
 * an error in an otherwise successful reply. Surfaced immediately.
 */
public class TerminalResponseException extends DataSourceException {

    public TerminalResponseException(String source, String operation, String message, int statusCode) {
        super(source, operation, message, statusCode);
    }
}
