package com.indicationscout.evidence.domain.exception;

import java.util.Map;

/**
 * Base exception for failures talking to an external evidence source.
 * Carries the source name, the operation being attempted and, when one was
 * observed, the upstream HTTP status (0 otherwise).
 */
public class DataSourceException extends RuntimeException {

    private final String source;
    private final String operation;
    private final int statusCode;
    private final Map<String, Object> context;

    public DataSourceException(String source, String operation, String message) {
        this(source, operation, message, 0, null, Map.of());
    }

    public DataSourceException(String source, String operation, String message, int statusCode) {
        this(source, operation, message, statusCode, null, Map.of());
    }

    public DataSourceException(String source, String operation, String message, Throwable cause) {
        this(source, operation, message, 0, cause, Map.of());
    }

    public DataSourceException(String source, String operation, String message, int statusCode,
                               Throwable cause, Map<String, Object> context) {
        super("[" + source + "." + operation + "] " + message, cause);
        this.source = source;
        this.operation = operation;
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    public String getSource() {
        return source;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode > 0;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
