package com.indicationscout.evidence.domain.exception;

/**
 * A single attempt failed in a way worth retrying: timeout, connection
 * failure or a retryable status. Never escapes the request executor;
 * callers see {@link ExhaustedRetryException} once the budget is spent.
 */
public class TransientNetworkException extends DataSourceException {

    private final String responseBody;

    public TransientNetworkException(String source, String operation, String message,
                                     int statusCode, String responseBody) {
        super(source, operation, message, statusCode);
        this.responseBody = responseBody;
    }

    public TransientNetworkException(String source, String operation, String message, Throwable cause) {
        super(source, operation, message, cause);
        this.responseBody = null;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
