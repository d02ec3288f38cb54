package com.indicationscout.evidence.domain.exception;

import java.util.Map;

/**
 * Every attempt allowed by the retry budget failed transiently.
 */
public class ExhaustedRetryException extends DataSourceException {

    private final int attempts;
    private final String lastResponseBody;

    public ExhaustedRetryException(TransientNetworkException last, int attempts) {
        super(last.getSource(), last.getOperation(),
                "All " + attempts + " attempts failed, last error: " + stripPrefix(last),
                last.getStatusCode(), last, Map.of("attempts", attempts));
        this.attempts = attempts;
        this.lastResponseBody = last.getResponseBody();
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastResponseBody() {
        return lastResponseBody;
    }

    private static String stripPrefix(DataSourceException e) {
        String message = e.getMessage();
        int end = message.indexOf("] ");
        return end >= 0 ? message.substring(end + 2) : message;
    }
}
