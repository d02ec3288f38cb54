package com.indicationscout.evidence.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outbound call shapes every source client composes over. One instance talks
 * to one source; paths are relative to that source's base URL.
 *
 * <p>Transient failures are retried inside the executor. Callers only see the
 * final outcome: a parsed body, or one of
 * {@link com.indicationscout.evidence.domain.exception.ExhaustedRetryException},
 * {@link com.indicationscout.evidence.domain.exception.TerminalResponseException},
 * {@link com.indicationscout.evidence.domain.exception.MalformedResponseException}.
 */
public interface RequestExecutor {

    /**
     * Name of the source, used in logs and error messages.
     */
    String sourceName();

    /**
     * REST GET returning a JSON body.
     *
     * @param operation label of the logical operation, for logs and errors
     */
    JsonNode get(String operation, String path, Map<String, String> query);

    /**
     * GraphQL POST of a single document with variables.
     *
     * @return the {@code data} member of the reply
     */
    JsonNode graphQl(String operation, String path, String document, Map<String, Object> variables);

    /**
     * REST GET returning a markup (XML) body, parsed into a tree.
     */
    JsonNode getStructuredText(String operation, String path, Map<String, String> query);
}
