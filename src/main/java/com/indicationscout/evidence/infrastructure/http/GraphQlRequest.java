package com.indicationscout.evidence.infrastructure.http;

import java.util.Map;

/**
 * JSON body of a GraphQL POST.
 */
public record GraphQlRequest(String query, Map<String, Object> variables) {}
