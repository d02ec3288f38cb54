package com.indicationscout.evidence.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache addresses. The namespace and parameters are written as
 * JSON with every map sorted by key, then hashed with SHA-256, so equal
 * parameters address the same entry whatever their insertion order.
 * The parameter name {@value #NAMESPACE_FIELD} is reserved.
 */
public final class CacheKeys {

    static final String NAMESPACE_FIELD = "ns";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private CacheKeys() {
    }

    public static String keyFor(String namespace, Map<String, ?> params) {
        return sha256(canonicalForm(namespace, params));
    }

    static String canonicalForm(String namespace, Map<String, ?> params) {
        if (params.containsKey(NAMESPACE_FIELD)) {
            throw new IllegalArgumentException("Cache parameter name '" + NAMESPACE_FIELD + "' is reserved for the namespace");
        }
        Map<String, Object> canonical = new TreeMap<>(params);
        canonical.put(NAMESPACE_FIELD, namespace);
        try {
            return CANONICAL_MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache parameters are not serializable: " + params, e);
        }
    }

    private static String sha256(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
