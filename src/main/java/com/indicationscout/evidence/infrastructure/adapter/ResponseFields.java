package com.indicationscout.evidence.infrastructure.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Field access over a decoded response. Required fields that are absent fail
 * with {@link MalformedResponseException} naming the record being parsed;
 * optional fields come back as null or an empty list, never a stand-in value.
 */
public final class ResponseFields {

    private final String source;
    private final String operation;
    private final String identifier;

    private ResponseFields(String source, String operation, String identifier) {
        this.source = source;
        this.operation = operation;
        this.identifier = identifier;
    }

    public static ResponseFields of(String source, String operation, String identifier) {
        return new ResponseFields(source, operation, identifier);
    }

    public JsonNode requiredObject(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw missing(field);
        }
        return value;
    }

    public String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw missing(field);
        }
        return value.asText();
    }

    public double requiredDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw missing(field);
        }
        return value.asDouble();
    }

    public long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw missing(field);
        }
        return value.asLong();
    }

    public MalformedResponseException malformed(String detail) {
        return new MalformedResponseException(source, operation, detail + " in " + identifier);
    }

    private MalformedResponseException missing(String field) {
        return malformed("Missing or invalid '" + field + "'");
    }

    public static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.isValueNode() ? null : value.asText();
    }

    public static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    public static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    public static Boolean optionalBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : null;
    }

    /**
     * Elements of an array field; empty when the field is absent or null.
     */
    public static List<JsonNode> elements(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<JsonNode> elements = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(elements::add);
        }
        return elements;
    }

    /**
     * Elements of {@code field.rows}, the paged-collection shape.
     */
    public static List<JsonNode> rows(JsonNode node, String field) {
        JsonNode collection = node.get(field);
        if (collection == null || !collection.isObject()) {
            return List.of();
        }
        return elements(collection, "rows");
    }

    public static List<String> textList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : elements(node, field)) {
            if (element.isValueNode() && !element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
