package com.centralbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;

/**
 * Lenient accessors for agent-sent JSON. Missing or null fields fall back to
 * defaults; nothing is rejected.
 */
final class ReportFields {

    private ReportFields() {
    }

    static JsonNode objectOrEmpty(JsonNode body) {
        return body != null && body.isObject() ? body : JsonNodeFactory.instance.objectNode();
    }

    static JsonNode node(JsonNode root, String field, JsonNode fallback) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? fallback : value;
    }

    static String text(JsonNode root, String field, String fallback) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    static boolean bool(JsonNode root, String field, boolean fallback) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? fallback : value.asBoolean(fallback);
    }

    /** Numeric value of an agent-reported field; anything non-numeric counts as 0. */
    static double number(JsonNode value) {
        return value != null && value.isNumber() ? value.asDouble() : 0;
    }

    /** Action count exactly as reported; integral counts stay integral. */
    static BigDecimal count(JsonNode value) {
        return value != null && value.isNumber() ? value.decimalValue() : BigDecimal.ZERO;
    }
}
