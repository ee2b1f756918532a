package com.tradescan.backend.service.marketdata;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Lenient readers for provider JSON. Missing, null, blank, "None" and "-" all read as null.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static Double decimal(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        String text = value.asText().trim();
        if (text.isEmpty() || "None".equalsIgnoreCase(text) || "-".equals(text)) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static BigDecimal money(JsonNode node, String field) {
        Double value = decimal(node, field);
        return value == null ? null : BigDecimal.valueOf(value);
    }

    public static Long whole(JsonNode node, String field) {
        Double value = decimal(node, field);
        return value == null ? null : value.longValue();
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "None".equalsIgnoreCase(text) ? null : text;
    }
}
