package com.example.marketdata.provider.alpaca;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Field readers for Alpaca payloads. Required readers throw IllegalArgumentException
 * so a single malformed record can be skipped by the caller.
 */
final class AlpacaJson {

    private AlpacaJson() {
    }

    /**
     * Epoch millis when numeric, RFC-3339 when text.
     */
    static Instant instant(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            try {
                return Instant.ofEpochMilli(value.asLong());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Bad timestamp " + value.asText() + " in field " + field, e);
            }
        }
        if (value.isTextual()) {
            try {
                return OffsetDateTime.parse(value.asText()).toInstant();
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Bad timestamp '" + value.asText() + "' in field " + field, e);
            }
        }
        throw new IllegalArgumentException("Missing timestamp field: " + field);
    }

    static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber() && !value.isTextual()) {
            throw new IllegalArgumentException("Missing numeric field: " + field);
        }
        try {
            return new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad number '" + value.asText() + "' in field " + field, e);
        }
    }

    static BigDecimal optionalDecimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return decimal(node, field);
    }

    static long wholeNumber(JsonNode node, String field) {
        return decimal(node, field).longValue();
    }

    static Long optionalWholeNumber(JsonNode node, String field) {
        BigDecimal value = optionalDecimal(node, field);
        return value != null ? value.longValue() : null;
    }

    static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Missing text field: " + field);
        }
        return value.asText();
    }
}
