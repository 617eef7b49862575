package com.binance.refdata.parse;

import com.binance.refdata.MalformedDocumentException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Typed access to exchangeInfo fields. A missing or mistyped required field
 * means the document no longer matches the expected layout.
 */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw missing(field, context);
        }
        return value.asText();
    }

    static Optional<String> optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    static int integer(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw missing(field, context);
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.asInt();
        }
        String raw = value.asText().trim();
        if (value.isTextual() && raw.matches("\\d{1,9}")) {
            return Integer.parseInt(raw);
        }
        throw new MalformedDocumentException(
                "field '" + field + "' of " + context + " is not an integer: " + value);
    }

    static BigDecimal decimal(JsonNode node, String field, String context) {
        String raw = text(node, field, context);
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedDocumentException(
                    "field '" + field + "' of " + context + " is not a number: '" + raw + "'", e);
        }
    }

    static JsonNode array(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new MalformedDocumentException("expected array '" + field + "' in " + context);
        }
        return value;
    }

    private static MalformedDocumentException missing(String field, String context) {
        return new MalformedDocumentException("missing field '" + field + "' in " + context);
    }
}
