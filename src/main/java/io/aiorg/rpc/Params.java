package io.aiorg.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aiorg.error.InvalidDateException;
import io.aiorg.error.InvalidParamsException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public final class Params {
    private final ObjectNode node;

    public Params(ObjectNode node) {
        this.node = node;
    }

    public ObjectNode node() {
        return node;
    }

    public String require(String name) {
        String value = optional(name);
        if (value == null) {
            throw new InvalidParamsException("Missing required parameter: " + name);
        }
        return value;
    }

    // Text value, or null when absent, null or blank. Numbers and booleans are read as text.
    public String optional(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be a string");
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    // Verbatim string value, kept untrimmed and possibly empty; null only when absent or null.
    public String text(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be a string");
        }
        return value.asText();
    }

    public String optional(String name, String fallback) {
        String value = optional(name);
        return value == null ? fallback : value;
    }

    public List<String> strings(String name) {
        JsonNode value = node.get(name);
        List<String> out = new ArrayList<>();
        if (value == null || value.isNull()) {
            return out;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (!item.isValueNode() || item.isNull()) {
                    throw new InvalidParamsException("Parameter '" + name + "' must be a list of strings");
                }
                if (!item.asText().isBlank()) {
                    out.add(item.asText().trim());
                }
            }
            return out;
        }
        if (value.isTextual()) {
            for (String part : value.asText().split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
            return out;
        }
        throw new InvalidParamsException("Parameter '" + name + "' must be a list of strings");
    }

    public LocalDate date(String name) {
        String value = optional(name);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidDateException("Could not parse date: " + value);
        }
    }

    public <T> T enumValue(String name, Function<String, T> parser, T fallback) {
        String value = optional(name);
        if (value == null) {
            return fallback;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsException("Invalid " + name + ": " + value);
        }
    }
}
