package io.aiorg.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.aiorg.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A markdown document split into its YAML frontmatter and body.
 *
 * <p>The on-disk form is {@code ---\n<yaml>---\n\n<body>}. A file without a leading {@code ---}
 * line has empty metadata and the whole text as body.
 */
public record Frontmatter(Map<String, Object> metadata, String body) {
    private static final String FENCE = "---";
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public Frontmatter {
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        body = body == null ? "" : body;
    }

    public static Frontmatter read(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public static Frontmatter parse(String text) {
        String normalized = text.replace("\r\n", "\n");
        if (!normalized.startsWith(FENCE + "\n")) {
            return new Frontmatter(Map.of(), normalized);
        }
        int start = FENCE.length() + 1;
        int end = findClosingFence(normalized, start);
        if (end < 0) {
            return new Frontmatter(Map.of(), normalized);
        }
        String yaml = normalized.substring(start, end);
        int bodyStart = normalized.indexOf('\n', end);
        String body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);
        return new Frontmatter(parseYaml(yaml), stripLeadingBlankLines(body));
    }

    public static void write(Path file, Map<String, Object> metadata, String body) {
        MarkdownFiles.writeAtomically(file, render(metadata, body));
    }

    public static String render(Map<String, Object> metadata, String body) {
        String yaml;
        try {
            yaml = metadata == null || metadata.isEmpty() ? "" : Jsons.yaml().writeValueAsString(toPlain(metadata));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize frontmatter", e);
        }
        if (!yaml.isEmpty() && !yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        return FENCE + "\n" + yaml + FENCE + "\n\n" + (body == null ? "" : body);
    }

    public String string(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public String string(String key, String fallback) {
        String value = string(key);
        return value == null ? fallback : value;
    }

    public LocalDate date(String key) {
        String value = string(key);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date in '" + key + "': " + value, e);
        }
    }

    public LocalDateTime dateTime(String key) {
        String value = string(key);
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            if (OFFSET_SUFFIX.matcher(value).find()) {
                return OffsetDateTime.parse(value).toLocalDateTime();
            }
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid datetime in '" + key + "': " + value, e);
        }
    }

    public List<String> strings(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
            return out;
        }
        return List.of(value.toString());
    }

    public String headingTitle() {
        for (String line : body.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("# ")) {
                return trimmed.substring(2).trim();
            }
        }
        return null;
    }

    private static int findClosingFence(String text, int from) {
        int pos = from;
        while (pos <= text.length()) {
            int lineEnd = text.indexOf('\n', pos);
            String line = lineEnd < 0 ? text.substring(pos) : text.substring(pos, lineEnd);
            if (line.trim().equals(FENCE)) {
                return pos;
            }
            if (lineEnd < 0) {
                return -1;
            }
            pos = lineEnd + 1;
        }
        return -1;
    }

    private static Map<String, Object> parseYaml(String yaml) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = Jsons.yaml().readValue(yaml, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid frontmatter: " + e.getOriginalMessage(), e);
        }
    }

    private static String stripLeadingBlankLines(String body) {
        int i = 0;
        while (i < body.length() && body.charAt(i) == '\n') {
            i++;
        }
        return body.substring(i);
    }

    private static Map<String, Object> toPlain(Map<String, Object> metadata) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : metadata.entrySet()) {
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            out.put(e.getKey(), value instanceof TemporalAccessor ? value.toString() : value);
        }
        return out;
    }
}
