package io.aiorg.model;

import java.util.Locale;

public enum ProjectStatus {
    ACTIVE("active"),
    ON_HOLD("on-hold"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ProjectStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ProjectStatus status : values()) {
            if (status.value.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown project status: " + raw);
    }
}
