package io.aiorg.model;

import java.util.Locale;

public enum TaskStatus {
    INBOX("inbox"),
    NEXT("next"),
    WAITING("waiting"),
    SCHEDULED("scheduled"),
    SOMEDAY("someday"),
    COMPLETED("completed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String folderName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    public boolean activeByDefault() {
        return this != COMPLETED && this != SOMEDAY;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
