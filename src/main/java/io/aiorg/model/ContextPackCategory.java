package io.aiorg.model;

import java.util.Locale;

public enum ContextPackCategory {
    DOMAIN("domain", "Domains"),
    SYSTEM("system", "Systems"),
    OPERATING("operating", "Operating");

    private final String value;
    private final String folderName;

    ContextPackCategory(String value, String folderName) {
        this.value = value;
        this.folderName = folderName;
    }

    public String value() {
        return value;
    }

    public String folderName() {
        return folderName;
    }

    public static ContextPackCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Context pack category is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ContextPackCategory category : values()) {
            if (category.value.equals(normalized) || category.folderName.equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown context pack category: " + raw);
    }
}
