package io.aiorg.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record Project(
        String id,
        String title,
        ProjectStatus status,
        String category,
        String team,
        LocalDate targetDate,
        LocalDateTime created,
        String body
) {
}
