package io.aiorg.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record Task(
        String id,
        String title,
        TaskStatus status,
        LocalDate due,
        LocalDateTime created,
        LocalDateTime updated,
        LocalDateTime completed,
        String project,
        String assignedTo,
        String waitingOn,
        List<String> blockedBy,
        List<String> blocks,
        List<String> tags,
        String timeEstimate,
        String jiraKey,
        String body
) {
    public Task {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        tags = tags == null ? List.of() : List.copyOf(tags);
        body = body == null ? "" : body;
    }

    public boolean isOverdue(LocalDate today) {
        return due != null && status != TaskStatus.COMPLETED && due.isBefore(today);
    }

    public boolean isDueToday(LocalDate today) {
        return due != null && due.isEqual(today);
    }

    public Task withStatus(TaskStatus newStatus, LocalDateTime now) {
        return new Task(id, title, newStatus, due, created, now,
                newStatus == TaskStatus.COMPLETED ? now : completed,
                project, assignedTo, waitingOn, blockedBy, blocks, tags, timeEstimate, jiraKey, body);
    }

    public Task withWaitingOn(String person) {
        return new Task(id, title, status, due, created, updated, completed,
                project, assignedTo, person, blockedBy, blocks, tags, timeEstimate, jiraKey, body);
    }
}
