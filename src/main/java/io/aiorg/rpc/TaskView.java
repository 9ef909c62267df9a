package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.aiorg.model.Task;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        String id,
        String title,
        String status,
        LocalDateTime created,
        LocalDateTime updated,
        @JsonProperty("is_overdue") boolean isOverdue,
        @JsonProperty("is_due_today") boolean isDueToday,
        LocalDate due,
        String project,
        String waitingOn,
        String assignedTo,
        List<String> tags,
        String timeEstimate,
        LocalDateTime completed
) {
    public static TaskView of(Task task, LocalDate today) {
        return new TaskView(
                task.id(),
                task.title(),
                task.status().value(),
                task.created(),
                task.updated(),
                task.isOverdue(today),
                task.isDueToday(today),
                task.due(),
                task.project(),
                task.waitingOn(),
                task.assignedTo(),
                task.tags().isEmpty() ? null : task.tags(),
                task.timeEstimate(),
                task.completed()
        );
    }
}
