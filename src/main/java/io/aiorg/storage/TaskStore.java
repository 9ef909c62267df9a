package io.aiorg.storage;

import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface TaskStore {

    List<Task> list(TaskStatus status);

    Optional<Task> get(String id);

    // Id lookup first, then a case-insensitive title substring search over all statuses.
    Task find(String query);

    Task create(NewTask task);

    Task complete(String query);

    Task start(String query);

    Task defer(String query);

    Task waitOn(String query, String personLink);

    record NewTask(String title, LocalDate due, String project, TaskStatus status, List<String> tags) {
        public NewTask {
            status = status == null ? TaskStatus.INBOX : status;
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }
}
