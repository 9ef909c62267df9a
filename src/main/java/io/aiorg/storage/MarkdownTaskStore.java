package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import io.aiorg.error.AmbiguousMatchException;
import io.aiorg.error.TaskNotFoundException;
import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class MarkdownTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(MarkdownTaskStore.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final AiorgConfig config;
    private final EntityIds ids;
    private final Clock clock;

    public MarkdownTaskStore(AiorgConfig config, EntityIds ids, Clock clock) {
        this.config = config;
        this.ids = ids;
        this.clock = clock;
    }

    @Override
    public List<Task> list(TaskStatus status) {
        config.ensureInitialized();
        List<Task> out = new ArrayList<>();
        for (Path file : taskFiles(status)) {
            readQuietly(file).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public Optional<Task> get(String id) {
        if (!EntityIds.isValid(id)) {
            return Optional.empty();
        }
        return locate(EntityIds.normalize(id)).map(Located::task);
    }

    @Override
    public Task find(String query) {
        if (query == null || query.isBlank()) {
            throw new TaskNotFoundException("Task query is empty");
        }
        String trimmed = query.trim();
        Optional<Task> byId = get(trimmed);
        if (byId.isPresent()) {
            return byId.get();
        }
        String needle = trimmed.toLowerCase(Locale.ROOT);
        List<Task> matches = new ArrayList<>();
        for (TaskStatus status : TaskStatus.values()) {
            for (Task task : list(status)) {
                if (task.title().toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(task);
                }
            }
        }
        if (matches.isEmpty()) {
            throw new TaskNotFoundException("No task found matching: " + trimmed);
        }
        if (matches.size() > 1) {
            List<String> matchIds = new ArrayList<>();
            for (Task t : matches) {
                matchIds.add(t.id());
            }
            throw new AmbiguousMatchException(trimmed, matchIds);
        }
        return matches.get(0);
    }

    @Override
    public Task create(NewTask spec) {
        config.ensureInitialized();
        LocalDateTime now = LocalDateTime.now(clock);
        Task task = new Task(
                ids.next(),
                spec.title().trim(),
                spec.status(),
                spec.due(),
                now,
                now,
                spec.status() == TaskStatus.COMPLETED ? now : null,
                spec.project(),
                null,
                null,
                List.of(),
                List.of(),
                spec.tags(),
                null,
                null,
                "# " + spec.title().trim() + "\n\n## Notes\n"
        );
        Path file = folderFor(task).resolve(fileName(task));
        if (Files.exists(file)) {
            file = file.resolveSibling(MarkdownFiles.stem(file) + "-" + task.id().toLowerCase(Locale.ROOT) + ".md");
        }
        Frontmatter.write(file, toMetadata(task), task.body());
        log.debug("Created task {} at {}", task.id(), file);
        return task;
    }

    @Override
    public Task complete(String query) {
        return moveTo(find(query), TaskStatus.COMPLETED);
    }

    @Override
    public Task start(String query) {
        return moveTo(find(query), TaskStatus.NEXT);
    }

    @Override
    public Task defer(String query) {
        return moveTo(find(query), TaskStatus.SOMEDAY);
    }

    @Override
    public Task waitOn(String query, String personLink) {
        Task task = find(query);
        if (personLink != null && !personLink.isBlank()) {
            task = task.withWaitingOn(personLink);
        }
        return moveTo(task, TaskStatus.WAITING);
    }

    private Task moveTo(Task task, TaskStatus newStatus) {
        Located current = locate(task.id())
                .orElseThrow(() -> new TaskNotFoundException("Task file not found: " + task.id()));
        Task updated = task.withStatus(newStatus, LocalDateTime.now(clock));
        Path target = folderFor(updated).resolve(current.file().getFileName());
        Frontmatter.write(target, toMetadata(updated), updated.body());
        if (!target.equals(current.file())) {
            try {
                Files.deleteIfExists(current.file());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to remove old task file " + current.file(), e);
            }
        }
        log.debug("Moved task {} from {} to {}", updated.id(), task.status().value(), newStatus.value());
        return updated;
    }

    private Path folderFor(Task task) {
        if (task.status() == TaskStatus.COMPLETED) {
            LocalDateTime when = task.completed() == null ? LocalDateTime.now(clock) : task.completed();
            return config.completedFolder(when.getYear(), when.getMonthValue());
        }
        return config.tasksFolder(task.status());
    }

    private List<Path> taskFiles(TaskStatus status) {
        Path folder = config.tasksFolder(status);
        List<Path> files = new ArrayList<>(MarkdownFiles.list(folder));
        if (status == TaskStatus.COMPLETED) {
            for (Path year : MarkdownFiles.subdirectories(folder)) {
                if (!MarkdownFiles.isDigits(year.getFileName().toString())) {
                    continue;
                }
                for (Path month : MarkdownFiles.subdirectories(year)) {
                    files.addAll(MarkdownFiles.list(month));
                }
            }
        }
        return files;
    }

    private Optional<Located> locate(String normalizedId) {
        for (TaskStatus status : TaskStatus.values()) {
            for (Path file : taskFiles(status)) {
                Optional<Task> task = readQuietly(file);
                if (task.isPresent() && normalizedId.equalsIgnoreCase(task.get().id())) {
                    return Optional.of(new Located(file, task.get()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Task> readQuietly(Path file) {
        try {
            return Optional.of(readTask(file));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed task file {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (UncheckedIOException e) {
            // Deleted between listing and reading: another writer moved it.
            if (Files.exists(file)) {
                throw e;
            }
            return Optional.empty();
        }
    }

    Task readTask(Path file) {
        Frontmatter doc = Frontmatter.read(file);
        LocalDateTime fallback = LocalDateTime.now(clock);
        String title = doc.headingTitle();
        if (title == null) {
            title = titleFromFileName(MarkdownFiles.stem(file));
        }
        String id = doc.string("id", "????");
        LocalDateTime created = doc.dateTime("created");
        LocalDateTime updated = doc.dateTime("updated");
        return new Task(
                EntityIds.isValid(id) ? EntityIds.normalize(id) : id,
                title,
                TaskStatus.fromString(doc.string("status", TaskStatus.INBOX.value())),
                doc.date("due"),
                created == null ? fallback : created,
                updated == null ? fallback : updated,
                doc.dateTime("completed"),
                doc.string("project"),
                doc.string("assignedTo"),
                doc.string("waitingOn"),
                doc.strings("blockedBy"),
                doc.strings("blocks"),
                doc.strings("tags"),
                doc.string("timeEstimate"),
                doc.string("jiraKey"),
                doc.body()
        );
    }

    static Map<String, Object> toMetadata(Task task) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", task.id());
        m.put("type", "task");
        m.put("status", task.status().value());
        putIfPresent(m, "due", task.due());
        putIfPresent(m, "project", task.project());
        putIfPresent(m, "assignedTo", task.assignedTo());
        putIfPresent(m, "waitingOn", task.waitingOn());
        if (!task.blockedBy().isEmpty()) m.put("blockedBy", task.blockedBy());
        if (!task.blocks().isEmpty()) m.put("blocks", task.blocks());
        if (!task.tags().isEmpty()) m.put("tags", task.tags());
        putIfPresent(m, "timeEstimate", task.timeEstimate());
        putIfPresent(m, "jiraKey", task.jiraKey());
        m.put("created", task.created());
        m.put("updated", task.updated());
        putIfPresent(m, "completed", task.completed());
        return m;
    }

    static String fileName(Task task) {
        return FILE_DATE.format(task.created()) + "-" + Slugs.slugify(task.title()) + ".md";
    }

    private static String titleFromFileName(String stem) {
        String name = stem;
        if (name.length() > 11 && name.charAt(4) == '-' && name.charAt(7) == '-') {
            name = name.substring(11);
        }
        StringBuilder sb = new StringBuilder();
        for (String word : name.split("-")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    private static void putIfPresent(Map<String, Object> m, String key, Object value) {
        if (value != null) {
            m.put(key, value);
        }
    }

    private record Located(Path file, Task task) {
    }
}
