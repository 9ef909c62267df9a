package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import io.aiorg.error.AmbiguousMatchException;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.error.ProjectNotFoundException;
import io.aiorg.model.Project;
import io.aiorg.model.ProjectStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class MarkdownProjectStore {
    private static final Logger log = LoggerFactory.getLogger(MarkdownProjectStore.class);

    private final AiorgConfig config;
    private final EntityIds ids;
    private final Clock clock;

    public MarkdownProjectStore(AiorgConfig config, EntityIds ids, Clock clock) {
        this.config = config;
        this.ids = ids;
        this.clock = clock;
    }

    public List<Project> listAll(ProjectStatus status) {
        config.ensureInitialized();
        List<Project> out = new ArrayList<>();
        for (Path file : MarkdownFiles.list(config.projectsDir())) {
            Optional<Project> project = readQuietly(file);
            if (project.isPresent() && (status == null || project.get().status() == status)) {
                out.add(project.get());
            }
        }
        out.sort((a, b) -> a.title().compareToIgnoreCase(b.title()));
        return out;
    }

    public List<String> names() {
        config.ensureInitialized();
        List<String> out = new ArrayList<>();
        for (Path file : MarkdownFiles.list(config.projectsDir())) {
            out.add(MarkdownFiles.stem(file));
        }
        return out;
    }

    public Project find(String query) {
        config.ensureInitialized();
        if (query == null || query.isBlank()) {
            throw new InvalidParamsException("Project name is required");
        }
        String trimmed = query.trim();
        String id = EntityIds.isValid(trimmed) ? EntityIds.normalize(trimmed) : null;
        String needle = trimmed.toLowerCase(Locale.ROOT);
        List<Project> matches = new ArrayList<>();
        for (Path file : MarkdownFiles.list(config.projectsDir())) {
            Optional<Project> p = readQuietly(file);
            if (p.isEmpty()) {
                continue;
            }
            if (id != null && id.equalsIgnoreCase(p.get().id())) {
                return p.get();
            }
            if (p.get().title().toLowerCase(Locale.ROOT).contains(needle)
                    || MarkdownFiles.stem(file).toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(p.get());
            }
        }
        if (matches.isEmpty()) {
            throw new ProjectNotFoundException(trimmed, NameSuggestions.similar(trimmed, names()));
        }
        if (matches.size() > 1) {
            List<String> matchIds = new ArrayList<>();
            for (Project p : matches) {
                matchIds.add(p.id());
            }
            throw new AmbiguousMatchException(trimmed, matchIds);
        }
        return matches.get(0);
    }

    public Project create(String name, ProjectStatus status, String team) {
        config.ensureInitialized();
        String title = name.trim();
        Project project = new Project(
                ids.next(),
                title,
                status == null ? ProjectStatus.ACTIVE : status,
                "project",
                team,
                null,
                LocalDateTime.now(clock),
                body(title)
        );
        Path file = config.projectsDir().resolve(Slugs.nameSlug(title) + ".md");
        Frontmatter.write(file, toMetadata(project), project.body());
        log.debug("Created project {} at {}", project.id(), file);
        return project;
    }

    public String link(Project project) {
        return "[[" + AiorgConfig.AIO_DIR + "/Projects/" + Slugs.nameSlug(project.title()) + "]]";
    }

    private Optional<Project> readQuietly(Path file) {
        try {
            return Optional.of(read(file));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed project file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Project read(Path file) {
        Frontmatter doc = Frontmatter.read(file);
        LocalDateTime created = doc.dateTime("created");
        return new Project(
                doc.string("id", "????"),
                doc.string("title", MarkdownFiles.stem(file)),
                ProjectStatus.fromString(doc.string("status")),
                doc.string("category", "project"),
                doc.string("team"),
                doc.date("targetDate"),
                created == null ? lastModified(file) : created,
                doc.body()
        );
    }

    private LocalDateTime lastModified(Path file) {
        try {
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), clock.getZone());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + file, e);
        }
    }

    private static Map<String, Object> toMetadata(Project p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", p.id());
        m.put("type", "project");
        m.put("title", p.title());
        m.put("status", p.status().value());
        m.put("category", p.category());
        if (p.team() != null) m.put("team", p.team());
        if (p.targetDate() != null) m.put("targetDate", p.targetDate());
        m.put("created", p.created());
        return m;
    }

    private static String body(String name) {
        String link = "AIO/Projects/" + Slugs.nameSlug(name);
        return "# " + name + "\n\n"
                + "## Overview\n\n"
                + "## Goals\n\n"
                + "## Backlog\n\n"
                + "```dataview\n"
                + "TABLE due AS \"Due\", status AS \"Status\"\n"
                + "FROM \"AIO/Tasks\"\n"
                + "WHERE contains(project, link(\"" + link + "\")) AND status != \"completed\"\n"
                + "SORT due ASC\n"
                + "```\n\n"
                + "## Previous Actions\n\n"
                + "```dataview\n"
                + "TABLE due AS \"Due\", completed AS \"Completed\"\n"
                + "FROM \"AIO/Tasks\"\n"
                + "WHERE contains(project, link(\"" + link + "\")) AND status = \"completed\"\n"
                + "SORT completed DESC\n"
                + "```\n\n"
                + "## Supporting Material\n\n"
                + "## Notes\n";
    }
}
