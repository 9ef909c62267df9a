package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import io.aiorg.error.AmbiguousMatchException;
import io.aiorg.error.FileOutsideVaultException;
import io.aiorg.error.InvalidParamsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class VaultFiles {
    private static final Logger log = LoggerFactory.getLogger(VaultFiles.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final AiorgConfig config;
    private final Clock clock;

    public VaultFiles(AiorgConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public Content get(String query) {
        config.ensureInitialized();
        Path file = resolve(query, false);
        if (!Files.isRegularFile(file)) {
            throw new InvalidParamsException("File not found: " + query);
        }
        try {
            return new Content(relative(file), Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    // Path queries may name a new file; id and title queries must match an existing one.
    public Written set(String query, String content) {
        config.ensureInitialized();
        if (content == null) {
            throw new InvalidParamsException("Missing required parameter: content");
        }
        Path file = resolve(query, true);
        String backup = null;
        if (Files.isRegularFile(file)) {
            backup = relative(backup(file));
        }
        MarkdownFiles.writeAtomically(file, content);
        log.debug("Wrote {} (backup {})", file, backup);
        return new Written(relative(file), backup, file.startsWith(config.tasksRoot()));
    }

    Path resolve(String query, boolean allowNew) {
        if (query == null || query.isBlank()) {
            throw new InvalidParamsException("Missing required parameter: query");
        }
        String trimmed = query.trim();
        boolean pathLike = trimmed.contains("/") || trimmed.contains("\\") || trimmed.endsWith(".md");

        if (EntityIds.isValid(trimmed) && !pathLike) {
            Optional<Path> byId = findById(EntityIds.normalize(trimmed));
            if (byId.isPresent()) {
                return byId.get();
            }
        }
        if (pathLike) {
            Path path = insideVault(trimmed);
            if (allowNew || Files.exists(path)) {
                return path;
            }
        }
        List<Path> matches = findByTitle(trimmed);
        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.size() > 1) {
            throw new AmbiguousMatchException(trimmed, matches.stream().map(this::relative).collect(Collectors.toList()));
        }
        throw new InvalidParamsException("File not found: " + trimmed);
    }

    private Path insideVault(String raw) {
        Path vault = config.vaultRoot();
        Path path = Paths.get(raw);
        Path candidate = (path.isAbsolute() ? path : vault.resolve(path)).normalize();
        if (!candidate.startsWith(vault)) {
            throw new FileOutsideVaultException(raw);
        }
        if (Files.exists(candidate)) {
            try {
                if (!candidate.toRealPath().startsWith(vault.toRealPath())) {
                    throw new FileOutsideVaultException(raw);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to resolve " + candidate, e);
            }
        }
        return candidate;
    }

    private Optional<Path> findById(String id) {
        for (Path file : candidates()) {
            Optional<Frontmatter> doc = readQuietly(file);
            if (doc.isPresent() && id.equalsIgnoreCase(doc.get().string("id", ""))) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    private List<Path> findByTitle(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<Path> out = new ArrayList<>();
        for (Path file : candidates()) {
            Optional<Frontmatter> doc = readQuietly(file);
            if (doc.isEmpty()) {
                continue;
            }
            String title = doc.get().string("title", doc.get().headingTitle());
            if (title != null && title.toLowerCase(Locale.ROOT).contains(needle)) {
                out.add(file);
            }
        }
        return out;
    }

    private List<Path> candidates() {
        Path aio = config.aioDir();
        Path backups = config.backupDir();
        if (!Files.isDirectory(aio)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(aio)) {
            return walk.filter(MarkdownFiles::isMarkdown)
                    .filter(p -> !p.startsWith(backups))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + aio, e);
        }
    }

    private Path backup(Path file) {
        Path relative = config.vaultRoot().relativize(file);
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        Path dir = relative.getParent() == null ? config.backupDir() : config.backupDir().resolve(relative.getParent());
        Path target = dir.resolve(stem + "-" + BACKUP_STAMP.format(LocalDateTime.now(clock)) + ext);
        try {
            Files.createDirectories(dir);
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up " + file, e);
        }
        return target;
    }

    private Optional<Frontmatter> readQuietly(Path file) {
        try {
            return Optional.of(Frontmatter.read(file));
        } catch (RuntimeException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private String relative(Path file) {
        return config.vaultRoot().relativize(file).toString().replace('\\', '/');
    }

    public record Content(String file, String content) {
    }

    public record Written(String file, String backup, boolean underTasks) {
    }
}
