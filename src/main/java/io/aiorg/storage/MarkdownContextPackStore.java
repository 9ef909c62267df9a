package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import io.aiorg.error.ContextPackExistsException;
import io.aiorg.error.ContextPackNotFoundException;
import io.aiorg.error.FileOutsideVaultException;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.model.ContextPack;
import io.aiorg.model.ContextPackCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Context packs under {@code AIO/Context-Packs/<Category>/<slug>.md}. The slug of the title is the
 * pack id and is unique across categories.
 */
public final class MarkdownContextPackStore {
    private static final Logger log = LoggerFactory.getLogger(MarkdownContextPackStore.class);
    private static final String SEPARATOR = "\n\n---\n\n";

    private final AiorgConfig config;
    private final Clock clock;

    public MarkdownContextPackStore(AiorgConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public List<ContextPack> list(ContextPackCategory category) {
        config.ensureInitialized();
        List<ContextPack> out = new ArrayList<>();
        for (ContextPackCategory c : categories(category)) {
            for (Path file : MarkdownFiles.list(config.contextPacksFolder(c))) {
                readQuietly(file, c).ifPresent(out::add);
            }
        }
        out.sort((a, b) -> a.title().compareToIgnoreCase(b.title()));
        return out;
    }

    public ContextPack find(String query) {
        config.ensureInitialized();
        if (query == null || query.isBlank()) {
            throw new InvalidParamsException("Context pack name is required");
        }
        String trimmed = query.trim();
        Optional<Located> exact = locate(trimmed);
        if (exact.isPresent()) {
            return read(exact.get().file(), exact.get().category());
        }
        String needle = trimmed.toLowerCase(Locale.ROOT);
        for (ContextPack pack : list(null)) {
            if (pack.title().toLowerCase(Locale.ROOT).contains(needle)) {
                return pack;
            }
        }
        throw new ContextPackNotFoundException("No context pack found matching: " + trimmed);
    }

    public ContextPack create(String title, ContextPackCategory category, String content,
                              String description, List<String> tags) {
        config.ensureInitialized();
        String id = Slugs.slugify(title);
        if (id.isEmpty()) {
            throw new InvalidParamsException("Context pack title must contain letters or digits");
        }
        if (locate(id).isPresent()) {
            throw new ContextPackExistsException("Context pack '" + id + "' already exists. Use add_to_context_pack to extend it.");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String body = "# " + title.trim() + "\n\n" + (content == null || content.isBlank() ? "## Overview\n\n" : content);
        ContextPack pack = new ContextPack(id, title.trim(), category, description, tags, now, now, body);
        Path file = config.contextPacksFolder(category).resolve(id + ".md");
        Frontmatter.write(file, toMetadata(pack), body);
        log.debug("Created context pack {} in {}", id, category.value());
        return pack;
    }

    public ContextPack append(String query, String content, String section) {
        ContextPack pack = find(query);
        Located located = locate(pack.id())
                .orElseThrow(() -> new ContextPackNotFoundException("Context pack file not found: " + pack.id()));
        String body = section == null || section.isBlank()
                ? appendToEnd(pack.body(), content)
                : appendToSection(pack.body(), content, section.trim());
        ContextPack updated = pack.withBody(body, LocalDateTime.now(clock));
        Frontmatter.write(located.file(), toMetadata(updated), body);
        return updated;
    }

    public ContextPack appendFile(String query, String filePath, String section) {
        config.ensureInitialized();
        Path source = resolveVaultFile(filePath);
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
        String relative = config.vaultRoot().relativize(source).toString().replace('\\', '/');
        if (relative.endsWith(".md")) {
            relative = relative.substring(0, relative.length() - 3);
        }
        return append(query, "> From: [[" + relative + "]]\n\n" + text, section);
    }

    public Bundle bundle(List<String> names) {
        config.ensureInitialized();
        List<String> parts = new ArrayList<>();
        List<String> found = new ArrayList<>();
        for (String name : names) {
            if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
                continue;
            }
            Optional<Path> file = rawPackFile(name.trim());
            if (file.isEmpty()) {
                continue;
            }
            try {
                parts.add("# Context: " + name.trim() + "\n\n" + Files.readString(file.get(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file.get(), e);
            }
            found.add(name.trim());
        }
        return new Bundle(String.join(SEPARATOR, parts), found);
    }

    Path resolveVaultFile(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new InvalidParamsException("File path is required");
        }
        Path vault = config.vaultRoot();
        Path raw = Paths.get(filePath.trim());
        Path candidate;
        if (raw.isAbsolute()) {
            candidate = raw.normalize();
        } else {
            candidate = config.aioDir().resolve(raw).normalize();
            if (!Files.exists(candidate)) {
                candidate = vault.resolve(raw).normalize();
            }
        }
        if (!candidate.startsWith(vault)) {
            throw new FileOutsideVaultException(filePath);
        }
        if (Files.exists(candidate)) {
            try {
                if (!candidate.toRealPath().startsWith(vault.toRealPath())) {
                    throw new FileOutsideVaultException(filePath);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to resolve " + candidate, e);
            }
        }
        if (!Files.isRegularFile(candidate)) {
            throw new InvalidParamsException("Source file not found: " + filePath);
        }
        return candidate;
    }

    static String appendToEnd(String body, String content) {
        return stripTrailing(body) + "\n\n" + content;
    }

    static String appendToSection(String body, String content, String section) {
        Pattern heading = Pattern.compile("(?im)^## " + Pattern.quote(section) + ".*$");
        Matcher m = heading.matcher(body);
        if (!m.find()) {
            return appendToEnd(body, content);
        }
        int next = body.indexOf("\n## ", m.end());
        int insertAt = next < 0 ? body.length() : next;
        String before = stripTrailing(body.substring(0, insertAt));
        String rest = body.substring(insertAt);
        return before + "\n\n" + content + (rest.isEmpty() ? "" : "\n" + rest);
    }

    private Optional<Path> rawPackFile(String name) {
        for (ContextPackCategory c : ContextPackCategory.values()) {
            Path file = config.contextPacksFolder(c).resolve(name + ".md");
            if (Files.isRegularFile(file)) {
                return Optional.of(file);
            }
        }
        Path flat = config.contextPacksDir().resolve(name + ".md");
        return Files.isRegularFile(flat) ? Optional.of(flat) : Optional.empty();
    }

    private Optional<Located> locate(String id) {
        for (ContextPackCategory c : ContextPackCategory.values()) {
            Path folder = config.contextPacksFolder(c);
            Path exact = folder.resolve(id + ".md");
            if (Files.isRegularFile(exact)) {
                return Optional.of(new Located(exact, c));
            }
            for (Path file : MarkdownFiles.list(folder)) {
                if (MarkdownFiles.stem(file).equalsIgnoreCase(id)) {
                    return Optional.of(new Located(file, c));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ContextPack> readQuietly(Path file, ContextPackCategory category) {
        try {
            return Optional.of(read(file, category));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed context pack {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private ContextPack read(Path file, ContextPackCategory folderCategory) {
        Frontmatter doc = Frontmatter.read(file);
        String title = doc.string("title");
        if (title == null) {
            title = doc.headingTitle();
        }
        if (title == null) {
            title = MarkdownFiles.stem(file).replace('-', ' ');
        }
        String category = doc.string("category");
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime created = doc.dateTime("created");
        LocalDateTime updated = doc.dateTime("updated");
        return new ContextPack(
                doc.string("id", MarkdownFiles.stem(file)),
                title,
                category == null ? folderCategory : ContextPackCategory.fromString(category),
                doc.string("description"),
                doc.strings("tags"),
                created == null ? now : created,
                updated == null ? now : updated,
                doc.body()
        );
    }

    private static Map<String, Object> toMetadata(ContextPack pack) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", pack.id());
        m.put("type", "context-pack");
        m.put("category", pack.category().value());
        m.put("title", pack.title());
        if (pack.description() != null) m.put("description", pack.description());
        if (!pack.tags().isEmpty()) m.put("tags", pack.tags());
        m.put("created", pack.created());
        m.put("updated", pack.updated());
        return m;
    }

    private static List<ContextPackCategory> categories(ContextPackCategory only) {
        return only == null ? List.of(ContextPackCategory.values()) : List.of(only);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    public record Bundle(String content, List<String> packsFound) {
        public Bundle {
            packsFound = List.copyOf(packsFound);
        }
    }

    private record Located(Path file, ContextPackCategory category) {
    }
}
