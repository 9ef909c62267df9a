package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class EntityIds {
    public static final String ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZ";
    public static final int LENGTH = 4;

    private static final Logger log = LoggerFactory.getLogger(EntityIds.class);
    private static final Pattern ID_PATTERN = Pattern.compile("^[" + ALPHABET + "]{" + LENGTH + "}$", Pattern.CASE_INSENSITIVE);
    private static final int MAX_ATTEMPTS = 100;

    private final AiorgConfig config;

    public EntityIds(AiorgConfig config) {
        this.config = config;
    }

    public static boolean isValid(String raw) {
        return raw != null && ID_PATTERN.matcher(raw.trim()).matches();
    }

    public static String normalize(String raw) {
        if (!isValid(raw)) {
            throw new IllegalArgumentException("Invalid id: " + raw);
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    public static String random() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            out[i] = ALPHABET.charAt(rnd.nextInt(ALPHABET.length()));
        }
        return new String(out);
    }

    public synchronized String next() {
        Set<String> taken = existingIds();
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String candidate = random();
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Failed to generate a unique id after " + MAX_ATTEMPTS + " attempts");
    }

    Set<String> existingIds() {
        Set<String> ids = new HashSet<>();
        collect(config.tasksRoot(), ids);
        collect(config.projectsDir(), ids);
        collect(config.peopleDir(), ids);
        collect(config.archiveDir(), ids);
        return ids;
    }

    private static void collect(Path root, Set<String> ids) {
        if (!Files.isDirectory(root)) {
            return;
        }
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(MarkdownFiles::isMarkdown).forEach(file -> {
                try {
                    String id = Frontmatter.read(file).string("id");
                    if (isValid(id)) {
                        ids.add(normalize(id));
                    }
                } catch (RuntimeException e) {
                    log.debug("Skipping unreadable file while collecting ids: {}", file, e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan ids under " + root, e);
        }
    }
}
