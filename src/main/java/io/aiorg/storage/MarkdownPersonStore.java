package io.aiorg.storage;

import io.aiorg.config.AiorgConfig;
import io.aiorg.error.AmbiguousMatchException;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.error.PersonNotFoundException;
import io.aiorg.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class MarkdownPersonStore {
    private static final Logger log = LoggerFactory.getLogger(MarkdownPersonStore.class);

    private final AiorgConfig config;
    private final EntityIds ids;

    public MarkdownPersonStore(AiorgConfig config, EntityIds ids) {
        this.config = config;
        this.ids = ids;
    }

    public List<Person> listAll() {
        config.ensureInitialized();
        List<Person> out = new ArrayList<>();
        for (Path file : MarkdownFiles.list(config.peopleDir())) {
            readQuietly(file).ifPresent(out::add);
        }
        out.sort((a, b) -> a.name().compareToIgnoreCase(b.name()));
        return out;
    }

    // Id, then exact normalized name, then name substring.
    public Person find(String query) {
        config.ensureInitialized();
        if (query == null || query.isBlank()) {
            throw new InvalidParamsException("Person name is required");
        }
        String trimmed = query.trim();
        List<Person> all = listAll();
        if (EntityIds.isValid(trimmed)) {
            for (Person p : all) {
                if (trimmed.equalsIgnoreCase(p.id())) {
                    return p;
                }
            }
        }
        String normalized = Slugs.normalizeName(trimmed);
        for (Person p : all) {
            if (Slugs.normalizeName(p.name()).equals(normalized)) {
                return p;
            }
        }
        String needle = trimmed.toLowerCase(Locale.ROOT);
        List<Person> matches = new ArrayList<>();
        for (Person p : all) {
            if (p.name().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(p);
            }
        }
        if (matches.isEmpty()) {
            List<String> names = new ArrayList<>();
            for (Person p : all) {
                names.add(p.name());
            }
            List<String> suggestions = NameSuggestions.similar(trimmed, names);
            String msg = "Person not found: " + trimmed;
            if (!suggestions.isEmpty()) {
                msg += " (did you mean: " + String.join(", ", suggestions) + "?)";
            }
            throw new PersonNotFoundException(msg);
        }
        if (matches.size() > 1) {
            List<String> matchIds = new ArrayList<>();
            for (Person p : matches) {
                matchIds.add(p.id());
            }
            throw new AmbiguousMatchException(trimmed, matchIds);
        }
        return matches.get(0);
    }

    public Person create(String name, String team, String role, String email) {
        config.ensureInitialized();
        String trimmed = name.trim();
        Person person = new Person(ids.next(), trimmed, team, role, email, body(trimmed));
        Path file = config.peopleDir().resolve(Slugs.nameSlug(trimmed) + ".md");
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", person.id());
        m.put("type", "person");
        m.put("name", person.name());
        if (team != null) m.put("team", team);
        if (role != null) m.put("role", role);
        if (email != null) m.put("email", email);
        Frontmatter.write(file, m, person.body());
        log.debug("Created person {} at {}", person.id(), file);
        return person;
    }

    public String link(Person person) {
        return "[[" + AiorgConfig.AIO_DIR + "/People/" + Slugs.nameSlug(person.name()) + "]]";
    }

    private Optional<Person> readQuietly(Path file) {
        try {
            Frontmatter doc = Frontmatter.read(file);
            String stem = MarkdownFiles.stem(file);
            return Optional.of(new Person(
                    doc.string("id", "????"),
                    doc.string("name", stem.replace('-', ' ')),
                    doc.string("team"),
                    doc.string("role"),
                    doc.string("email"),
                    doc.body()
            ));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed person file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String body(String name) {
        String link = "AIO/People/" + Slugs.nameSlug(name);
        return "# " + name + "\n\n"
                + "## Notes\n\n"
                + "## Tasks Delegated\n\n"
                + "```dataview\n"
                + "TABLE due AS \"Due\", status AS \"Status\"\n"
                + "FROM \"AIO/Tasks\"\n"
                + "WHERE contains(waitingOn, link(\"" + link + "\")) AND status != \"completed\"\n"
                + "SORT due ASC\n"
                + "```\n\n"
                + "## Previously Completed Tasks\n\n"
                + "```dataview\n"
                + "TABLE due AS \"Due\", completed AS \"Completed\"\n"
                + "FROM \"AIO/Tasks\"\n"
                + "WHERE contains(waitingOn, link(\"" + link + "\")) AND status = \"completed\"\n"
                + "SORT completed DESC\n"
                + "```\n\n"
                + "## Interactions\n";
    }
}
