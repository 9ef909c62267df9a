package io.aiorg.model;

import java.time.LocalDateTime;
import java.util.List;

public record ContextPack(
        String id,
        String title,
        ContextPackCategory category,
        String description,
        List<String> tags,
        LocalDateTime created,
        LocalDateTime updated,
        String body
) {
    public ContextPack {
        tags = tags == null ? List.of() : List.copyOf(tags);
        body = body == null ? "" : body;
    }

    public ContextPack withBody(String newBody, LocalDateTime now) {
        return new ContextPack(id, title, category, description, tags, created, now, newBody);
    }
}
