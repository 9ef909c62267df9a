package io.aiorg.model;

public record Person(
        String id,
        String name,
        String team,
        String role,
        String email,
        String body
) {
}
