package io.aiorg.error;

import java.util.List;
import java.util.Map;

public class ProjectNotFoundException extends AiorgException {
    private final List<String> suggestions;

    public ProjectNotFoundException(String project) {
        this(project, List.of());
    }

    public ProjectNotFoundException(String project, List<String> suggestions) {
        super(ErrorCode.PROJECT_NOT_FOUND, message(project, suggestions),
                suggestions.isEmpty() ? Map.of() : Map.of("suggestions", List.copyOf(suggestions)));
        this.suggestions = List.copyOf(suggestions);
    }

    public List<String> suggestions() {
        return suggestions;
    }

    private static String message(String project, List<String> suggestions) {
        String msg = "Project not found: " + project;
        if (!suggestions.isEmpty()) {
            msg += " (did you mean: " + String.join(", ", suggestions) + "?)";
        }
        return msg;
    }
}
