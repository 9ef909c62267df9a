package io.aiorg.error;

import java.util.List;
import java.util.Map;

public class AmbiguousMatchException extends AiorgException {
    private final String query;
    private final List<String> matches;

    public AmbiguousMatchException(String query, List<String> matches) {
        super(ErrorCode.AMBIGUOUS_MATCH,
                "Query '" + query + "' matches multiple entities: " + String.join(", ", matches),
                Map.of("query", query, "matches", List.copyOf(matches)));
        this.query = query;
        this.matches = List.copyOf(matches);
    }

    public String query() {
        return query;
    }

    public List<String> matches() {
        return matches;
    }
}
