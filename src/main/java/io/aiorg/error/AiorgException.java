package io.aiorg.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class AiorgException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> details;

    public AiorgException(ErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public AiorgException(ErrorCode code, String message, Map<String, ?> details) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.details = copy(details);
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage()
                + (details.isEmpty() ? "" : ", details=" + details) + '}';
    }
}
