package io.aiorg.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.aiorg.error.ErrorCode;

import java.util.Optional;

public final class DaemonCallException extends DaemonException {
    private final int code;
    private final JsonNode data;

    public DaemonCallException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public Optional<ErrorCode> errorCode() {
        return ErrorCode.fromCode(code);
    }

    public JsonNode data() {
        return data;
    }
}
