package io.aiorg.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.aiorg.error.ErrorCode;

public final class RpcProtocolException extends Exception {
    private final ErrorCode code;
    private final JsonNode id;

    public RpcProtocolException(ErrorCode code, String message, JsonNode id, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.id = id == null ? NullNode.getInstance() : id;
    }

    public ErrorCode code() {
        return code;
    }

    public JsonNode id() {
        return id;
    }

    public RpcResponse toResponse() {
        return RpcResponse.failure(id, code, getMessage());
    }
}
