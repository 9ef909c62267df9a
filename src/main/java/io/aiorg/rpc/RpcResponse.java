package io.aiorg.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.aiorg.error.ErrorCode;

public record RpcResponse(JsonNode id, Object result, RpcError error) {
    public RpcResponse {
        id = id == null ? NullNode.getInstance() : id;
    }

    public static RpcResponse success(JsonNode id, Object result) {
        return new RpcResponse(id, result, null);
    }

    public static RpcResponse failure(JsonNode id, RpcError error) {
        return new RpcResponse(id, null, error);
    }

    public static RpcResponse failure(JsonNode id, ErrorCode code, String message) {
        return new RpcResponse(id, null, RpcError.of(code, message));
    }

    public boolean isError() {
        return error != null;
    }
}
