package io.aiorg.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aiorg.util.Jsons;

public record RpcRequest(JsonNode id, String method, ObjectNode params) {
    public RpcRequest {
        id = id == null ? NullNode.getInstance() : id;
        params = params == null ? Jsons.mapper().createObjectNode() : params;
    }

    public static RpcRequest of(Object id, String method, ObjectNode params) {
        return new RpcRequest(Jsons.mapper().valueToTree(id), method, params);
    }
}
