package io.aiorg.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aiorg.error.ErrorCode;
import io.aiorg.util.Jsons;

import java.nio.charset.StandardCharsets;

public final class RpcCodec {
    public static final String VERSION = "2.0";

    private RpcCodec() {
    }

    public static RpcRequest decode(byte[] body) throws RpcProtocolException {
        return decode(new String(body, StandardCharsets.UTF_8));
    }

    public static RpcRequest decode(String body) throws RpcProtocolException {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcProtocolException(ErrorCode.PARSE_ERROR, "Parse error: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || root.isMissingNode()) {
            throw new RpcProtocolException(ErrorCode.PARSE_ERROR, "Parse error: empty message", null, null);
        }
        if (!root.isObject()) {
            throw invalid("Request must be a JSON object", null);
        }
        JsonNode id = root.get("id");
        if (id != null && !(id.isNull() || id.isIntegralNumber() || id.isTextual())) {
            throw invalid("Request id must be a string, an integer or null", null);
        }
        JsonNode version = root.get("jsonrpc");
        if (version != null && !(version.isTextual() && VERSION.equals(version.asText()))) {
            throw invalid("Unsupported jsonrpc version: " + version, id);
        }
        JsonNode method = root.get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            throw invalid("Missing required field: method", id);
        }
        JsonNode params = root.get("params");
        if (params != null && !params.isNull() && !params.isObject()) {
            throw invalid("params must be an object", id);
        }
        return new RpcRequest(id, method.asText(), params == null || params.isNull() ? null : (ObjectNode) params);
    }

    public static ObjectNode toTree(RpcResponse response) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("jsonrpc", VERSION);
        node.set("id", response.id());
        if (response.isError()) {
            node.set("error", Jsons.mapper().valueToTree(response.error()));
        } else {
            node.set("result", Jsons.mapper().valueToTree(response.result()));
        }
        return node;
    }

    public static byte[] encode(RpcResponse response) {
        return Jsons.toJsonBytes(toTree(response));
    }

    public static ObjectNode toTree(RpcRequest request) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("jsonrpc", VERSION);
        node.set("id", request.id());
        node.put("method", request.method());
        node.set("params", request.params());
        return node;
    }

    public static byte[] encode(RpcRequest request) {
        return Jsons.toJsonBytes(toTree(request));
    }

    private static RpcProtocolException invalid(String message, JsonNode id) {
        return new RpcProtocolException(ErrorCode.INVALID_REQUEST, message, id, null);
    }
}
