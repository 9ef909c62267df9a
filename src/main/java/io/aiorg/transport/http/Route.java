package io.aiorg.transport.http;

import io.aiorg.rpc.RpcMethod;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

record Route(String verb, List<String> segments, RpcMethod method, List<String> required) {

    // Params listed in required get a MISSING_FIELD reply before dispatch.
    static Route of(String verb, String pattern, RpcMethod method, String... required) {
        return new Route(verb, split(pattern), method, List.of(required));
    }

    Map<String, String> match(List<String> path) {
        if (path.size() != segments.size()) {
            return null;
        }
        Map<String, String> captured = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String seg = segments.get(i);
            if (seg.startsWith("{") && seg.endsWith("}")) {
                captured.put(seg.substring(1, seg.length() - 1), path.get(i));
            } else if (!seg.equals(path.get(i))) {
                return null;
            }
        }
        return captured;
    }

    static List<String> split(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("/"));
    }
}
