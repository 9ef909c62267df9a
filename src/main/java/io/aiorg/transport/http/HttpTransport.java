package io.aiorg.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.aiorg.error.ErrorCode;
import io.aiorg.rpc.RpcDispatcher;
import io.aiorg.rpc.RpcError;
import io.aiorg.rpc.RpcMethod;
import io.aiorg.rpc.RpcRequest;
import io.aiorg.rpc.RpcResponse;
import io.aiorg.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * REST façade over the dispatcher. Each route turns path, query and JSON body into RPC params;
 * results come back as {@code {"ok":true,"data":...}} and errors as
 * {@code {"ok":false,"error":{"code":"<NAME>","message":"..."}}}.
 */
public final class HttpTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
    private static final String PREFIX = "/api/v1";
    private static final int WORKER_THREADS = 8;
    private static final int STOP_DELAY_SECONDS = 1;

    static final List<Route> ROUTES = List.of(
            Route.of("GET", PREFIX + "/tasks", RpcMethod.LIST_TASKS),
            Route.of("POST", PREFIX + "/tasks", RpcMethod.ADD_TASK),
            Route.of("GET", PREFIX + "/tasks/{query}", RpcMethod.GET_TASK),
            Route.of("POST", PREFIX + "/tasks/{query}/complete", RpcMethod.COMPLETE_TASK),
            Route.of("POST", PREFIX + "/tasks/{query}/start", RpcMethod.START_TASK),
            Route.of("POST", PREFIX + "/tasks/{query}/defer", RpcMethod.DEFER_TASK),
            Route.of("POST", PREFIX + "/tasks/{query}/delegate", RpcMethod.DELEGATE_TASK),
            Route.of("GET", PREFIX + "/projects", RpcMethod.LIST_PROJECTS),
            Route.of("POST", PREFIX + "/projects", RpcMethod.CREATE_PROJECT),
            Route.of("GET", PREFIX + "/people", RpcMethod.LIST_PEOPLE),
            Route.of("POST", PREFIX + "/people", RpcMethod.CREATE_PERSON),
            Route.of("GET", PREFIX + "/dashboard", RpcMethod.GET_DASHBOARD),
            Route.of("GET", PREFIX + "/context-packs", RpcMethod.LIST_CONTEXT_PACKS),
            Route.of("POST", PREFIX + "/context-packs", RpcMethod.CREATE_CONTEXT_PACK),
            Route.of("POST", PREFIX + "/context-packs/{pack}/content", RpcMethod.ADD_TO_CONTEXT_PACK),
            Route.of("GET", PREFIX + "/files", RpcMethod.FILE_GET, "query"),
            Route.of("POST", PREFIX + "/files", RpcMethod.FILE_SET, "query", "content")
    );

    private final String host;
    private final int port;
    private final int maxBodyBytes;
    private final RpcDispatcher dispatcher;
    private final Supplier<?> health;
    private final AtomicInteger threadSeq = new AtomicInteger();

    private volatile HttpServer server;
    private ExecutorService executor;

    public HttpTransport(String host, int port, int maxBodyBytes, RpcDispatcher dispatcher, Supplier<?> health) {
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive");
        }
        this.host = host;
        this.port = port;
        this.maxBodyBytes = maxBodyBytes;
        this.dispatcher = dispatcher;
        this.health = health;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        HttpServer created;
        try {
            created = HttpServer.create(new InetSocketAddress(host, port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind HTTP " + host + ":" + port, e);
        }
        executor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "aiorg-http-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        created.createContext("/", this::handle);
        created.setExecutor(executor);
        created.start();
        server = created;
        log.info("HTTP transport listening on http://{}:{}", host, created.getAddress().getPort());
    }

    public synchronized void stop() {
        HttpServer current = server;
        if (current == null) {
            return;
        }
        server = null;
        current.stop(STOP_DELAY_SECONDS);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP transport stopped");
    }

    public boolean isRunning() {
        return server != null;
    }

    public InetSocketAddress address() {
        HttpServer current = server;
        return current == null ? null : current.getAddress();
    }

    @Override
    public void close() {
        stop();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (RuntimeException e) {
            log.error("HTTP {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            writeError(exchange, 500, ErrorCode.INTERNAL_ERROR.name(), "Internal error");
        } finally {
            exchange.close();
        }
    }

    private void route(HttpExchange exchange) throws IOException {
        String verb = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        List<String> path = Route.split(exchange.getRequestURI().getPath());
        String joined = "/" + String.join("/", path);

        if (joined.equals(PREFIX + "/health")) {
            if (!verb.equals("GET")) {
                writeError(exchange, 405, "METHOD_NOT_ALLOWED", "Method not allowed: " + verb);
                return;
            }
            writeJson(exchange, 200, ok(health.get()));
            return;
        }
        if (joined.equals(PREFIX + "/rpc")) {
            if (!verb.equals("POST")) {
                writeError(exchange, 405, "METHOD_NOT_ALLOWED", "Method not allowed: " + verb);
                return;
            }
            byte[] body = readBody(exchange);
            if (body == null) {
                return;
            }
            writeBytes(exchange, 200, dispatcher.handle(body));
            return;
        }

        boolean pathKnown = false;
        for (Route route : ROUTES) {
            Map<String, String> captured = route.match(path);
            if (captured == null) {
                continue;
            }
            pathKnown = true;
            if (route.verb().equals(verb)) {
                invoke(exchange, route, captured);
                return;
            }
        }
        if (pathKnown) {
            writeError(exchange, 405, "METHOD_NOT_ALLOWED", "Method not allowed: " + verb);
        } else {
            writeError(exchange, 404, "NOT_FOUND", "No route for " + verb + " " + joined);
        }
    }

    private void invoke(HttpExchange exchange, Route route, Map<String, String> captured) throws IOException {
        ObjectNode params = Jsons.mapper().createObjectNode();
        try {
            parseQuery(exchange.getRequestURI().getRawQuery()).forEach(params::put);
        } catch (IllegalArgumentException e) {
            writeError(exchange, 400, ErrorCode.INVALID_REQUEST.name(), "Malformed query string: " + e.getMessage());
            return;
        }
        boolean post = route.verb().equals("POST");
        if (post) {
            byte[] raw = readBody(exchange);
            if (raw == null) {
                return;
            }
            String body = new String(raw, StandardCharsets.UTF_8).trim();
            if (!body.isEmpty()) {
                JsonNode node;
                try {
                    node = Jsons.mapper().readTree(body);
                } catch (JsonProcessingException e) {
                    writeError(exchange, 400, "INVALID_JSON", "Invalid JSON body: " + e.getOriginalMessage());
                    return;
                }
                if (!node.isObject()) {
                    writeError(exchange, 400, "INVALID_JSON", "Request body must be a JSON object");
                    return;
                }
                params.setAll((ObjectNode) node);
            }
        }
        captured.forEach(params::put);
        for (String field : route.required()) {
            if (isMissing(params.get(field), field)) {
                writeError(exchange, 400, "MISSING_FIELD", post
                        ? "Missing required field: " + field
                        : "Missing required query parameter: " + field);
                return;
            }
        }

        RpcResponse response = dispatcher.dispatch(new RpcRequest(null, route.method().wireName(), params));
        if (response.isError()) {
            RpcError error = response.error();
            ErrorCode code = ErrorCode.fromCode(error.code()).orElse(ErrorCode.INTERNAL_ERROR);
            writeError(exchange, statusFor(code), code.name(), error.message());
        } else {
            writeJson(exchange, 200, ok(response.result()));
        }
    }

    // Empty content is a valid file body; any other blank field counts as missing.
    private static boolean isMissing(JsonNode value, String field) {
        if (value == null || value.isNull()) {
            return true;
        }
        return !field.equals("content") && value.isTextual() && value.asText().isBlank();
    }

    private byte[] readBody(HttpExchange exchange) throws IOException {
        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null) {
            long length;
            try {
                length = Long.parseLong(declared.trim());
            } catch (NumberFormatException e) {
                writeError(exchange, 400, ErrorCode.INVALID_REQUEST.name(), "Invalid Content-Length: " + declared);
                return null;
            }
            if (length > maxBodyBytes) {
                tooLarge(exchange);
                return null;
            }
        }
        int cap = maxBodyBytes == Integer.MAX_VALUE ? maxBodyBytes : maxBodyBytes + 1;
        byte[] body = exchange.getRequestBody().readNBytes(cap);
        if (body.length > maxBodyBytes) {
            tooLarge(exchange);
            return null;
        }
        return body;
    }

    private void tooLarge(HttpExchange exchange) throws IOException {
        log.warn("Rejected {} {}: body over {} bytes", exchange.getRequestMethod(), exchange.getRequestURI(), maxBodyBytes);
        writeError(exchange, 413, "PAYLOAD_TOO_LARGE", "Request body exceeds " + maxBodyBytes + " bytes");
    }

    static int statusFor(ErrorCode code) {
        if (code.isNotFound()) {
            return 404;
        }
        switch (code) {
            case AMBIGUOUS_MATCH:
            case CONTEXT_PACK_EXISTS:
                return 409;
            case INVALID_REQUEST:
            case INVALID_PARAMS:
            case INVALID_DATE:
            case FILE_OUTSIDE_VAULT:
            case PARSE_ERROR:
                return 400;
            case METHOD_NOT_FOUND:
                return 404;
            default:
                return 500;
        }
    }

    private static Map<String, Object> ok(Object data) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("data", data);
        return out;
    }

    private static void writeError(HttpExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("error", error);
        writeJson(exchange, status, out);
    }

    private static void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        writeBytes(exchange, status, Jsons.toJsonBytes(body));
    }

    private static void writeBytes(HttpExchange exchange, int status, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }
}
