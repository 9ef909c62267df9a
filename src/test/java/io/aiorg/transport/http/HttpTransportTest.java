package io.aiorg.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.aiorg.TestVaults;
import io.aiorg.config.AiorgConfig;
import io.aiorg.error.ErrorCode;
import io.aiorg.model.TaskStatus;
import io.aiorg.rpc.HandlerContext;
import io.aiorg.rpc.RpcDispatcher;
import io.aiorg.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

final class HttpTransportTest {
    private static final int BODY_LIMIT = 4096;

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private Path root;
    private HandlerContext ctx;
    private HttpTransport transport;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        root = TestVaults.create("aiorg-http-");
        AiorgConfig config = TestVaults.config(root);
        TestVaults.writeTask(config, TaskStatus.NEXT, "AB23", "Review budget", null);
        ctx = TestVaults.context(config, TestVaults.clock());
        transport = new HttpTransport("127.0.0.1", 0, BODY_LIMIT, new RpcDispatcher(ctx), () -> Map.of("status", "running"));
        transport.start();
        base = "http://127.0.0.1:" + transport.address().getPort();
    }

    @AfterEach
    void tearDown() throws Exception {
        transport.stop();
        ctx.cache().close();
        TestVaults.deleteRecursively(root);
    }

    @Test
    void missingTaskIsNotFound() throws Exception {
        HttpResponse<String> response = get("/api/v1/tasks/DOES-NOT-EXIST");

        Assertions.assertEquals(404, response.statusCode());
        JsonNode body = Jsons.mapper().readTree(response.body());
        Assertions.assertFalse(body.path("ok").asBoolean());
        Assertions.assertEquals("TASK_NOT_FOUND", body.path("error").path("code").asText());
        Assertions.assertFalse(body.path("error").path("message").asText().isBlank());
    }

    @Test
    void listsAndFetchesTasks() throws Exception {
        HttpResponse<String> list = get("/api/v1/tasks?status=next");
        Assertions.assertEquals(200, list.statusCode());
        Assertions.assertTrue(list.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode data = Jsons.mapper().readTree(list.body()).path("data");
        Assertions.assertEquals(1, data.path("count").asInt());

        JsonNode task = Jsons.mapper().readTree(get("/api/v1/tasks/AB23").body()).path("data").path("task");
        Assertions.assertEquals("Review budget", task.path("title").asText());
    }

    @Test
    void postCreatesAndCompletesTask() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks", "{\"title\":\"Ship it\",\"due\":\"2026-03-10\"}");
        Assertions.assertEquals(200, created.statusCode());
        JsonNode task = Jsons.mapper().readTree(created.body()).path("data").path("task");
        Assertions.assertTrue(task.path("is_due_today").asBoolean());
        String id = task.path("id").asText();

        HttpResponse<String> completed = post("/api/v1/tasks/" + id + "/complete", "");
        Assertions.assertEquals(200, completed.statusCode());
        Assertions.assertEquals("completed",
                Jsons.mapper().readTree(completed.body()).path("data").path("task").path("status").asText());
    }

    @Test
    void rpcEndpointPassesThroughEnvelopes() throws Exception {
        HttpResponse<String> ok = post("/api/v1/rpc", "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"list_tasks\"}");
        Assertions.assertEquals(200, ok.statusCode());
        JsonNode body = Jsons.mapper().readTree(ok.body());
        Assertions.assertEquals("2.0", body.path("jsonrpc").asText());
        Assertions.assertEquals(7, body.path("id").asInt());
        Assertions.assertEquals(1, body.path("result").path("count").asInt());

        HttpResponse<String> unknown = post("/api/v1/rpc", "{\"jsonrpc\":\"2.0\",\"id\":8,\"method\":\"nope\"}");
        Assertions.assertEquals(200, unknown.statusCode());
        Assertions.assertEquals(ErrorCode.METHOD_NOT_FOUND.code(),
                Jsons.mapper().readTree(unknown.body()).path("error").path("code").asInt());
    }

    @Test
    void routingErrors() throws Exception {
        HttpResponse<String> wrongVerb = send(HttpRequest.newBuilder(URI.create(base + "/api/v1/tasks"))
                .DELETE().build());
        Assertions.assertEquals(405, wrongVerb.statusCode());
        Assertions.assertEquals("METHOD_NOT_ALLOWED",
                Jsons.mapper().readTree(wrongVerb.body()).path("error").path("code").asText());

        HttpResponse<String> unknown = get("/api/v1/widgets");
        Assertions.assertEquals(404, unknown.statusCode());
        Assertions.assertEquals("NOT_FOUND", Jsons.mapper().readTree(unknown.body()).path("error").path("code").asText());

        HttpResponse<String> badJson = post("/api/v1/tasks", "{title:");
        Assertions.assertEquals(400, badJson.statusCode());
        Assertions.assertEquals("INVALID_JSON", Jsons.mapper().readTree(badJson.body()).path("error").path("code").asText());

        HttpResponse<String> arrayBody = post("/api/v1/projects", "[1,2]");
        Assertions.assertEquals(400, arrayBody.statusCode());

        HttpResponse<String> missingTitle = post("/api/v1/tasks", "{}");
        Assertions.assertEquals(400, missingTitle.statusCode());
        Assertions.assertEquals("INVALID_PARAMS",
                Jsons.mapper().readTree(missingTitle.body()).path("error").path("code").asText());
    }

    @Test
    void healthReportsSupplierValue() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        Assertions.assertEquals(200, response.statusCode());
        JsonNode body = Jsons.mapper().readTree(response.body());
        Assertions.assertTrue(body.path("ok").asBoolean());
        Assertions.assertEquals("running", body.path("data").path("status").asText());
    }

    @Test
    void contextPackRoutesUsePathParams() throws Exception {
        Assertions.assertEquals(200,
                post("/api/v1/context-packs", "{\"title\":\"Payments\",\"category\":\"domain\"}").statusCode());
        HttpResponse<String> duplicate = post("/api/v1/context-packs", "{\"title\":\"Payments\",\"category\":\"domain\"}");
        Assertions.assertEquals(409, duplicate.statusCode());

        HttpResponse<String> appended = post("/api/v1/context-packs/payments/content", "{\"content\":\"ledger notes\"}");
        Assertions.assertEquals(200, appended.statusCode());
        Assertions.assertEquals("payments", Jsons.mapper().readTree(appended.body()).path("data").path("id").asText());

        HttpResponse<String> missing = post("/api/v1/context-packs/unknown/content", "{\"content\":\"x\"}");
        Assertions.assertEquals(404, missing.statusCode());
    }

    @Test
    void statusMapping() {
        Assertions.assertEquals(404, HttpTransport.statusFor(ErrorCode.PERSON_NOT_FOUND));
        Assertions.assertEquals(409, HttpTransport.statusFor(ErrorCode.AMBIGUOUS_MATCH));
        Assertions.assertEquals(400, HttpTransport.statusFor(ErrorCode.INVALID_DATE));
        Assertions.assertEquals(400, HttpTransport.statusFor(ErrorCode.FILE_OUTSIDE_VAULT));
        Assertions.assertEquals(500, HttpTransport.statusFor(ErrorCode.VAULT_NOT_INITIALIZED));
        Assertions.assertEquals(500, HttpTransport.statusFor(ErrorCode.INTERNAL_ERROR));
    }

    @Test
    void queryStringDecoding() {
        Map<String, String> parsed = HttpTransport.parseQuery("status=next&q=a%20b&flag");

        Assertions.assertEquals("next", parsed.get("status"));
        Assertions.assertEquals("a b", parsed.get("q"));
        Assertions.assertEquals("", parsed.get("flag"));
    }

    @Test
    void malformedPercentEscapeIsRejected() throws Exception {
        Assertions.assertThrows(IllegalArgumentException.class, () -> HttpTransport.parseQuery("status=%zz"));

        try (Socket socket = new Socket("127.0.0.1", transport.address().getPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET /api/v1/tasks?status=%zz HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n")
                    .getBytes(StandardCharsets.US_ASCII));
            out.flush();
            BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            String statusLine = in.readLine();
            Assertions.assertNotNull(statusLine);
            Assertions.assertTrue(statusLine.contains(" 400"), statusLine);
        }
        Assertions.assertEquals(200, get("/api/v1/tasks").statusCode());
    }

    @Test
    void oversizedBodiesAreRejectedUnparsed() throws Exception {
        String huge = "{\"title\":\"" + "x".repeat(BODY_LIMIT * 2) + "\"}";

        HttpResponse<String> rest = post("/api/v1/tasks", huge);
        Assertions.assertEquals(413, rest.statusCode());
        Assertions.assertEquals("PAYLOAD_TOO_LARGE",
                Jsons.mapper().readTree(rest.body()).path("error").path("code").asText());

        HttpResponse<String> rpc = post("/api/v1/rpc", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"add_task\","
                + "\"params\":{\"title\":\"" + "y".repeat(BODY_LIMIT * 2) + "\"}}");
        Assertions.assertEquals(413, rpc.statusCode());

        byte[] bytes = huge.getBytes(StandardCharsets.UTF_8);
        HttpResponse<String> chunked = send(HttpRequest.newBuilder(URI.create(base + "/api/v1/tasks"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofInputStream(() -> new ByteArrayInputStream(bytes)))
                .build());
        Assertions.assertEquals(413, chunked.statusCode());

        JsonNode list = Jsons.mapper().readTree(get("/api/v1/tasks").body()).path("data");
        Assertions.assertEquals(1, list.path("count").asInt());
        Assertions.assertEquals(200, post("/api/v1/tasks", "{\"title\":\"Small\"}").statusCode());
    }

    @Test
    void fileRoutesReadAndWriteVaultFiles() throws Exception {
        HttpResponse<String> read = get("/api/v1/files?query=AB23");
        Assertions.assertEquals(200, read.statusCode());
        JsonNode data = Jsons.mapper().readTree(read.body()).path("data");
        Assertions.assertTrue(data.path("content").asText().contains("Review budget"));

        HttpResponse<String> written = post("/api/v1/files", "{\"query\":\"notes/plan.md\",\"content\":\"# Plan\\n\"}");
        Assertions.assertEquals(200, written.statusCode());
        Assertions.assertEquals("notes/plan.md",
                Jsons.mapper().readTree(written.body()).path("data").path("file").asText());
        Assertions.assertEquals("# Plan\n", Files.readString(root.resolve("notes/plan.md")));

        HttpResponse<String> noQuery = get("/api/v1/files");
        Assertions.assertEquals(400, noQuery.statusCode());
        JsonNode error = Jsons.mapper().readTree(noQuery.body()).path("error");
        Assertions.assertEquals("MISSING_FIELD", error.path("code").asText());
        Assertions.assertEquals("Missing required query parameter: query", error.path("message").asText());

        HttpResponse<String> noContent = post("/api/v1/files", "{\"query\":\"notes/plan.md\"}");
        Assertions.assertEquals(400, noContent.statusCode());
        Assertions.assertEquals("Missing required field: content",
                Jsons.mapper().readTree(noContent.body()).path("error").path("message").asText());

        HttpResponse<String> outside = post("/api/v1/files", "{\"query\":\"../escape.md\",\"content\":\"x\"}");
        Assertions.assertEquals(400, outside.statusCode());
        Assertions.assertEquals("FILE_OUTSIDE_VAULT",
                Jsons.mapper().readTree(outside.body()).path("error").path("code").asText());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(URI.create(base + path)).GET().build());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return send(HttpRequest.newBuilder(URI.create(base + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
