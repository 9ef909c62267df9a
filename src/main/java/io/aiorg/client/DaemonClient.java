package io.aiorg.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aiorg.rpc.RpcCodec;
import io.aiorg.rpc.RpcRequest;
import io.aiorg.transport.socket.FrameCodec;
import io.aiorg.util.Jsons;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

public final class DaemonClient implements AutoCloseable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_RESPONSE_BYTES = 10 * 1024 * 1024;

    private final Path socketPath;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();
    private final ExecutorService io = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "aiorg-client");
        t.setDaemon(true);
        return t;
    });

    public DaemonClient(Path socketPath) {
        this(socketPath, DEFAULT_TIMEOUT);
    }

    public DaemonClient(Path socketPath, Duration timeout) {
        this.socketPath = socketPath;
        this.timeout = timeout;
    }

    public Path socketPath() {
        return socketPath;
    }

    public boolean isRunning() {
        if (!Files.exists(socketPath)) {
            return false;
        }
        try (SocketChannel ignored = SocketChannel.open(UnixDomainSocketAddress.of(socketPath))) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public JsonNode call(String method) {
        return call(method, null);
    }

    public JsonNode call(String method, ObjectNode params) {
        if (!Files.exists(socketPath)) {
            throw new DaemonUnavailableException("Daemon socket not found: " + socketPath);
        }
        SocketChannel channel;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        } catch (IOException e) {
            throw new DaemonException("Failed to open socket", e);
        }
        try (channel) {
            try {
                channel.connect(UnixDomainSocketAddress.of(socketPath));
            } catch (IOException e) {
                throw new DaemonUnavailableException("Daemon refused connection on " + socketPath, e);
            }
            RpcRequest request = RpcRequest.of(requestIds.incrementAndGet(), method, params);
            Future<byte[]> exchange = io.submit(() -> roundTrip(channel, RpcCodec.encode(request)));
            byte[] raw;
            try {
                raw = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                exchange.cancel(true);
                throw new DaemonTimeoutException(method, timeout);
            } catch (InterruptedException e) {
                exchange.cancel(true);
                Thread.currentThread().interrupt();
                throw new DaemonException("Interrupted waiting for " + method, e);
            } catch (ExecutionException e) {
                throw new DaemonException("Failed to talk to daemon: " + e.getCause().getMessage(), e.getCause());
            }
            return result(raw);
        } catch (IOException e) {
            throw new DaemonException("Failed to close socket", e);
        }
    }

    private static byte[] roundTrip(SocketChannel channel, byte[] request) throws IOException {
        FrameCodec.write(Channels.newOutputStream(channel), request);
        byte[] response = FrameCodec.read(Channels.newInputStream(channel), MAX_RESPONSE_BYTES);
        if (response == null) {
            throw new IOException("Daemon closed the connection without answering");
        }
        return response;
    }

    private static JsonNode result(byte[] raw) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(raw);
        } catch (IOException e) {
            throw new DaemonException("Daemon sent invalid JSON", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            JsonNode data = error.get("data");
            throw new DaemonCallException(
                    error.path("code").asInt(),
                    error.path("message").asText("Unknown error"),
                    data == null || data.isNull() ? null : data);
        }
        return root.path("result");
    }

    @Override
    public void close() {
        io.shutdownNow();
    }
}
