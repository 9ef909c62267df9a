package io.aiorg.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aiorg.client.DaemonCallException;
import io.aiorg.client.DaemonClient;
import io.aiorg.client.DaemonException;
import io.aiorg.client.DaemonUnavailableException;
import io.aiorg.config.AiorgConfig;
import io.aiorg.config.VaultLocator;
import io.aiorg.daemon.AiorgDaemon;
import io.aiorg.error.AiorgException;
import io.aiorg.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "aiorg",
        mixinStandardHelpOptions = true,
        description = "Vault cache daemon for tasks, projects, people and context packs",
        subcommands = {
                AiorgCommand.DaemonCommand.class,
                AiorgCommand.InitCommand.class,
                AiorgCommand.StatusCommand.class,
                AiorgCommand.CallCommand.class
        }
)
public final class AiorgCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(AiorgCommand.class);
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_RUNNING = 3;

    @Option(names = {"--vault"}, description = "Vault root (default: AIO_VAULT_PATH, then the enclosing vault)")
    String vault;

    @Option(names = {"--socket"}, description = "Daemon socket path (default: ~/.aio/daemon.sock or the vault config)")
    String socket;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG")
    boolean verbose;

    @Override
    public void run() {
        System.out.println("Use subcommands: daemon | init | status | call");
    }

    void applyVerbosity() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("io.aiorg")).setLevel(Level.DEBUG);
        }
    }

    AiorgConfig config() {
        applyVerbosity();
        AiorgConfig config = AiorgConfig.load(VaultLocator.system().locate(vault));
        return socket == null ? config : config.withSocketPath(AiorgConfig.expandHome(socket));
    }

    Path clientSocket() {
        applyVerbosity();
        if (socket != null) {
            return AiorgConfig.expandHome(socket);
        }
        try {
            return AiorgConfig.load(VaultLocator.system().locate(vault)).socketPath();
        } catch (AiorgException e) {
            log.debug("No vault config ({}); using default socket", e.getMessage());
            return AiorgConfig.defaultSocketPath();
        }
    }

    @Command(name = "daemon", description = "Run the daemon in the foreground until interrupted")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        AiorgCommand parent;

        @Option(names = {"--http-host"}, description = "HTTP bind host")
        String httpHost;

        @Option(names = {"--http-port"}, description = "HTTP port")
        Integer httpPort;

        @Option(names = {"--no-http"}, description = "Disable the HTTP transport")
        boolean noHttp;

        @Option(names = {"--no-socket"}, description = "Disable the socket transport")
        boolean noSocket;

        @Option(names = {"--debounce-ms"}, description = "Quiet period before a change-driven refresh")
        Long debounceMs;

        @Override
        public Integer call() throws Exception {
            AiorgConfig config = parent.config();
            if (httpHost != null || httpPort != null) {
                config = config.withHttp(
                        httpHost == null ? config.httpHost() : httpHost,
                        httpPort == null ? config.httpPort() : httpPort);
            }
            if (noHttp || noSocket) {
                config = config.withTransports(config.socketEnabled() && !noSocket, config.httpEnabled() && !noHttp);
            }
            if (debounceMs != null) {
                config = config.withDebounceMillis(debounceMs);
            }
            AiorgDaemon daemon = new AiorgDaemon(config);
            daemon.start();
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::stop, "aiorg-shutdown-hook"));
            System.out.println(Jsons.toJson(daemon.healthCheck()));
            daemon.awaitTermination();
            return 0;
        }
    }

    @Command(name = "init", description = "Create the AIO folder layout inside a vault")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AiorgCommand parent;

        @Parameters(index = "0", description = "Vault root directory")
        String path;

        @Override
        public Integer call() {
            parent.applyVerbosity();
            AiorgConfig config = AiorgConfig.forVault(AiorgConfig.expandHome(path).toAbsolutePath().normalize());
            config.initializeLayout();
            writeDefaultConfig(config);
            System.out.println("Initialized vault at: " + config.vaultRoot());
            return 0;
        }

        private static void writeDefaultConfig(AiorgConfig config) {
            Path file = config.vaultConfigFile();
            if (Files.exists(file)) {
                return;
            }
            Map<String, Object> daemon = new LinkedHashMap<>();
            daemon.put("httpHost", config.httpHost());
            daemon.put("httpPort", config.httpPort());
            daemon.put("debounceMillis", config.debounceMillis());
            Map<String, Object> root = new LinkedHashMap<>();
            root.put("daemon", daemon);
            try {
                Files.writeString(file, Jsons.yaml().writeValueAsString(root), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + file, e);
            }
        }
    }

    @Command(name = "status", description = "Check whether the daemon answers on its socket")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AiorgCommand parent;

        @Option(names = {"--timeout-ms"}, defaultValue = "2000", description = "Status call timeout")
        long timeoutMs;

        @Override
        public Integer call() {
            Path socketPath = parent.clientSocket();
            try (DaemonClient client = new DaemonClient(socketPath, Duration.ofMillis(timeoutMs))) {
                JsonNode result = client.call("list_tasks");
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("running", true);
                out.put("socket", socketPath.toString());
                out.put("activeTasks", result.path("count").asInt());
                System.out.println(Jsons.toPrettyJson(out));
                return 0;
            } catch (DaemonUnavailableException e) {
                System.out.println("Daemon not running (" + socketPath + ")");
                return EXIT_NOT_RUNNING;
            } catch (DaemonException e) {
                System.err.println("Daemon unhealthy: " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }

    @Command(name = "call", description = "Send one JSON-RPC request to the daemon and print the result")
    static final class CallCommand implements Callable<Integer> {
        @ParentCommand
        AiorgCommand parent;

        @Parameters(index = "0", description = "Method name, e.g. list_tasks")
        String method;

        @Option(names = {"--params"}, description = "Params as a JSON object")
        String params;

        @Option(names = {"--timeout-ms"}, defaultValue = "5000", description = "Call timeout")
        long timeoutMs;

        @Override
        public Integer call() throws Exception {
            ObjectNode parsed = null;
            if (params != null && !params.isBlank()) {
                JsonNode node = Jsons.mapper().readTree(params);
                if (!node.isObject()) {
                    System.err.println("--params must be a JSON object");
                    return EXIT_ERROR;
                }
                parsed = (ObjectNode) node;
            }
            Path socketPath = parent.clientSocket();
            try (DaemonClient client = new DaemonClient(socketPath, Duration.ofMillis(timeoutMs))) {
                System.out.println(Jsons.toPrettyJson(client.call(method, parsed)));
                return 0;
            } catch (DaemonUnavailableException e) {
                System.err.println("Daemon not running (" + socketPath + ")");
                return EXIT_NOT_RUNNING;
            } catch (DaemonCallException e) {
                System.err.println("Error " + e.code() + ": " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }
}
