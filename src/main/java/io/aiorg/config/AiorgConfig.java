package io.aiorg.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.aiorg.error.VaultNotInitializedException;
import io.aiorg.model.ContextPackCategory;
import io.aiorg.model.TaskStatus;
import io.aiorg.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class AiorgConfig {
    public static final String AIO_DIR = "AIO";
    public static final String CONFIG_DIR = ".aio";
    public static final String DEFAULT_HTTP_HOST = "127.0.0.1";
    public static final int DEFAULT_HTTP_PORT = 7432;
    public static final long DEFAULT_MAX_MESSAGE_BYTES = 10L * 1024L * 1024L;
    public static final long DEFAULT_DEBOUNCE_MS = 100L;

    private static final List<String> LAYOUT = List.of(
            "AIO/Dashboard",
            "AIO/Tasks/Inbox",
            "AIO/Tasks/Next",
            "AIO/Tasks/Waiting",
            "AIO/Tasks/Scheduled",
            "AIO/Tasks/Someday",
            "AIO/Tasks/Completed",
            "AIO/Projects",
            "AIO/Areas",
            "AIO/People",
            "AIO/Context-Packs/Domains",
            "AIO/Context-Packs/Systems",
            "AIO/Context-Packs/Operating",
            "AIO/Archive/Tasks",
            "AIO/Archive/Projects",
            "AIO/Archive/People"
    );

    private final Path vaultRoot;
    private final Path socketPath;
    private final String httpHost;
    private final int httpPort;
    private final long maxMessageBytes;
    private final long debounceMillis;
    private final boolean socketEnabled;
    private final boolean httpEnabled;

    public AiorgConfig(
            Path vaultRoot,
            Path socketPath,
            String httpHost,
            int httpPort,
            long maxMessageBytes,
            long debounceMillis,
            boolean socketEnabled,
            boolean httpEnabled
    ) {
        this.vaultRoot = vaultRoot.toAbsolutePath().normalize();
        this.socketPath = socketPath.toAbsolutePath().normalize();
        this.httpHost = httpHost == null || httpHost.isBlank() ? DEFAULT_HTTP_HOST : httpHost.trim();
        this.httpPort = httpPort;
        this.maxMessageBytes = maxMessageBytes > 0 ? maxMessageBytes : DEFAULT_MAX_MESSAGE_BYTES;
        this.debounceMillis = Math.max(1L, debounceMillis);
        this.socketEnabled = socketEnabled;
        this.httpEnabled = httpEnabled;
    }

    public static AiorgConfig forVault(Path vaultRoot) {
        return new AiorgConfig(
                vaultRoot,
                defaultSocketPath(),
                DEFAULT_HTTP_HOST,
                DEFAULT_HTTP_PORT,
                DEFAULT_MAX_MESSAGE_BYTES,
                DEFAULT_DEBOUNCE_MS,
                true,
                true
        );
    }

    // Defaults overlaid with the daemon: section of <vault>/.aio/config.yaml, when the file exists.
    public static AiorgConfig load(Path vaultRoot) {
        AiorgConfig config = forVault(vaultRoot);
        Path file = config.vaultConfigFile();
        if (!Files.isRegularFile(file)) {
            return config;
        }
        JsonNode root;
        try {
            root = Jsons.yaml().readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read vault config: " + file, e);
        }
        JsonNode daemon = root == null ? null : root.path("daemon");
        if (daemon == null || !daemon.isObject()) {
            return config;
        }
        return new AiorgConfig(
                config.vaultRoot,
                daemon.hasNonNull("socketPath") ? expandHome(daemon.get("socketPath").asText()) : config.socketPath,
                daemon.path("httpHost").asText(config.httpHost),
                daemon.path("httpPort").asInt(config.httpPort),
                daemon.path("maxMessageBytes").asLong(config.maxMessageBytes),
                daemon.path("debounceMillis").asLong(config.debounceMillis),
                daemon.path("socketEnabled").asBoolean(config.socketEnabled),
                daemon.path("httpEnabled").asBoolean(config.httpEnabled)
        );
    }

    public static Path defaultSocketPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, "daemon.sock");
    }

    public static Path expandHome(String raw) {
        String value = raw.trim();
        if (value.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (value.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), value.substring(2));
        }
        return Paths.get(value);
    }

    public AiorgConfig withSocketPath(Path path) {
        return new AiorgConfig(vaultRoot, path, httpHost, httpPort, maxMessageBytes, debounceMillis, socketEnabled, httpEnabled);
    }

    public AiorgConfig withHttp(String host, int port) {
        return new AiorgConfig(vaultRoot, socketPath, host, port, maxMessageBytes, debounceMillis, socketEnabled, httpEnabled);
    }

    public AiorgConfig withTransports(boolean socket, boolean http) {
        return new AiorgConfig(vaultRoot, socketPath, httpHost, httpPort, maxMessageBytes, debounceMillis, socket, http);
    }

    public AiorgConfig withMaxMessageBytes(long bytes) {
        return new AiorgConfig(vaultRoot, socketPath, httpHost, httpPort, bytes, debounceMillis, socketEnabled, httpEnabled);
    }

    public AiorgConfig withDebounceMillis(long millis) {
        return new AiorgConfig(vaultRoot, socketPath, httpHost, httpPort, maxMessageBytes, millis, socketEnabled, httpEnabled);
    }

    public void initializeLayout() {
        try {
            for (String folder : LAYOUT) {
                Files.createDirectories(vaultRoot.resolve(folder));
            }
            Files.createDirectories(vaultRoot.resolve(CONFIG_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize vault layout under " + vaultRoot, e);
        }
    }

    public boolean isInitialized() {
        return Files.isDirectory(aioDir());
    }

    public void ensureInitialized() {
        if (!isInitialized()) {
            throw new VaultNotInitializedException("Vault not initialized. Run 'aiorg init " + vaultRoot + "'");
        }
    }

    public Path vaultRoot() {
        return vaultRoot;
    }

    public Path socketPath() {
        return socketPath;
    }

    public String httpHost() {
        return httpHost;
    }

    public int httpPort() {
        return httpPort;
    }

    public long maxMessageBytes() {
        return maxMessageBytes;
    }

    public long debounceMillis() {
        return debounceMillis;
    }

    public boolean socketEnabled() {
        return socketEnabled;
    }

    public boolean httpEnabled() {
        return httpEnabled;
    }

    public Path vaultConfigFile() {
        return vaultRoot.resolve(CONFIG_DIR).resolve("config.yaml");
    }

    public Path aioDir() {
        return vaultRoot.resolve(AIO_DIR);
    }

    public Path tasksRoot() {
        return aioDir().resolve("Tasks");
    }

    public Path tasksFolder(TaskStatus status) {
        return tasksRoot().resolve(status.folderName());
    }

    public Path completedFolder(int year, int month) {
        return tasksFolder(TaskStatus.COMPLETED)
                .resolve(String.format("%04d", year))
                .resolve(String.format("%02d", month));
    }

    public Path projectsDir() {
        return aioDir().resolve("Projects");
    }

    public Path peopleDir() {
        return aioDir().resolve("People");
    }

    public Path contextPacksDir() {
        return aioDir().resolve("Context-Packs");
    }

    public Path contextPacksFolder(ContextPackCategory category) {
        return contextPacksDir().resolve(category.folderName());
    }

    public Path backupDir() {
        return aioDir().resolve("Backup");
    }

    public Path archiveDir() {
        return aioDir().resolve("Archive");
    }
}
