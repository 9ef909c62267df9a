package io.aiorg.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.aiorg.error.VaultNotFoundException;
import io.aiorg.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

public final class VaultLocator {
    public static final String ENV_VAULT_PATH = "AIO_VAULT_PATH";
    private static final Logger log = LoggerFactory.getLogger(VaultLocator.class);

    private final Map<String, String> env;
    private final Path workingDir;
    private final Path homeDir;

    public VaultLocator(Map<String, String> env, Path workingDir, Path homeDir) {
        this.env = env;
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.homeDir = homeDir;
    }

    public static VaultLocator system() {
        return new VaultLocator(
                System.getenv(),
                Paths.get("").toAbsolutePath(),
                Paths.get(System.getProperty("user.home"))
        );
    }

    public Path locate(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            Path path = AiorgConfig.expandHome(explicit);
            if (!isVault(path)) {
                throw new VaultNotFoundException("Not a valid Obsidian vault: " + path);
            }
            return path.toAbsolutePath().normalize();
        }
        String fromEnv = env.get(ENV_VAULT_PATH);
        if (fromEnv != null && !fromEnv.isBlank()) {
            Path path = AiorgConfig.expandHome(fromEnv);
            if (isVault(path)) {
                return path.toAbsolutePath().normalize();
            }
            throw new VaultNotFoundException(ENV_VAULT_PATH + " is set but not a valid vault: " + path);
        }
        for (Path dir = workingDir; dir != null; dir = dir.getParent()) {
            if (isVault(dir)) {
                return dir;
            }
        }
        Optional<Path> configured = globalConfigVault();
        if (configured.isPresent() && isVault(configured.get())) {
            return configured.get().toAbsolutePath().normalize();
        }
        throw new VaultNotFoundException("Could not find vault. Set " + ENV_VAULT_PATH + " or pass --vault");
    }

    private Optional<Path> globalConfigVault() {
        Path file = homeDir.resolve(AiorgConfig.CONFIG_DIR).resolve("config.yaml");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = Jsons.yaml().readTree(file.toFile());
            JsonNode path = root == null ? null : root.path("vault").path("path");
            if (path == null || !path.isTextual() || path.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(AiorgConfig.expandHome(path.asText()));
        } catch (IOException e) {
            log.warn("Ignoring unreadable global config {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    static boolean isVault(Path path) {
        return Files.isDirectory(path) && Files.isDirectory(path.resolve(".obsidian"));
    }
}
