package io.aiorg.cli;

import io.aiorg.TestVaults;
import io.aiorg.config.AiorgConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

final class AiorgCommandTest {

    @Test
    void initCreatesLayoutAndConfig() throws Exception {
        Path root = Files.createTempDirectory("aiorg-cli-");
        try {
            int code = new CommandLine(new AiorgCommand()).execute("init", root.toString());

            Assertions.assertEquals(0, code);
            Assertions.assertTrue(Files.isDirectory(root.resolve("AIO/Tasks/Inbox")));
            Path configFile = root.resolve(".aio/config.yaml");
            Assertions.assertTrue(Files.readString(configFile).contains("httpPort: " + AiorgConfig.DEFAULT_HTTP_PORT));

            Files.writeString(configFile, "daemon:\n  httpPort: 9100\n");
            Assertions.assertEquals(0, new CommandLine(new AiorgCommand()).execute("init", root.toString()));
            Assertions.assertEquals(9100, AiorgConfig.load(root).httpPort());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void statusAndCallReportMissingDaemon() throws Exception {
        Path dir = Files.createTempDirectory("aiorg-cli-");
        try {
            String socket = dir.resolve("none.sock").toString();

            Assertions.assertEquals(AiorgCommand.EXIT_NOT_RUNNING,
                    new CommandLine(new AiorgCommand()).execute("--socket", socket, "status"));
            Assertions.assertEquals(AiorgCommand.EXIT_NOT_RUNNING,
                    new CommandLine(new AiorgCommand()).execute("--socket", socket, "call", "list_tasks"));
            Assertions.assertEquals(AiorgCommand.EXIT_ERROR,
                    new CommandLine(new AiorgCommand()).execute("--socket", socket, "call", "list_tasks", "--params", "[1]"));
        } finally {
            TestVaults.deleteRecursively(dir);
        }
    }
}
