package io.aiorg.daemon;

import io.aiorg.TestVaults;
import io.aiorg.cache.WatchServiceChangeNotifier;
import io.aiorg.config.AiorgConfig;
import io.aiorg.error.VaultNotInitializedException;
import io.aiorg.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

final class AiorgDaemonTest {

    @Test
    void startsServesAndStops() throws Exception {
        Path root = TestVaults.create("aiorg-daemon-");
        AiorgConfig config = TestVaults.config(root);
        TestVaults.writeTask(config, TaskStatus.INBOX, "AB23", "Preloaded", null);
        AiorgDaemon daemon = daemon(config);
        try {
            Assertions.assertEquals(DaemonState.STOPPED, daemon.state());
            daemon.start();

            Assertions.assertEquals(DaemonState.RUNNING, daemon.state());
            Assertions.assertTrue(Files.exists(config.socketPath()));
            Assertions.assertNotNull(daemon.httpAddress());
            Assertions.assertTrue(daemon.cache().get("AB23").isPresent());

            HealthStatus health = daemon.healthCheck();
            Assertions.assertTrue(health.isRunning());
            Assertions.assertEquals(TestVaults.NOW, health.startedAt());
            Assertions.assertEquals(1, health.cache().totalTasks());
            Assertions.assertTrue(health.cache().watching());
            Assertions.assertTrue(health.socket().running());
            Assertions.assertTrue(health.http().running());
            Assertions.assertTrue(health.http().address().endsWith(":" + daemon.httpAddress().getPort()));

            daemon.start();
            Assertions.assertEquals(DaemonState.RUNNING, daemon.state());

            daemon.stop();
            Assertions.assertEquals(DaemonState.STOPPED, daemon.state());
            Assertions.assertTrue(daemon.awaitTermination(1, TimeUnit.SECONDS));
            Assertions.assertFalse(Files.exists(config.socketPath()));
            Assertions.assertNull(daemon.cache());
            Assertions.assertNull(daemon.httpAddress());
            Assertions.assertNull(daemon.healthCheck().cache());
        } finally {
            daemon.close();
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void transportsCanBeDisabled() throws Exception {
        Path root = TestVaults.create("aiorg-daemon-");
        AiorgConfig config = TestVaults.config(root).withTransports(true, false);
        AiorgDaemon daemon = daemon(config);
        try {
            daemon.start();

            HealthStatus health = daemon.healthCheck();
            Assertions.assertTrue(health.socket().running());
            Assertions.assertFalse(health.http().enabled());
            Assertions.assertFalse(health.http().running());
            Assertions.assertNull(daemon.httpAddress());
        } finally {
            daemon.close();
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void uninitializedVaultRollsBack() throws Exception {
        Path root = Files.createTempDirectory("aiorg-daemon-");
        AiorgConfig config = TestVaults.config(root);
        AiorgDaemon daemon = daemon(config);
        try {
            Assertions.assertThrows(VaultNotInitializedException.class, daemon::start);

            Assertions.assertEquals(DaemonState.STOPPED, daemon.state());
            Assertions.assertFalse(Files.exists(config.socketPath()));
        } finally {
            daemon.close();
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void picksUpFilesWrittenBehindItsBack() throws Exception {
        Path root = TestVaults.create("aiorg-daemon-");
        AiorgConfig config = TestVaults.config(root);
        AiorgDaemon daemon = daemon(config);
        try {
            daemon.start();
            Assertions.assertTrue(daemon.cache().get("ZX98").isEmpty());

            TestVaults.writeTask(config, TaskStatus.NEXT, "ZX98", "Edited in the editor", null);

            long deadline = System.currentTimeMillis() + 5_000L;
            while (daemon.cache().get("ZX98").isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(50L);
            }
            Assertions.assertTrue(daemon.cache().get("ZX98").isPresent());
            Assertions.assertEquals(TaskStatus.NEXT, daemon.cache().get("ZX98").get().status());
        } finally {
            daemon.close();
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void canRestartAfterStop() throws Exception {
        Path root = TestVaults.create("aiorg-daemon-");
        AiorgDaemon daemon = daemon(TestVaults.config(root));
        try {
            daemon.start();
            daemon.stop();
            daemon.start();

            Assertions.assertEquals(DaemonState.RUNNING, daemon.state());
            Assertions.assertTrue(daemon.healthCheck().socket().running());
        } finally {
            daemon.close();
            TestVaults.deleteRecursively(root);
        }
    }

    private static AiorgDaemon daemon(AiorgConfig config) {
        return new AiorgDaemon(config, TestVaults.clock(), new WatchServiceChangeNotifier(config.aioDir()));
    }
}
