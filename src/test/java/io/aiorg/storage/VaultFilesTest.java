package io.aiorg.storage;

import io.aiorg.TestVaults;
import io.aiorg.config.AiorgConfig;
import io.aiorg.error.AmbiguousMatchException;
import io.aiorg.error.FileOutsideVaultException;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.error.VaultNotInitializedException;
import io.aiorg.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class VaultFilesTest {

    @Test
    void getFindsFilesByIdTitleAndPath() throws Exception {
        Path root = TestVaults.create("aiorg-files-");
        try {
            AiorgConfig config = TestVaults.config(root);
            Path task = TestVaults.writeTask(config, TaskStatus.NEXT, "AB23", "Review budget", null);
            Files.writeString(config.aioDir().resolve("Notes.md"), "# Weekly notes\n\nsome text\n");
            VaultFiles files = new VaultFiles(config, TestVaults.clock());

            VaultFiles.Content byId = files.get("ab23");
            Assertions.assertEquals(root.relativize(task).toString().replace('\\', '/'), byId.file());
            Assertions.assertEquals(Files.readString(task), byId.content());

            Assertions.assertTrue(files.get("weekly").content().contains("some text"));
            Assertions.assertEquals("AIO/Notes.md", files.get("AIO/Notes.md").file());

            InvalidParamsException miss = Assertions.assertThrows(InvalidParamsException.class,
                    () -> files.get("nothing like this"));
            Assertions.assertTrue(miss.getMessage().contains("File not found"));
            Assertions.assertThrows(InvalidParamsException.class, () -> files.get("AIO/Missing.md"));
            Assertions.assertThrows(InvalidParamsException.class, () -> files.get(" "));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void pathsMayNotLeaveTheVault() throws Exception {
        Path root = TestVaults.create("aiorg-files-");
        try {
            VaultFiles files = new VaultFiles(TestVaults.config(root), TestVaults.clock());

            Assertions.assertThrows(FileOutsideVaultException.class, () -> files.get("../outside.md"));
            Assertions.assertThrows(FileOutsideVaultException.class, () -> files.set("/etc/aiorg.md", "x"));
            Assertions.assertThrows(FileOutsideVaultException.class, () -> files.set("AIO/../../up.md", "x"));
            Assertions.assertFalse(Files.exists(root.getParent().resolve("up.md")));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void setBacksUpBeforeOverwriting() throws Exception {
        Path root = TestVaults.create("aiorg-files-");
        try {
            AiorgConfig config = TestVaults.config(root);
            Path task = TestVaults.writeTask(config, TaskStatus.NEXT, "AB23", "Review budget", null);
            String before = Files.readString(task);
            VaultFiles files = new VaultFiles(config, TestVaults.clock());

            VaultFiles.Written written = files.set("AB23", "---\nid: AB23\n---\n\n# Review budget v2\n");

            Assertions.assertTrue(written.underTasks());
            Assertions.assertTrue(Files.readString(task).endsWith("# Review budget v2\n"));
            Path backup = config.backupDir()
                    .resolve(root.relativize(task.getParent()))
                    .resolve("2026-03-01-ab23-20260310-090000.md");
            Assertions.assertEquals(root.relativize(backup).toString().replace('\\', '/'), written.backup());
            Assertions.assertEquals(before, Files.readString(backup));

            // The backup copy carries the same title but is never a lookup candidate.
            Assertions.assertEquals(written.file(), files.get("budget v2").file());
            Assertions.assertEquals(written.file(), files.get("AB23").file());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void setCreatesNewPathsWithoutBackup() throws Exception {
        Path root = TestVaults.create("aiorg-files-");
        try {
            AiorgConfig config = TestVaults.config(root);
            VaultFiles files = new VaultFiles(config, TestVaults.clock());

            VaultFiles.Written written = files.set("Journal/2026-03-10.md", "");

            Assertions.assertEquals("Journal/2026-03-10.md", written.file());
            Assertions.assertNull(written.backup());
            Assertions.assertFalse(written.underTasks());
            Assertions.assertEquals("", Files.readString(root.resolve("Journal/2026-03-10.md")));
            Assertions.assertFalse(Files.exists(config.backupDir()));

            Assertions.assertThrows(InvalidParamsException.class, () -> files.set("no such title", "x"));
            Assertions.assertThrows(InvalidParamsException.class, () -> files.set("Journal/x.md", null));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void ambiguousTitlesListRelativePaths() throws Exception {
        Path root = TestVaults.create("aiorg-files-");
        try {
            AiorgConfig config = TestVaults.config(root);
            TestVaults.writeTask(config, TaskStatus.INBOX, "AB23", "Budget review", null);
            TestVaults.writeTask(config, TaskStatus.NEXT, "CD45", "Budget plan", null);
            VaultFiles files = new VaultFiles(config, TestVaults.clock());

            AmbiguousMatchException ambiguous = Assertions.assertThrows(AmbiguousMatchException.class,
                    () -> files.get("budget"));
            Assertions.assertEquals(2, ambiguous.matches().size());
            for (String match : ambiguous.matches()) {
                Assertions.assertTrue(match.startsWith("AIO/Tasks/"), match);
            }
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void uninitializedVaultIsRejected() throws Exception {
        Path root = Files.createTempDirectory("aiorg-files-");
        try {
            VaultFiles files = new VaultFiles(AiorgConfig.forVault(root), TestVaults.clock());
            Assertions.assertThrows(VaultNotInitializedException.class, () -> files.get("anything"));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }
}
