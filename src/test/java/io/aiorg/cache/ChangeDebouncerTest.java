package io.aiorg.cache;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

final class ChangeDebouncerTest {

    @Test
    void burstOfChangesBecomesOneRefresh() throws Exception {
        List<Set<Path>> refreshes = new CopyOnWriteArrayList<>();
        try (ChangeDebouncer debouncer = new ChangeDebouncer(50, refreshes::add)) {
            for (int i = 0; i < 5; i++) {
                debouncer.onChange(Path.of("/vault/AIO/Tasks/Inbox/task-" + i + ".md"));
            }
            debouncer.onChange(Path.of("/vault/AIO/Tasks/Inbox/task-0.md"));

            waitFor(() -> refreshes.size() == 1);
            Thread.sleep(200);

            Assertions.assertEquals(1, refreshes.size());
            Assertions.assertEquals(5, refreshes.get(0).size());
            Assertions.assertEquals(0, debouncer.pendingCount());
        }
    }

    @Test
    void nonMarkdownPathsAreIgnored() throws Exception {
        List<Set<Path>> refreshes = new CopyOnWriteArrayList<>();
        try (ChangeDebouncer debouncer = new ChangeDebouncer(20, refreshes::add)) {
            debouncer.onChange(Path.of("/vault/AIO/Tasks/Inbox/.task.md.swp"));
            debouncer.onChange(Path.of("/vault/AIO/Tasks/Inbox/notes.txt"));
            debouncer.onChange(Path.of("/vault/AIO/Tasks/Inbox/task.md.tmp"));

            Assertions.assertEquals(0, debouncer.pendingCount());
            Thread.sleep(150);
            Assertions.assertTrue(refreshes.isEmpty());
        }
    }

    @Test
    void overflowRequestsRefreshWithoutPaths() throws Exception {
        List<Set<Path>> refreshes = new CopyOnWriteArrayList<>();
        try (ChangeDebouncer debouncer = new ChangeDebouncer(20, refreshes::add)) {
            debouncer.onOverflow();
            waitFor(() -> refreshes.size() == 1);
            Assertions.assertTrue(refreshes.get(0).isEmpty());
        }
    }

    @Test
    void failingRefreshDoesNotStopLaterBatches() throws Exception {
        List<Set<Path>> refreshes = new CopyOnWriteArrayList<>();
        try (ChangeDebouncer debouncer = new ChangeDebouncer(20, paths -> {
            refreshes.add(paths);
            if (refreshes.size() == 1) {
                throw new IllegalStateException("first refresh fails");
            }
        })) {
            debouncer.onChange(Path.of("/vault/a.md"));
            waitFor(() -> refreshes.size() == 1);
            debouncer.onChange(Path.of("/vault/b.md"));
            waitFor(() -> refreshes.size() == 2);
            Assertions.assertEquals(Set.of(Path.of("/vault/b.md")), refreshes.get(1));
        }
    }

    static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
