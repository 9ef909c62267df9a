package io.aiorg.cache;

import io.aiorg.TestVaults;
import io.aiorg.model.Task;
import io.aiorg.config.AiorgConfig;
import io.aiorg.model.TaskStatus;
import io.aiorg.storage.EntityIds;
import io.aiorg.storage.MarkdownTaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class VaultCacheTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Test
    void refreshMirrorsStoreBucketByBucket() {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        store.put(FakeTaskStore.task("CD45", TaskStatus.NEXT, null, T0));
        store.put(FakeTaskStore.task("EF67", TaskStatus.COMPLETED, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            Assertions.assertFalse(cache.isPopulated());
            cache.refresh();

            for (TaskStatus status : TaskStatus.values()) {
                Assertions.assertEquals(ids(store.list(status)), ids(cache.list(status)), status.value());
            }
            Assertions.assertTrue(cache.isPopulated());
            Assertions.assertEquals(3, cache.stats().totalTasks());
            Assertions.assertEquals(1, cache.stats().byStatus().get("completed"));
            Assertions.assertEquals("AB23", cache.get("ab23").orElseThrow().id());
        }
    }

    @Test
    void defaultListingExcludesCompletedAndSomeday() {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        store.put(FakeTaskStore.task("CD45", TaskStatus.SOMEDAY, null, T0));
        store.put(FakeTaskStore.task("EF67", TaskStatus.COMPLETED, null, T0));
        store.put(FakeTaskStore.task("GH89", TaskStatus.WAITING, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();
            Assertions.assertEquals(List.of("AB23", "GH89"), ids(cache.list(null)));
        }
    }

    @Test
    void todayAndOverdueSkipCompletedAndSortByDueThenCreated() {
        LocalDate today = TestVaults.TODAY;
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, today, T0.plusHours(2)));
        store.put(FakeTaskStore.task("CD45", TaskStatus.NEXT, today.minusDays(3), T0));
        store.put(FakeTaskStore.task("EF67", TaskStatus.COMPLETED, today.minusDays(5), T0));
        store.put(FakeTaskStore.task("GH89", TaskStatus.INBOX, today, T0));
        store.put(FakeTaskStore.task("JK23", TaskStatus.INBOX, today.plusDays(1), T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();
            Assertions.assertEquals(List.of("CD45", "GH89", "AB23"), ids(cache.listToday(today)));
            Assertions.assertEquals(List.of("CD45"), ids(cache.listOverdue(today)));
        }
    }

    @Test
    void failedRefreshKeepsPreviousIndexAndRecordsError() {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();
            store.put(FakeTaskStore.task("CD45", TaskStatus.INBOX, null, T0));
            store.failListing = true;

            Assertions.assertThrows(CacheRefreshException.class, cache::refresh);
            Assertions.assertEquals(List.of("AB23"), ids(cache.list(TaskStatus.INBOX)));
            Assertions.assertNotNull(cache.stats().lastRefreshError());

            store.failListing = false;
            cache.refresh();
            Assertions.assertEquals(List.of("AB23", "CD45"), ids(cache.list(TaskStatus.INBOX)));
            Assertions.assertNull(cache.stats().lastRefreshError());
        }
    }

    @Test
    void invalidateReloadsOrDropsOneTask() {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        store.put(FakeTaskStore.task("CD45", TaskStatus.INBOX, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();

            store.put(FakeTaskStore.task("AB23", TaskStatus.NEXT, null, T0));
            cache.invalidateAndWait("ab23");
            Assertions.assertEquals(List.of("CD45"), ids(cache.list(TaskStatus.INBOX)));
            Assertions.assertEquals(List.of("AB23"), ids(cache.list(TaskStatus.NEXT)));

            store.remove("CD45");
            cache.invalidateAndWait("CD45");
            Assertions.assertTrue(cache.get("CD45").isEmpty());
            Assertions.assertEquals(1, cache.stats().totalTasks());
        }
    }

    @Test
    void readsAreServedWhileRefreshIsInFlight() throws Exception {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();
            CountDownLatch gate = new CountDownLatch(1);
            store.listingGate = gate;
            store.put(FakeTaskStore.task("CD45", TaskStatus.INBOX, null, T0));

            CompletableFuture<CacheIndex> pending = cache.refreshAsync();
            Assertions.assertFalse(pending.isDone());
            Assertions.assertEquals(List.of("AB23"), ids(cache.list(TaskStatus.INBOX)));

            gate.countDown();
            pending.get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(List.of("AB23", "CD45"), ids(cache.list(TaskStatus.INBOX)));
        }
    }

    @Test
    void listenersSeeEachSwapAndFailuresDoNotStopOthers() {
        FakeTaskStore store = new FakeTaskStore();
        AtomicInteger seen = new AtomicInteger();
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.addListener(index -> {
                throw new IllegalStateException("listener bug");
            });
            cache.addListener(index -> seen.incrementAndGet());
            cache.refresh();
            cache.refresh();
            Assertions.assertEquals(2, seen.get());
            Assertions.assertEquals(2, cache.stats().refreshCount());
        }
    }

    @Test
    void invalidateDoesNotCountAsRefresh() {
        FakeTaskStore store = new FakeTaskStore();
        store.put(FakeTaskStore.task("AB23", TaskStatus.INBOX, null, T0));
        try (VaultCache cache = new VaultCache(store, TestVaults.clock())) {
            cache.refresh();
            Assertions.assertEquals(1, cache.stats().refreshCount());

            store.put(FakeTaskStore.task("AB23", TaskStatus.NEXT, null, T0));
            cache.invalidateAndWait("AB23");
            cache.invalidateAndWait("ZZ99");

            Assertions.assertEquals(1, cache.stats().refreshCount());
            Assertions.assertEquals(List.of("AB23"), ids(cache.list(TaskStatus.NEXT)));
        }
    }

    @Test
    void tasksAreBucketedByFrontmatterStatusNotFolder() throws Exception {
        Path root = TestVaults.create("aiorg-cache-");
        try {
            AiorgConfig config = TestVaults.config(root);
            TestVaults.writeTask(config, TaskStatus.INBOX, "CD45", "Triage mail", null);
            Path misfiled = TestVaults.writeTask(config, TaskStatus.NEXT, "AB23", "Call bank", null);
            Files.move(misfiled, config.tasksFolder(TaskStatus.INBOX).resolve(misfiled.getFileName()));

            MarkdownTaskStore tasks = new MarkdownTaskStore(config, new EntityIds(config), TestVaults.clock());
            try (VaultCache cache = new VaultCache(tasks, TestVaults.clock())) {
                cache.refresh();

                for (TaskStatus status : TaskStatus.values()) {
                    for (Task task : cache.list(status)) {
                        Assertions.assertEquals(status, task.status(), task.id() + " in " + status.value());
                    }
                }
                Assertions.assertEquals(List.of("CD45"), ids(cache.list(TaskStatus.INBOX)));
                Assertions.assertEquals(List.of("AB23"), ids(cache.list(TaskStatus.NEXT)));
                Assertions.assertEquals(1, cache.stats().byStatus().get("inbox"));
                Assertions.assertEquals(1, cache.stats().byStatus().get("next"));
            }
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    private static List<String> ids(List<Task> tasks) {
        List<String> out = new ArrayList<>();
        for (Task t : tasks) {
            out.add(t.id());
        }
        return out;
    }
}
