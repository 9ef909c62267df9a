package io.aiorg.cache;

import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;
import io.aiorg.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * In-memory mirror of the vault's tasks.
 *
 * <p>Reads go straight to the current {@link CacheIndex} through a volatile reference and never
 * block. Every rebuild runs on one refresh thread, builds a complete new index from the store and
 * swaps it in; a failed rebuild leaves the previous index in place.
 */
public final class VaultCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VaultCache.class);
    private static final Comparator<Task> BY_DUE_THEN_CREATED = Comparator
            .comparing(Task::due, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Task::created, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TaskStore store;
    private final Clock clock;
    private final ExecutorService refresher;
    private final List<Consumer<CacheIndex>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong refreshCount = new AtomicLong();

    private volatile CacheIndex index = CacheIndex.EMPTY;
    private volatile boolean populated;
    private volatile Instant lastRefresh;
    private volatile String lastRefreshError;
    private volatile BooleanSupplier watching = () -> false;

    public VaultCache(TaskStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.refresher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "aiorg-cache-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    public void refresh() {
        await(refreshAsync(), "refresh");
    }

    public CompletableFuture<CacheIndex> refreshAsync() {
        return CompletableFuture.supplyAsync(this::rebuild, refresher);
    }

    public CompletableFuture<CacheIndex> invalidate(String id) {
        return CompletableFuture.supplyAsync(() -> {
            Optional<Task> reloaded = store.get(id);
            CacheIndex next = index.replacing(id, reloaded.orElse(null));
            publish(next);
            return next;
        }, refresher);
    }

    public void invalidateAndWait(String id) {
        await(invalidate(id), "invalidate " + id);
    }

    public Optional<Task> get(String id) {
        return Optional.ofNullable(index.get(id));
    }

    public List<Task> list(TaskStatus status) {
        CacheIndex snapshot = index;
        if (status != null) {
            return snapshot.tasks(status);
        }
        List<Task> out = new ArrayList<>();
        for (TaskStatus s : TaskStatus.values()) {
            if (s.activeByDefault()) {
                out.addAll(snapshot.tasks(s));
            }
        }
        return out;
    }

    public List<Task> listToday(LocalDate today) {
        List<Task> out = new ArrayList<>();
        for (Task task : index.all()) {
            if (task.status() != TaskStatus.COMPLETED && task.due() != null && !task.due().isAfter(today)) {
                out.add(task);
            }
        }
        out.sort(BY_DUE_THEN_CREATED);
        return out;
    }

    public List<Task> listOverdue(LocalDate today) {
        List<Task> out = new ArrayList<>();
        for (Task task : index.all()) {
            if (task.isOverdue(today)) {
                out.add(task);
            }
        }
        out.sort(BY_DUE_THEN_CREATED);
        return out;
    }

    public List<Task> all() {
        List<Task> out = new ArrayList<>();
        index.all().forEach(out::add);
        return out;
    }

    public CacheStats stats() {
        CacheIndex snapshot = index;
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (TaskStatus s : TaskStatus.values()) {
            byStatus.put(s.value(), snapshot.count(s));
        }
        return new CacheStats(
                snapshot.size(),
                byStatus,
                watching.getAsBoolean(),
                populated,
                refreshCount.get(),
                lastRefresh,
                lastRefreshError
        );
    }

    public boolean isPopulated() {
        return populated;
    }

    // Called on the refresh thread after each successful swap.
    public void addListener(Consumer<CacheIndex> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<CacheIndex> listener) {
        listeners.remove(listener);
    }

    public void watchingWith(BooleanSupplier supplier) {
        this.watching = supplier == null ? () -> false : supplier;
    }

    @Override
    public void close() {
        refresher.shutdown();
        try {
            if (!refresher.awaitTermination(5, TimeUnit.SECONDS)) {
                refresher.shutdownNow();
            }
        } catch (InterruptedException e) {
            refresher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CacheIndex rebuild() {
        long start = System.nanoTime();
        CacheIndex next;
        try {
            Map<TaskStatus, List<Task>> listings = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                listings.put(status, store.list(status));
            }
            next = CacheIndex.build(listings);
        } catch (RuntimeException e) {
            lastRefreshError = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Cache refresh failed; keeping previous index ({} tasks)", index.size(), e);
            throw new CacheRefreshException("Cache refresh failed", e);
        }
        publish(next);
        refreshCount.incrementAndGet();
        populated = true;
        lastRefreshError = null;
        log.info("Cache refreshed: {} tasks loaded in {} ms", next.size(), (System.nanoTime() - start) / 1_000_000L);
        return next;
    }

    private void publish(CacheIndex next) {
        index = next;
        lastRefresh = clock.instant();
        for (Consumer<CacheIndex> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                log.error("Cache update listener failed", e);
            }
        }
    }

    private static void await(CompletableFuture<?> future, String what) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheRefreshException("Interrupted waiting for cache " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CacheRefreshException cre) {
                throw cre;
            }
            throw new CacheRefreshException("Cache " + what + " failed", cause);
        }
    }
}
