package io.aiorg.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

public final class ChangeDebouncer implements ChangeListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChangeDebouncer.class);

    private final long delayMillis;
    private final Consumer<Set<Path>> refresh;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();
    private final Set<Path> pending = new LinkedHashSet<>();
    private ScheduledFuture<?> timer;
    private boolean overflowed;

    public ChangeDebouncer(long delayMillis, Consumer<Set<Path>> refresh) {
        this.delayMillis = delayMillis;
        this.refresh = refresh;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "aiorg-debounce");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void onChange(Path path) {
        if (path == null || !path.getFileName().toString().endsWith(".md")) {
            return;
        }
        synchronized (lock) {
            pending.add(path);
            reschedule();
        }
    }

    @Override
    public void onOverflow() {
        synchronized (lock) {
            overflowed = true;
            reschedule();
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            pending.clear();
        }
        scheduler.shutdownNow();
    }

    private void reschedule() {
        if (scheduler.isShutdown()) {
            return;
        }
        if (timer != null) {
            timer.cancel(false);
        }
        timer = scheduler.schedule(this::flush, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void flush() {
        Set<Path> drained;
        synchronized (lock) {
            if (pending.isEmpty() && !overflowed) {
                return;
            }
            drained = Set.copyOf(pending);
            pending.clear();
            overflowed = false;
        }
        log.debug("Processing {} file change(s)", drained.size());
        try {
            refresh.accept(drained);
        } catch (RuntimeException e) {
            log.error("Refresh request after file changes failed", e);
        }
    }
}
