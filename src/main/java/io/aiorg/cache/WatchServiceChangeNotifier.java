package io.aiorg.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class WatchServiceChangeNotifier implements ChangeNotifier {
    private static final Logger log = LoggerFactory.getLogger(WatchServiceChangeNotifier.class);

    private final Path root;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private volatile WatchService watcher;
    private volatile Thread thread;

    public WatchServiceChangeNotifier(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public synchronized void start(ChangeListener listener) {
        if (thread != null) {
            return;
        }
        try {
            Files.createDirectories(root);
            watcher = FileSystems.getDefault().newWatchService();
            registerTree(root, null);
        } catch (IOException e) {
            closeWatcher();
            throw new UncheckedIOException("Failed to watch " + root, e);
        }
        Thread t = new Thread(() -> loop(listener), "aiorg-watcher");
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("Watching {} for changes", root);
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            t = thread;
            thread = null;
            closeWatcher();
        }
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("File watcher stopped");
    }

    @Override
    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void loop(ChangeListener listener) {
        WatchService ws = watcher;
        while (thread == Thread.currentThread()) {
            WatchKey key;
            try {
                key = ws.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                dispatch(listener, dir, event);
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void dispatch(ChangeListener listener, Path dir, WatchEvent<?> event) {
        try {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW || dir == null) {
                listener.onOverflow();
                return;
            }
            Path child = dir.resolve((Path) event.context());
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                registerTree(child, listener);
                return;
            }
            listener.onChange(child);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to handle change event {} in {}", event.kind(), dir, e);
        }
    }

    private void registerTree(Path start, ChangeListener listener) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(watcher,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (listener != null) {
                    listener.onChange(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void closeWatcher() {
        WatchService ws = watcher;
        watcher = null;
        keys.clear();
        if (ws == null) {
            return;
        }
        try {
            ws.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service for {}", root, e);
        }
    }
}
