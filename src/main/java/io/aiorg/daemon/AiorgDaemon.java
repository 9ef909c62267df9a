package io.aiorg.daemon;

import io.aiorg.cache.ChangeDebouncer;
import io.aiorg.cache.ChangeNotifier;
import io.aiorg.cache.VaultCache;
import io.aiorg.cache.WatchServiceChangeNotifier;
import io.aiorg.config.AiorgConfig;
import io.aiorg.dashboard.DashboardRenderer;
import io.aiorg.rpc.HandlerContext;
import io.aiorg.rpc.RpcDispatcher;
import io.aiorg.storage.EntityIds;
import io.aiorg.storage.MarkdownContextPackStore;
import io.aiorg.storage.MarkdownPersonStore;
import io.aiorg.storage.MarkdownProjectStore;
import io.aiorg.storage.MarkdownTaskStore;
import io.aiorg.storage.VaultFiles;
import io.aiorg.transport.http.HttpTransport;
import io.aiorg.transport.socket.SocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class AiorgDaemon implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AiorgDaemon.class);

    private final AiorgConfig config;
    private final Clock clock;
    private final ChangeNotifier notifier;

    private volatile DaemonState state = DaemonState.STOPPED;
    private volatile Instant startedAt;
    private volatile VaultCache cache;
    private volatile ChangeDebouncer debouncer;
    private volatile RpcDispatcher dispatcher;
    private volatile SocketTransport socket;
    private volatile HttpTransport http;
    private volatile CountDownLatch terminated = new CountDownLatch(0);

    public AiorgDaemon(AiorgConfig config) {
        this(config, Clock.systemDefaultZone(), new WatchServiceChangeNotifier(config.aioDir()));
    }

    public AiorgDaemon(AiorgConfig config, Clock clock, ChangeNotifier notifier) {
        this.config = config;
        this.clock = clock;
        this.notifier = notifier;
    }

    public synchronized void start() {
        if (state == DaemonState.RUNNING) {
            log.warn("Daemon already running for {}", config.vaultRoot());
            return;
        }
        if (state != DaemonState.STOPPED) {
            throw new IllegalStateException("Cannot start daemon while " + state.value());
        }
        state = DaemonState.STARTING;
        log.info("Starting daemon for vault {}", config.vaultRoot());
        try {
            config.ensureInitialized();
            EntityIds ids = new EntityIds(config);
            MarkdownTaskStore tasks = new MarkdownTaskStore(config, ids, clock);
            cache = new VaultCache(tasks, clock);
            cache.refresh();

            VaultCache current = cache;
            debouncer = new ChangeDebouncer(config.debounceMillis(), paths -> {
                log.debug("{} vault change(s), refreshing cache", paths.size());
                current.refreshAsync();
            });
            notifier.start(debouncer);
            cache.watchingWith(notifier::isRunning);

            HandlerContext context = new HandlerContext(
                    cache,
                    tasks,
                    new MarkdownProjectStore(config, ids, clock),
                    new MarkdownPersonStore(config, ids),
                    new MarkdownContextPackStore(config, clock),
                    new DashboardRenderer(clock),
                    new VaultFiles(config, clock),
                    clock);
            dispatcher = new RpcDispatcher(context);

            if (config.socketEnabled()) {
                socket = new SocketTransport(config.socketPath(), messageLimit(), dispatcher);
                socket.start();
            }
            if (config.httpEnabled()) {
                http = new HttpTransport(config.httpHost(), config.httpPort(), messageLimit(), dispatcher, this::healthCheck);
                http.start();
            }
        } catch (RuntimeException e) {
            log.error("Daemon failed to start; rolling back", e);
            shutdownComponents();
            state = DaemonState.STOPPED;
            throw e;
        }
        startedAt = clock.instant();
        terminated = new CountDownLatch(1);
        state = DaemonState.RUNNING;
        log.info("Daemon running ({} tasks cached)", cache.stats().totalTasks());
    }

    public synchronized void stop() {
        if (state != DaemonState.RUNNING) {
            return;
        }
        state = DaemonState.STOPPING;
        log.info("Stopping daemon");
        shutdownComponents();
        startedAt = null;
        state = DaemonState.STOPPED;
        terminated.countDown();
        log.info("Daemon stopped");
    }

    // Transports first so no call arrives mid-teardown, then the notifier, then the cache threads.
    private void shutdownComponents() {
        if (http != null) {
            http.stop();
            http = null;
        }
        if (socket != null) {
            socket.stop();
            socket = null;
        }
        notifier.stop();
        if (debouncer != null) {
            debouncer.close();
            debouncer = null;
        }
        if (cache != null) {
            cache.close();
        }
        dispatcher = null;
    }

    public HealthStatus healthCheck() {
        VaultCache c = cache;
        SocketTransport s = socket;
        HttpTransport h = http;
        InetSocketAddress httpAddress = h == null ? null : h.address();
        return new HealthStatus(
                state.value(),
                config.vaultRoot().toString(),
                startedAt,
                c == null || state != DaemonState.RUNNING ? null : c.stats(),
                new HealthStatus.Endpoint(
                        config.socketEnabled(),
                        s != null && s.isRunning(),
                        config.socketPath().toString()),
                new HealthStatus.Endpoint(
                        config.httpEnabled(),
                        h != null && h.isRunning(),
                        httpAddress == null
                                ? config.httpHost() + ":" + config.httpPort()
                                : httpAddress.getHostString() + ":" + httpAddress.getPort())
        );
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public DaemonState state() {
        return state;
    }

    public AiorgConfig config() {
        return config;
    }

    public VaultCache cache() {
        return state == DaemonState.RUNNING ? cache : null;
    }

    public InetSocketAddress httpAddress() {
        HttpTransport h = http;
        return h == null ? null : h.address();
    }

    private int messageLimit() {
        return (int) Math.min(Integer.MAX_VALUE, config.maxMessageBytes());
    }

    @Override
    public void close() {
        stop();
    }
}
