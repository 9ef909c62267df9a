package io.aiorg.transport.socket;

import io.aiorg.rpc.RpcDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local socket server. One worker thread per connection reads frames, dispatches them and writes
 * the responses back in order. A failure on one connection only closes that connection.
 */
public final class SocketTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);
    private static final long STOP_WAIT_MILLIS = 5_000;

    private final Path socketPath;
    private final int maxMessageBytes;
    private final RpcDispatcher dispatcher;
    private final Set<Connection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionSeq = new AtomicInteger();

    private volatile boolean running;
    private ServerSocketChannel server;
    private Thread acceptThread;
    private ExecutorService workers;

    public SocketTransport(Path socketPath, int maxMessageBytes, RpcDispatcher dispatcher) {
        this.socketPath = socketPath;
        this.maxMessageBytes = maxMessageBytes;
        this.dispatcher = dispatcher;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            Path parent = socketPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.deleteIfExists(socketPath)) {
                log.info("Removed stale socket file {}", socketPath);
            }
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            server.bind(UnixDomainSocketAddress.of(socketPath));
            restrictPermissions();
        } catch (IOException e) {
            closeServerQuietly();
            throw new UncheckedIOException("Failed to bind socket " + socketPath, e);
        }
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "aiorg-socket-conn-" + connectionSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;
        acceptThread = new Thread(this::acceptLoop, "aiorg-socket-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Socket transport listening on {}", socketPath);
    }

    private void restrictPermissions() throws IOException {
        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.warn("File system does not support POSIX permissions; socket {} left with default mode", socketPath);
        }
    }

    private void acceptLoop() {
        while (running) {
            SocketChannel channel;
            try {
                channel = server.accept();
            } catch (AsynchronousCloseException e) {
                break;
            } catch (IOException e) {
                if (running) {
                    log.error("Accept failed on {}", socketPath, e);
                }
                break;
            }
            Connection conn = new Connection(channel);
            connections.add(conn);
            try {
                workers.execute(() -> serve(conn));
            } catch (RuntimeException e) {
                log.warn("Rejected connection: {}", e.getMessage());
                conn.close();
                connections.remove(conn);
            }
        }
    }

    private void serve(Connection conn) {
        log.debug("Connection opened");
        try {
            InputStream in = Channels.newInputStream(conn.channel);
            while (running) {
                byte[] frame = FrameCodec.read(in, maxMessageBytes);
                if (frame == null) {
                    break;
                }
                conn.write(dispatcher.handle(frame));
            }
        } catch (FrameTooLargeException e) {
            log.warn("Closing connection: {}", e.getMessage());
        } catch (IOException e) {
            if (running) {
                log.debug("Connection ended: {}", e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Connection worker failed", e);
        } finally {
            conn.close();
            connections.remove(conn);
            log.debug("Connection closed");
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        closeServerQuietly();
        for (Connection conn : connections) {
            conn.close();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Socket workers still running after {} ms", STOP_WAIT_MILLIS);
                workers.shutdownNow();
            }
            acceptThread.join(STOP_WAIT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        connections.clear();
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Failed to delete socket file {}: {}", socketPath, e.getMessage());
        }
        log.info("Socket transport stopped");
    }

    private void closeServerQuietly() {
        if (server == null) {
            return;
        }
        try {
            server.close();
        } catch (IOException e) {
            log.debug("Error closing socket listener: {}", e.getMessage());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Path socketPath() {
        return socketPath;
    }

    public int connectionCount() {
        return connections.size();
    }

    @Override
    public void close() {
        stop();
    }

    private static final class Connection {
        private final SocketChannel channel;
        private final OutputStream out;
        private final Object writeLock = new Object();

        Connection(SocketChannel channel) {
            this.channel = channel;
            this.out = Channels.newOutputStream(channel);
        }

        void write(byte[] body) throws IOException {
            byte[] frame = FrameCodec.encode(body);
            synchronized (writeLock) {
                out.write(frame);
                out.flush();
            }
        }

        void close() {
            synchronized (writeLock) {
                try {
                    channel.close();
                } catch (IOException e) {
                    log.debug("Error closing connection: {}", e.getMessage());
                }
            }
        }
    }
}
