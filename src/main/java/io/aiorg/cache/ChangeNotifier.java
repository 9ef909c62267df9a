package io.aiorg.cache;

public interface ChangeNotifier extends AutoCloseable {

    void start(ChangeListener listener);

    void stop();

    boolean isRunning();

    @Override
    default void close() {
        stop();
    }
}
