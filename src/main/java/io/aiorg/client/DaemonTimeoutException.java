package io.aiorg.client;

import java.time.Duration;

public final class DaemonTimeoutException extends DaemonException {
    public DaemonTimeoutException(String method, Duration timeout) {
        super("Daemon did not answer " + method + " within " + timeout.toMillis() + " ms");
    }
}
