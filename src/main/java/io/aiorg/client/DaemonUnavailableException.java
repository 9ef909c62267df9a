package io.aiorg.client;

public final class DaemonUnavailableException extends DaemonException {
    public DaemonUnavailableException(String message) {
        super(message);
    }

    public DaemonUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
