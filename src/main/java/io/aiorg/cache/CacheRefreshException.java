package io.aiorg.cache;

public final class CacheRefreshException extends RuntimeException {
    public CacheRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
