package io.aiorg.transport.socket;

import java.io.IOException;

public final class FrameTooLargeException extends IOException {
    private final long declaredLength;
    private final int maxBytes;

    public FrameTooLargeException(long declaredLength, int maxBytes) {
        super("Frame of " + declaredLength + " bytes exceeds limit of " + maxBytes);
        this.declaredLength = declaredLength;
        this.maxBytes = maxBytes;
    }

    public long declaredLength() {
        return declaredLength;
    }

    public int maxBytes() {
        return maxBytes;
    }
}
