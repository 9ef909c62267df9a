package io.aiorg.daemon;

import java.util.Locale;

public enum DaemonState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
