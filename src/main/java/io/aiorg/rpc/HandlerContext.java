package io.aiorg.rpc;

import io.aiorg.cache.VaultCache;
import io.aiorg.dashboard.DashboardRenderer;
import io.aiorg.storage.MarkdownContextPackStore;
import io.aiorg.storage.MarkdownPersonStore;
import io.aiorg.storage.MarkdownProjectStore;
import io.aiorg.storage.TaskStore;
import io.aiorg.storage.VaultFiles;

import java.time.Clock;
import java.time.LocalDate;

public record HandlerContext(
        VaultCache cache,
        TaskStore tasks,
        MarkdownProjectStore projects,
        MarkdownPersonStore people,
        MarkdownContextPackStore contextPacks,
        DashboardRenderer dashboard,
        VaultFiles files,
        Clock clock
) {
    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
