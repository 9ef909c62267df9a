package io.aiorg.daemon;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.aiorg.cache.CacheStats;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthStatus(
        String status,
        String vaultPath,
        Instant startedAt,
        CacheStats cache,
        Endpoint socket,
        Endpoint http
) {
    public boolean isRunning() {
        return DaemonState.RUNNING.value().equals(status);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Endpoint(boolean enabled, boolean running, String address) {
    }
}
