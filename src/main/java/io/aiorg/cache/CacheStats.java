package io.aiorg.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStats(
        int totalTasks,
        Map<String, Integer> byStatus,
        boolean watching,
        boolean populated,
        long refreshCount,
        Instant lastRefresh,
        String lastRefreshError
) {
    public CacheStats {
        byStatus = Collections.unmodifiableMap(new LinkedHashMap<>(byStatus));
    }
}
