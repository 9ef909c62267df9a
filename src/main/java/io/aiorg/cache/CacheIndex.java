package io.aiorg.cache;

import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class CacheIndex {
    static final CacheIndex EMPTY = new CacheIndex(Map.of(), emptyBuckets());

    private final Map<String, Task> byId;
    private final Map<TaskStatus, List<String>> byStatus;

    private CacheIndex(Map<String, Task> byId, Map<TaskStatus, List<String>> byStatus) {
        this.byId = byId;
        this.byStatus = byStatus;
    }

    // Builds from per-status listings. Each task lands in the bucket of its own status, whichever listing it
    // came from; the first listing to name an id wins.
    static CacheIndex build(Map<TaskStatus, List<Task>> listings) {
        Map<String, Task> byId = new LinkedHashMap<>();
        Map<TaskStatus, List<String>> buckets = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            buckets.put(status, new ArrayList<>());
        }
        for (TaskStatus status : TaskStatus.values()) {
            for (Task task : listings.getOrDefault(status, List.of())) {
                String key = key(task.id());
                if (byId.putIfAbsent(key, task) == null) {
                    buckets.get(task.status()).add(key);
                }
            }
        }
        Map<TaskStatus, List<String>> byStatus = new EnumMap<>(TaskStatus.class);
        buckets.forEach((status, ids) -> byStatus.put(status, Collections.unmodifiableList(ids)));
        return new CacheIndex(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(byStatus));
    }

    CacheIndex replacing(String id, Task reloaded) {
        String key = key(id);
        Map<String, Task> byId = new LinkedHashMap<>(this.byId);
        byId.remove(key);
        Map<TaskStatus, List<String>> byStatus = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            List<String> ids = new ArrayList<>(this.byStatus.get(status));
            ids.remove(key);
            if (reloaded != null && reloaded.status() == status) {
                ids.add(key);
            }
            byStatus.put(status, Collections.unmodifiableList(ids));
        }
        if (reloaded != null) {
            byId.put(key, reloaded);
        }
        return new CacheIndex(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(byStatus));
    }

    public Task get(String id) {
        return id == null ? null : byId.get(key(id));
    }

    public List<Task> tasks(TaskStatus status) {
        List<Task> out = new ArrayList<>();
        for (String id : byStatus.get(status)) {
            Task task = byId.get(id);
            if (task != null) {
                out.add(task);
            }
        }
        return out;
    }

    public Iterable<Task> all() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    public int count(TaskStatus status) {
        return byStatus.get(status).size();
    }

    static String key(String id) {
        return id.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<TaskStatus, List<String>> emptyBuckets() {
        Map<TaskStatus, List<String>> m = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            m.put(status, List.of());
        }
        return Collections.unmodifiableMap(m);
    }
}
