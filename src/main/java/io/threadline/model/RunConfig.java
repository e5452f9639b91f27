package io.threadline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution context handed to a store by the executor.
 *
 * <p>{@code threadId} is required. {@code configurable} carries any further caller fields; they
 * are merged into the persisted checkpoint metadata on write, together with {@code metadata}.
 */
public record RunConfig(
        String threadId,
        String checkpointNs,
        String checkpointId,
        String runId,
        Map<String, Object> configurable,
        Map<String, Object> metadata
) {
    public static final String DEFAULT_NAMESPACE = "";

    public RunConfig {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("thread_id is required");
        }
        checkpointNs = checkpointNs == null ? DEFAULT_NAMESPACE : checkpointNs;
        checkpointId = checkpointId == null || checkpointId.isBlank() ? null : checkpointId;
        runId = runId == null || runId.isBlank() ? null : runId;
        configurable = configurable == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(configurable));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunConfig forThread(String threadId) {
        return new RunConfig(threadId, DEFAULT_NAMESPACE, null, null, Map.of(), Map.of());
    }

    public static RunConfig forCheckpoint(String threadId, String checkpointNs, String checkpointId) {
        return new RunConfig(threadId, checkpointNs, checkpointId, null, Map.of(), Map.of());
    }

    public RunConfig withCheckpointId(String id) {
        return new RunConfig(threadId, checkpointNs, id, runId, configurable, metadata);
    }

    public RunConfig withNamespace(String ns) {
        return new RunConfig(threadId, ns, checkpointId, runId, configurable, metadata);
    }

    public RunConfig withRunId(String id) {
        return new RunConfig(threadId, checkpointNs, checkpointId, id, configurable, metadata);
    }

    public RunConfig withMetadata(Map<String, Object> values) {
        return new RunConfig(threadId, checkpointNs, checkpointId, runId, configurable, values);
    }

    public RunConfig withConfigurable(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(configurable);
        next.put(key, value);
        return new RunConfig(threadId, checkpointNs, checkpointId, runId, next, metadata);
    }

    /** Lineage pointer for a checkpoint written under this config: same thread and namespace. */
    public RunConfig pointingAt(String id) {
        return new RunConfig(threadId, checkpointNs, id, null, Map.of(), Map.of());
    }
}
