package io.threadline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form metadata stored next to a checkpoint. Stores only filter on it; they never interpret it.
 */
public record CheckpointMetadata(Map<String, Object> values) {
    public static final String SOURCE = "source";
    public static final String STEP = "step";
    public static final String WRITES = "writes";

    private static final CheckpointMetadata EMPTY = new CheckpointMetadata(Map.of());

    public CheckpointMetadata {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CheckpointMetadata empty() {
        return EMPTY;
    }

    public static CheckpointMetadata of(String source, int step, Map<String, Object> writes) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SOURCE, source);
        values.put(STEP, step);
        values.put(WRITES, writes);
        return new CheckpointMetadata(values);
    }

    public String source() {
        Object source = values.get(SOURCE);
        return source == null ? null : source.toString();
    }

    public Integer step() {
        Object step = values.get(STEP);
        return step instanceof Number n ? n.intValue() : null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Fields persisted for a write under {@code config}: configurable extras, the run id, the
     * config's metadata and finally this metadata, later entries winning.
     */
    public CheckpointMetadata mergedWith(RunConfig config) {
        Map<String, Object> merged = new LinkedHashMap<>(config.configurable());
        if (config.runId() != null) {
            merged.put("run_id", config.runId());
        }
        merged.putAll(config.metadata());
        merged.putAll(values);
        return new CheckpointMetadata(merged);
    }
}
