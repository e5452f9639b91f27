package io.threadline.model;

import java.util.Locale;

/** How a store picks the id under which {@code put} persists a checkpoint. */
public enum CheckpointIdPolicy {
    /** Use the checkpoint's own id; writing an existing id again upserts that row. */
    CALLER_SUPPLIED,
    /** Assign a fresh time-ordered id on every put, so each put adds a row. */
    GENERATE;

    public String resolve(Checkpoint checkpoint) {
        if (this == CALLER_SUPPLIED && checkpoint.id() != null && !checkpoint.id().isBlank()) {
            return checkpoint.id();
        }
        return CheckpointIds.next();
    }

    public static CheckpointIdPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CALLER_SUPPLIED;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (CheckpointIdPolicy value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown checkpoint id policy: " + raw);
    }
}
