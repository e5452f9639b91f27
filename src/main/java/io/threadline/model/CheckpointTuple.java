package io.threadline.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-side view of a stored checkpoint.
 *
 * <p>{@code parentConfig} points at the previous checkpoint of the lineage without loading it.
 * {@code pendingWrites} is {@code null} when the query did not load writes.
 */
public record CheckpointTuple(
        RunConfig config,
        Checkpoint checkpoint,
        CheckpointMetadata metadata,
        RunConfig parentConfig,
        List<PendingWrite> pendingWrites
) {
    public CheckpointTuple {
        metadata = metadata == null ? CheckpointMetadata.empty() : metadata;
        pendingWrites = pendingWrites == null ? null : List.copyOf(pendingWrites);
    }

    public String threadId() {
        return config.threadId();
    }

    public String checkpointId() {
        return config.checkpointId();
    }

    public Optional<RunConfig> parent() {
        return Optional.ofNullable(parentConfig);
    }
}
