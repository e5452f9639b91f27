package io.threadline.storage;

import io.threadline.channel.Channel;
import io.threadline.model.ChannelWrite;
import io.threadline.model.Checkpoint;
import io.threadline.model.CheckpointMetadata;
import io.threadline.model.CheckpointTuple;
import io.threadline.model.RunConfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Durable store for checkpoints and pending writes. A backend implements either the blocking or
 * the async family; the other throws {@link UnsupportedOperationException}.
 */
public interface CheckpointStore extends AutoCloseable {

    void setup();

    /** Latest checkpoint of the thread when {@code config} carries no checkpoint id. */
    Optional<CheckpointTuple> getTuple(RunConfig config);

    /** Newest first. A {@code null} config scans every thread. */
    Stream<CheckpointTuple> list(RunConfig config, Map<String, Object> filter, String beforeId, Integer limit);

    RunConfig put(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata);

    void putWrites(RunConfig config, List<ChannelWrite> writes, String taskId);

    CompletableFuture<Void> setupAsync();

    CompletableFuture<Optional<CheckpointTuple>> getTupleAsync(RunConfig config);

    CompletableFuture<List<CheckpointTuple>> listAsync(RunConfig config, Map<String, Object> filter, String beforeId, Integer limit);

    CompletableFuture<RunConfig> putAsync(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata);

    CompletableFuture<Void> putWritesAsync(RunConfig config, List<ChannelWrite> writes, String taskId);

    /** Next version for {@code channel}, strictly above {@code current}. */
    String nextVersion(String current, Channel<?, ?, ?> channel);

    default Stream<CheckpointTuple> list(RunConfig config) {
        return list(config, null, null, null);
    }

    default Optional<Checkpoint> get(RunConfig config) {
        return getTuple(config).map(CheckpointTuple::checkpoint);
    }

    @Override
    void close();
}
