package io.threadline.storage;

import io.threadline.channel.Channel;
import io.threadline.model.ChannelWrite;
import io.threadline.model.Checkpoint;
import io.threadline.model.CheckpointIdPolicy;
import io.threadline.model.CheckpointMetadata;
import io.threadline.model.CheckpointTuple;
import io.threadline.model.RunConfig;
import io.threadline.serde.Serializer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Shared plumbing for backends: serializer, version oracle, id policy, and the rejecting
 * defaults for whichever operation family a backend does not implement.
 */
public abstract class BaseCheckpointStore implements CheckpointStore {
    protected final Serializer serde;
    protected final VersionOracle versions;
    protected final CheckpointIdPolicy idPolicy;

    protected BaseCheckpointStore(Serializer serde, CheckpointIdPolicy idPolicy) {
        this.serde = serde;
        this.versions = new VersionOracle(serde);
        this.idPolicy = idPolicy == null ? CheckpointIdPolicy.CALLER_SUPPLIED : idPolicy;
    }

    public Serializer serde() {
        return serde;
    }

    public CheckpointIdPolicy idPolicy() {
        return idPolicy;
    }

    @Override
    public String nextVersion(String current, Channel<?, ?, ?> channel) {
        return versions.nextVersion(current, channel);
    }

    /** Message used when the blocking family is called on an async-only backend. */
    protected String blockingUnsupportedMessage() {
        return getClass().getSimpleName() + " does not support blocking operations. Use the *Async methods instead.";
    }

    /** Message used when the async family is called on a blocking-only backend. */
    protected String asyncUnsupportedMessage() {
        return getClass().getSimpleName() + " does not support async operations. Use the blocking methods instead.";
    }

    @Override
    public void setup() {
        throw new UnsupportedOperationException(blockingUnsupportedMessage());
    }

    @Override
    public Optional<CheckpointTuple> getTuple(RunConfig config) {
        throw new UnsupportedOperationException(blockingUnsupportedMessage());
    }

    @Override
    public Stream<CheckpointTuple> list(RunConfig config, Map<String, Object> filter, String beforeId, Integer limit) {
        throw new UnsupportedOperationException(blockingUnsupportedMessage());
    }

    @Override
    public RunConfig put(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata) {
        throw new UnsupportedOperationException(blockingUnsupportedMessage());
    }

    @Override
    public void putWrites(RunConfig config, List<ChannelWrite> writes, String taskId) {
        throw new UnsupportedOperationException(blockingUnsupportedMessage());
    }

    @Override
    public CompletableFuture<Void> setupAsync() {
        throw new UnsupportedOperationException(asyncUnsupportedMessage());
    }

    @Override
    public CompletableFuture<Optional<CheckpointTuple>> getTupleAsync(RunConfig config) {
        throw new UnsupportedOperationException(asyncUnsupportedMessage());
    }

    @Override
    public CompletableFuture<List<CheckpointTuple>> listAsync(RunConfig config, Map<String, Object> filter, String beforeId, Integer limit) {
        throw new UnsupportedOperationException(asyncUnsupportedMessage());
    }

    @Override
    public CompletableFuture<RunConfig> putAsync(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata) {
        throw new UnsupportedOperationException(asyncUnsupportedMessage());
    }

    @Override
    public CompletableFuture<Void> putWritesAsync(RunConfig config, List<ChannelWrite> writes, String taskId) {
        throw new UnsupportedOperationException(asyncUnsupportedMessage());
    }

    protected static void requireCheckpointId(RunConfig config) {
        if (config.checkpointId() == null) {
            throw new IllegalArgumentException("checkpoint_id is required to record writes for thread " + config.threadId());
        }
    }

    protected static void requireValidLimit(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }
}
