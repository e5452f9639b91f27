package io.threadline.model;

import io.threadline.channel.Channel;
import io.threadline.channel.EmptyChannelException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Checkpoints {
    private Checkpoints() {
    }

    public static Checkpoint empty() {
        return new Checkpoint(
                Checkpoint.FORMAT_VERSION,
                CheckpointIds.next(),
                Instant.now().toString(),
                Map.of(),
                Map.of(),
                Map.of(),
                List.of()
        );
    }

    public static Checkpoint copy(Checkpoint checkpoint) {
        return new Checkpoint(
                checkpoint.v(),
                checkpoint.id(),
                checkpoint.ts(),
                checkpoint.channelValues(),
                checkpoint.channelVersions(),
                checkpoint.versionsSeen(),
                checkpoint.pendingSends()
        );
    }

    /**
     * Snapshots {@code channels} into a new checkpoint with a fresh id. Channels that have nothing
     * to persist are left out; versions and pending sends carry over from {@code previous}.
     */
    public static Checkpoint create(Checkpoint previous, Map<String, ? extends Channel<?, ?, ?>> channels) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Channel<?, ?, ?>> entry : channels.entrySet()) {
            try {
                values.put(entry.getKey(), entry.getValue().checkpoint());
            } catch (EmptyChannelException ignored) {
                // empty channels have no durable value
            }
        }
        return new Checkpoint(
                Checkpoint.FORMAT_VERSION,
                CheckpointIds.next(),
                Instant.now().toString(),
                values,
                previous.channelVersions(),
                previous.versionsSeen(),
                previous.pendingSends()
        );
    }
}
