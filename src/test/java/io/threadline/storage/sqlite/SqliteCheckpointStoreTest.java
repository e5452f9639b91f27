package io.threadline.storage.sqlite;

import io.threadline.channel.LastValue;
import io.threadline.model.ChannelWrite;
import io.threadline.model.Checkpoint;
import io.threadline.model.CheckpointIdPolicy;
import io.threadline.model.CheckpointMetadata;
import io.threadline.model.CheckpointTuple;
import io.threadline.model.PendingWrite;
import io.threadline.model.RunConfig;
import io.threadline.serde.JsonPlusSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

final class SqliteCheckpointStoreTest {
    private SqliteCheckpointStore store;

    @BeforeEach
    void open() {
        store = SqliteCheckpointStore.fromConnString(":memory:");
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void latestCheckpointRoundTrips() {
        Map<String, Object> values = new HashMap<>();
        values.put("messages", List.of("hi"));
        values.put("nothing", null);
        Checkpoint checkpoint = checkpoint("c1", values);

        RunConfig saved = store.put(RunConfig.forThread("t-1"), checkpoint, CheckpointMetadata.of("input", -1, Map.of()));
        Assertions.assertEquals("c1", saved.checkpointId());
        Assertions.assertEquals("t-1", saved.threadId());

        CheckpointTuple tuple = store.getTuple(RunConfig.forThread("t-1")).orElseThrow();
        Assertions.assertEquals("c1", tuple.checkpointId());
        Assertions.assertEquals(List.of("hi"), tuple.checkpoint().channelValues().get("messages"));
        Assertions.assertTrue(tuple.checkpoint().channelValues().containsKey("nothing"));
        Assertions.assertNull(tuple.checkpoint().channelValues().get("nothing"));
        Assertions.assertFalse(tuple.checkpoint().channelValues().containsKey("absent"));
        Assertions.assertEquals("input", tuple.metadata().source());
        Assertions.assertEquals(-1, tuple.metadata().step());
        Assertions.assertTrue(tuple.parent().isEmpty());
        Assertions.assertEquals(List.of(), tuple.pendingWrites());

        Assertions.assertEquals(checkpoint, store.get(saved).orElseThrow());
        Assertions.assertTrue(store.getTuple(RunConfig.forThread("other")).isEmpty());
    }

    @Test
    void rawBytesKeepTheirTypeInValuesAndSends() {
        Checkpoint checkpoint = checkpoint("c1", Map.of("raw", new byte[]{1, 2, 3}, "text", "AQID"))
                .withPendingSends(List.of(new byte[]{9}, Map.of("node", "agent")));
        store.put(RunConfig.forThread("t-1"), checkpoint, CheckpointMetadata.empty());

        Checkpoint loaded = store.get(RunConfig.forThread("t-1")).orElseThrow();
        Object raw = loaded.channelValues().get("raw");
        Assertions.assertTrue(raw instanceof byte[], "raw was " + raw.getClass().getName());
        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) raw);
        Assertions.assertEquals("AQID", loaded.channelValues().get("text"));
        Assertions.assertEquals(checkpoint.channelVersions(), loaded.channelVersions());

        Assertions.assertEquals(2, loaded.pendingSends().size());
        Assertions.assertArrayEquals(new byte[]{9}, (byte[]) loaded.pendingSends().get(0));
        Assertions.assertEquals(Map.of("node", "agent"), loaded.pendingSends().get(1));
    }

    @Test
    void historyIsListedNewestFirstWithParents() {
        RunConfig config = RunConfig.forThread("t-1");
        for (int step = 1; step <= 3; step++) {
            config = store.put(config, checkpoint("c" + step, Map.of("step", step)), CheckpointMetadata.of("loop", step, Map.of()));
        }
        store.put(RunConfig.forThread("t-2"), checkpoint("c9", Map.of()), CheckpointMetadata.of("input", 0, Map.of()));

        List<CheckpointTuple> history = store.list(RunConfig.forThread("t-1")).collect(Collectors.toList());
        Assertions.assertEquals(List.of("c3", "c2", "c1"), ids(history));
        Assertions.assertEquals("c2", history.get(0).parentConfig().checkpointId());
        Assertions.assertEquals("c1", history.get(1).parentConfig().checkpointId());
        Assertions.assertNull(history.get(2).parentConfig());

        Assertions.assertEquals(List.of("c2"), ids(store.list(RunConfig.forThread("t-1"), null, "c3", 1)));
        Assertions.assertEquals(List.of("c2"), ids(store.list(RunConfig.forThread("t-1"), Map.of("step", 2), null, null)));
        Assertions.assertEquals(List.of("c3"), ids(store.list(RunConfig.forThread("t-1"), Map.of("source", "loop"), null, 1)));
        Assertions.assertEquals(List.of("c9", "c3", "c2", "c1"), ids(store.list(null, null, null, null)));
        Assertions.assertEquals(List.of(), ids(store.list(RunConfig.forThread("t-1"), null, null, 0)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.list(null, null, null, -1));
    }

    @Test
    void namespacesAreSeparateHistories() {
        store.put(RunConfig.forThread("t-1"), checkpoint("c1", Map.of()), CheckpointMetadata.empty());
        store.put(RunConfig.forThread("t-1").withNamespace("child"), checkpoint("c2", Map.of()), CheckpointMetadata.empty());

        Assertions.assertEquals("c1", store.getTuple(RunConfig.forThread("t-1")).orElseThrow().checkpointId());
        Assertions.assertEquals("c2", store.getTuple(RunConfig.forThread("t-1").withNamespace("child")).orElseThrow().checkpointId());
    }

    @Test
    void writesAreIdempotentAndOrdered() {
        RunConfig saved = store.put(RunConfig.forThread("t-1"), checkpoint("c1", Map.of()), CheckpointMetadata.empty());
        List<ChannelWrite> writes = List.of(ChannelWrite.of("messages", "a"), ChannelWrite.of("count", 1));
        store.putWrites(saved, writes, "task-b");
        store.putWrites(saved, writes, "task-b");
        store.putWrites(saved, List.of(ChannelWrite.of("messages", "z")), "task-a");
        store.putWrites(saved, List.of(), "task-c");

        List<PendingWrite> pending = store.getTuple(saved).orElseThrow().pendingWrites();
        Assertions.assertEquals(List.of(
                new PendingWrite("task-a", "messages", "z"),
                new PendingWrite("task-b", "messages", "a"),
                new PendingWrite("task-b", "count", 1)
        ), pending);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.putWrites(RunConfig.forThread("t-1"), writes, "task-x"));
    }

    @Test
    void callerSuppliedIdUpsertsAndGeneratedIdAppends() {
        RunConfig first = store.put(RunConfig.forThread("t-1"), checkpoint("c1", Map.of("v", 1)), CheckpointMetadata.of("loop", 1, Map.of()));
        store.put(first, checkpoint("c1", Map.of("v", 2)), CheckpointMetadata.of("update", 1, Map.of()));
        List<CheckpointTuple> rows = store.list(RunConfig.forThread("t-1")).collect(Collectors.toList());
        Assertions.assertEquals(1, rows.size());
        Assertions.assertEquals(2, rows.get(0).checkpoint().channelValues().get("v"));
        Assertions.assertEquals("update", rows.get(0).metadata().source());

        try (SqliteCheckpointStore generating = new SqliteCheckpointStore(
                memoryConnection(), new JsonPlusSerializer(), CheckpointIdPolicy.GENERATE, "WAL")) {
            RunConfig a = generating.put(RunConfig.forThread("t-1"), checkpoint("c1", Map.of()), CheckpointMetadata.empty());
            RunConfig b = generating.put(a, checkpoint("c1", Map.of()), CheckpointMetadata.empty());
            Assertions.assertNotEquals("c1", a.checkpointId());
            Assertions.assertTrue(b.checkpointId().compareTo(a.checkpointId()) > 0);
            Assertions.assertEquals(2, generating.list(RunConfig.forThread("t-1")).count());
            CheckpointTuple latest = generating.getTuple(RunConfig.forThread("t-1")).orElseThrow();
            Assertions.assertEquals(b.checkpointId(), latest.checkpoint().id());
            Assertions.assertEquals(a.checkpointId(), latest.parentConfig().checkpointId());
        }
    }

    @Test
    void configMetadataIsMergedIntoStoredMetadata() {
        RunConfig config = RunConfig.forThread("t-1").withRunId("run-1").withConfigurable("user", "ada");
        store.put(config, checkpoint("c1", Map.of()), CheckpointMetadata.of("input", 0, Map.of()));
        CheckpointMetadata metadata = store.getTuple(RunConfig.forThread("t-1")).orElseThrow().metadata();
        Assertions.assertEquals("run-1", metadata.get("run_id"));
        Assertions.assertEquals("ada", metadata.get("user"));
        Assertions.assertEquals(1, store.list(null, Map.of("run_id", "run-1"), null, null).count());
    }

    @Test
    void storeHandsOutIncreasingChannelVersions() {
        LastValue<String> channel = new LastValue<>(String.class);
        channel.update(List.of("v"));
        String first = store.nextVersion(null, channel);
        String second = store.nextVersion(first, channel);
        Assertions.assertTrue(second.compareTo(first) > 0);
    }

    @Test
    void asyncOperationsPointToTheNetworkedStore() {
        UnsupportedOperationException error = Assertions.assertThrows(
                UnsupportedOperationException.class,
                () -> store.getTupleAsync(RunConfig.forThread("t-1"))
        );
        Assertions.assertTrue(error.getMessage().contains("PostgresCheckpointStore"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> store.setupAsync());
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> store.putAsync(RunConfig.forThread("t-1"), checkpoint("c1", Map.of()), CheckpointMetadata.empty()));
    }

    @Test
    void concurrentCallersShareOneConnection() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<RunConfig>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String thread = "t-" + (i % 4);
                String id = String.format("c%03d", i);
                results.add(pool.submit(() -> {
                    store.setup();
                    return store.put(RunConfig.forThread(thread), checkpoint(id, Map.of("i", id)), CheckpointMetadata.empty());
                }));
            }
            for (Future<RunConfig> result : results) {
                result.get();
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(32, store.list(null, null, null, null).count());
        Assertions.assertEquals(8, store.list(RunConfig.forThread("t-3")).count());
        Assertions.assertEquals("c031", store.getTuple(RunConfig.forThread("t-3")).orElseThrow().checkpointId());
    }

    @Test
    void fileDatabaseSurvivesReopen(@TempDir Path dir) {
        Path file = dir.resolve("nested").resolve("checkpoints.db");
        try (SqliteCheckpointStore first = SqliteCheckpointStore.fromConnString(file.toString())) {
            first.put(RunConfig.forThread("t-1"), checkpoint("c1", Map.of("k", "v")), CheckpointMetadata.empty());
        }
        Assertions.assertTrue(Files.exists(file));
        try (SqliteCheckpointStore reopened = SqliteCheckpointStore.fromConnString(file.toString())) {
            Optional<Checkpoint> loaded = reopened.get(RunConfig.forThread("t-1"));
            Assertions.assertEquals("v", loaded.orElseThrow().channelValues().get("k"));
        }
    }

    static Checkpoint checkpoint(String id, Map<String, Object> values) {
        Map<String, String> versions = new HashMap<>();
        for (String channel : values.keySet()) {
            versions.put(channel, "00000000000000000000000000000001.");
        }
        return new Checkpoint(
                Checkpoint.FORMAT_VERSION,
                id,
                "2024-05-01T12:00:00Z",
                values,
                versions,
                Map.of(),
                Collections.emptyList()
        );
    }

    static Connection memoryConnection() {
        try {
            return DriverManager.getConnection("jdbc:sqlite::memory:");
        } catch (java.sql.SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<String> ids(java.util.stream.Stream<CheckpointTuple> tuples) {
        return ids(tuples.collect(Collectors.toList()));
    }

    private static List<String> ids(List<CheckpointTuple> tuples) {
        List<String> ids = new ArrayList<>();
        for (CheckpointTuple tuple : tuples) {
            ids.add(tuple.checkpointId());
        }
        return ids;
    }
}
