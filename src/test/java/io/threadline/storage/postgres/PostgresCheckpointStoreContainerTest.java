package io.threadline.storage.postgres;

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
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Testcontainers(disabledWithoutDocker = true)
final class PostgresCheckpointStoreContainerTest {
    private static final String V1 = "00000000000000000000000000000001.aa";
    private static final String V2 = "00000000000000000000000000000002.bb";

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    private PostgresCheckpointStore store;
    private String thread;

    @BeforeEach
    void open() throws SQLException {
        store = new PostgresCheckpointStore(connect(), null, new JsonPlusSerializer(), CheckpointIdPolicy.CALLER_SUPPLIED, 2);
        store.setupAsync().join();
        thread = "t-" + UUID.randomUUID();
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void historyRoundTripsNewestFirst() {
        RunConfig config = RunConfig.forThread(thread);
        for (int step = 1; step <= 3; step++) {
            Map<String, Object> values = Map.of("messages", List.of("m" + step));
            Map<String, String> versions = Map.of("messages", String.format("%032d.", step));
            config = store.putAsync(config, checkpoint("c" + step, values, versions), CheckpointMetadata.of("loop", step, Map.of())).join();
        }

        CheckpointTuple latest = store.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow();
        Assertions.assertEquals("c3", latest.checkpointId());
        Assertions.assertEquals(List.of("m3"), latest.checkpoint().channelValues().get("messages"));
        Assertions.assertEquals("c2", latest.parentConfig().checkpointId());
        Assertions.assertEquals(3, latest.metadata().step());

        CheckpointTuple first = store.getTupleAsync(RunConfig.forCheckpoint(thread, "", "c1")).join().orElseThrow();
        Assertions.assertEquals(List.of("m1"), first.checkpoint().channelValues().get("messages"));
        Assertions.assertNull(first.parentConfig());

        Assertions.assertEquals(List.of("c3", "c2", "c1"), ids(store.listAsync(RunConfig.forThread(thread), null, null, null).join()));
        Assertions.assertEquals(List.of("c2"), ids(store.listAsync(RunConfig.forThread(thread), null, "c3", 1).join()));
        Assertions.assertEquals(List.of("c2"), ids(store.listAsync(RunConfig.forThread(thread), Map.of("step", 2), null, null).join()));
        Assertions.assertTrue(store.getTupleAsync(RunConfig.forThread(thread + "-other")).join().isEmpty());
    }

    @Test
    void unchangedChannelsKeepPointingAtTheirBlob() throws SQLException {
        Map<String, Object> before = Map.of("messages", List.of("hi"), "topic", "weather");
        RunConfig c1 = store.putAsync(RunConfig.forThread(thread),
                checkpoint("c1", before, Map.of("messages", V1, "topic", V1)), CheckpointMetadata.empty()).join();

        Map<String, Object> after = Map.of("messages", List.of("hi", "there"), "topic", "weather");
        store.putAsync(c1, checkpoint("c2", after, Map.of("messages", V2, "topic", V1)), CheckpointMetadata.empty()).join();

        Assertions.assertEquals(3, count("SELECT count(*) FROM checkpoint_blobs WHERE thread_id = ?"));
        Assertions.assertEquals(after, store.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow().checkpoint().channelValues());
        Assertions.assertEquals(before, store.getTupleAsync(c1).join().orElseThrow().checkpoint().channelValues());
    }

    @Test
    void versionedChannelWithoutValueLoadsAsAbsent() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("nothing", null);
        store.putAsync(RunConfig.forThread(thread),
                checkpoint("c1", values, Map.of("nothing", V1, "scratch", V1)), CheckpointMetadata.empty()).join();

        Checkpoint loaded = store.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow().checkpoint();
        Assertions.assertTrue(loaded.channelValues().containsKey("nothing"));
        Assertions.assertNull(loaded.channelValues().get("nothing"));
        Assertions.assertFalse(loaded.channelValues().containsKey("scratch"));
        Assertions.assertEquals(V1, loaded.channelVersions().get("scratch"));
    }

    @Test
    void pendingWritesAreIdempotentAndOrdered() {
        RunConfig saved = store.putAsync(RunConfig.forThread(thread),
                checkpoint("c1", Map.of(), Map.of()), CheckpointMetadata.empty()).join();
        List<ChannelWrite> writes = List.of(ChannelWrite.of("messages", "a"), ChannelWrite.of("raw", new byte[]{7}));
        store.putWritesAsync(saved, writes, "task-b").join();
        store.putWritesAsync(saved, writes, "task-b").join();
        store.putWritesAsync(saved, List.of(ChannelWrite.of("messages", "z")), "task-a").join();

        List<PendingWrite> pending = store.getTupleAsync(saved).join().orElseThrow().pendingWrites();
        Assertions.assertEquals(3, pending.size());
        Assertions.assertEquals(new PendingWrite("task-a", "messages", "z"), pending.get(0));
        Assertions.assertEquals(new PendingWrite("task-b", "messages", "a"), pending.get(1));
        Assertions.assertArrayEquals(new byte[]{7}, (byte[]) pending.get(2).value());
        Assertions.assertEquals(3, store.listAsync(RunConfig.forThread(thread), null, null, null).join().get(0).pendingWrites().size());
    }

    @Test
    void pendingSendsSurviveTheDocumentEncoding() {
        Checkpoint checkpoint = checkpoint("c1", Map.of(), Map.of())
                .withPendingSends(List.of(Map.of("node", "agent"), new byte[]{4, 2}));
        store.putAsync(RunConfig.forThread(thread), checkpoint, CheckpointMetadata.empty()).join();
        Checkpoint loaded = store.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow().checkpoint();
        Assertions.assertEquals(2, loaded.pendingSends().size());
        Assertions.assertEquals(Map.of("node", "agent"), loaded.pendingSends().get(0));
        Assertions.assertArrayEquals(new byte[]{4, 2}, (byte[]) loaded.pendingSends().get(1));
    }

    @Test
    void pipelinedStoreBehavesTheSame() throws SQLException {
        Connection conn = connect();
        try (PostgresCheckpointStore pipelined = new PostgresCheckpointStore(
                conn, new Pipeline(conn), new JsonPlusSerializer(), CheckpointIdPolicy.GENERATE, 2)) {
            Assertions.assertTrue(pipelined.pipelined());
            RunConfig a = pipelined.putAsync(RunConfig.forThread(thread),
                    checkpoint("ignored", Map.of("k", 1), Map.of("k", V1)), CheckpointMetadata.empty()).join();
            RunConfig b = pipelined.putAsync(a,
                    checkpoint("ignored", Map.of("k", 2), Map.of("k", V2)), CheckpointMetadata.empty()).join();
            pipelined.putWritesAsync(b, List.of(ChannelWrite.of("k", 3)), "task").join();

            Assertions.assertNotEquals("ignored", a.checkpointId());
            CheckpointTuple latest = pipelined.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow();
            Assertions.assertEquals(b.checkpointId(), latest.checkpointId());
            Assertions.assertEquals(2, latest.checkpoint().channelValues().get("k"));
            Assertions.assertEquals(a.checkpointId(), latest.parentConfig().checkpointId());
            Assertions.assertEquals(List.of(new PendingWrite("task", "k", 3)), latest.pendingWrites());
        }
    }

    @Test
    void prefetchedLatestIsSharedAcrossCallers() {
        store.putAsync(RunConfig.forThread(thread), checkpoint("c1", Map.of(), Map.of()), CheckpointMetadata.empty()).join();

        store.prefetchLatest(RunConfig.forThread(thread));
        CompletableFuture<java.util.Optional<CheckpointTuple>> a = store.getTupleAsync(RunConfig.forThread(thread));
        CompletableFuture<java.util.Optional<CheckpointTuple>> b = store.getTupleAsync(RunConfig.forThread(thread + "-other"));
        Assertions.assertEquals("c1", a.join().orElseThrow().checkpointId());
        Assertions.assertTrue(b.join().isEmpty());

        store.putAsync(RunConfig.forCheckpoint(thread, "", "c1"), checkpoint("c2", Map.of(), Map.of()), CheckpointMetadata.empty()).join();
        Assertions.assertEquals("c2", store.getTupleAsync(RunConfig.forThread(thread)).join().orElseThrow().checkpointId());
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }

    private int count(String sql) throws SQLException {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, thread);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static Checkpoint checkpoint(String id, Map<String, Object> values, Map<String, String> versions) {
        return new Checkpoint(Checkpoint.FORMAT_VERSION, id, "2024-05-01T12:00:00Z", values, versions, Map.of(), List.of());
    }

    private static List<String> ids(List<CheckpointTuple> tuples) {
        List<String> ids = new ArrayList<>();
        for (CheckpointTuple tuple : tuples) {
            ids.add(tuple.checkpointId());
        }
        return ids;
    }
}
