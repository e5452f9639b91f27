package io.threadline.storage.postgres;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.threadline.config.ThreadlineConfig;
import io.threadline.model.ChannelWrite;
import io.threadline.model.Checkpoint;
import io.threadline.model.CheckpointIdPolicy;
import io.threadline.model.CheckpointMetadata;
import io.threadline.model.CheckpointTuple;
import io.threadline.model.PendingWrite;
import io.threadline.model.RunConfig;
import io.threadline.serde.JsonPlusSerializer;
import io.threadline.serde.Serializer;
import io.threadline.serde.TypedValue;
import io.threadline.storage.BaseCheckpointStore;
import io.threadline.storage.CheckpointDocument;
import io.threadline.storage.CheckpointStoreException;
import io.threadline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Networked checkpoint store on PostgreSQL.
 *
 * <p>A checkpoint row holds the snapshot without its channel values. Each channel value lives in
 * {@code checkpoint_blobs} under the version it was written at, and a {@code put} only writes the
 * channels whose version advanced past the previous checkpoint. Reads join the blobs back in
 * through the checkpoint's {@code channel_versions}.
 *
 * <p>Statements run one at a time on a single connection thread. Encoding and decoding of values
 * runs on a separate worker pool so large payloads never hold up the connection. With a
 * {@link Pipeline} attached, the statements of one {@code put} or {@code putWrites} are sent as
 * batches and synced once.
 *
 * <p>Only the async operations are supported.
 */
public final class PostgresCheckpointStore extends BaseCheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresCheckpointStore.class);

    private final Connection conn;
    private final Pipeline pipeline;
    private final ExecutorService connectionExecutor;
    private final ExecutorService workers;
    private final LatestTupleCache cache = new LatestTupleCache();
    private final Object setupLock = new Object();
    private CompletableFuture<Void> setupResult;

    public PostgresCheckpointStore(Connection conn) {
        this(conn, null, new JsonPlusSerializer(), CheckpointIdPolicy.CALLER_SUPPLIED, ThreadlineConfig.DEFAULT_WORKER_THREADS);
    }

    /**
     * @param pipeline      pipeline over {@code conn}, or {@code null} to run statements one by one
     * @param workerThreads size of the pool that encodes and decodes values
     */
    public PostgresCheckpointStore(
            Connection conn,
            Pipeline pipeline,
            Serializer serde,
            CheckpointIdPolicy idPolicy,
            int workerThreads
    ) {
        super(serde, idPolicy);
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1: " + workerThreads);
        }
        this.conn = conn;
        this.pipeline = pipeline;
        this.connectionExecutor = Executors.newSingleThreadExecutor(namedThreads("threadline-pg-conn"));
        this.workers = Executors.newFixedThreadPool(workerThreads, namedThreads("threadline-pg-worker"));
    }

    public static PostgresCheckpointStore fromConnString(String url) {
        return fromConfig(ThreadlineConfig.postgres(url));
    }

    public static PostgresCheckpointStore fromConfig(ThreadlineConfig config) {
        String url = config.postgresUrl()
                .orElseThrow(() -> new IllegalStateException("postgres.url is not configured"));
        Properties props = new Properties();
        config.postgresUser().ifPresent(user -> props.setProperty("user", user));
        config.postgresPassword().ifPresent(password -> props.setProperty("password", password));
        try {
            Connection conn = DriverManager.getConnection(url, props);
            Pipeline pipeline = config.pipeline() ? new Pipeline(conn) : null;
            return new PostgresCheckpointStore(conn, pipeline, new JsonPlusSerializer(), config.idPolicy(), config.workerThreads());
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to connect to PostgreSQL at " + url, e);
        }
    }

    public boolean pipelined() {
        return pipeline != null;
    }

    /**
     * Creates the schema once. Concurrent callers share one attempt; a failed attempt is
     * forgotten so the next call retries.
     */
    @Override
    public CompletableFuture<Void> setupAsync() {
        synchronized (setupLock) {
            if (setupResult == null || setupResult.isCompletedExceptionally()) {
                setupResult = onConnection("initialize PostgreSQL checkpoint schema", c -> {
                    PostgresSchema.create(c);
                    return null;
                });
                setupResult.whenComplete((ok, error) -> {
                    if (error == null) {
                        log.info("PostgreSQL checkpoint schema ready (pipeline={})", pipelined());
                    } else {
                        log.warn("PostgreSQL checkpoint schema setup failed", error);
                    }
                });
            }
            return setupResult;
        }
    }

    @Override
    public CompletableFuture<Optional<CheckpointTuple>> getTupleAsync(RunConfig config) {
        return cache.get(config, this::fetchTuple);
    }

    /**
     * Starts loading the latest checkpoint of {@code config}'s thread in the background. The
     * next {@link #getTupleAsync} for that thread without a checkpoint id, and every one issued
     * while the load is running, receives its result instead of querying again.
     */
    public void prefetchLatest(RunConfig config) {
        RunConfig latest = config.withCheckpointId(null);
        cache.offer(latest, fetchTuple(latest));
    }

    /** Hands in an externally started lookup of the latest checkpoint of {@code config}'s thread. */
    public void offerLatest(RunConfig config, CompletableFuture<Optional<CheckpointTuple>> lookup) {
        cache.offer(config, lookup);
    }

    @Override
    public CompletableFuture<List<CheckpointTuple>> listAsync(
            RunConfig config,
            Map<String, Object> filter,
            String beforeId,
            Integer limit
    ) {
        requireValidLimit(limit);
        StringBuilder sql = new StringBuilder(PostgresSchema.SELECT_TUPLE);
        List<Object> params = new ArrayList<>();
        List<String> wheres = new ArrayList<>();
        if (config != null) {
            wheres.add("thread_id = ?");
            params.add(config.threadId());
            wheres.add("checkpoint_ns = ?");
            params.add(config.checkpointNs());
        }
        if (beforeId != null) {
            wheres.add("checkpoint_id < ?");
            params.add(beforeId);
        }
        if (filter != null && !filter.isEmpty()) {
            wheres.add("metadata @> ?::jsonb");
            params.add(Jsons.toJson(filter));
        }
        if (!wheres.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", wheres));
        }
        sql.append(" ORDER BY checkpoint_id DESC");
        if (limit != null) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }
        return setupAsync()
                .thenCompose(ready -> onConnection("list checkpoints", c -> select(c, sql.toString(), params)))
                .thenApplyAsync(rows -> {
                    List<CheckpointTuple> tuples = new ArrayList<>(rows.size());
                    for (TupleRow row : rows) {
                        tuples.add(toTuple(row));
                    }
                    return tuples;
                }, workers);
    }

    @Override
    public CompletableFuture<RunConfig> putAsync(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata) {
        String checkpointId = idPolicy.resolve(checkpoint);
        Checkpoint stored = checkpointId.equals(checkpoint.id()) ? checkpoint : checkpoint.withId(checkpointId);
        String parentId = checkpointId.equals(config.checkpointId()) ? null : config.checkpointId();
        CheckpointMetadata merged = (metadata == null ? CheckpointMetadata.empty() : metadata).mergedWith(config);
        Map<String, String> previous = cache.previousVersions(config);
        RunConfig next = config.pointingAt(checkpointId);

        return setupAsync()
                .thenApplyAsync(ready -> planPut(next, stored, parentId, merged, previous), workers)
                .thenCompose(batches -> onConnection("put checkpoint", c -> execute(c, batches)))
                .thenApply(affected -> {
                    RunConfig parent = parentId == null ? null : config.pointingAt(parentId);
                    cache.recordPut(new CheckpointTuple(next, stored, merged, parent, List.of()));
                    log.debug("Stored checkpoint {} for thread {} (parent={}, rows={})",
                            checkpointId, config.threadId(), parentId, affected);
                    return next;
                });
    }

    @Override
    public CompletableFuture<Void> putWritesAsync(RunConfig config, List<ChannelWrite> writes, String taskId) {
        requireCheckpointId(config);
        if (writes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return setupAsync()
                .thenApplyAsync(ready -> {
                    List<List<Object>> rows = new ArrayList<>(writes.size());
                    for (int idx = 0; idx < writes.size(); idx++) {
                        ChannelWrite write = writes.get(idx);
                        TypedValue value = serde.dumps(write.value());
                        rows.add(row(config.threadId(), config.checkpointNs(), config.checkpointId(),
                                taskId, idx, write.channel(), value.type(), value.data()));
                    }
                    return List.of(new StatementBatch(PostgresSchema.INSERT_WRITE, rows));
                }, workers)
                .thenCompose(batches -> onConnection("put writes", c -> execute(c, batches)))
                .thenAccept(inserted -> {
                    cache.invalidate(config);
                    log.debug("Recorded {}/{} writes for task {} on checkpoint {}",
                            inserted, writes.size(), taskId, config.checkpointId());
                });
    }

    @Override
    protected String blockingUnsupportedMessage() {
        return "PostgresCheckpointStore does not support blocking operations. "
                + "Use the *Async methods, or SqliteCheckpointStore for blocking access.";
    }

    @Override
    public void close() {
        connectionExecutor.shutdown();
        workers.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("PostgreSQL connection thread did not finish within 10s; closing anyway");
                connectionExecutor.shutdownNow();
            }
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connectionExecutor.shutdownNow();
            workers.shutdownNow();
        }
        try {
            conn.close();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to close PostgreSQL connection", e);
        }
    }

    private CompletableFuture<Optional<CheckpointTuple>> fetchTuple(RunConfig config) {
        String sql;
        List<Object> params;
        if (config.checkpointId() != null) {
            sql = PostgresSchema.SELECT_TUPLE + " WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ?";
            params = List.of(config.threadId(), config.checkpointNs(), config.checkpointId());
        } else {
            sql = PostgresSchema.SELECT_TUPLE
                    + " WHERE thread_id = ? AND checkpoint_ns = ? ORDER BY checkpoint_id DESC LIMIT 1";
            params = List.of(config.threadId(), config.checkpointNs());
        }
        return setupAsync()
                .thenCompose(ready -> onConnection("load checkpoint", c -> select(c, sql, params)))
                .thenApplyAsync(rows -> rows.isEmpty() ? Optional.<CheckpointTuple>empty() : Optional.of(toTuple(rows.get(0))), workers);
    }

    private List<StatementBatch> planPut(
            RunConfig target,
            Checkpoint checkpoint,
            String parentId,
            CheckpointMetadata metadata,
            Map<String, String> previous
    ) {
        List<List<Object>> blobRows = new ArrayList<>();
        for (BlobPlanner.BlobRow blob : BlobPlanner.plan(serde, checkpoint.channelValues(), checkpoint.channelVersions(), previous)) {
            blobRows.add(row(target.threadId(), target.checkpointNs(), blob.channel(), blob.version(),
                    blob.value().type(), blob.value().data()));
        }
        if (previous != null) {
            log.debug("Writing {}/{} channel blobs for checkpoint {}",
                    blobRows.size(), checkpoint.channelVersions().size(), target.checkpointId());
        }
        ObjectNode document = CheckpointDocument.encode(serde, checkpoint, false);

        List<StatementBatch> batches = new ArrayList<>();
        if (!blobRows.isEmpty()) {
            batches.add(new StatementBatch(PostgresSchema.UPSERT_BLOB, blobRows));
        }
        batches.add(StatementBatch.single(PostgresSchema.UPSERT_CHECKPOINT, row(
                target.threadId(),
                target.checkpointNs(),
                target.checkpointId(),
                parentId,
                document.toString(),
                Jsons.toJson(metadata.values())
        )));
        return batches;
    }

    private int execute(Connection c, List<StatementBatch> batches) throws SQLException {
        if (pipeline != null) {
            for (StatementBatch batch : batches) {
                pipeline.enqueue(batch);
            }
            return pipeline.sync();
        }
        boolean autoCommit = c.getAutoCommit();
        c.setAutoCommit(false);
        try {
            int affected = 0;
            for (StatementBatch batch : batches) {
                affected += batch.executeEach(c);
            }
            c.commit();
            return affected;
        } catch (SQLException | RuntimeException e) {
            try {
                c.rollback();
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            c.setAutoCommit(autoCommit);
        }
    }

    private static List<TupleRow> select(Connection c, String sql, List<Object> params) throws SQLException {
        List<TupleRow> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            StatementBatch.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new TupleRow(
                            rs.getString("thread_id"),
                            rs.getString("checkpoint_ns"),
                            rs.getString("checkpoint_id"),
                            rs.getString("parent_checkpoint_id"),
                            rs.getString("checkpoint"),
                            rs.getString("metadata"),
                            rs.getString("channel_values"),
                            rs.getString("pending_writes")
                    ));
                }
            }
        }
        return rows;
    }

    private CheckpointTuple toTuple(TupleRow row) {
        Checkpoint checkpoint = CheckpointDocument.decode(serde,
                (ObjectNode) Jsons.readTree(row.checkpoint()), loadChannelValues(row.channelValues()));

        CheckpointMetadata metadata = new CheckpointMetadata(
                row.metadata() == null ? Map.of() : Jsons.toMap(Jsons.readTree(row.metadata())));
        RunConfig config = RunConfig.forCheckpoint(row.threadId(), row.checkpointNs(), row.checkpointId());
        RunConfig parent = row.parentCheckpointId() == null
                ? null
                : RunConfig.forCheckpoint(row.threadId(), row.checkpointNs(), row.parentCheckpointId());
        return new CheckpointTuple(config, checkpoint, metadata, parent, loadPendingWrites(row.pendingWrites()));
    }

    private Map<String, Object> loadChannelValues(String json) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (json == null) {
            return values;
        }
        for (JsonNode entry : Jsons.readTree(json)) {
            String type = entry.get(1).asText();
            if (TypedValue.EMPTY.equals(type)) {
                continue;
            }
            values.put(entry.get(0).asText(), serde.loads(new TypedValue(type, decodeBase64(entry.get(2)))));
        }
        return values;
    }

    private List<PendingWrite> loadPendingWrites(String json) {
        List<PendingWrite> writes = new ArrayList<>();
        if (json == null) {
            return writes;
        }
        for (JsonNode entry : Jsons.readTree(json)) {
            TypedValue value = new TypedValue(entry.get(2).asText(), decodeBase64(entry.get(3)));
            writes.add(new PendingWrite(entry.get(0).asText(), entry.get(1).asText(), serde.loads(value)));
        }
        return writes;
    }

    // encode(..., 'base64') wraps lines every 76 characters
    private static byte[] decodeBase64(JsonNode node) {
        if (node == null || node.isNull()) {
            return new byte[0];
        }
        return Base64.getMimeDecoder().decode(node.asText());
    }

    private <T> CompletableFuture<T> onConnection(String action, SqlWork<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return work.run(conn);
            } catch (SQLException e) {
                throw new CheckpointStoreException("Failed to " + action, e);
            }
        }, connectionExecutor);
    }

    private static List<Object> row(Object... values) {
        List<Object> row = new ArrayList<>(values.length);
        for (Object value : values) {
            row.add(value);
        }
        return row;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private record TupleRow(
            String threadId,
            String checkpointNs,
            String checkpointId,
            String parentCheckpointId,
            String checkpoint,
            String metadata,
            String channelValues,
            String pendingWrites
    ) {
    }
}
