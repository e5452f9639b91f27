package io.threadline.storage.sqlite;

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
import io.threadline.util.MetadataFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Embedded checkpoint store on a single SQLite connection.
 *
 * <p>Each checkpoint is one row holding the snapshot as a JSON document in which every channel
 * value is serialized on its own; pending writes live in a companion table. Every statement on the shared connection runs under one exclusive lock, and
 * mutations additionally run in their own transaction, so callers on different threads never
 * interleave statements.
 *
 * <p>Only the blocking operations are supported; use
 * {@link io.threadline.storage.postgres.PostgresCheckpointStore} for async access.
 */
public final class SqliteCheckpointStore extends BaseCheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteCheckpointStore.class);

    private static final String SELECT_CHECKPOINT = """
            SELECT thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, type, checkpoint, metadata
            FROM checkpoints""";

    private final Connection conn;
    private final String journalMode;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean isSetup;

    public SqliteCheckpointStore(Connection conn) {
        this(conn, new JsonPlusSerializer(), CheckpointIdPolicy.CALLER_SUPPLIED, ThreadlineConfig.DEFAULT_JOURNAL_MODE);
    }

    public SqliteCheckpointStore(Connection conn, Serializer serde, CheckpointIdPolicy idPolicy, String journalMode) {
        super(serde, idPolicy);
        this.conn = conn;
        this.journalMode = journalMode;
    }

    /** Opens a store on {@code :memory:} or a database file path. */
    public static SqliteCheckpointStore fromConnString(String connString) {
        return fromConfig(ThreadlineConfig.sqlite(connString));
    }

    public static SqliteCheckpointStore fromConfig(ThreadlineConfig config) {
        try {
            Optional<Path> file = config.sqliteFile();
            if (file.isPresent() && file.get().getParent() != null) {
                Files.createDirectories(file.get().getParent());
            }
            Connection conn = DriverManager.getConnection(config.sqliteJdbcUrl());
            return new SqliteCheckpointStore(conn, new JsonPlusSerializer(), config.idPolicy(), config.journalMode());
        } catch (IOException | SQLException e) {
            throw new CheckpointStoreException("Failed to open SQLite database at " + config.sqlitePath(), e);
        }
    }

    @Override
    public void setup() {
        if (isSetup) {
            return;
        }
        lock.lock();
        try {
            if (isSetup) {
                return;
            }
            SqliteSchema.apply(conn, journalMode);
            isSetup = true;
            log.info("SQLite checkpoint schema ready (journal_mode={})", journalMode);
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to initialize SQLite checkpoint schema", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CheckpointTuple> getTuple(RunConfig config) {
        Optional<StoredTuple> stored = withConnection("load checkpoint", c -> {
            Optional<CheckpointRow> row = config.checkpointId() != null
                    ? selectOne(c, SELECT_CHECKPOINT + " WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ?",
                    config.threadId(), config.checkpointNs(), config.checkpointId())
                    : selectOne(c, SELECT_CHECKPOINT + " WHERE thread_id = ? AND checkpoint_ns = ? ORDER BY checkpoint_id DESC LIMIT 1",
                    config.threadId(), config.checkpointNs());
            if (row.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new StoredTuple(row.get(), selectWrites(c, row.get())));
        });
        return stored.map(s -> toTuple(s.row(), s.writes()));
    }

    /**
     * Rows are read under the connection lock when this method is called; decoding and the
     * metadata filter run as the returned stream is consumed.
     */
    @Override
    public Stream<CheckpointTuple> list(RunConfig config, Map<String, Object> filter, String beforeId, Integer limit) {
        requireValidLimit(limit);
        boolean filtering = filter != null && !filter.isEmpty();
        StringBuilder sql = new StringBuilder(SELECT_CHECKPOINT);
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
        if (!wheres.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", wheres));
        }
        sql.append(" ORDER BY checkpoint_id DESC");
        if (limit != null && !filtering) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }

        List<CheckpointRow> rows = withConnection("list checkpoints", c -> selectAll(c, sql.toString(), params.toArray()));
        Stream<CheckpointTuple> tuples = rows.stream().map(row -> toTuple(row, null));
        if (filtering) {
            tuples = tuples.filter(t -> MetadataFilter.matches(t.metadata().values(), filter));
            if (limit != null) {
                tuples = tuples.limit(limit);
            }
        }
        return tuples;
    }

    @Override
    public RunConfig put(RunConfig config, Checkpoint checkpoint, CheckpointMetadata metadata) {
        String checkpointId = idPolicy.resolve(checkpoint);
        Checkpoint stored = checkpointId.equals(checkpoint.id()) ? checkpoint : checkpoint.withId(checkpointId);
        String parentId = checkpointId.equals(config.checkpointId()) ? null : config.checkpointId();
        TypedValue checkpointValue = serde.dumps(CheckpointDocument.encode(serde, stored, true));
        TypedValue metadataValue = serde.dumps(
                (metadata == null ? CheckpointMetadata.empty() : metadata).mergedWith(config).values());

        inTransaction("put checkpoint", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO checkpoints (thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, type, checkpoint, metadata)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id) DO UPDATE SET
                        type = excluded.type,
                        checkpoint = excluded.checkpoint,
                        metadata = excluded.metadata
                    """)) {
                ps.setString(1, config.threadId());
                ps.setString(2, config.checkpointNs());
                ps.setString(3, checkpointId);
                ps.setString(4, parentId);
                ps.setString(5, checkpointValue.type());
                ps.setBytes(6, checkpointValue.data());
                ps.setBytes(7, metadataValue.data());
                ps.executeUpdate();
            }
            return null;
        });
        log.debug("Stored checkpoint {} for thread {} (parent={})", checkpointId, config.threadId(), parentId);
        return config.pointingAt(checkpointId);
    }

    @Override
    public void putWrites(RunConfig config, List<ChannelWrite> writes, String taskId) {
        requireCheckpointId(config);
        if (writes.isEmpty()) {
            return;
        }
        List<TypedValue> values = new ArrayList<>(writes.size());
        for (ChannelWrite write : writes) {
            values.add(serde.dumps(write.value()));
        }
        int inserted = inTransaction("put writes", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR IGNORE INTO writes (thread_id, checkpoint_ns, checkpoint_id, task_id, idx, channel, type, value)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                for (int idx = 0; idx < writes.size(); idx++) {
                    ps.setString(1, config.threadId());
                    ps.setString(2, config.checkpointNs());
                    ps.setString(3, config.checkpointId());
                    ps.setString(4, taskId);
                    ps.setInt(5, idx);
                    ps.setString(6, writes.get(idx).channel());
                    ps.setString(7, values.get(idx).type());
                    ps.setBytes(8, values.get(idx).data());
                    ps.addBatch();
                }
                int count = 0;
                for (int n : ps.executeBatch()) {
                    count += Math.max(n, 0);
                }
                return count;
            }
        });
        log.debug("Recorded {}/{} writes for task {} on checkpoint {}", inserted, writes.size(), taskId, config.checkpointId());
    }

    @Override
    protected String asyncUnsupportedMessage() {
        return "SqliteCheckpointStore does not support async operations. "
                + "Use the blocking methods, or PostgresCheckpointStore for async access.";
    }

    @Override
    public void close() {
        lock.lock();
        try {
            conn.close();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to close SQLite connection", e);
        } finally {
            lock.unlock();
        }
    }

    private CheckpointTuple toTuple(CheckpointRow row, List<WriteRow> writes) {
        Checkpoint checkpoint = loadCheckpoint(row);
        CheckpointMetadata metadata = row.metadata() == null
                ? CheckpointMetadata.empty()
                : new CheckpointMetadata(loadMap(row.metadata()));
        RunConfig config = RunConfig.forCheckpoint(row.threadId(), row.checkpointNs(), row.checkpointId());
        RunConfig parent = row.parentCheckpointId() == null
                ? null
                : RunConfig.forCheckpoint(row.threadId(), row.checkpointNs(), row.parentCheckpointId());
        List<PendingWrite> pending = null;
        if (writes != null) {
            pending = new ArrayList<>(writes.size());
            for (WriteRow w : writes) {
                pending.add(new PendingWrite(w.taskId(), w.channel(), serde.loads(typed(w.type(), w.value()))));
            }
        }
        return new CheckpointTuple(config, checkpoint, metadata, parent, pending);
    }

    private Checkpoint loadCheckpoint(CheckpointRow row) {
        TypedValue value = typed(row.type(), row.checkpoint());
        if (row.checkpoint() != null && JsonPlusSerializer.isLegacyPayload(row.checkpoint())) {
            return serde.loads(value, Checkpoint.class);
        }
        return CheckpointDocument.decode(serde, serde.loads(value, ObjectNode.class));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadMap(byte[] data) {
        return serde.loads(typed(null, data), Map.class);
    }

    private static TypedValue typed(String type, byte[] data) {
        return new TypedValue(type == null ? TypedValue.JSON : type, data);
    }

    private static Optional<CheckpointRow> selectOne(Connection c, String sql, Object... params) throws SQLException {
        List<CheckpointRow> rows = selectAll(c, sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static List<CheckpointRow> selectAll(Connection c, String sql, Object... params) throws SQLException {
        List<CheckpointRow> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new CheckpointRow(
                            rs.getString("thread_id"),
                            rs.getString("checkpoint_ns"),
                            rs.getString("checkpoint_id"),
                            rs.getString("parent_checkpoint_id"),
                            rs.getString("type"),
                            rs.getBytes("checkpoint"),
                            rs.getBytes("metadata")
                    ));
                }
            }
        }
        return rows;
    }

    private static List<WriteRow> selectWrites(Connection c, CheckpointRow row) throws SQLException {
        List<WriteRow> writes = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT task_id, channel, type, value FROM writes
                WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ?
                ORDER BY task_id, idx
                """)) {
            ps.setString(1, row.threadId());
            ps.setString(2, row.checkpointNs());
            ps.setString(3, row.checkpointId());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    writes.add(new WriteRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getBytes(4)));
                }
            }
        }
        return writes;
    }

    private <T> T withConnection(String action, SqlWork<T> work) {
        setup();
        lock.lock();
        try {
            return work.run(conn);
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to " + action, e);
        } finally {
            lock.unlock();
        }
    }

    private <T> T inTransaction(String action, SqlWork<T> work) {
        setup();
        lock.lock();
        try {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                SqliteSchema.rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to " + action, e);
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private record CheckpointRow(
            String threadId,
            String checkpointNs,
            String checkpointId,
            String parentCheckpointId,
            String type,
            byte[] checkpoint,
            byte[] metadata
    ) {
    }

    private record WriteRow(String taskId, String channel, String type, byte[] value) {
    }

    private record StoredTuple(CheckpointRow row, List<WriteRow> writes) {
    }
}
