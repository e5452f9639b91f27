package io.threadline.storage.postgres;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Schema for the networked store: checkpoint headers, write-once channel blobs keyed by version,
 * and pending writes.
 */
final class PostgresSchema {
    static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS checkpoints (
                thread_id TEXT NOT NULL,
                checkpoint_ns TEXT NOT NULL DEFAULT '',
                checkpoint_id TEXT NOT NULL,
                parent_checkpoint_id TEXT,
                checkpoint JSONB NOT NULL,
                metadata JSONB NOT NULL DEFAULT '{}',
                PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS checkpoint_blobs (
                thread_id TEXT NOT NULL,
                checkpoint_ns TEXT NOT NULL DEFAULT '',
                channel TEXT NOT NULL,
                version TEXT NOT NULL,
                type TEXT NOT NULL,
                blob BYTEA,
                PRIMARY KEY (thread_id, checkpoint_ns, channel, version)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS checkpoint_writes (
                thread_id TEXT NOT NULL,
                checkpoint_ns TEXT NOT NULL DEFAULT '',
                checkpoint_id TEXT NOT NULL,
                task_id TEXT NOT NULL,
                idx INTEGER NOT NULL,
                channel TEXT NOT NULL,
                type TEXT NOT NULL,
                blob BYTEA,
                PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id, task_id, idx)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_metadata ON checkpoints USING GIN (metadata)"
    );

    static final String SELECT_TUPLE = """
            SELECT
                thread_id,
                checkpoint_ns,
                checkpoint_id,
                parent_checkpoint_id,
                checkpoint::text AS checkpoint,
                metadata::text AS metadata,
                (
                    SELECT jsonb_agg(jsonb_build_array(bl.channel, bl.type, encode(bl.blob, 'base64')))
                    FROM jsonb_each_text(checkpoints.checkpoint -> 'channel_versions')
                    INNER JOIN checkpoint_blobs bl
                        ON bl.thread_id = checkpoints.thread_id
                        AND bl.checkpoint_ns = checkpoints.checkpoint_ns
                        AND bl.channel = jsonb_each_text.key
                        AND bl.version = jsonb_each_text.value
                )::text AS channel_values,
                (
                    SELECT jsonb_agg(jsonb_build_array(cw.task_id, cw.channel, cw.type, encode(cw.blob, 'base64'))
                                     ORDER BY cw.task_id, cw.idx)
                    FROM checkpoint_writes cw
                    WHERE cw.thread_id = checkpoints.thread_id
                        AND cw.checkpoint_ns = checkpoints.checkpoint_ns
                        AND cw.checkpoint_id = checkpoints.checkpoint_id
                )::text AS pending_writes
            FROM checkpoints""";

    static final String UPSERT_BLOB = """
            INSERT INTO checkpoint_blobs (thread_id, checkpoint_ns, channel, version, type, blob)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (thread_id, checkpoint_ns, channel, version) DO NOTHING""";

    static final String UPSERT_CHECKPOINT = """
            INSERT INTO checkpoints (thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, checkpoint, metadata)
            VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb)
            ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id) DO UPDATE SET
                checkpoint = EXCLUDED.checkpoint,
                metadata = EXCLUDED.metadata""";

    static final String INSERT_WRITE = """
            INSERT INTO checkpoint_writes (thread_id, checkpoint_ns, checkpoint_id, task_id, idx, channel, type, blob)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id, task_id, idx) DO NOTHING""";

    private PostgresSchema() {
    }

    static void create(Connection conn) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement()) {
            for (String ddl : DDL) {
                st.execute(ddl);
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }
}
