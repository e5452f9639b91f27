package io.threadline.storage.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Schema for the embedded store. Databases written by the older layout, keyed by
 * {@code (thread_id, thread_ts)} without namespaces or type tags, are rebuilt in place.
 */
final class SqliteSchema {
    private static final Logger log = LoggerFactory.getLogger(SqliteSchema.class);
    private static final Set<String> JOURNAL_MODES = Set.of("DELETE", "TRUNCATE", "PERSIST", "MEMORY", "WAL", "OFF");

    static final String CREATE_CHECKPOINTS = """
            CREATE TABLE IF NOT EXISTS checkpoints (
                thread_id TEXT NOT NULL,
                checkpoint_ns TEXT NOT NULL DEFAULT '',
                checkpoint_id TEXT NOT NULL,
                parent_checkpoint_id TEXT,
                type TEXT,
                checkpoint BLOB,
                metadata BLOB,
                PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id)
            )
            """;

    static final String CREATE_WRITES = """
            CREATE TABLE IF NOT EXISTS writes (
                thread_id TEXT NOT NULL,
                checkpoint_ns TEXT NOT NULL DEFAULT '',
                checkpoint_id TEXT NOT NULL,
                task_id TEXT NOT NULL,
                idx INTEGER NOT NULL,
                channel TEXT NOT NULL,
                type TEXT,
                value BLOB,
                PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id, task_id, idx)
            )
            """;

    private SqliteSchema() {
    }

    static void apply(Connection conn, String journalMode) throws SQLException {
        String mode = journalMode == null ? "WAL" : journalMode.trim().toUpperCase(Locale.ROOT);
        if (!JOURNAL_MODES.contains(mode)) {
            throw new IllegalArgumentException("Unsupported SQLite journal mode: " + journalMode);
        }
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=" + mode);
        }

        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            migrateLegacyCheckpoints(conn);
            migrateLegacyWrites(conn);
            try (Statement st = conn.createStatement()) {
                st.execute(CREATE_CHECKPOINTS);
                st.execute(CREATE_WRITES);
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(conn, e);
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private static void migrateLegacyCheckpoints(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "checkpoints");
        if (!columns.contains("thread_ts")) {
            return;
        }
        log.info("Migrating legacy checkpoints table to namespaced layout");
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE checkpoints RENAME TO checkpoints_legacy");
            st.execute(CREATE_CHECKPOINTS);
            st.execute("""
                    INSERT INTO checkpoints (thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, type, checkpoint, metadata)
                    SELECT thread_id, '', thread_ts, parent_ts, NULL, checkpoint, metadata FROM checkpoints_legacy
                    """);
            st.execute("DROP TABLE checkpoints_legacy");
        }
    }

    private static void migrateLegacyWrites(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "writes");
        if (!columns.contains("thread_ts")) {
            return;
        }
        log.info("Migrating legacy writes table to namespaced layout");
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE writes RENAME TO writes_legacy");
            st.execute(CREATE_WRITES);
            st.execute("""
                    INSERT INTO writes (thread_id, checkpoint_ns, checkpoint_id, task_id, idx, channel, type, value)
                    SELECT thread_id, '', thread_ts, task_id, idx, channel, NULL, value FROM writes_legacy
                    """);
            st.execute("DROP TABLE writes_legacy");
        }
    }

    static Set<String> tableColumns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            log.warn("Rollback failed", rollbackError);
            cause.addSuppressed(rollbackError);
        }
    }
}
