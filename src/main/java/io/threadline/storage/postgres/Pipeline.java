package io.threadline.storage.postgres;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Statement pipeline over one connection. Statements queue up until {@link #sync()}, which sends
 * them as driver batches inside a single transaction. The store syncs once per logical unit of
 * work ({@code put}, {@code putWrites}) rather than once per statement.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Connection conn;
    private final List<StatementBatch> queued = new ArrayList<>();

    public Pipeline(Connection conn) {
        this.conn = conn;
    }

    synchronized void enqueue(StatementBatch batch) {
        queued.add(batch);
    }

    public synchronized int pending() {
        return queued.size();
    }

    /**
     * Flushes every queued statement and commits. On failure the transaction is rolled back and
     * the queue is cleared.
     *
     * @return rows affected
     */
    public synchronized int sync() throws SQLException {
        if (queued.isEmpty()) {
            return 0;
        }
        List<StatementBatch> flushing = new ArrayList<>(queued);
        queued.clear();
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            int affected = 0;
            for (StatementBatch batch : flushing) {
                affected += batch.executeBatched(conn);
            }
            conn.commit();
            log.debug("Pipeline synced {} statements, {} rows affected", flushing.size(), affected);
            return affected;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackError) {
                log.warn("Pipeline rollback failed", rollbackError);
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }
}
