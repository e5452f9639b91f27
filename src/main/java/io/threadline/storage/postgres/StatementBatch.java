package io.threadline.storage.postgres;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * One SQL statement with the parameter rows to run it for.
 *
 * <p>{@link #executeEach} issues one round trip per row. {@link #executeBatched} hands all rows
 * to the driver as a single JDBC batch, which the PostgreSQL driver sends pipelined.
 */
record StatementBatch(String sql, List<List<Object>> rows) {

    StatementBatch {
        rows = List.copyOf(rows);
    }

    static StatementBatch single(String sql, List<Object> params) {
        return new StatementBatch(sql, List.of(params));
    }

    int executeEach(Connection conn) throws SQLException {
        int affected = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (List<Object> row : rows) {
                bind(ps, row);
                affected += ps.executeUpdate();
            }
        }
        return affected;
    }

    int executeBatched(Connection conn) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        int affected = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (List<Object> row : rows) {
                bind(ps, row);
                ps.addBatch();
            }
            for (int n : ps.executeBatch()) {
                affected += Math.max(n, 0);
            }
        }
        return affected;
    }

    static void bind(PreparedStatement ps, List<Object> row) throws SQLException {
        for (int i = 0; i < row.size(); i++) {
            Object value = row.get(i);
            int index = i + 1;
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof byte[] bytes) {
                ps.setBytes(index, bytes);
            } else if (value instanceof Integer n) {
                ps.setInt(index, n);
            } else if (value instanceof Long n) {
                ps.setLong(index, n);
            } else {
                ps.setString(index, value.toString());
            }
        }
    }
}
