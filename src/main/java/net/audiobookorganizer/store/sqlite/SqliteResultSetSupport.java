package net.audiobookorganizer.store.sqlite;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Nullable column readers for SQLite rows. Timestamps are stored as INTEGER epoch milliseconds
 * and booleans as 0/1.
 */
final class SqliteResultSetSupport {

    private SqliteResultSetSupport() {
    }

    static Integer getIntOrNull(ResultSet rs, String columnName) throws SQLException {
        int value = rs.getInt(columnName);
        return rs.wasNull() ? null : value;
    }

    static Long getLongOrNull(ResultSet rs, String columnName) throws SQLException {
        long value = rs.getLong(columnName);
        return rs.wasNull() ? null : value;
    }

    static Boolean getBooleanOrNull(ResultSet rs, String columnName) throws SQLException {
        int value = rs.getInt(columnName);
        return rs.wasNull() ? null : value != 0;
    }

    static Instant getInstantOrNull(ResultSet rs, String columnName) throws SQLException {
        long value = rs.getLong(columnName);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    /** Bind value for a nullable timestamp column. */
    static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    static Integer toFlag(Boolean value) {
        return value == null ? null : (value ? 1 : 0);
    }
}
