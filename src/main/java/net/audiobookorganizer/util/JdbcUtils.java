package net.audiobookorganizer.util;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Shared JDBC helper methods for retrieving optional values without repeating
 * boilerplate try/catch blocks.
 */
@Slf4j
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for an optional single value.
     * Returns empty for zero rows or multiple rows (logs warning for multiple).
     */
    public static <T> Optional<T> queryForOptional(JdbcTemplate jdbc, String sql, Class<T> type, Object... params) {
        try {
            return Optional.ofNullable(jdbc.queryForObject(sql, type, params));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (IncorrectResultSizeDataAccessException e) {
            log.warn("queryForOptional returned multiple rows (expected 0 or 1): sql={}, actualSize={}",
                sql, e.getActualSize());
            return Optional.empty();
        }
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * True when the failure is a UNIQUE or PRIMARY KEY violation. The SQLite driver reports
     * these through its own result codes rather than a SQLState, so the cause chain is inspected.
     */
    public static boolean isUniqueViolation(Throwable failure) {
        if (failure instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLiteException sqliteException) {
                SQLiteErrorCode code = sqliteException.getResultCode();
                return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                    || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
