package com.tcrimer.db;

import com.tcrimer.db.pool.PoolExhaustedException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;

/**
 * Classifies driver errors from both backends.
 */
public final class SqlErrors {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private SqlErrors() {
    }

    /**
     * Worth retrying: connection loss, serialization or deadlock aborts, and SQLite lock contention.
     * Pool exhaustion is never transient here.
     */
    public static boolean isTransient(SQLException e) {
        for (SQLException cur = e; cur != null; cur = nextSql(cur)) {
            if (cur instanceof PoolExhaustedException) {
                return false;
            }
            if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
                return true;
            }
            if (isConnectionFailure(cur)) {
                return true;
            }
            String state = cur.getSQLState();
            if ("40001".equals(state) || "40P01".equals(state)) {
                return true;
            }
            if (isSqliteBusy(cur)) {
                return true;
            }
        }
        return false;
    }

    /**
     * SQLState class 08 or a recoverable driver error: the physical connection should not be reused.
     */
    public static boolean isConnectionFailure(SQLException e) {
        if (e == null || e instanceof PoolExhaustedException) {
            return false;
        }
        if (e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private static boolean isSqliteBusy(SQLException e) {
        int primaryCode = e.getErrorCode() & 0xff;
        if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
            return true;
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("database is locked") || msg.contains("sqlite_busy");
    }

    private static SQLException nextSql(SQLException e) {
        Throwable cause = e.getCause();
        return cause instanceof SQLException sql && sql != e ? sql : null;
    }
}
