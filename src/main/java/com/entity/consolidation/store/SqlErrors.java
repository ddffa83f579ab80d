package com.entity.consolidation.store;

import com.entity.consolidation.merge.MergeError;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Translates driver exceptions into {@link MergeError}s so that callers never inspect
 * driver-specific codes.
 */
public final class SqlErrors {

    /** SQLite primary result code for constraint failures. */
    private static final int SQLITE_CONSTRAINT = 19;

    private static final Set<SQLiteErrorCode> UNIQUE_CODES = EnumSet.of(
            SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE, SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY);

    /** Standard SQLState for a unique key clash. */
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private SqlErrors() {
        // Utility class
    }

    /**
     * Whether the failure was a UNIQUE, PRIMARY KEY or other constraint violation.
     */
    public static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode resultCode = sqliteException.getResultCode();
            if (resultCode != null && resultCode.name().startsWith("SQLITE_CONSTRAINT")) {
                return true;
            }
        }
        if ((e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    /**
     * Whether the failure was a UNIQUE or PRIMARY KEY clash, the only violation that a merge
     * may resolve by discarding the losing row. CHECK, NOT NULL, FOREIGN KEY and trigger
     * aborts are not.
     */
    public static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            return UNIQUE_CODES.contains(sqliteException.getResultCode());
        }
        return UNIQUE_VIOLATION_STATE.equals(e.getSQLState());
    }

    /**
     * Classifies an exception raised while executing a merge.
     */
    public static MergeError classify(SQLException e) {
        String code = code(e);
        if (isConstraintViolation(e)) {
            return MergeError.constraintViolation(code, e.getMessage());
        }
        return MergeError.other(code, e.getMessage());
    }

    private static String code(SQLException e) {
        if (e instanceof SQLiteException sqliteException && sqliteException.getResultCode() != null) {
            return sqliteException.getResultCode().name();
        }
        if (e.getSQLState() != null) {
            return e.getSQLState();
        }
        return String.valueOf(e.getErrorCode());
    }
}
