package com.ivamare.ogcapi.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies database exceptions raised by the job store and process catalog, and
 * translates them into {@link StorageUnavailableException}.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
    }

    /**
     * SQL state classes that indicate a temporary condition: connection exceptions (08),
     * insufficient resources (53), operator intervention (57) and transaction rollback (40).
     */
    private static final Set<String> TRANSIENT_SQL_STATE_CLASSES = Set.of("08", "53", "57", "40");

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection is not available",
        "connection closed",
        "socket timeout",
        "read timed out",
        "pool exhausted",
        "terminating connection",
        "the database system is starting up",
        "the database system is shutting down"
    };

    /**
     * Determine if the exception (or one of its causes) is transient.
     */
    public static boolean isTransient(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException) {
                return true;
            }
            if (current instanceof SQLException sqlEx && isTransientSqlState(sqlEx.getSQLState())) {
                return true;
            }
            if (matchesTransientMessage(current.getMessage())) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return false;
    }

    /**
     * Get the SQL state from an exception chain if available.
     *
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return null;
    }

    /**
     * Wrap a data access failure of the given store operation.
     *
     * @param operation short description used in the message, e.g. "read job 42"
     * @param ex the failure
     */
    public static StorageUnavailableException toStorageException(String operation, DataAccessException ex) {
        boolean transientFailure = isTransient(ex);
        String sqlState = getSqlState(ex);
        String message = "Job store unavailable while trying to " + operation
            + (sqlState != null ? " (SQL state " + sqlState + ")" : "");
        return new StorageUnavailableException(message, ex, transientFailure);
    }

    private static boolean isTransientSqlState(String sqlState) {
        return sqlState != null
            && sqlState.length() >= 2
            && TRANSIENT_SQL_STATE_CLASSES.contains(sqlState.substring(0, 2));
    }

    private static boolean matchesTransientMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
