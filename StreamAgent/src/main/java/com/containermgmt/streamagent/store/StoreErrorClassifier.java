package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.exception.FatalStoreException;
import com.containermgmt.streamagent.exception.StoreException;
import com.containermgmt.streamagent.exception.TransientStoreException;
import org.springframework.stereotype.Component;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Splits store failures into retryable (connection, timeout, lock contention)
 * and terminal (constraint, schema, data) ones by walking the cause chain.
 */
@Component
public class StoreErrorClassifier {

    /** MySQL lock wait timeout and deadlock. */
    private static final Set<Integer> MYSQL_RETRYABLE_CODES = Set.of(1205, 1213);

    public StoreException classify(String context, Throwable error) {
        if (error instanceof StoreException) {
            return (StoreException) error;
        }
        String message = context + ": " + describe(error);
        return isTransient(error)
                ? new TransientStoreException(message, error)
                : new FatalStoreException(message, error);
    }

    public boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = nextCause(t)) {
            if (t instanceof SQLTransientException
                    || t instanceof SQLRecoverableException
                    || t instanceof SQLNonTransientConnectionException
                    || t instanceof SocketException
                    || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t instanceof SQLException) {
                SQLException sql = (SQLException) t;
                String state = sql.getSQLState();
                if (state != null && (state.startsWith("08") || state.startsWith("40") || state.startsWith("HYT"))) {
                    return true;
                }
                if (MYSQL_RETRYABLE_CODES.contains(sql.getErrorCode())) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isDuplicateKey(Throwable error) {
        for (Throwable t = error; t != null; t = nextCause(t)) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null && state.startsWith("23")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Throwable nextCause(Throwable t) {
        Throwable cause = t.getCause();
        if (cause == null && t instanceof SQLException) {
            cause = ((SQLException) t).getNextException();
        }
        return cause == t ? null : cause;
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        if (root instanceof SQLException) {
            return "[" + ((SQLException) root).getSQLState() + "] " + message;
        }
        return message;
    }
}
