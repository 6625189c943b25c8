package com.hospital.opd.component;

import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import org.hibernate.StaleStateException;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.net.ConnectException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Classifies store failures into the retryable kinds the concurrency
 * controller recovers from.
 */
public final class TransientErrors {

    public static final String VERSION_CONFLICT = "VERSION_CONFLICT";
    public static final String WRITE_CONFLICT = "WRITE_CONFLICT";
    public static final String LOCK_TIMEOUT = "LOCK_TIMEOUT";
    public static final String NETWORK_ERROR = "NETWORK_ERROR";
    public static final String TIMEOUT_ERROR = "TIMEOUT_ERROR";
    public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    private static final Set<String> CONFLICT_TYPES = Set.of(VERSION_CONFLICT, WRITE_CONFLICT, LOCK_TIMEOUT);

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        return !UNKNOWN_ERROR.equals(errorType(error));
    }

    public static boolean isConflict(String errorType) {
        return CONFLICT_TYPES.contains(errorType);
    }

    public static String errorType(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof AllocationException ae) {
                return ae.getCode() == ErrorCode.CONCURRENT_MODIFICATION ? VERSION_CONFLICT : UNKNOWN_ERROR;
            }
            if (t instanceof OptimisticLockingFailureException
                    || t instanceof OptimisticLockException
                    || t instanceof StaleStateException) {
                return VERSION_CONFLICT;
            }
            if (t instanceof CannotAcquireLockException
                    || t instanceof PessimisticLockingFailureException
                    || t instanceof PessimisticLockException
                    || t instanceof LockTimeoutException) {
                return LOCK_TIMEOUT;
            }
            if (t instanceof QueryTimeoutException) {
                return TIMEOUT_ERROR;
            }
            if (t instanceof CannotCreateTransactionException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof SQLTransientConnectionException
                    || t instanceof ConnectException) {
                return NETWORK_ERROR;
            }
            if (t instanceof TransientDataAccessException) {
                return WRITE_CONFLICT;
            }
        }
        return UNKNOWN_ERROR;
    }
}
