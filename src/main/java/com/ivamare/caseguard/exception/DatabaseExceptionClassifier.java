package com.ivamare.caseguard.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies database exceptions raised by the record store.
 *
 * <p>Two questions are answered:
 * <ul>
 *   <li>Is this a unique-key violation, optionally of a named constraint?
 *       Used to translate the active-case backstop into a business-rule error.</li>
 *   <li>Is this a transient condition (connectivity, resources, timeouts)?
 *       Used only to classify failures in logs; nothing here retries.</li>
 * </ul>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    /** PostgreSQL unique_violation. */
    public static final String UNIQUE_VIOLATION = "23505";

    private DatabaseExceptionClassifier() {
        // Utility class - no instantiation
    }

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        // Class 08 - Connection Exception
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        // Class 53 - Insufficient Resources
        "53000", "53100", "53200", "53300",
        // Class 57 - Operator Intervention
        "57014",  // query_canceled (statement timeout)
        "57P01", "57P02", "57P03",
        // Class 40 - Transaction Rollback
        "40001", "40P01"
    );

    /**
     * Determine if the exception is a unique-key violation.
     *
     * @param ex the exception to classify
     * @return true for {@link DuplicateKeyException} or SQL state 23505 anywhere in the cause chain
     */
    public static boolean isUniqueViolation(Throwable ex) {
        if (ex == null) {
            return false;
        }
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        return UNIQUE_VIOLATION.equals(getSqlState(ex));
    }

    /**
     * Determine if the exception is a unique-key violation of the named constraint.
     *
     * <p>PostgreSQL reports the constraint (or index) name in the message, e.g.
     * {@code duplicate key value violates unique constraint "uq_case_active_customer"}.
     *
     * @param ex the exception to classify
     * @param constraintName constraint or unique index name
     * @return true if the violation names {@code constraintName}
     */
    public static boolean isUniqueViolation(Throwable ex, String constraintName) {
        if (!isUniqueViolation(ex) || constraintName == null) {
            return false;
        }
        Throwable current = ex;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.contains(constraintName)) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return false;
    }

    /**
     * Determine if the exception indicates a transient store condition.
     *
     * @param ex the exception to classify
     * @return true for connectivity, resource, timeout and rollback conditions
     */
    public static boolean isTransient(Throwable ex) {
        if (ex == null) {
            return false;
        }

        // Check subclasses before parent classes
        if (ex instanceof CannotGetJdbcConnectionException) {
            return true;
        }
        if (ex instanceof TransientDataAccessException) {
            return true;
        }
        if (ex instanceof RecoverableDataAccessException) {
            return true;
        }
        if (ex instanceof DataAccessResourceFailureException) {
            return true;
        }
        if (ex instanceof SQLTransientException) {
            return true;
        }
        if (ex instanceof SQLRecoverableException) {
            return true;
        }

        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return true;
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isTransient(cause);
        }

        return false;
    }

    /**
     * Get the SQL state from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        if (ex == null) {
            return null;
        }
        if (ex instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
            return sqlEx.getSQLState();
        }
        if (ex.getCause() != null && ex.getCause() != ex) {
            return getSqlState(ex.getCause());
        }
        return null;
    }
}
