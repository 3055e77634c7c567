package com.ivamare.caseguard.exception;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseExceptionClassifierTest {

    private static final String CONSTRAINT = "uq_case_active_customer";

    @Nested
    class UniqueViolationClassification {

        @Test
        void shouldRecognizeDuplicateKeyException() {
            assertTrue(DatabaseExceptionClassifier.isUniqueViolation(new DuplicateKeyException("dup")));
        }

        @Test
        void shouldRecognizeUniqueViolationSqlStateInCauseChain() {
            SQLException sqlEx = new SQLException("duplicate key", "23505");
            DataIntegrityViolationException wrapped = new DataIntegrityViolationException("insert failed", sqlEx);

            assertTrue(DatabaseExceptionClassifier.isUniqueViolation(wrapped));
        }

        @Test
        void shouldNotTreatOtherIntegrityErrorsAsUniqueViolation() {
            SQLException sqlEx = new SQLException("null value in column", "23502");

            assertFalse(DatabaseExceptionClassifier.isUniqueViolation(
                new DataIntegrityViolationException("insert failed", sqlEx)));
            assertFalse(DatabaseExceptionClassifier.isUniqueViolation(null));
        }

        @Test
        void shouldMatchNamedConstraintInMessage() {
            DuplicateKeyException ex = new DuplicateKeyException(
                "duplicate key value violates unique constraint \"" + CONSTRAINT + "\"");

            assertTrue(DatabaseExceptionClassifier.isUniqueViolation(ex, CONSTRAINT));
            assertFalse(DatabaseExceptionClassifier.isUniqueViolation(ex, "case_record_pkey"));
        }

        @Test
        void shouldMatchNamedConstraintInCauseMessage() {
            SQLException sqlEx = new SQLException(
                "ERROR: duplicate key value violates unique constraint \"" + CONSTRAINT + "\"", "23505");
            UncategorizedSQLException wrapped = new UncategorizedSQLException("INSERT", "INSERT INTO ...", sqlEx);

            assertTrue(DatabaseExceptionClassifier.isUniqueViolation(wrapped, CONSTRAINT));
        }

        @Test
        void shouldNotMatchConstraintForNonUniqueErrors() {
            DataAccessResourceFailureException ex = new DataAccessResourceFailureException(CONSTRAINT);

            assertFalse(DatabaseExceptionClassifier.isUniqueViolation(ex, CONSTRAINT));
            assertFalse(DatabaseExceptionClassifier.isUniqueViolation(new DuplicateKeyException("dup"), null));
        }
    }

    @Nested
    class TransientClassification {

        @Test
        void shouldClassifySpringConnectivityErrorsAsTransient() {
            assertTrue(DatabaseExceptionClassifier.isTransient(
                new CannotGetJdbcConnectionException("no connection")));
            assertTrue(DatabaseExceptionClassifier.isTransient(new QueryTimeoutException("timeout")));
            assertTrue(DatabaseExceptionClassifier.isTransient(new DataAccessResourceFailureException("down")));
        }

        @Test
        void shouldClassifyTransientSqlStatesAsTransient() {
            assertTrue(DatabaseExceptionClassifier.isTransient(new SQLException("failure", "08006")));
            assertTrue(DatabaseExceptionClassifier.isTransient(new SQLException("canceled", "57014")));
            assertTrue(DatabaseExceptionClassifier.isTransient(new SQLException("deadlock", "40P01")));
        }

        @Test
        void shouldFollowCauseChain() {
            RuntimeException wrapped = new RuntimeException("wrapper",
                new SQLTransientConnectionException("reset"));

            assertTrue(DatabaseExceptionClassifier.isTransient(wrapped));
        }

        @Test
        void shouldClassifyPermanentErrorsAsNonTransient() {
            assertFalse(DatabaseExceptionClassifier.isTransient(new SQLException("denied", "42501")));
            assertFalse(DatabaseExceptionClassifier.isTransient(new DuplicateKeyException("dup")));
            assertFalse(DatabaseExceptionClassifier.isTransient(null));
        }
    }

    @Nested
    class SqlStateExtraction {

        @Test
        void shouldExtractNestedSqlState() {
            SQLException sqlEx = new SQLException("dup", "23505");

            assertEquals("23505", DatabaseExceptionClassifier.getSqlState(new RuntimeException(sqlEx)));
        }

        @Test
        void shouldReturnNullWithoutSqlState() {
            assertNull(DatabaseExceptionClassifier.getSqlState(new RuntimeException("plain")));
            assertNull(DatabaseExceptionClassifier.getSqlState(null));
        }
    }
}
