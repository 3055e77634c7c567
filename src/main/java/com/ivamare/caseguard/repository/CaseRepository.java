package com.ivamare.caseguard.repository;

import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CaseStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Record store for cases.
 *
 * <p>Instances are bound to a caller (see {@link CaseRepositoryFactory}).
 * Failures surface as Spring {@link org.springframework.dao.DataAccessException}s;
 * "no rows" is never a failure.
 */
public interface CaseRepository {

    /**
     * Check whether the customer has at least one active case.
     *
     * <p>Looks for at most one matching row; it never scans past the first match.
     *
     * @param customerId Identity of the referenced customer (organization or individual)
     * @return true if an active case exists for the customer
     */
    boolean hasActiveCase(UUID customerId);

    /**
     * Insert a new case.
     *
     * @param record The case to insert
     * @return the inserted case
     * @throws org.springframework.dao.DuplicateKeyException if the store's
     *         active-case constraint rejects the row
     */
    CaseRecord insert(CaseRecord record);

    /**
     * Get a case by ID.
     *
     * @param caseId The case ID
     * @return Optional containing the case if found
     */
    Optional<CaseRecord> get(UUID caseId);

    /**
     * List all cases of a customer, oldest first.
     *
     * @param customerId The customer ID
     * @return cases in any status
     */
    List<CaseRecord> findByCustomer(UUID customerId);

    /**
     * Change the status of a case if it currently has {@code expected}.
     *
     * @param caseId The case ID
     * @param expected The status the case must currently have
     * @param newStatus The status to set
     * @return true if the case was updated
     */
    boolean updateStatus(UUID caseId, CaseStatus expected, CaseStatus newStatus);
}
