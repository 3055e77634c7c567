package com.ivamare.caseguard.api;

import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CreateCaseRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for creating and closing cases.
 */
public interface CaseService {

    /**
     * Open a new active case.
     *
     * <p>The case passes through the create pipeline; the uniqueness guard
     * rejects it if the customer already has an active case.
     *
     * @param request The case to open
     * @param callerId The user opening the case
     * @return the committed case
     * @throws com.ivamare.caseguard.exception.InvalidCustomerReferenceException if the customer is missing
     * @throws com.ivamare.caseguard.exception.ActiveCaseExistsException if the customer has an active case
     */
    CaseRecord create(CreateCaseRequest request, UUID callerId);

    /**
     * Get a case by ID.
     *
     * @param caseId The case ID
     * @return Optional containing the case if found
     */
    Optional<CaseRecord> get(UUID caseId);

    /**
     * List the cases of a customer, oldest first.
     *
     * @param customerId The customer ID (organization or individual)
     * @return cases in any status
     */
    List<CaseRecord> findByCustomer(UUID customerId);

    /**
     * Mark an active case as resolved.
     *
     * @param caseId The case ID
     * @param callerId The user resolving the case
     * @return the updated case
     * @throws com.ivamare.caseguard.exception.CaseNotFoundException if the case does not exist
     * @throws com.ivamare.caseguard.exception.InvalidOperationException if the case is not active
     */
    CaseRecord resolve(UUID caseId, UUID callerId);

    /**
     * Cancel an active case.
     *
     * @param caseId The case ID
     * @param callerId The user cancelling the case
     * @return the updated case
     * @throws com.ivamare.caseguard.exception.CaseNotFoundException if the case does not exist
     * @throws com.ivamare.caseguard.exception.InvalidOperationException if the case is not active
     */
    CaseRecord cancel(UUID caseId, UUID callerId);
}
