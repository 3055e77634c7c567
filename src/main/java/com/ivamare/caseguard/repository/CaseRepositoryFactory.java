package com.ivamare.caseguard.repository;

import java.util.UUID;

/**
 * Creates record-store handles scoped to a caller.
 */
@FunctionalInterface
public interface CaseRepositoryFactory {

    /**
     * Get a repository acting on behalf of {@code callerId}.
     *
     * @param callerId The caller's user ID
     * @return repository bound to the caller
     */
    CaseRepository forCaller(UUID callerId);
}
