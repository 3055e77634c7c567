package com.ivamare.caseguard.guard;

import com.ivamare.caseguard.exception.ActiveCaseExistsException;
import com.ivamare.caseguard.exception.InvalidCustomerReferenceException;
import com.ivamare.caseguard.model.CaseAttributes;
import com.ivamare.caseguard.model.CustomerReference;
import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;
import com.ivamare.caseguard.pipeline.CreateInterceptor;
import com.ivamare.caseguard.repository.CaseRepository;
import com.ivamare.caseguard.repository.CaseRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * Rejects the creation of a case for a customer that already has an active case.
 *
 * <p>Per invocation the guard resolves the customer reference of the pending
 * case, asks the record store whether an active case exists for that
 * customer, and either returns (allow) or throws (reject). It never writes,
 * never changes the pending record and holds no state between calls.
 *
 * <p>Errors:
 * <ul>
 *   <li>{@link InvalidCustomerReferenceException} - customer reference absent or not a
 *       {@link CustomerReference}</li>
 *   <li>{@link ActiveCaseExistsException} - the customer already has an active case</li>
 *   <li>Record-store failures - propagated unchanged</li>
 * </ul>
 *
 * <p>The check and the later commit are not atomic. Two concurrent creates
 * for one customer can both pass the guard; the store's active-case unique
 * index rejects the second commit.
 *
 * <p>Registered for the {@code case} entity by the auto-configuration,
 * whichever {@link com.ivamare.caseguard.pipeline.InterceptorRegistry} is in use.
 */
public class CaseUniquenessGuard implements CreateInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CaseUniquenessGuard.class);

    private final CaseRepositoryFactory repositoryFactory;

    public CaseUniquenessGuard(CaseRepositoryFactory repositoryFactory) {
        this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory must not be null");
    }

    @Override
    public void beforeCreate(PendingRecord target, ExecutionContext context) {
        UUID customerId = resolveCustomerId(target);

        log.debug("Checking active cases for customer {} (case={})", customerId, target.id());

        CaseRepository store = repositoryFactory.forCaller(context.userId());
        if (store.hasActiveCase(customerId)) {
            log.info("Active case found for customer {}, blocking creation of case {}", customerId, target.id());
            throw new ActiveCaseExistsException(customerId);
        }

        log.debug("No active case for customer {}, allowing case {}", customerId, target.id());
    }

    /**
     * Resolve the customer identity the uniqueness rule keys on.
     *
     * <p>The reference kind (organization or individual) is ignored.
     *
     * @param target The pending case
     * @return identity of the referenced customer
     * @throws InvalidCustomerReferenceException if no valid reference is present
     */
    static UUID resolveCustomerId(PendingRecord target) {
        Object value = target.attribute(CaseAttributes.CUSTOMER);
        if (!(value instanceof CustomerReference reference)) {
            throw new InvalidCustomerReferenceException(CaseAttributes.CUSTOMER, value);
        }
        return reference.id();
    }
}
