package com.ivamare.caseguard.api.impl;

import com.ivamare.caseguard.api.CaseService;
import com.ivamare.caseguard.exception.CaseNotFoundException;
import com.ivamare.caseguard.exception.InvalidCustomerReferenceException;
import com.ivamare.caseguard.exception.InvalidOperationException;
import com.ivamare.caseguard.model.CaseAttributes;
import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CaseStatus;
import com.ivamare.caseguard.model.CreateCaseRequest;
import com.ivamare.caseguard.model.CustomerReference;
import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;
import com.ivamare.caseguard.pipeline.CreatePipeline;
import com.ivamare.caseguard.repository.CaseRepository;
import com.ivamare.caseguard.repository.CaseRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of CaseService.
 */
public class DefaultCaseService implements CaseService {

    private static final Logger log = LoggerFactory.getLogger(DefaultCaseService.class);

    private final CreatePipeline createPipeline;
    private final CaseRepositoryFactory repositoryFactory;

    public DefaultCaseService(CreatePipeline createPipeline, CaseRepositoryFactory repositoryFactory) {
        this.createPipeline = Objects.requireNonNull(createPipeline, "createPipeline must not be null");
        this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory must not be null");
    }

    @Override
    public CaseRecord create(CreateCaseRequest request, UUID callerId) {
        PendingRecord target = new PendingRecord(CaseRecord.ENTITY_NAME, UUID.randomUUID(), toAttributes(request));
        ExecutionContext context = ExecutionContext.forCreate(target, callerId);

        return createPipeline.execute(context, pending -> {
            Instant now = Instant.now();
            CaseRecord record = new CaseRecord(
                pending.id(),
                pending.attribute(CaseAttributes.TITLE, String.class).orElse(null),
                pending.attribute(CaseAttributes.CUSTOMER, CustomerReference.class)
                    .orElseThrow(() -> new InvalidCustomerReferenceException(
                        CaseAttributes.CUSTOMER, pending.attribute(CaseAttributes.CUSTOMER))),
                CaseStatus.ACTIVE,
                extraAttributes(pending),
                callerId,
                now,
                now
            );
            return repositoryFactory.forCaller(callerId).insert(record);
        });
    }

    @Override
    public Optional<CaseRecord> get(UUID caseId) {
        return repositoryFactory.forCaller(null).get(caseId);
    }

    @Override
    public List<CaseRecord> findByCustomer(UUID customerId) {
        return repositoryFactory.forCaller(null).findByCustomer(customerId);
    }

    @Override
    public CaseRecord resolve(UUID caseId, UUID callerId) {
        return close(caseId, callerId, CaseStatus.RESOLVED);
    }

    @Override
    public CaseRecord cancel(UUID caseId, UUID callerId) {
        return close(caseId, callerId, CaseStatus.CANCELLED);
    }

    private CaseRecord close(UUID caseId, UUID callerId, CaseStatus newStatus) {
        CaseRepository repository = repositoryFactory.forCaller(callerId);
        CaseRecord current = repository.get(caseId)
            .orElseThrow(() -> new CaseNotFoundException(caseId));

        if (!current.isActive()
                || !repository.updateStatus(caseId, CaseStatus.ACTIVE, newStatus)) {
            throw new InvalidOperationException(
                "Cannot move case " + caseId + " to " + newStatus + ": case is " + current.status());
        }

        log.info("Case {} moved to {} by {}", caseId, newStatus, callerId);
        return repository.get(caseId)
            .orElseThrow(() -> new CaseNotFoundException(caseId));
    }

    private static Map<String, Object> extraAttributes(PendingRecord pending) {
        Map<String, Object> extra = new HashMap<>(pending.attributes());
        extra.keySet().removeAll(CaseAttributes.CORE);
        return extra;
    }

    private static Map<String, Object> toAttributes(CreateCaseRequest request) {
        Map<String, Object> attributes = new HashMap<>(request.attributes());
        attributes.keySet().removeAll(CaseAttributes.CORE);
        if (request.title() != null) {
            attributes.put(CaseAttributes.TITLE, request.title());
        }
        if (request.customer() != null) {
            attributes.put(CaseAttributes.CUSTOMER, request.customer());
        }
        attributes.put(CaseAttributes.STATUS, CaseStatus.ACTIVE.getValue());
        return attributes;
    }
}
