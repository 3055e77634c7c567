package com.ivamare.caseguard.pipeline.impl;

import com.ivamare.caseguard.exception.ActiveCaseExistsException;
import com.ivamare.caseguard.exception.BusinessRuleException;
import com.ivamare.caseguard.exception.HostConfigurationException;
import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CustomerReference;
import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;
import com.ivamare.caseguard.pipeline.CreateInterceptor;
import com.ivamare.caseguard.support.TestCases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultCreatePipelineTest {

    private static final String CONSTRAINT = "uq_case_active_customer";

    private PlatformTransactionManager transactionManager;
    private DefaultInterceptorRegistry registry;
    private DefaultCreatePipeline pipeline;
    private UUID callerId;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        registry = new DefaultInterceptorRegistry();
        pipeline = new DefaultCreatePipeline(registry, new TransactionTemplate(transactionManager), CONSTRAINT);
        callerId = UUID.randomUUID();
    }

    @Nested
    class ContextValidation {

        @Test
        void shouldRejectMissingContext() {
            HostConfigurationException ex = assertThrows(HostConfigurationException.class,
                () -> pipeline.execute(null, target -> "committed"));
            assertEquals("Execution context unavailable", ex.getMessage());
        }

        @Test
        void shouldRejectMissingCaller() {
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(UUID.randomUUID()));
            ExecutionContext context = ExecutionContext.forCreate(target, null);

            HostConfigurationException ex = assertThrows(HostConfigurationException.class,
                () -> pipeline.execute(context, t -> "committed"));
            assertEquals("Caller identity unavailable", ex.getMessage());
        }

        @Test
        void shouldRejectMissingTarget() {
            ExecutionContext context = new ExecutionContext(
                ExecutionContext.CREATE, CaseRecord.ENTITY_NAME, UUID.randomUUID(),
                callerId, UUID.randomUUID(), Map.of());

            HostConfigurationException ex = assertThrows(HostConfigurationException.class,
                () -> pipeline.execute(context, t -> "committed"));
            assertEquals("Target record is missing or invalid", ex.getMessage());
        }

        @Test
        void shouldRejectWronglyTypedTarget() {
            ExecutionContext context = new ExecutionContext(
                ExecutionContext.CREATE, CaseRecord.ENTITY_NAME, UUID.randomUUID(),
                callerId, UUID.randomUUID(), Map.of(ExecutionContext.TARGET, "not a record"));

            assertThrows(HostConfigurationException.class, () -> pipeline.execute(context, t -> "committed"));
        }

        @Test
        void shouldRejectEntityMismatch() {
            PendingRecord target = new PendingRecord("task", UUID.randomUUID(), Map.of());
            ExecutionContext context = new ExecutionContext(
                ExecutionContext.CREATE, CaseRecord.ENTITY_NAME, target.id(),
                callerId, UUID.randomUUID(), Map.of(ExecutionContext.TARGET, target));

            assertThrows(HostConfigurationException.class, () -> pipeline.execute(context, t -> "committed"));
        }

        @Test
        void shouldRejectOperationOtherThanCreate() {
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(UUID.randomUUID()));
            ExecutionContext context = new ExecutionContext(
                "Update", CaseRecord.ENTITY_NAME, target.id(),
                callerId, UUID.randomUUID(), Map.of(ExecutionContext.TARGET, target));

            HostConfigurationException ex = assertThrows(HostConfigurationException.class,
                () -> pipeline.execute(context, t -> "committed"));
            assertEquals("Unsupported operation Update", ex.getMessage());
        }

        @Test
        void shouldRejectTargetIdMismatch() {
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(UUID.randomUUID()));
            ExecutionContext context = new ExecutionContext(
                ExecutionContext.CREATE, CaseRecord.ENTITY_NAME, UUID.randomUUID(),
                callerId, UUID.randomUUID(), Map.of(ExecutionContext.TARGET, target));

            assertThrows(HostConfigurationException.class, () -> pipeline.execute(context, t -> "committed"));
        }

        @Test
        void shouldNotRunInterceptorsOrOpenTransactionForInvalidContext() {
            CreateInterceptor interceptor = mock(CreateInterceptor.class);
            registry.register(CaseRecord.ENTITY_NAME, interceptor);

            assertThrows(HostConfigurationException.class, () -> pipeline.execute(null, t -> "committed"));

            verifyNoInteractions(interceptor);
            verify(transactionManager, never()).getTransaction(any());
        }
    }

    @Nested
    class Execution {

        @Test
        void shouldRunInterceptorsThenCommit() {
            List<String> calls = new ArrayList<>();
            registry.register(CaseRecord.ENTITY_NAME, (t, c) -> calls.add("interceptor"));
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(UUID.randomUUID()));

            String result = pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> {
                calls.add("commit");
                return "committed:" + t.id();
            });

            assertEquals("committed:" + target.id(), result);
            assertEquals(List.of("interceptor", "commit"), calls);
            verify(transactionManager).commit(any());
        }

        @Test
        void shouldPassTargetAndContextToInterceptors() {
            CreateInterceptor interceptor = mock(CreateInterceptor.class);
            registry.register(CaseRecord.ENTITY_NAME, interceptor);
            PendingRecord target = TestCases.pendingCase(CustomerReference.individual(UUID.randomUUID()));
            ExecutionContext context = ExecutionContext.forCreate(target, callerId);

            pipeline.execute(context, t -> null);

            verify(interceptor).beforeCreate(target, context);
        }

        @Test
        void shouldCommitWhenNoInterceptorsRegistered() {
            PendingRecord target = TestCases.pendingCase(CustomerReference.individual(UUID.randomUUID()));

            assertEquals("ok", pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> "ok"));
        }

        @Test
        void shouldAbortAndRollBackWhenInterceptorRejects() {
            BusinessRuleException rejection = new BusinessRuleException("RULE", "Rejected");
            registry.register(CaseRecord.ENTITY_NAME, (t, c) -> {
                throw rejection;
            });
            PendingRecord target = TestCases.pendingCase(CustomerReference.individual(UUID.randomUUID()));
            List<PendingRecord> committed = new ArrayList<>();

            BusinessRuleException thrown = assertThrows(BusinessRuleException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> committed.add(t)));

            assertSame(rejection, thrown);
            assertTrue(committed.isEmpty());
            verify(transactionManager).rollback(any());
            verify(transactionManager, never()).commit(any());
        }

        @Test
        void shouldStopAtFirstRejectingInterceptor() {
            CreateInterceptor later = mock(CreateInterceptor.class);
            registry.register(CaseRecord.ENTITY_NAME, (t, c) -> {
                throw new BusinessRuleException("RULE", "Rejected");
            }, 0);
            registry.register(CaseRecord.ENTITY_NAME, later, 10);
            PendingRecord target = TestCases.pendingCase(CustomerReference.individual(UUID.randomUUID()));

            assertThrows(BusinessRuleException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> "ok"));

            verifyNoInteractions(later);
        }

        @Test
        void shouldPropagateStoreFailuresUnchanged() {
            DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection reset");
            registry.register(CaseRecord.ENTITY_NAME, (t, c) -> {
                throw failure;
            });
            PendingRecord target = TestCases.pendingCase(CustomerReference.individual(UUID.randomUUID()));

            DataAccessResourceFailureException thrown = assertThrows(DataAccessResourceFailureException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> "ok"));

            assertSame(failure, thrown);
        }
    }

    @Nested
    class ConstraintTranslation {

        @Test
        void shouldTranslateActiveCaseViolationIntoBusinessRuleError() {
            UUID customerId = UUID.randomUUID();
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(customerId));
            DuplicateKeyException violation = new DuplicateKeyException(
                "duplicate key value violates unique constraint \"" + CONSTRAINT + "\"");

            ActiveCaseExistsException ex = assertThrows(ActiveCaseExistsException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> {
                    throw violation;
                }));

            assertEquals(customerId, ex.getCustomerId());
            assertEquals(ActiveCaseExistsException.MESSAGE, ex.getErrorMessage());
            assertSame(violation, ex.getCause());
            verify(transactionManager).rollback(any());
        }

        @Test
        void shouldNotTranslateOtherUniqueViolations() {
            PendingRecord target = TestCases.pendingCase(CustomerReference.organization(UUID.randomUUID()));
            DuplicateKeyException violation = new DuplicateKeyException(
                "duplicate key value violates unique constraint \"case_record_pkey\"");

            DuplicateKeyException thrown = assertThrows(DuplicateKeyException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> {
                    throw violation;
                }));

            assertSame(violation, thrown);
        }

        @Test
        void shouldNotTranslateViolationsForOtherEntities() {
            PendingRecord target = new PendingRecord("task", UUID.randomUUID(), Map.of());
            DuplicateKeyException violation = new DuplicateKeyException(CONSTRAINT);

            assertThrows(DuplicateKeyException.class,
                () -> pipeline.execute(ExecutionContext.forCreate(target, callerId), t -> {
                    throw violation;
                }));
        }
    }
}
