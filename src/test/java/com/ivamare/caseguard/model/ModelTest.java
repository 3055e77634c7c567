package com.ivamare.caseguard.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    class PendingRecordTests {

        @Test
        void shouldCopyAttributes() {
            Map<String, Object> attributes = new HashMap<>();
            attributes.put(CaseAttributes.TITLE, "Title");

            PendingRecord record = new PendingRecord("case", UUID.randomUUID(), attributes);
            attributes.put(CaseAttributes.DESCRIPTION, "added later");

            assertFalse(record.contains(CaseAttributes.DESCRIPTION));
            assertThrows(UnsupportedOperationException.class,
                () -> record.attributes().put("key", "value"));
        }

        @Test
        void shouldHandleNullAttributes() {
            PendingRecord record = new PendingRecord("case", UUID.randomUUID(), null);

            assertEquals(Map.of(), record.attributes());
            assertNull(record.attribute(CaseAttributes.CUSTOMER));
        }

        @Test
        void shouldReturnTypedAttributeOnlyForMatchingType() {
            CustomerReference customer = CustomerReference.organization(UUID.randomUUID());
            PendingRecord record = new PendingRecord("case", UUID.randomUUID(),
                Map.of(CaseAttributes.CUSTOMER, customer, CaseAttributes.TITLE, "Title"));

            assertEquals(customer, record.attribute(CaseAttributes.CUSTOMER, CustomerReference.class).orElseThrow());
            assertTrue(record.attribute(CaseAttributes.TITLE, CustomerReference.class).isEmpty());
            assertTrue(record.attribute(CaseAttributes.EMAIL_ADDRESS, String.class).isEmpty());
        }

        @Test
        void shouldRequireEntityNameAndId() {
            assertThrows(NullPointerException.class, () -> new PendingRecord(null, UUID.randomUUID(), Map.of()));
            assertThrows(NullPointerException.class, () -> new PendingRecord("case", null, Map.of()));
        }
    }

    @Nested
    class ExecutionContextTests {

        @Test
        void shouldBuildCreateContext() {
            PendingRecord target = new PendingRecord("case", UUID.randomUUID(), Map.of());
            UUID userId = UUID.randomUUID();

            ExecutionContext context = ExecutionContext.forCreate(target, userId);

            assertEquals(ExecutionContext.CREATE, context.operation());
            assertEquals("case", context.primaryEntityName());
            assertEquals(target.id(), context.primaryEntityId());
            assertEquals(userId, context.userId());
            assertNotNull(context.correlationId());
            assertSame(target, context.target());
        }

        @Test
        void shouldReturnNullTargetWhenAbsent() {
            ExecutionContext context = new ExecutionContext(
                ExecutionContext.CREATE, "case", UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), null);

            assertNull(context.target());
            assertEquals(Map.of(), context.inputParameters());
        }
    }

    @Nested
    class CaseRecordTests {

        @Test
        void shouldChangeStatusOnCopy() {
            CaseRecord record = new CaseRecord(UUID.randomUUID(), "Title",
                CustomerReference.individual(UUID.randomUUID()), CaseStatus.ACTIVE, Map.of(),
                UUID.randomUUID(), Instant.EPOCH, Instant.EPOCH);
            Instant now = Instant.now();

            CaseRecord resolved = record.withStatus(CaseStatus.RESOLVED, now);

            assertTrue(record.isActive());
            assertFalse(resolved.isActive());
            assertEquals(now, resolved.updatedAt());
            assertEquals(record.createdAt(), resolved.createdAt());
        }

        @Test
        void shouldDefaultRequestAttributesToEmpty() {
            CreateCaseRequest request = new CreateCaseRequest("Title", null);

            assertEquals(Map.of(), request.attributes());
            assertNull(request.customer());
        }
    }
}
