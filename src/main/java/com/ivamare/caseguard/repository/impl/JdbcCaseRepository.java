package com.ivamare.caseguard.repository.impl;

import com.ivamare.caseguard.model.CaseAttributes;
import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CaseStatus;
import com.ivamare.caseguard.model.CustomerKind;
import com.ivamare.caseguard.model.CustomerReference;
import com.ivamare.caseguard.repository.CaseRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of CaseRepository.
 *
 * <p>Core fields live in columns; the remaining attributes are stored as a
 * JSONB document.
 */
public class JdbcCaseRepository implements CaseRepository {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final UUID callerId;
    private final RowMapper<CaseRecord> caseMapper;

    public JdbcCaseRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, UUID callerId) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.callerId = callerId;
        this.caseMapper = (rs, rowNum) -> new CaseRecord(
            UUID.fromString(rs.getString("case_id")),
            rs.getString("title"),
            new CustomerReference(
                CustomerKind.fromValue(rs.getString("customer_kind")),
                UUID.fromString(rs.getString("customer_id"))
            ),
            CaseStatus.fromValue(rs.getString("status")),
            deserializeAttributes(rs.getString("attributes")),
            rs.getString("created_by") != null ? UUID.fromString(rs.getString("created_by")) : null,
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    @Override
    public boolean hasActiveCase(UUID customerId) {
        List<UUID> matches = jdbcTemplate.query(
            "SELECT case_id FROM caseguard.case_record WHERE status = ? AND customer_id = ? LIMIT 1",
            (rs, rowNum) -> UUID.fromString(rs.getString("case_id")),
            CaseStatus.ACTIVE.getValue(), customerId
        );
        return !matches.isEmpty();
    }

    @Override
    public CaseRecord insert(CaseRecord record) {
        Instant createdAt = record.createdAt() != null ? record.createdAt() : Instant.now();
        Instant updatedAt = record.updatedAt() != null ? record.updatedAt() : createdAt;
        UUID createdBy = record.createdBy() != null ? record.createdBy() : callerId;

        jdbcTemplate.update("""
            INSERT INTO caseguard.case_record (
                case_id, title, customer_kind, customer_id, status,
                attributes, created_by, updated_by, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            """,
            record.caseId(),
            record.title(),
            record.customer().kind().getValue(),
            record.customer().id(),
            record.status().getValue(),
            serializeAttributes(record.attributes()),
            createdBy,
            callerId,
            Timestamp.from(createdAt),
            Timestamp.from(updatedAt)
        );

        return new CaseRecord(
            record.caseId(), record.title(), record.customer(), record.status(),
            record.attributes(), createdBy, createdAt, updatedAt
        );
    }

    @Override
    public Optional<CaseRecord> get(UUID caseId) {
        List<CaseRecord> results = jdbcTemplate.query(
            "SELECT * FROM caseguard.case_record WHERE case_id = ?",
            caseMapper,
            caseId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CaseRecord> findByCustomer(UUID customerId) {
        return jdbcTemplate.query(
            "SELECT * FROM caseguard.case_record WHERE customer_id = ? ORDER BY created_at ASC",
            caseMapper,
            customerId
        );
    }

    @Override
    public boolean updateStatus(UUID caseId, CaseStatus expected, CaseStatus newStatus) {
        int rows = jdbcTemplate.update(
            "UPDATE caseguard.case_record SET status = ?, updated_by = ?, updated_at = NOW() " +
                "WHERE case_id = ? AND status = ?",
            newStatus.getValue(), callerId, caseId, expected.getValue()
        );
        return rows == 1;
    }

    private String serializeAttributes(Map<String, Object> attributes) {
        Map<String, Object> extra = new HashMap<>(attributes);
        extra.keySet().removeAll(CaseAttributes.CORE);
        try {
            return objectMapper.writeValueAsString(extra);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize case attributes", e);
        }
    }

    private Map<String, Object> deserializeAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored case attributes are not valid JSON", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
