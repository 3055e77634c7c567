package com.ivamare.caseguard.repository.impl;

import com.ivamare.caseguard.repository.CaseRepository;
import com.ivamare.caseguard.repository.CaseRepositoryFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Objects;
import java.util.UUID;

/**
 * Creates {@link JdbcCaseRepository} instances sharing one {@link JdbcTemplate}.
 *
 * <p>The caller is stamped on writes. Reads are not filtered by caller: the
 * active-case check has to see every case of the customer, whoever owns it.
 */
public class JdbcCaseRepositoryFactory implements CaseRepositoryFactory {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCaseRepositoryFactory(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public CaseRepository forCaller(UUID callerId) {
        return new JdbcCaseRepository(jdbcTemplate, objectMapper, callerId);
    }
}
