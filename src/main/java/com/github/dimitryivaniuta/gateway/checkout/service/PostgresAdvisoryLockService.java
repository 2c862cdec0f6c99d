package com.github.dimitryivaniuta.gateway.checkout.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Postgres advisory lock service.
 *
 * <p>Serializes checkout creation per reference record. A row lock is not enough there: for the first
 * checkout of a reference the token row does not exist yet, so two concurrent requests could both insert.</p>
 *
 * <p>{@code pg_advisory_xact_lock} is released automatically when the surrounding transaction ends.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Acquires a transaction-scoped advisory lock for (scope, key). Must run inside a transaction.
     *
     * @param scope lock namespace
     * @param key key within the namespace
     */
    public void lock(String scope, String key) {
        long lockId = lockId(scope + "|" + key);
        jdbcTemplate.queryForObject("select pg_advisory_xact_lock(?)", Long.class, lockId);
    }

    static long lockId(String s) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
            // first 8 bytes as a signed long
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
