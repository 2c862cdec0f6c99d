package com.github.dimitryivaniuta.gateway.checkout.service;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PostgresAdvisoryLockServiceTest {

    @Test
    void lockIdIsStablePerKey() {
        Assertions.assertEquals(
                PostgresAdvisoryLockService.lockId("checkout:token|PR-1"),
                PostgresAdvisoryLockService.lockId("checkout:token|PR-1"));
        Assertions.assertNotEquals(
                PostgresAdvisoryLockService.lockId("checkout:token|PR-1"),
                PostgresAdvisoryLockService.lockId("checkout:token|PR-2"));
    }
}
