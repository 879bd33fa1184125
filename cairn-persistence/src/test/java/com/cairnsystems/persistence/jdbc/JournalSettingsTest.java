package com.cairnsystems.persistence.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JournalSettings and its nested settings.
 */
class JournalSettingsTest {

    @Test
    void testDefaults() {
        JournalSettings settings = JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:defaults")
                .build();

        assertEquals(64, settings.getMaxConcurrentOperations());
        assertEquals(100, settings.getMaxBatchSize());
        assertEquals(Integer.MAX_VALUE, settings.getMaxBufferSize());
        assertEquals(Duration.ofSeconds(30), settings.getConnectionTimeout());
        assertEquals(Connection.TRANSACTION_READ_COMMITTED, settings.getIsolationLevel());
        assertTrue(settings.isTransactional());
        assertFalse(settings.isAutoInitialize());
        assertFalse(settings.isKeepAnchorConnection());
        assertEquals("event_journal", settings.getNamingConventions().fullJournalTableName());
        assertEquals(5, settings.getCircuitBreaker().getMaxFailures());
        assertNull(settings.getRequestTap());
    }

    @Test
    void testMissingUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> JournalSettings.builder().build());
    }

    @Test
    void testInvalidLimitsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:x").maxConcurrentOperations(0).build());
        assertThrows(IllegalArgumentException.class, () -> JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:x").maxBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:x").maxBufferSize(-1).build());
        assertThrows(IllegalArgumentException.class, () -> JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:x").isolationLevel(42).build());
    }

    @Test
    void testCircuitBreakerValidation() {
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerSettings.builder().maxFailures(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerSettings.builder().callTimeout(Duration.ZERO).build());
    }

    @Test
    void testNamingConventionsRejectBlankNames() {
        assertThrows(IllegalArgumentException.class,
                () -> NamingConventions.builder().journalTableName(" ").build());
    }
}
