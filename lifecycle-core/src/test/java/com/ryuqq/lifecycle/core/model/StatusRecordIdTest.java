package com.ryuqq.lifecycle.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusRecordId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StatusRecordIdTest {

    @Test
    void generate_ReturnsUniqueUuid() {
        // When
        StatusRecordId first = StatusRecordId.generate();
        StatusRecordId second = StatusRecordId.generate();

        // Then
        assertNotEquals(first, second);
        assertEquals(first.getValue(), UUID.fromString(first.getValue()).toString());
    }

    @Test
    void of_GeneratedValue_RoundTrips() {
        // Given
        String stored = StatusRecordId.generate().getValue();

        // When & Then
        assertEquals(stored, StatusRecordId.of(stored).getValue());
    }

    @Test
    void of_ShortStoredId_CreatesId() {
        assertEquals("s-1", StatusRecordId.of("s-1").getValue());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of(null));
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of(""));
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of("  "));
    }

    @Test
    void of_LongerThanUuid_ThrowsException() {
        // Given
        String tooLong = UUID.randomUUID() + "-x";

        // When & Then
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of(tooLong));
        assertTrue(e.getMessage().contains("36"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of("s_1"));
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of("s 1"));
        assertThrows(IllegalArgumentException.class, () -> StatusRecordId.of("{s-1}"));
    }
}
