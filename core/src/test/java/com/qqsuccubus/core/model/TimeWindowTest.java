package com.qqsuccubus.core.model;

import com.qqsuccubus.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    private static final Instant NOW = Instant.parse("2024-01-19T15:30:00Z");

    @Test
    void testAllZeroSpans_ResolveToEmptyWindow() {
        TimeWindow window = TimeWindow.resolve(0, 0, 0, NOW);

        assertTrue(window.isEmpty());
        assertEquals(NOW, window.getEnd());
        assertEquals(Duration.ZERO, window.getDuration());
    }

    @Test
    void testSpansAreSummed() {
        TimeWindow window = TimeWindow.resolve(1, 2, 30, NOW);

        assertFalse(window.isEmpty());
        assertEquals(NOW, window.getEnd());
        assertEquals(Instant.parse("2024-01-18T13:00:00Z"), window.getStart());
    }

    @Test
    void testMinutesOnly() {
        TimeWindow window = TimeWindow.resolve(0, 0, 5, NOW);

        assertFalse(window.isEmpty());
        assertEquals(Duration.ofMinutes(5), window.getDuration());
    }

    @Test
    void testNegativeSpan_IsRejected() {
        assertThrows(ValidationException.class, () -> TimeWindow.resolve(0, -1, 0, NOW));
        assertThrows(ValidationException.class, () -> TimeWindow.resolve(-1, 0, 10, NOW));
    }
}
