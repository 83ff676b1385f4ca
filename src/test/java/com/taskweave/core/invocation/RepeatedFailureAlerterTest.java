package com.taskweave.core.invocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RepeatedFailureAlerterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("alerts at every multiple of the threshold")
    void multiples() {
        var alerter = new RepeatedFailureAlerter(3);
        int alerts = 0;
        for (int i = 1; i <= 9; i++) {
            var alert = alerter.onDegrade("coder", FailureKind.TIMEOUT, NOW);
            if (alert.isPresent()) {
                alerts++;
                assertEquals(0, i % 3);
                assertEquals(i, alert.get().degradeCount());
            }
        }
        assertEquals(3, alerts);
    }

    @Test
    @DisplayName("threshold must be at least one")
    void threshold() {
        assertThrows(IllegalArgumentException.class, () -> new RepeatedFailureAlerter(0));
        assertTrue(new RepeatedFailureAlerter(1).onDegrade("u", FailureKind.TIMEOUT, NOW).isPresent());
    }
}
