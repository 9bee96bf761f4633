package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.UnknownInterval;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MovementIntervalTest {

    @Test
    void shouldParseStoredValuesCaseInsensitively() {
        assertEquals(MovementInterval.DAILY, MovementInterval.parse("daily").getOrThrow());
        assertEquals(MovementInterval.WEEKLY, MovementInterval.parse(" Weekly ").getOrThrow());
    }

    @Test
    void shouldRejectUnknownInterval() {
        var result = MovementInterval.parse("monthly");
        assertTrue(result.isFailure());
        assertInstanceOf(UnknownInterval.class, result.errorOrNull());
    }

    @Test
    void fromTrustedShouldThrowOnCorruptedValue() {
        assertThrows(IllegalStateException.class, () -> MovementInterval.fromTrusted("hourly"));
    }

    @Test
    void toStringIsTheStoredValue() {
        assertEquals("weekly", MovementInterval.WEEKLY.toString());
    }
}
