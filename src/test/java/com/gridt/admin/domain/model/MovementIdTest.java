package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.IdError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MovementIdTest {

    @Test
    void shouldRoundTripThroughString() {
        MovementId id = MovementId.random();
        assertEquals(id, MovementId.parse(id.toString()).getOrThrow());
    }

    @Test
    void invalidFormatMessageNamesTheKind() {
        var error = MovementId.parse("42").errorOrNull();
        assertInstanceOf(IdError.InvalidFormat.class, error);
        assertTrue(error.message().startsWith("Movement ID"));
    }
}
