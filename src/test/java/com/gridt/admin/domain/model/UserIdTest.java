package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.IdError;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserIdTest {

    private static final String VALID_UUID = "0190a2b4-7c3e-7d4a-9f10-2b3c4d5e6f70";

    @Test
    void parseShouldSucceedWithValidUUID() {
        var result = UserId.parse(VALID_UUID);
        assertTrue(result.isSuccess());
        assertEquals(UUID.fromString(VALID_UUID), result.getOrThrow().value());
    }

    @Test
    void parseShouldTrimSurroundingWhitespace() {
        var result = UserId.parse("  " + VALID_UUID + "\n");
        assertEquals(VALID_UUID, result.getOrThrow().toString());
    }

    @Test
    void parseShouldFailWithBlankValue() {
        var result = UserId.parse("   ");
        assertTrue(result.isFailure());
        assertInstanceOf(IdError.Empty.class, result.errorOrNull());
        assertEquals("User ID cannot be empty", result.errorOrNull().message());
    }

    @Test
    void parseShouldFailWithNullValue() {
        assertInstanceOf(IdError.Empty.class, UserId.parse(null).errorOrNull());
    }

    @Test
    void parseShouldFailWithUsername() {
        var result = UserId.parse("alice");
        assertTrue(result.isFailure());
        assertInstanceOf(IdError.InvalidFormat.class, result.errorOrNull());
        assertEquals("ID_INVALID_FORMAT", result.errorOrNull().code());
    }

    @Test
    void fromTrustedShouldThrowOnInvalidData() {
        assertThrows(IllegalStateException.class, () -> UserId.fromTrusted("corrupted-data"));
    }

    @Test
    void shouldRejectNullValue() {
        assertThrows(IllegalStateException.class, () -> new UserId(null));
    }
}
