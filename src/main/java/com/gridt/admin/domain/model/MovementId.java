package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.IdError;

import java.util.UUID;

/**
 * Identity of a row in the movements table.
 */
public record MovementId(UUID value) {

    public MovementId {
        if (value == null) {
            throw new IllegalStateException("MovementId value cannot be null - use parse() for operator input");
        }
    }

    /**
     * Parses operator input, returning a Result for malformed values.
     */
    public static Result<MovementId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty("Movement"));
        }
        try {
            return Result.success(new MovementId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new IdError.InvalidFormat("Movement", value));
        }
    }

    public static MovementId of(UUID value) {
        return new MovementId(value);
    }

    /**
     * Reads an identifier that came out of our own tables.
     *
     * @throws IllegalStateException if the stored value is not a UUID (indicates data corruption)
     */
    public static MovementId fromTrusted(String value) {
        try {
            return new MovementId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Corrupted MovementId in trusted source: " + value, e);
        }
    }

    public static MovementId random() {
        return new MovementId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
