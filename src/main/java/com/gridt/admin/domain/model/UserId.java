package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.IdError;

import java.util.UUID;

/**
 * Identity of a row in the users table.
 */
public record UserId(UUID value) {

    public UserId {
        if (value == null) {
            throw new IllegalStateException("UserId value cannot be null - use parse() for operator input");
        }
    }

    /**
     * Parses operator input, returning a Result for malformed values.
     */
    public static Result<UserId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty("User"));
        }
        try {
            return Result.success(new UserId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new IdError.InvalidFormat("User", value));
        }
    }

    public static UserId of(UUID value) {
        return new UserId(value);
    }

    /**
     * Reads an identifier that came out of our own tables.
     *
     * @throws IllegalStateException if the stored value is not a UUID (indicates data corruption)
     */
    public static UserId fromTrusted(String value) {
        try {
            return new UserId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Corrupted UserId in trusted source: " + value, e);
        }
    }

    public static UserId random() {
        return new UserId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
