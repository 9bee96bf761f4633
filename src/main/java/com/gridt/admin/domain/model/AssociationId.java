package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.IdError;

import java.util.UUID;

/**
 * Identity of a movement-user association (subscription) row.
 */
public record AssociationId(UUID value) {

    public AssociationId {
        if (value == null) {
            throw new IllegalStateException("AssociationId value cannot be null - use parse() for operator input");
        }
    }

    /**
     * Parses operator input, returning a Result for malformed values.
     */
    public static Result<AssociationId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty("Association"));
        }
        try {
            return Result.success(new AssociationId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new IdError.InvalidFormat("Association", value));
        }
    }

    public static AssociationId of(UUID value) {
        return new AssociationId(value);
    }

    /**
     * Reads an identifier that came out of our own tables.
     *
     * @throws IllegalStateException if the stored value is not a UUID (indicates data corruption)
     */
    public static AssociationId fromTrusted(String value) {
        try {
            return new AssociationId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Corrupted AssociationId in trusted source: " + value, e);
        }
    }

    public static AssociationId random() {
        return new AssociationId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
