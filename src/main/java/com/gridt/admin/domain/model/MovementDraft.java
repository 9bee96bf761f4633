package com.gridt.admin.domain.model;

import java.util.Objects;

/**
 * An unsaved movement whose text fields already fit their columns.
 * The only way to build one is {@link #of}, which truncates, so a draft handed to a
 * writer can never overflow a column.
 */
public record MovementDraft(
    String name,
    MovementInterval interval,
    String shortDescription,
    String description
) {
    public MovementDraft {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(interval, "interval");
        if (name.length() > Movement.NAME_MAX_LENGTH
                || length(shortDescription) > Movement.SHORT_DESCRIPTION_MAX_LENGTH
                || length(description) > Movement.DESCRIPTION_MAX_LENGTH) {
            throw new IllegalArgumentException("Movement draft exceeds column limits, build it with MovementDraft.of()");
        }
    }

    public static MovementDraft of(String name, MovementInterval interval, String shortDescription, String description) {
        return new MovementDraft(
            Text.truncate(name, Movement.NAME_MAX_LENGTH),
            interval,
            Text.truncate(shortDescription, Movement.SHORT_DESCRIPTION_MAX_LENGTH),
            Text.truncate(description, Movement.DESCRIPTION_MAX_LENGTH)
        );
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
