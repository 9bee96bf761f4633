package com.gridt.admin.domain.model;

import java.time.Instant;

/**
 * A stored movement. Column limits live here so that drafts, the schema and the
 * fixture generator agree on them.
 */
public record Movement(
    MovementId id,
    String name,
    MovementInterval interval,
    String shortDescription,
    String description,
    Instant createdAt
) {
    public static final int NAME_MAX_LENGTH = 50;
    public static final int SHORT_DESCRIPTION_MAX_LENGTH = 100;
    public static final int DESCRIPTION_MAX_LENGTH = 1000;

    public static Movement from(MovementId id, MovementDraft draft) {
        return new Movement(
            id,
            draft.name(),
            draft.interval(),
            draft.shortDescription(),
            draft.description(),
            Instant.now()
        );
    }
}
