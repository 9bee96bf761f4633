package com.gridt.admin.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A follower's subscription to a movement, optionally pointing at the leader they follow
 * inside it. {@code destroyed} is null while the subscription is active.
 */
public record Association(
    AssociationId id,
    UserId followerId,
    UserId leaderId,
    MovementId movementId,
    Instant createdAt,
    Instant destroyed
) {
    public static Association create(AssociationId id, UserId followerId, UserId leaderId, MovementId movementId) {
        return new Association(id, followerId, leaderId, movementId, Instant.now(), null);
    }

    public boolean isActive() {
        return destroyed == null;
    }

    public Optional<UserId> leader() {
        return Optional.ofNullable(leaderId);
    }

    public Association destroy(Instant at) {
        if (!isActive()) {
            throw new IllegalStateException("Association " + id + " was already destroyed at " + destroyed);
        }
        return new Association(id, followerId, leaderId, movementId, createdAt, at);
    }
}
