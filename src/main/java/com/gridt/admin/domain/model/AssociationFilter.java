package com.gridt.admin.domain.model;

/**
 * Criteria for counting or deleting associations. Null components match anything.
 */
public record AssociationFilter(
    UserId followerId,
    UserId leaderId,
    MovementId movementId,
    boolean activeOnly
) {
    public static AssociationFilter any() {
        return new AssociationFilter(null, null, null, false);
    }

    public static AssociationFilter activeOf(UserId followerId) {
        return new AssociationFilter(followerId, null, null, true);
    }

    public boolean isUnrestricted() {
        return followerId == null && leaderId == null && movementId == null && !activeOnly;
    }
}
