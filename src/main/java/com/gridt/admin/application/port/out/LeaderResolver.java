package com.gridt.admin.application.port.out;

import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;

import java.util.Optional;

/**
 * Decides which leader a new follower of a movement is attached to.
 * Called inside the subscribe transaction; an empty result stores no leader.
 */
public interface LeaderResolver {
    Optional<UserId> resolveLeader(MovementId movementId, UserId followerId);
}
