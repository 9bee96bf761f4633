package com.gridt.admin.application.port.out;

import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AssociationRepository extends BulkDeletable<AssociationFilter, AssociationId> {

    void save(Association association);

    /**
     * The active ({@code destroyed IS NULL}) association of a follower in a movement, if any.
     */
    Optional<Association> findActive(UserId followerId, MovementId movementId);

    /**
     * Marks an association destroyed. Returns false if it was not active anymore.
     */
    boolean markDestroyed(AssociationId id, Instant destroyedAt);

    /**
     * Followers actively subscribed to a movement, in id order.
     */
    List<UserId> findActiveFollowerIds(MovementId movementId);

    /**
     * Active associations of a follower whose movement still exists.
     */
    long countActiveWithExistingMovement(UserId followerId);

    /**
     * Active associations pointing at any of the given movements.
     */
    long countActiveReferencing(Collection<MovementId> movementIds);

    long count(AssociationFilter filter);
}
