package com.gridt.admin.application.port.in;

import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.EntityKind;
import com.gridt.admin.domain.model.UserId;

public interface CountUseCase {

    /**
     * Counts rows of one kind. The filter only applies to {@link EntityKind#ASSOCIATIONS}.
     */
    long count(EntityKind kind, AssociationFilter filter);

    /**
     * Active subscriptions of a follower to movements that still exist.
     */
    long countActiveSubscriptions(UserId followerId);
}
