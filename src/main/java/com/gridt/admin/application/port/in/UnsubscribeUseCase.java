package com.gridt.admin.application.port.in;

import com.gridt.admin.domain.error.SubscriptionError;
import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.Result;
import com.gridt.admin.domain.model.UserId;

public interface UnsubscribeUseCase {

    /**
     * Soft-deletes the follower's active association with the movement.
     */
    Result<Association, SubscriptionError> unsubscribe(UserId followerId, MovementId movementId);
}
