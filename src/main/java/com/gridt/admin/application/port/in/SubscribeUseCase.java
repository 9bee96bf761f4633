package com.gridt.admin.application.port.in;

import com.gridt.admin.domain.error.SubscriptionError;
import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.Result;
import com.gridt.admin.domain.model.UserId;

import java.util.List;

public interface SubscribeUseCase {

    /**
     * Subscribes a follower to a movement. Returns the already active association when there is one.
     */
    Result<Association, SubscriptionError> subscribe(UserId followerId, MovementId movementId);

    /**
     * Subscribes one follower to several movements, each in its own transaction.
     * A missing movement is reported in its attempt and does not stop the others.
     */
    List<SubscriptionAttempt> subscribeAll(UserId followerId, List<MovementId> movementIds);

    record SubscriptionAttempt(
        UserId followerId,
        MovementId movementId,
        Result<Association, SubscriptionError> result
    ) {}
}
