package com.gridt.admin.domain.error;

import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;

/**
 * Expected failures of the subscription lifecycle.
 * The not-found variants are reference errors: the requested row does not exist, nothing was written.
 */
public sealed interface SubscriptionError {

    record FollowerNotFound(UserId followerId) implements SubscriptionError {
        @Override
        public String message() {
            return "User " + followerId + " does not exist";
        }

        @Override
        public String code() {
            return "FOLLOWER_NOT_FOUND";
        }
    }

    record MovementNotFound(MovementId movementId) implements SubscriptionError {
        @Override
        public String message() {
            return "Movement " + movementId + " does not exist";
        }

        @Override
        public String code() {
            return "MOVEMENT_NOT_FOUND";
        }
    }

    record NotSubscribed(UserId followerId, MovementId movementId) implements SubscriptionError {
        @Override
        public String message() {
            return "User " + followerId + " has no active subscription to movement " + movementId;
        }

        @Override
        public String code() {
            return "NOT_SUBSCRIBED";
        }
    }

    String message();

    String code();
}
