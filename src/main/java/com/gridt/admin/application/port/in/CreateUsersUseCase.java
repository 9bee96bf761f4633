package com.gridt.admin.application.port.in;

import com.gridt.admin.application.port.in.SubscribeUseCase.SubscriptionAttempt;
import com.gridt.admin.application.service.BulkWriteOutcome;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;

import java.util.List;

public interface CreateUsersUseCase {

    /**
     * Generates and registers {@code number} random users, then subscribes every user that was
     * durably created to each of {@code movementIds}.
     */
    UserSeedResult createUsers(int number, int chunkSize, List<MovementId> movementIds);

    record UserSeedResult(
        BulkWriteOutcome<UserId> users,
        List<SubscriptionAttempt> subscriptions
    ) {
        public long subscriptionsCreated() {
            return subscriptions.stream().filter(a -> a.result().isSuccess()).count();
        }

        public List<SubscriptionAttempt> failedSubscriptions() {
            return subscriptions.stream().filter(a -> a.result().isFailure()).toList();
        }
    }
}
