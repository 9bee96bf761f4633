package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.application.port.in.SubscribeUseCase.SubscriptionAttempt;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.List;

final class SubscriptionCommands {

    private SubscriptionCommands() {
    }

    @Command(name = "create-subscription", description = "Subscribe a user to one or more movements.")
    static class CreateSubscription implements AdminTask {

        @Parameters(index = "0", description = "Id of the subscribing user.")
        UserId userId;

        @Parameters(index = "1..*", arity = "1..*", description = "Ids of the movements.")
        List<MovementId> movementIds;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            List<SubscriptionAttempt> attempts = operations.subscribe().subscribeAll(userId, movementIds);
            for (SubscriptionAttempt attempt : attempts) {
                if (attempt.result().isSuccess()) {
                    out.println("Subscribed: " + SubscriptionReport.describe(attempt.result().getOrThrow()));
                }
            }
            return SubscriptionReport.print(attempts, out, err);
        }
    }

    @Command(name = "delete-subscription", description = "End a user's active subscription to a movement (soft delete).")
    static class DeleteSubscription implements AdminTask {

        @Parameters(index = "0", description = "Id of the subscribed user.")
        UserId userId;

        @Parameters(index = "1", description = "Id of the movement.")
        MovementId movementId;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            return operations.unsubscribe().unsubscribe(userId, movementId).fold(
                association -> {
                    out.println("Unsubscribed: " + SubscriptionReport.describe(association));
                    return ExitCodes.OK;
                },
                error -> {
                    err.println(error.message());
                    return ExitCodes.NOT_FOUND;
                }
            );
        }
    }

    @Command(name = "count-subscriptions", description = "Count the active subscriptions of a user.")
    static class CountSubscriptions implements AdminTask {

        @Parameters(index = "0", description = "Id of the user.")
        UserId userId;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            out.println(operations.count().countActiveSubscriptions(userId));
            return ExitCodes.OK;
        }
    }
}
