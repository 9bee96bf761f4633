package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.application.port.in.SubscribeUseCase.SubscriptionAttempt;
import com.gridt.admin.domain.model.Association;

import java.io.PrintWriter;
import java.util.List;

/**
 * Prints subscription attempts, one line per failure, and tells the caller which exit code they add up to.
 */
final class SubscriptionReport {

    private SubscriptionReport() {
    }

    static int print(List<SubscriptionAttempt> attempts, PrintWriter out, PrintWriter err) {
        long created = attempts.stream().filter(a -> a.result().isSuccess()).count();
        for (SubscriptionAttempt attempt : attempts) {
            attempt.result().onFailure(error -> err.println(
                "Subscription of " + attempt.followerId() + " to " + attempt.movementId()
                    + " failed [" + error.code() + "]: " + error.message()));
        }
        if (!attempts.isEmpty()) {
            out.println("Subscriptions active: " + created + " of " + attempts.size());
        }
        return created == attempts.size() ? ExitCodes.OK : ExitCodes.NOT_FOUND;
    }

    static String describe(Association association) {
        return association.id() + " (follower " + association.followerId()
            + ", movement " + association.movementId()
            + ", leader " + association.leader().map(Object::toString).orElse("none") + ")";
    }
}
