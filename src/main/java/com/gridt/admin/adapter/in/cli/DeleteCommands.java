package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.application.port.in.DeleteManyUseCase.MovementDeletion;
import com.gridt.admin.application.service.BulkDeleteOutcome;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.MovementInterval;
import com.gridt.admin.domain.model.UserId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

final class DeleteCommands {

    private DeleteCommands() {
    }

    /**
     * Options shared by the bulk delete commands. Unset values fall back to {@link AdminSettings}.
     */
    abstract static class BoundedDelete implements AdminTask {

        @Option(names = {"-n", "--number"}, description = "Maximum number of rows to delete (default: admin.delete-limit).")
        Integer number;

        @Option(names = "--random", description = "Pick the rows uniformly at random.")
        boolean random;

        @Option(names = "--oldest-first", description = "Pick the oldest rows. Without either flag admin.random-delete decides.")
        boolean oldestFirst;

        int limit(AdminSettings settings) {
            return number != null ? number : settings.deleteLimit();
        }

        boolean randomOrder(AdminSettings settings) {
            if (random && oldestFirst) {
                throw new IllegalArgumentException("--random and --oldest-first cannot be combined");
            }
            if (random || oldestFirst) {
                return random;
            }
            return settings.randomDelete();
        }
    }

    @Command(name = "delete-many-movements", description = "Delete movements, at most --number of them.")
    static class DeleteManyMovements extends BoundedDelete {

        @Option(names = "--interval", description = "Only movements with this interval (daily or weekly).")
        MovementInterval interval;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            MovementDeletion deletion = operations.deleteMany()
                .deleteMovements(new MovementFilter(interval), limit(settings), randomOrder(settings));
            BulkDeleteOutcome<MovementId> outcome = deletion.outcome();
            out.println("Deleted " + outcome.deleted() + " of " + outcome.matched() + " movements");
            if (deletion.orphanedAssociations() > 0) {
                err.println("Warning: " + deletion.orphanedAssociations()
                    + " active associations reference the deleted movements");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete-many-associations", description = "Hard-delete associations, at most --number of them.")
    static class DeleteManyAssociations extends BoundedDelete {

        @Option(names = "--follower-id", description = "Only associations of this follower.")
        UserId followerId;

        @Option(names = "--leader-id", description = "Only associations led by this user.")
        UserId leaderId;

        @Option(names = "--movement-id", description = "Only associations in this movement.")
        MovementId movementId;

        @Option(names = "--active", description = "Only associations that were not destroyed.")
        boolean activeOnly;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            AssociationFilter filter = new AssociationFilter(followerId, leaderId, movementId, activeOnly);
            BulkDeleteOutcome<AssociationId> outcome = operations.deleteMany()
                .deleteAssociations(filter, limit(settings), randomOrder(settings));
            out.println("Deleted " + outcome.deleted() + " of " + outcome.matched() + " associations");
            return ExitCodes.OK;
        }
    }
}
