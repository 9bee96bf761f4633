package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.EntityKind;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

final class CountCommands {

    private CountCommands() {
    }

    @Command(name = "count-movements", description = "Count the movements in the database.")
    static class CountMovements implements AdminTask {

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            out.println(operations.count().count(EntityKind.MOVEMENTS, null));
            return ExitCodes.OK;
        }
    }

    @Command(name = "count-users", description = "Count the users in the database.")
    static class CountUsers implements AdminTask {

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            out.println(operations.count().count(EntityKind.USERS, null));
            return ExitCodes.OK;
        }
    }

    @Command(name = "count-associations", description = "Count movement-user associations, optionally filtered.")
    static class CountAssociations implements AdminTask {

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
            out.println(operations.count().count(EntityKind.ASSOCIATIONS, filter));
            return ExitCodes.OK;
        }
    }
}
