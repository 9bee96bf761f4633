package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.application.port.in.CreateUsersUseCase.UserSeedResult;
import com.gridt.admin.application.service.BulkWriteOutcome;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserCredentials;
import com.gridt.admin.domain.model.UserId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

final class CreateCommands {

    private CreateCommands() {
    }

    @Command(name = "create-many-movements", description = "Create many random movements in the database.")
    static class CreateManyMovements implements AdminTask {

        @Option(names = {"-n", "--number"}, defaultValue = "100", description = "How many movements to create (default: ${DEFAULT-VALUE}).")
        int number;

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            if (number < 0) {
                err.println("--number must not be negative");
                return ExitCodes.USAGE;
            }
            BulkWriteOutcome<MovementId> outcome = operations.createMovements().createMovements(number, settings.chunkSize());
            out.println("Added " + outcome.count() + " random movements in " + outcome.commits() + " transactions");
            return reportFailure(outcome, number, err);
        }
    }

    @Command(name = "create-many-users", description = "Create many random users, optionally subscribed to movements.")
    static class CreateManyUsers implements AdminTask {

        @Option(names = {"-n", "--number"}, defaultValue = "100", description = "How many users to create (default: ${DEFAULT-VALUE}).")
        int number;

        @Option(names = {"-s", "--subscriptions"}, arity = "1..*", description = "Movement ids every new user subscribes to.")
        List<MovementId> subscriptions = new ArrayList<>();

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            if (number < 0) {
                err.println("--number must not be negative");
                return ExitCodes.USAGE;
            }
            UserSeedResult result = operations.createUsers().createUsers(number, settings.chunkSize(), subscriptions);
            out.println("Added " + result.users().count() + " random users in " + result.users().commits() + " transactions");
            int subscriptionExit = SubscriptionReport.print(result.subscriptions(), out, err);
            int writeExit = reportFailure(result.users(), number, err);
            return Math.max(writeExit, subscriptionExit);
        }
    }

    @Command(name = "create-user", description = "Register a user in the database, optionally subscribed to movements.")
    static class CreateUser implements AdminTask {

        @Parameters(index = "0", description = "Username.")
        String username;

        @Parameters(index = "1", description = "Email address, must be unique.")
        String email;

        @Parameters(index = "2", description = "Plain text password, stored hashed.")
        String password;

        @Option(names = {"-s", "--subscriptions"}, arity = "1..*", description = "Movement ids to subscribe the user to.")
        List<MovementId> subscriptions = new ArrayList<>();

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            if (username.length() > User.USERNAME_MAX_LENGTH) {
                err.println("Username must be at most " + User.USERNAME_MAX_LENGTH + " characters, was " + username.length());
                return ExitCodes.USAGE;
            }
            if (email.length() > User.EMAIL_MAX_LENGTH) {
                err.println("Email must be at most " + User.EMAIL_MAX_LENGTH + " characters, was " + email.length());
                return ExitCodes.USAGE;
            }
            UserId id = operations.registerUser().register(new UserCredentials(username, email, password));
            out.println("Registered user " + username + " with id " + id);
            return SubscriptionReport.print(operations.subscribe().subscribeAll(id, subscriptions), out, err);
        }
    }

    private static int reportFailure(BulkWriteOutcome<?> outcome, int requested, PrintWriter err) {
        return outcome.failure()
            .map(error -> {
                err.println("Stopped after " + outcome.count() + " of " + requested
                    + " rows [" + error.code() + "]: " + error.message());
                return ExitCodes.FAILURE;
            })
            .orElse(ExitCodes.OK);
    }
}
