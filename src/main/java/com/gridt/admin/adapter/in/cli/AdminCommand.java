package com.gridt.admin.adapter.in.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Root of the command table. Every subcommand sits directly under it; there are no nested groups.
 */
@Command(
    name = "gridt-admin",
    mixinStandardHelpOptions = true,
    version = "gridt-admin 0.1.0",
    description = "Maintenance tool for the movements database: seed, count, find and delete rows.",
    subcommands = {
        SchemaCommands.InitializeDatabase.class,
        CreateCommands.CreateManyMovements.class,
        CreateCommands.CreateManyUsers.class,
        CreateCommands.CreateUser.class,
        SubscriptionCommands.CreateSubscription.class,
        SubscriptionCommands.DeleteSubscription.class,
        SubscriptionCommands.CountSubscriptions.class,
        CountCommands.CountMovements.class,
        CountCommands.CountUsers.class,
        CountCommands.CountAssociations.class,
        FindUserCommand.class,
        DeleteCommands.DeleteManyMovements.class,
        DeleteCommands.DeleteManyAssociations.class
    }
)
public class AdminCommand {

    @Option(names = "--uri", description = "Database URI, overrides the ADMIN_DB_URI environment variable.")
    String uri;

    @Option(names = "--chunk-size", description = "Rows per transaction for bulk inserts, defaults to admin.chunk-size.")
    Integer chunkSize;
}
