package com.gridt.admin.adapter.in.cli;

import picocli.CommandLine.Command;

import java.io.PrintWriter;

final class SchemaCommands {

    private SchemaCommands() {
    }

    @Command(name = "initialize-database", description = "Create the required tables in the database.")
    static class InitializeDatabase implements AdminTask {

        @Override
        public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
            operations.initializeDatabase().initializeDatabase();
            out.println("Tables created");
            return ExitCodes.OK;
        }
    }
}
