package com.gridt.admin.adapter.in.cli;

/**
 * An open connection to one database for the lifetime of a single command.
 */
public interface AdminSession extends AutoCloseable {

    AdminSettings settings();

    AdminOperations operations();

    @Override
    void close();
}
