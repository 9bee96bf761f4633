package com.gridt.admin.application.port.out;

/**
 * Creates the tables and indexes this tool works on. Safe to run repeatedly.
 */
public interface SchemaInitializer {
    void initialize();
}
