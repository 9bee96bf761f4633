package com.gridt.admin.application.port.out;

/**
 * Port for recording what a command changed.
 */
public interface MetricsPort {

    void incrementMovementsCreated(int count);

    void incrementUsersCreated(int count);

    void incrementSubscriptionsCreated();

    void incrementSubscriptionsDestroyed();

    void incrementRowsDeleted(String table, int count);

    void incrementChunksCommitted();

    void incrementChunksRolledBack();

    /**
     * One-line summary of every counter, logged when a session ends.
     */
    String summary();
}
