package com.gridt.admin.application.port.out;

import java.util.function.Supplier;

/**
 * Explicit transaction scopes. The work runs inside a fresh transaction that is committed
 * when it returns and rolled back when it throws; the exception is rethrown unchanged.
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);

    /**
     * Runs {@code work} in a read-only transaction.
     */
    <T> T readOnly(Supplier<T> work);
}
