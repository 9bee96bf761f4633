package com.gridt.admin.application.service;

import com.gridt.admin.domain.error.BulkWriteError;

import java.util.List;
import java.util.Optional;

/**
 * What a bulk insert left in storage.
 *
 * @param written results of every durably committed draft, in input order
 * @param commits number of chunks committed
 * @param error why the run stopped early, null when every draft was written
 */
public record BulkWriteOutcome<T>(List<T> written, int commits, BulkWriteError error) {

    public BulkWriteOutcome {
        written = List.copyOf(written);
    }

    public int count() {
        return written.size();
    }

    public boolean isComplete() {
        return error == null;
    }

    public Optional<BulkWriteError> failure() {
        return Optional.ofNullable(error);
    }
}
