package com.gridt.admin.domain.error;

/**
 * Why a bulk insert stopped before consuming all of its drafts.
 * The chunk in flight at that moment was rolled back; earlier chunks stay committed.
 */
public sealed interface BulkWriteError {

    /**
     * A uniqueness constraint rejected a row, e.g. a generated email that already exists.
     */
    record DuplicateValue(int chunk, String detail) implements BulkWriteError {
        @Override
        public String message() {
            return "Duplicate value rejected in chunk " + chunk + ": " + detail;
        }

        @Override
        public String code() {
            return "DUPLICATE_VALUE";
        }
    }

    record StorageFailure(int chunk, String detail) implements BulkWriteError {
        @Override
        public String message() {
            return "Storage failure in chunk " + chunk + ": " + detail;
        }

        @Override
        public String code() {
            return "STORAGE_FAILURE";
        }
    }

    String message();

    String code();
}
