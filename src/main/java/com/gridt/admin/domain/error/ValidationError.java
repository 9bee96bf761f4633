package com.gridt.admin.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected outcomes of parsing operator input, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Identifier parsing errors, shared by users, movements and associations
    sealed interface IdError extends ValidationError {

        record Empty(String kind) implements IdError {
            @Override
            public String message() {
                return kind + " ID cannot be empty";
            }

            @Override
            public String code() {
                return "ID_EMPTY";
            }
        }

        record InvalidFormat(String kind, String value) implements IdError {
            @Override
            public String message() {
                return kind + " ID must be a valid UUID: " + value;
            }

            @Override
            public String code() {
                return "ID_INVALID_FORMAT";
            }
        }
    }

    record UnknownInterval(String value) implements ValidationError {
        @Override
        public String message() {
            return "Unknown movement interval '" + value + "', expected daily or weekly";
        }

        @Override
        public String code() {
            return "INTERVAL_UNKNOWN";
        }
    }
}
