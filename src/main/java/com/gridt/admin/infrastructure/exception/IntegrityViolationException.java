package com.gridt.admin.infrastructure.exception;

/**
 * Stored data contradicts a uniqueness rule: a duplicate email on registration, or a lookup
 * that was expected to match one row and matched several.
 */
public class IntegrityViolationException extends BusinessException {

    public IntegrityViolationException(String message) {
        super("INTEGRITY_VIOLATION", message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super("INTEGRITY_VIOLATION", message, cause);
    }
}
