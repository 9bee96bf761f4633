package com.gridt.admin.domain.model;

import com.gridt.admin.domain.error.ValidationError.UnknownInterval;

import java.util.Locale;

/**
 * How often followers of a movement are expected to check in.
 */
public enum MovementInterval {
    DAILY("daily"),
    WEEKLY("weekly");

    private final String storedValue;

    MovementInterval(String storedValue) {
        this.storedValue = storedValue;
    }

    /**
     * The value written to the {@code interval} column.
     */
    public String storedValue() {
        return storedValue;
    }

    public static Result<MovementInterval, UnknownInterval> parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (MovementInterval interval : values()) {
                if (interval.storedValue.equals(normalized)) {
                    return Result.success(interval);
                }
            }
        }
        return Result.failure(new UnknownInterval(value));
    }

    public static MovementInterval fromTrusted(String storedValue) {
        return parse(storedValue).fold(
            interval -> interval,
            error -> {
                throw new IllegalStateException("Corrupted interval in trusted source: " + storedValue);
            }
        );
    }

    @Override
    public String toString() {
        return storedValue;
    }
}
