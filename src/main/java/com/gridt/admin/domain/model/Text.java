package com.gridt.admin.domain.model;

/**
 * String helpers for values bound for length-limited columns.
 */
public final class Text {

    private Text() {
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} characters. Null stays null.
     * A surrogate pair is never split: if the cut would land between its halves the high
     * surrogate is dropped as well.
     */
    public static String truncate(String value, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
