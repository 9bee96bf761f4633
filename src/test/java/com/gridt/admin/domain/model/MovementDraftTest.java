package com.gridt.admin.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MovementDraftTest {

    @Test
    void shouldTruncateEveryTextFieldToItsColumn() {
        MovementDraft draft = MovementDraft.of(
            "n".repeat(500),
            MovementInterval.DAILY,
            "s".repeat(500),
            "d".repeat(5000)
        );

        assertEquals(Movement.NAME_MAX_LENGTH, draft.name().length());
        assertEquals(Movement.SHORT_DESCRIPTION_MAX_LENGTH, draft.shortDescription().length());
        assertEquals(Movement.DESCRIPTION_MAX_LENGTH, draft.description().length());
    }

    @Test
    void shouldKeepShortValuesUnchanged() {
        MovementDraft draft = MovementDraft.of("Read a page", MovementInterval.WEEKLY, "Books", null);

        assertEquals("Read a page", draft.name());
        assertEquals("Books", draft.shortDescription());
        assertNull(draft.description());
    }

    @Test
    void constructorShouldRejectOversizedName() {
        assertThrows(IllegalArgumentException.class,
            () -> new MovementDraft("x".repeat(51), MovementInterval.DAILY, null, null));
    }

    @Test
    void shouldRequireInterval() {
        assertThrows(NullPointerException.class, () -> MovementDraft.of("Walk", null, null, null));
    }
}
