package com.gridt.admin.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AssociationTest {

    @Test
    void shouldStartActive() {
        Association association = Association.create(AssociationId.random(), UserId.random(), null, MovementId.random());

        assertTrue(association.isActive());
        assertTrue(association.leader().isEmpty());
        assertNotNull(association.createdAt());
    }

    @Test
    void destroyShouldStampDestroyed() {
        Association association = Association.create(AssociationId.random(), UserId.random(), UserId.random(), MovementId.random());
        Instant at = Instant.parse("2026-01-01T00:00:00Z");

        Association destroyed = association.destroy(at);

        assertFalse(destroyed.isActive());
        assertEquals(at, destroyed.destroyed());
        assertEquals(association.id(), destroyed.id());
    }

    @Test
    void shouldNotDestroyTwice() {
        Association destroyed = Association.create(AssociationId.random(), UserId.random(), null, MovementId.random())
            .destroy(Instant.now());

        assertThrows(IllegalStateException.class, () -> destroyed.destroy(Instant.now()));
    }
}
