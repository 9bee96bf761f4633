package com.gridt.admin.domain.model;

/**
 * Criteria for selecting movements. A null interval matches every movement.
 */
public record MovementFilter(MovementInterval interval) {

    public static MovementFilter any() {
        return new MovementFilter(null);
    }
}
