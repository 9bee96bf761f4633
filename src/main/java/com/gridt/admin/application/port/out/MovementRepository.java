package com.gridt.admin.application.port.out;

import com.gridt.admin.domain.model.Movement;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;

import java.util.Optional;

public interface MovementRepository extends BulkDeletable<MovementFilter, MovementId> {
    void save(Movement movement);
    Optional<Movement> findById(MovementId id);
    boolean exists(MovementId id);
    long count();
}
