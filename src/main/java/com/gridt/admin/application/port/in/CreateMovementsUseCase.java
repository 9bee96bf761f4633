package com.gridt.admin.application.port.in;

import com.gridt.admin.application.service.BulkWriteOutcome;
import com.gridt.admin.domain.model.MovementId;

public interface CreateMovementsUseCase {

    /**
     * Generates and stores {@code number} random movements, committing every {@code chunkSize}.
     */
    BulkWriteOutcome<MovementId> createMovements(int number, int chunkSize);
}
