package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.DeleteManyUseCase;
import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
public class DeletionService implements DeleteManyUseCase {

    private static final Logger log = LoggerFactory.getLogger(DeletionService.class);

    private final BulkDeleter bulkDeleter;
    private final MovementRepository movementRepository;
    private final AssociationRepository associationRepository;
    private final MetricsPort metrics;

    public DeletionService(
            BulkDeleter bulkDeleter,
            MovementRepository movementRepository,
            AssociationRepository associationRepository,
            MetricsPort metrics) {
        this.bulkDeleter = bulkDeleter;
        this.movementRepository = movementRepository;
        this.associationRepository = associationRepository;
        this.metrics = metrics;
    }

    @Override
    public MovementDeletion deleteMovements(MovementFilter filter, int limit, boolean randomOrder) {
        AtomicLong orphaned = new AtomicLong();
        BulkDeleteOutcome<MovementId> outcome = bulkDeleter.delete(
            movementRepository,
            filter,
            limit,
            randomOrder,
            selected -> orphaned.set(associationRepository.countActiveReferencing(selected))
        );

        metrics.incrementRowsDeleted("movements", outcome.deleted());
        if (orphaned.get() > 0) {
            log.warn("{} active associations reference the {} deleted movements and are now orphaned",
                orphaned.get(), outcome.deleted());
        }
        return new MovementDeletion(outcome, orphaned.get());
    }

    @Override
    public BulkDeleteOutcome<AssociationId> deleteAssociations(AssociationFilter filter, int limit, boolean randomOrder) {
        BulkDeleteOutcome<AssociationId> outcome = bulkDeleter.delete(associationRepository, filter, limit, randomOrder);
        metrics.incrementRowsDeleted("movement_user_association", outcome.deleted());
        return outcome;
    }
}
