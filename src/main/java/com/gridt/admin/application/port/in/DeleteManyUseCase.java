package com.gridt.admin.application.port.in;

import com.gridt.admin.application.service.BulkDeleteOutcome;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;

public interface DeleteManyUseCase {

    MovementDeletion deleteMovements(MovementFilter filter, int limit, boolean randomOrder);

    /**
     * Hard-deletes associations, active or destroyed alike unless the filter says otherwise.
     */
    BulkDeleteOutcome<AssociationId> deleteAssociations(AssociationFilter filter, int limit, boolean randomOrder);

    /**
     * Movement deletion does not cascade. {@code orphanedAssociations} counts the active
     * associations that pointed at the deleted movements.
     */
    record MovementDeletion(BulkDeleteOutcome<MovementId> outcome, long orphanedAssociations) {}
}
