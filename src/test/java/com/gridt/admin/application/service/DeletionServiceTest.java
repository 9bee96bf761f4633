package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.DeleteManyUseCase.MovementDeletion;
import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.MovementInterval;
import com.gridt.admin.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeletionService")
class DeletionServiceTest {

    @Mock
    private MovementRepository movementRepository;

    @Mock
    private AssociationRepository associationRepository;

    @Mock
    private MetricsPort metrics;

    private RecordingTransactionRunner transactions;
    private DeletionService deletionService;

    @BeforeEach
    void setUp() {
        transactions = new RecordingTransactionRunner();
        deletionService = new DeletionService(
                new BulkDeleter(transactions, new Random(1)), movementRepository, associationRepository, metrics
        );
    }

    @Test
    @DisplayName("Should report active associations left pointing at deleted movements")
    void shouldReportOrphans() {
        // Given
        MovementId a = MovementId.random();
        MovementId b = MovementId.random();
        MovementId c = MovementId.random();
        MovementFilter weekly = new MovementFilter(MovementInterval.WEEKLY);
        when(movementRepository.findIds(weekly)).thenReturn(List.of(a, b, c));
        when(associationRepository.countActiveReferencing(List.of(a, b))).thenReturn(4L);
        when(movementRepository.deleteByIds(List.of(a, b))).thenReturn(2);

        // When
        MovementDeletion deletion = deletionService.deleteMovements(weekly, 2, false);

        // Then
        assertEquals(2, deletion.outcome().deleted());
        assertEquals(3, deletion.outcome().matched());
        assertEquals(4L, deletion.orphanedAssociations());
        verify(metrics).incrementRowsDeleted("movements", 2);
        assertEquals(1, transactions.commits);
    }

    @Test
    @DisplayName("Should not touch associations when no movement is selected")
    void shouldSkipOrphanCountWhenNothingSelected() {
        when(movementRepository.findIds(MovementFilter.any())).thenReturn(List.of());

        MovementDeletion deletion = deletionService.deleteMovements(MovementFilter.any(), 5, true);

        assertEquals(0, deletion.outcome().deleted());
        assertEquals(0L, deletion.orphanedAssociations());
        verifyNoInteractions(associationRepository);
    }

    @Test
    @DisplayName("Should delete associations matching the filter")
    void shouldDeleteAssociations() {
        // Given
        AssociationFilter filter = new AssociationFilter(UserId.random(), null, null, false);
        AssociationId first = AssociationId.random();
        AssociationId second = AssociationId.random();
        when(associationRepository.findIds(filter)).thenReturn(List.of(first, second));
        when(associationRepository.deleteByIds(List.of(first))).thenReturn(1);

        // When
        BulkDeleteOutcome<AssociationId> outcome = deletionService.deleteAssociations(filter, 1, false);

        // Then
        assertEquals(List.of(first), outcome.selected());
        assertEquals(1, outcome.deleted());
        verify(metrics).incrementRowsDeleted("movement_user_association", 1);
    }
}
