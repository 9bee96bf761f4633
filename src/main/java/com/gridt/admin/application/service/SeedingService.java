package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.CreateMovementsUseCase;
import com.gridt.admin.application.port.in.CreateUsersUseCase;
import com.gridt.admin.application.port.in.SubscribeUseCase;
import com.gridt.admin.application.port.in.SubscribeUseCase.SubscriptionAttempt;
import com.gridt.admin.application.port.out.IdGenerator;
import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.domain.model.Movement;
import com.gridt.admin.domain.model.MovementDraft;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserCredentials;
import com.gridt.admin.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Fills the database with synthetic movements and users.
 */
@Service
public class SeedingService implements CreateMovementsUseCase, CreateUsersUseCase {

    private static final Logger log = LoggerFactory.getLogger(SeedingService.class);

    private final FixtureGenerator fixtures;
    private final BulkWriter bulkWriter;
    private final MovementRepository movementRepository;
    private final RegistrationService registration;
    private final SubscribeUseCase subscriptions;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public SeedingService(
            FixtureGenerator fixtures,
            BulkWriter bulkWriter,
            MovementRepository movementRepository,
            RegistrationService registration,
            SubscribeUseCase subscriptions,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.fixtures = fixtures;
        this.bulkWriter = bulkWriter;
        this.movementRepository = movementRepository;
        this.registration = registration;
        this.subscriptions = subscriptions;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    public BulkWriteOutcome<MovementId> createMovements(int number, int chunkSize) {
        log.info("Creating {} random movements in chunks of {}", number, chunkSize);

        BulkWriteOutcome<MovementId> outcome = bulkWriter.insert(
            generated(number, fixtures::generateMovement),
            chunkSize,
            this::insertMovement
        );

        metrics.incrementMovementsCreated(outcome.count());
        outcome.failure().ifPresent(error ->
            log.error("Movement seeding stopped after {} of {}: {}", outcome.count(), number, error.message()));
        return outcome;
    }

    @Override
    public UserSeedResult createUsers(int number, int chunkSize, List<MovementId> movementIds) {
        log.info("Creating {} random users in chunks of {}, subscribing each to {} movements",
            number, chunkSize, movementIds.size());

        BulkWriteOutcome<UserId> users = bulkWriter.insert(
            generated(number, fixtures::generateUserCredentials),
            chunkSize,
            (UserCredentials credentials) -> registration.insert(credentials)
        );
        metrics.incrementUsersCreated(users.count());
        users.failure().ifPresent(error ->
            log.error("User seeding stopped after {} of {}: {}", users.count(), number, error.message()));

        List<SubscriptionAttempt> attempts = new ArrayList<>();
        if (!movementIds.isEmpty()) {
            for (UserId userId : users.written()) {
                attempts.addAll(subscriptions.subscribeAll(userId, movementIds));
            }
        }
        return new UserSeedResult(users, attempts);
    }

    private MovementId insertMovement(MovementDraft draft) {
        Movement movement = Movement.from(MovementId.of(idGenerator.generate()), draft);
        movementRepository.save(movement);
        return movement.id();
    }

    private static <D> Iterable<D> generated(int number, Supplier<D> generator) {
        if (number < 0) {
            throw new IllegalArgumentException("number must not be negative, was " + number);
        }
        return () -> Stream.generate(generator).limit(number).iterator();
    }
}
