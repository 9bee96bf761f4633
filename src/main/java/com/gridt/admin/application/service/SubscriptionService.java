package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.SubscribeUseCase;
import com.gridt.admin.application.port.in.UnsubscribeUseCase;
import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.application.port.out.IdGenerator;
import com.gridt.admin.application.port.out.LeaderResolver;
import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.application.port.out.TransactionRunner;
import com.gridt.admin.application.port.out.UserRepository;
import com.gridt.admin.domain.error.SubscriptionError;
import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.Result;
import com.gridt.admin.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of movement-user associations.
 *
 * <p>A follower has at most one active association per movement. {@link #subscribe} checks for it
 * inside the same transaction that would insert the new row and returns it unchanged when present.
 * Unsubscribing only stamps {@code destroyed}; a later subscribe inserts a fresh row.
 */
@Service
public class SubscriptionService implements SubscribeUseCase, UnsubscribeUseCase {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final AssociationRepository associationRepository;
    private final UserRepository userRepository;
    private final MovementRepository movementRepository;
    private final LeaderResolver leaderResolver;
    private final TransactionRunner transactions;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public SubscriptionService(
            AssociationRepository associationRepository,
            UserRepository userRepository,
            MovementRepository movementRepository,
            LeaderResolver leaderResolver,
            TransactionRunner transactions,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.associationRepository = associationRepository;
        this.userRepository = userRepository;
        this.movementRepository = movementRepository;
        this.leaderResolver = leaderResolver;
        this.transactions = transactions;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    public Result<Association, SubscriptionError> subscribe(UserId followerId, MovementId movementId) {
        log.debug("Processing subscribe request: follower={}, movement={}", followerId, movementId);
        return transactions.inTransaction(() -> subscribeInScope(followerId, movementId));
    }

    private Result<Association, SubscriptionError> subscribeInScope(UserId followerId, MovementId movementId) {
        if (!userRepository.exists(followerId)) {
            log.debug("Follower not found: {}", followerId);
            return Result.failure(new SubscriptionError.FollowerNotFound(followerId));
        }
        if (!movementRepository.exists(movementId)) {
            log.debug("Movement not found: {}", movementId);
            return Result.failure(new SubscriptionError.MovementNotFound(movementId));
        }

        Optional<Association> active = associationRepository.findActive(followerId, movementId);
        if (active.isPresent()) {
            log.debug("Already subscribed: follower={}, movement={}, association={}",
                followerId, movementId, active.get().id());
            return Result.success(active.get());
        }

        UserId leaderId = leaderResolver.resolveLeader(movementId, followerId)
            .filter(leader -> !leader.equals(followerId))
            .orElse(null);

        Association association = Association.create(
            AssociationId.of(idGenerator.generate()),
            followerId,
            leaderId,
            movementId
        );
        associationRepository.save(association);
        metrics.incrementSubscriptionsCreated();
        log.info("Subscribed {} to movement {} (leader={})", followerId, movementId, leaderId);

        return Result.success(association);
    }

    @Override
    public List<SubscriptionAttempt> subscribeAll(UserId followerId, List<MovementId> movementIds) {
        List<SubscriptionAttempt> attempts = new ArrayList<>(movementIds.size());
        for (MovementId movementId : movementIds) {
            Result<Association, SubscriptionError> result = subscribe(followerId, movementId)
                .onFailure(error -> log.warn("Subscription of {} to {} failed: {}", followerId, movementId, error.message()));
            attempts.add(new SubscriptionAttempt(followerId, movementId, result));
        }
        return attempts;
    }

    @Override
    public Result<Association, SubscriptionError> unsubscribe(UserId followerId, MovementId movementId) {
        log.debug("Processing unsubscribe request: follower={}, movement={}", followerId, movementId);
        return transactions.inTransaction(() -> {
            Optional<Association> active = associationRepository.findActive(followerId, movementId);
            if (active.isEmpty()) {
                return Result.<Association, SubscriptionError>failure(
                    new SubscriptionError.NotSubscribed(followerId, movementId));
            }

            Association destroyed = active.get().destroy(Instant.now());
            if (!associationRepository.markDestroyed(destroyed.id(), destroyed.destroyed())) {
                return Result.<Association, SubscriptionError>failure(
                    new SubscriptionError.NotSubscribed(followerId, movementId));
            }
            metrics.incrementSubscriptionsDestroyed();
            log.info("Unsubscribed {} from movement {}", followerId, movementId);
            return Result.<Association, SubscriptionError>success(destroyed);
        });
    }
}
