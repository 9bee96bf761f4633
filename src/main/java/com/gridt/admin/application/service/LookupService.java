package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.CountUseCase;
import com.gridt.admin.application.port.in.FindUserUseCase;
import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.application.port.out.TransactionRunner;
import com.gridt.admin.application.port.out.UserRepository;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.EntityKind;
import com.gridt.admin.domain.model.UserId;
import com.gridt.admin.infrastructure.exception.IntegrityViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only counts and lookups. Every query runs in a read-only transaction.
 */
@Service
public class LookupService implements CountUseCase, FindUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(LookupService.class);

    private final MovementRepository movementRepository;
    private final UserRepository userRepository;
    private final AssociationRepository associationRepository;
    private final TransactionRunner transactions;

    public LookupService(
            MovementRepository movementRepository,
            UserRepository userRepository,
            AssociationRepository associationRepository,
            TransactionRunner transactions) {
        this.movementRepository = movementRepository;
        this.userRepository = userRepository;
        this.associationRepository = associationRepository;
        this.transactions = transactions;
    }

    @Override
    public long count(EntityKind kind, AssociationFilter filter) {
        return transactions.readOnly(() -> switch (kind) {
            case MOVEMENTS -> movementRepository.count();
            case USERS -> userRepository.count();
            case ASSOCIATIONS -> associationRepository.count(filter != null ? filter : AssociationFilter.any());
        });
    }

    @Override
    public long countActiveSubscriptions(UserId followerId) {
        return transactions.readOnly(() -> associationRepository.countActiveWithExistingMovement(followerId));
    }

    @Override
    public Optional<UserId> findUserBy(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        List<UserId> matches = transactions.readOnly(() -> userRepository.findIdsByUsernameOrEmail(query));

        if (matches.isEmpty()) {
            log.debug("No user matches '{}'", query);
            return Optional.empty();
        }
        if (matches.size() > 1) {
            log.error("{} users match '{}' exactly: {}", matches.size(), query, matches);
            throw new IntegrityViolationException(
                matches.size() + " users match '" + query + "' exactly, usernames and emails must be unique");
        }
        return Optional.of(matches.get(0));
    }
}
