package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.RegisterUserUseCase;
import com.gridt.admin.application.port.out.IdGenerator;
import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.PasswordHasher;
import com.gridt.admin.application.port.out.TransactionRunner;
import com.gridt.admin.application.port.out.UserRepository;
import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserCredentials;
import com.gridt.admin.domain.model.UserId;
import com.gridt.admin.infrastructure.exception.IntegrityViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class RegistrationService implements RegisterUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final IdGenerator idGenerator;
    private final TransactionRunner transactions;
    private final MetricsPort metrics;

    public RegistrationService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            IdGenerator idGenerator,
            TransactionRunner transactions,
            MetricsPort metrics) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.idGenerator = idGenerator;
        this.transactions = transactions;
        this.metrics = metrics;
    }

    @Override
    public UserId register(UserCredentials credentials) {
        try {
            UserId id = transactions.inTransaction(() -> insert(credentials));
            metrics.incrementUsersCreated(1);
            log.info("Registered user {} ({})", credentials.username(), id);
            return id;
        } catch (DuplicateKeyException e) {
            throw new IntegrityViolationException("Email " + credentials.email() + " is already registered", e);
        }
    }

    /**
     * Inserts one user in the caller's transaction. Used by bulk seeding, where the chunk
     * transaction is already open.
     */
    UserId insert(UserCredentials credentials) {
        User user = new User(
            UserId.of(idGenerator.generate()),
            credentials.username(),
            credentials.email(),
            Instant.now()
        );
        userRepository.save(user, passwordHasher.hash(credentials.password()));
        return user.id();
    }
}
