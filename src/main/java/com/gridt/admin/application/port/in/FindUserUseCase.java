package com.gridt.admin.application.port.in;

import com.gridt.admin.domain.model.UserId;

import java.util.Optional;

public interface FindUserUseCase {

    /**
     * Exact match on username or email.
     *
     * @throws com.gridt.admin.infrastructure.exception.IntegrityViolationException if more than one user matches
     */
    Optional<UserId> findUserBy(String query);
}
