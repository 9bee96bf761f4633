package com.gridt.admin.application.port.in;

import com.gridt.admin.domain.model.UserCredentials;
import com.gridt.admin.domain.model.UserId;

public interface RegisterUserUseCase {

    /**
     * @throws com.gridt.admin.infrastructure.exception.IntegrityViolationException if the email is already registered
     */
    UserId register(UserCredentials credentials);
}
