package com.gridt.admin.domain.model;

import java.time.Instant;

/**
 * The parts of a user this tool reads. The password hash never leaves the repository.
 */
public record User(
    UserId id,
    String username,
    String email,
    Instant createdAt
) {
    public static final int USERNAME_MAX_LENGTH = 32;
    public static final int EMAIL_MAX_LENGTH = 80;
}
