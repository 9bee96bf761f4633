package com.gridt.admin.adapter.out.security;

import com.gridt.admin.application.port.out.PasswordHasher;
import com.gridt.admin.infrastructure.config.AdminProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt hashes, the format the application itself verifies at login.
 * Cost factor from {@code admin.password-hash-strength}.
 */
@Component
public class BcryptPasswordHasher implements PasswordHasher {

    private final BCryptPasswordEncoder encoder;

    public BcryptPasswordHasher(AdminProperties properties) {
        this.encoder = new BCryptPasswordEncoder(properties.getPasswordHashStrength());
    }

    @Override
    public String hash(String rawPassword) {
        return encoder.encode(rawPassword);
    }
}
