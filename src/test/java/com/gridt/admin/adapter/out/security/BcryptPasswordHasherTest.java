package com.gridt.admin.adapter.out.security;

import com.gridt.admin.infrastructure.config.AdminProperties;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCrypt;

import static org.junit.jupiter.api.Assertions.*;

class BcryptPasswordHasherTest {

    @Test
    void shouldProduceVerifiableBcryptHash() {
        AdminProperties properties = new AdminProperties();
        properties.setPasswordHashStrength(4);
        BcryptPasswordHasher hasher = new BcryptPasswordHasher(properties);

        String hash = hasher.hash("correct horse");

        assertTrue(hash.startsWith("$2a$04$"));
        assertTrue(BCrypt.checkpw("correct horse", hash));
        assertFalse(BCrypt.checkpw("wrong horse", hash));
    }
}
