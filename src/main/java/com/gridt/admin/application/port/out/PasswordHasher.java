package com.gridt.admin.application.port.out;

public interface PasswordHasher {
    String hash(String rawPassword);
}
