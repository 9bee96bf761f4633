package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserId;
import com.gridt.admin.integration.base.PostgresTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcUserRepositoryTest extends PostgresTestBase {

    @Autowired
    private JdbcUserRepository userRepository;

    private UserId save(String username, String email) {
        UserId id = UserId.random();
        userRepository.save(new User(id, username, email, Instant.now()), "$2a$04$hash");
        return id;
    }

    @Test
    void shouldSaveAndFindUser() {
        // Given
        UserId id = save("alice", "alice@example.com");

        // When
        var found = userRepository.findById(id);

        // Then
        assertTrue(found.isPresent());
        assertEquals("alice", found.get().username());
        assertEquals("alice@example.com", found.get().email());
        assertTrue(userRepository.exists(id));
        assertEquals(1, userRepository.count());
    }

    @Test
    void shouldRejectDuplicateEmail() {
        save("alice", "shared@example.com");

        assertThrows(DuplicateKeyException.class, () -> save("bob", "shared@example.com"));
    }

    @Test
    void shouldFindByUsernameOrEmailExactly() {
        // Given
        UserId alice = save("alice", "alice@example.com");
        save("alicia", "alicia@example.com");

        // When / Then
        assertEquals(List.of(alice), userRepository.findIdsByUsernameOrEmail("alice"));
        assertEquals(List.of(alice), userRepository.findIdsByUsernameOrEmail("alice@example.com"));
        assertTrue(userRepository.findIdsByUsernameOrEmail("ali").isEmpty());
    }

    @Test
    void shouldReturnEveryUserSharingAUsername() {
        save("sam", "sam1@example.com");
        save("sam", "sam2@example.com");

        assertEquals(2, userRepository.findIdsByUsernameOrEmail("sam").size());
    }
}
