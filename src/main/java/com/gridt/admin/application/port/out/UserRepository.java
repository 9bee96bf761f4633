package com.gridt.admin.application.port.out;

import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserId;

import java.util.List;
import java.util.Optional;

public interface UserRepository {

    /**
     * Inserts a user with an already hashed password.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the email is taken
     */
    void save(User user, String passwordHash);

    Optional<User> findById(UserId id);

    boolean exists(UserId id);

    /**
     * Ids of users whose username or email equals {@code query} exactly.
     * More than one element means the uniqueness assumption is broken.
     */
    List<UserId> findIdsByUsernameOrEmail(String query);

    long count();
}
