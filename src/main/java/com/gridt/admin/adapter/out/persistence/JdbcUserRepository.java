package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.UserRepository;
import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.fromTrusted(rs.getString("id")),
        rs.getString("username"),
        rs.getString("email"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(User user, String passwordHash) {
        jdbc.update("""
            INSERT INTO users (id, username, email, password_hash, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            user.id().value(),
            user.username(),
            user.email(),
            passwordHash,
            Timestamp.from(user.createdAt())
        );
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query(
            "SELECT id, username, email, created_at FROM users WHERE id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UserId id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            id.value()
        );
        return count != null && count > 0;
    }

    @Override
    public List<UserId> findIdsByUsernameOrEmail(String query) {
        return jdbc.queryForList(
            "SELECT id FROM users WHERE username = ? OR email = ? ORDER BY id",
            UUID.class,
            query,
            query
        ).stream().map(UserId::of).toList();
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }
}
