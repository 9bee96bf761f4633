package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.MovementRepository;
import com.gridt.admin.domain.model.Movement;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.MovementInterval;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcMovementRepository implements MovementRepository {

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;

    private static final RowMapper<Movement> ROW_MAPPER = (rs, rowNum) -> new Movement(
        MovementId.fromTrusted(rs.getString("id")),
        rs.getString("name"),
        MovementInterval.fromTrusted(rs.getString("interval")),
        rs.getString("short_description"),
        rs.getString("description"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcMovementRepository(JdbcTemplate jdbc, NamedParameterJdbcTemplate named) {
        this.jdbc = jdbc;
        this.named = named;
    }

    @Override
    public void save(Movement movement) {
        jdbc.update("""
            INSERT INTO movements (id, name, "interval", short_description, description, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            movement.id().value(),
            movement.name(),
            movement.interval().storedValue(),
            movement.shortDescription(),
            movement.description(),
            Timestamp.from(movement.createdAt())
        );
    }

    @Override
    public Optional<Movement> findById(MovementId id) {
        return jdbc.query("""
            SELECT id, name, "interval", short_description, description, created_at
            FROM movements
            WHERE id = ?
            """,
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public boolean exists(MovementId id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM movements WHERE id = ?",
            Integer.class,
            id.value()
        );
        return count != null && count > 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM movements", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public List<MovementId> findIds(MovementFilter filter) {
        if (filter == null || filter.interval() == null) {
            return jdbc.queryForList("SELECT id FROM movements ORDER BY id", UUID.class)
                .stream().map(MovementId::of).toList();
        }
        return jdbc.queryForList(
            "SELECT id FROM movements WHERE \"interval\" = ? ORDER BY id",
            UUID.class,
            filter.interval().storedValue()
        ).stream().map(MovementId::of).toList();
    }

    @Override
    public int deleteByIds(Collection<MovementId> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return named.update(
            "DELETE FROM movements WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", ids.stream().map(MovementId::value).toList())
        );
    }
}
