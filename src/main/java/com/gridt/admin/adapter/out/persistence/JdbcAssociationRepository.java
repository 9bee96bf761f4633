package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.AssociationId;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rows of {@code movement_user_association}. Only {@code destroyed} is ever updated;
 * everything else is insert-once.
 */
@Repository
public class JdbcAssociationRepository implements AssociationRepository {

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;

    private static final RowMapper<Association> ROW_MAPPER = (rs, rowNum) -> {
        String leader = rs.getString("leader_id");
        Timestamp destroyed = rs.getTimestamp("destroyed");
        return new Association(
            AssociationId.fromTrusted(rs.getString("id")),
            UserId.fromTrusted(rs.getString("follower_id")),
            leader != null ? UserId.fromTrusted(leader) : null,
            MovementId.fromTrusted(rs.getString("movement_id")),
            rs.getTimestamp("created_at").toInstant(),
            destroyed != null ? destroyed.toInstant() : null
        );
    };

    public JdbcAssociationRepository(JdbcTemplate jdbc, NamedParameterJdbcTemplate named) {
        this.jdbc = jdbc;
        this.named = named;
    }

    @Override
    public void save(Association association) {
        jdbc.update("""
            INSERT INTO movement_user_association (id, follower_id, leader_id, movement_id, created_at, destroyed)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            association.id().value(),
            association.followerId().value(),
            association.leader().map(UserId::value).orElse(null),
            association.movementId().value(),
            Timestamp.from(association.createdAt()),
            association.destroyed() != null ? Timestamp.from(association.destroyed()) : null
        );
    }

    @Override
    public Optional<Association> findActive(UserId followerId, MovementId movementId) {
        return jdbc.query("""
            SELECT id, follower_id, leader_id, movement_id, created_at, destroyed
            FROM movement_user_association
            WHERE follower_id = ? AND movement_id = ? AND destroyed IS NULL
            """,
            ROW_MAPPER,
            followerId.value(),
            movementId.value()
        ).stream().findFirst();
    }

    @Override
    public boolean markDestroyed(AssociationId id, Instant destroyedAt) {
        int updated = jdbc.update(
            "UPDATE movement_user_association SET destroyed = ? WHERE id = ? AND destroyed IS NULL",
            Timestamp.from(destroyedAt),
            id.value()
        );
        return updated == 1;
    }

    @Override
    public List<UserId> findActiveFollowerIds(MovementId movementId) {
        return jdbc.queryForList("""
            SELECT follower_id
            FROM movement_user_association
            WHERE movement_id = ? AND destroyed IS NULL
            ORDER BY follower_id
            """,
            UUID.class,
            movementId.value()
        ).stream().map(UserId::of).toList();
    }

    @Override
    public long countActiveWithExistingMovement(UserId followerId) {
        // movements are deleted without cascading, so the join drops orphans
        Long count = jdbc.queryForObject("""
            SELECT COUNT(*)
            FROM movement_user_association a
            JOIN movements m ON a.movement_id = m.id
            WHERE a.follower_id = ? AND a.destroyed IS NULL
            """,
            Long.class,
            followerId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public long countActiveReferencing(Collection<MovementId> movementIds) {
        if (movementIds.isEmpty()) {
            return 0;
        }
        Long count = named.queryForObject(
            "SELECT COUNT(*) FROM movement_user_association WHERE destroyed IS NULL AND movement_id IN (:ids)",
            new MapSqlParameterSource("ids", movementIds.stream().map(MovementId::value).toList()),
            Long.class
        );
        return count != null ? count : 0;
    }

    @Override
    public long count(AssociationFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        Long count = named.queryForObject(
            "SELECT COUNT(*) FROM movement_user_association" + where(filter, params),
            params,
            Long.class
        );
        return count != null ? count : 0;
    }

    @Override
    public List<AssociationId> findIds(AssociationFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        return named.queryForList(
            "SELECT id FROM movement_user_association" + where(filter, params) + " ORDER BY id",
            params,
            UUID.class
        ).stream().map(AssociationId::of).toList();
    }

    @Override
    public int deleteByIds(Collection<AssociationId> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return named.update(
            "DELETE FROM movement_user_association WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", ids.stream().map(AssociationId::value).toList())
        );
    }

    private static String where(AssociationFilter filter, MapSqlParameterSource params) {
        if (filter == null || filter.isUnrestricted()) {
            return "";
        }
        List<String> conditions = new ArrayList<>();
        if (filter.followerId() != null) {
            conditions.add("follower_id = :followerId");
            params.addValue("followerId", filter.followerId().value());
        }
        if (filter.leaderId() != null) {
            conditions.add("leader_id = :leaderId");
            params.addValue("leaderId", filter.leaderId().value());
        }
        if (filter.movementId() != null) {
            conditions.add("movement_id = :movementId");
            params.addValue("movementId", filter.movementId().value());
        }
        if (filter.activeOnly()) {
            conditions.add("destroyed IS NULL");
        }
        return " WHERE " + String.join(" AND ", conditions);
    }
}
