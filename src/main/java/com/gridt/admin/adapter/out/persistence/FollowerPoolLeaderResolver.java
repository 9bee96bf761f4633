package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.application.port.out.LeaderResolver;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Picks a leader uniformly among the movement's other active followers.
 * The first follower of a movement gets no leader.
 */
@Component
public class FollowerPoolLeaderResolver implements LeaderResolver {

    private final AssociationRepository associationRepository;
    private final Random random;

    public FollowerPoolLeaderResolver(AssociationRepository associationRepository, Random random) {
        this.associationRepository = associationRepository;
        this.random = random;
    }

    @Override
    public Optional<UserId> resolveLeader(MovementId movementId, UserId followerId) {
        List<UserId> candidates = associationRepository.findActiveFollowerIds(movementId).stream()
            .filter(candidate -> !candidate.equals(followerId))
            .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }
}
