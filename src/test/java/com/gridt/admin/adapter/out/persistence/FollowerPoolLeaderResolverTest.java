package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.AssociationRepository;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FollowerPoolLeaderResolverTest {

    @Mock
    private AssociationRepository associationRepository;

    private final MovementId movement = MovementId.random();
    private final UserId follower = UserId.random();

    @Test
    void shouldHaveNoLeaderForFirstFollower() {
        when(associationRepository.findActiveFollowerIds(movement)).thenReturn(List.of());
        FollowerPoolLeaderResolver resolver = new FollowerPoolLeaderResolver(associationRepository, new Random(1));

        assertEquals(Optional.empty(), resolver.resolveLeader(movement, follower));
    }

    @Test
    void shouldNeverPickTheFollowerThemselves() {
        when(associationRepository.findActiveFollowerIds(movement)).thenReturn(List.of(follower));
        FollowerPoolLeaderResolver resolver = new FollowerPoolLeaderResolver(associationRepository, new Random(1));

        assertTrue(resolver.resolveLeader(movement, follower).isEmpty());
    }

    @Test
    void shouldPickAmongOtherFollowers() {
        UserId first = UserId.random();
        UserId second = UserId.random();
        when(associationRepository.findActiveFollowerIds(movement)).thenReturn(List.of(first, follower, second));
        FollowerPoolLeaderResolver resolver = new FollowerPoolLeaderResolver(associationRepository, new Random(5));
        Set<UserId> picked = new HashSet<>();

        for (int i = 0; i < 50; i++) {
            picked.add(resolver.resolveLeader(movement, follower).orElseThrow());
        }

        assertEquals(Set.of(first, second), picked);
    }
}
