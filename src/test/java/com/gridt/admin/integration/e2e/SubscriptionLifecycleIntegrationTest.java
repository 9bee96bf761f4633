package com.gridt.admin.integration.e2e;

import com.gridt.admin.application.port.in.CountUseCase;
import com.gridt.admin.application.port.in.CreateMovementsUseCase;
import com.gridt.admin.application.port.in.DeleteManyUseCase;
import com.gridt.admin.application.port.in.RegisterUserUseCase;
import com.gridt.admin.application.port.in.SubscribeUseCase;
import com.gridt.admin.application.port.in.UnsubscribeUseCase;
import com.gridt.admin.domain.error.SubscriptionError;
import com.gridt.admin.domain.model.Association;
import com.gridt.admin.domain.model.AssociationFilter;
import com.gridt.admin.domain.model.EntityKind;
import com.gridt.admin.domain.model.MovementFilter;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.UserCredentials;
import com.gridt.admin.domain.model.UserId;
import com.gridt.admin.integration.base.PostgresTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Subscribe, unsubscribe and movement deletion against a real database.
 */
@SpringBootTest
@EnabledIf("isDockerAvailable")
@DisplayName("Subscription lifecycle")
class SubscriptionLifecycleIntegrationTest extends PostgresTestBase {

    @Autowired
    private RegisterUserUseCase registerUser;

    @Autowired
    private CreateMovementsUseCase createMovements;

    @Autowired
    private SubscribeUseCase subscribe;

    @Autowired
    private UnsubscribeUseCase unsubscribe;

    @Autowired
    private CountUseCase count;

    @Autowired
    private DeleteManyUseCase deleteMany;

    private UserId alice;
    private UserId bob;
    private List<MovementId> movements;

    @BeforeEach
    void setUpData() {
        alice = registerUser.register(new UserCredentials("alice", "alice@example.com", "password1"));
        bob = registerUser.register(new UserCredentials("bob", "bob@example.com", "password2"));
        movements = createMovements.createMovements(3, 10).written();
    }

    @Test
    @DisplayName("Subscribing twice keeps a single active association")
    void subscribeIsIdempotent() {
        // When
        Association first = subscribe.subscribe(alice, movements.get(0)).getOrThrow();
        Association second = subscribe.subscribe(alice, movements.get(0)).getOrThrow();

        // Then
        assertEquals(first.id(), second.id());
        assertEquals(1, count.count(EntityKind.ASSOCIATIONS, AssociationFilter.activeOf(alice)));
    }

    @Test
    @DisplayName("Second follower is led by the first")
    void secondFollowerGetsLeader() {
        Association first = subscribe.subscribe(alice, movements.get(0)).getOrThrow();
        Association second = subscribe.subscribe(bob, movements.get(0)).getOrThrow();

        assertTrue(first.leader().isEmpty());
        assertEquals(alice, second.leader().orElseThrow());
    }

    @Test
    @DisplayName("Unknown follower or movement writes nothing")
    void referenceErrorsWriteNothing() {
        var missingUser = subscribe.subscribe(UserId.random(), movements.get(0));
        var missingMovement = subscribe.subscribe(alice, MovementId.random());

        assertInstanceOf(SubscriptionError.FollowerNotFound.class, missingUser.errorOrNull());
        assertInstanceOf(SubscriptionError.MovementNotFound.class, missingMovement.errorOrNull());
        assertEquals(0, count.count(EntityKind.ASSOCIATIONS, AssociationFilter.any()));
    }

    @Test
    @DisplayName("Re-subscribing after unsubscribe inserts a new row")
    void resubscribeAfterUnsubscribe() {
        // Given
        Association original = subscribe.subscribe(alice, movements.get(0)).getOrThrow();

        // When
        Association destroyed = unsubscribe.unsubscribe(alice, movements.get(0)).getOrThrow();
        Association renewed = subscribe.subscribe(alice, movements.get(0)).getOrThrow();

        // Then
        assertEquals(original.id(), destroyed.id());
        assertNotNull(destroyed.destroyed());
        assertNotEquals(original.id(), renewed.id());
        assertEquals(2, count.count(EntityKind.ASSOCIATIONS, new AssociationFilter(alice, null, null, false)));
        assertEquals(1, count.countActiveSubscriptions(alice));
        assertInstanceOf(SubscriptionError.NotSubscribed.class,
            unsubscribe.unsubscribe(bob, movements.get(0)).errorOrNull());
    }

    @Test
    @DisplayName("Deleting movements reports and excludes orphaned subscriptions")
    void deletedMovementsAreExcludedFromCounts() {
        // Given
        subscribe.subscribeAll(alice, movements);
        assertEquals(3, count.countActiveSubscriptions(alice));

        // When
        var deletion = deleteMany.deleteMovements(MovementFilter.any(), 2, true);

        // Then
        assertEquals(2, deletion.outcome().deleted());
        assertEquals(2, deletion.orphanedAssociations());
        assertEquals(1, count.count(EntityKind.MOVEMENTS, null));
        assertEquals(1, count.countActiveSubscriptions(alice));
    }
}
