package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionException;
import com.ryuqq.lifecycle.core.exception.OwnerNotFoundException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.mapper.PersistedStatusRow;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.spi.StatusStore;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ryuqq.lifecycle.testkit.contract.StatusStoreFixtures.ownerWithInitialStatus;
import static com.ryuqq.lifecycle.testkit.contract.StatusStoreFixtures.ownerWithoutStatus;
import static com.ryuqq.lifecycle.testkit.contract.StatusStoreFixtures.statusRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract contract tests every {@link StatusStore} adapter must pass.
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Owner insertion, duplicate detection and retrieval</li>
 *   <li>Atomic append with pointer compare-and-swap</li>
 *   <li>Pointer repair and divergence scanning</li>
 *   <li>Cascading deletion</li>
 *   <li>Concurrent appends on one owner: exactly one winner</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class JdbcStatusStoreContractTest extends AbstractStatusStoreContractTest {
 *     {@literal @}Override
 *     protected StatusStore createStore() {
 *         return new JdbcStatusStore(dataSource);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractStatusStoreContractTest {

    protected StatusStore store;

    /**
     * Creates a fresh, empty store for each test.
     *
     * @return the store under test
     */
    protected abstract StatusStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ===== 1. Insert / Find =====

    @Test
    void insertOwner_WithInitialStatus_IsFoundWithResolvedCurrentStatus() {
        // Given
        PersistedStatusRow initial = statusRow("s-1", "plan-1", "DRAFT", 0);
        store.insertOwner(ownerWithInitialStatus(EntityKind.LESSON_PLAN, "plan-1", initial));

        // When
        PersistedOwnerRow found = store.findOwner(EntityKind.LESSON_PLAN, OwnerId.of("plan-1")).orElseThrow();

        // Then
        assertThat(found.kind()).isEqualTo("LESSON_PLAN");
        assertThat(found.parentId()).isEqualTo("parent-plan-1");
        assertThat(found.currentStatusId()).isEqualTo("s-1");
        assertThat(found.currentStatus()).isEqualTo(initial);
        assertThat(found.statuses()).containsExactly(initial);
    }

    @Test
    void insertOwner_WithoutStatus_HasNullPointer() {
        // Given
        store.insertOwner(ownerWithoutStatus(EntityKind.LESSON, "lesson-1"));

        // When
        PersistedOwnerRow found = store.findOwner(EntityKind.LESSON, OwnerId.of("lesson-1")).orElseThrow();

        // Then
        assertThat(found.currentStatusId()).isNull();
        assertThat(found.currentStatus()).isNull();
        assertThat(found.statuses()).isEmpty();
    }

    @Test
    void insertOwner_DuplicateId_ThrowsValidationException() {
        // Given
        store.insertOwner(ownerWithoutStatus(EntityKind.LESSON, "lesson-1"));

        // When & Then
        assertThatThrownBy(() -> store.insertOwner(ownerWithoutStatus(EntityKind.LESSON, "lesson-1")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void insertOwner_SameIdDifferentKinds_AreIndependent() {
        // Given
        store.insertOwner(ownerWithoutStatus(EntityKind.LESSON, "shared-1"));
        store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, "shared-1",
            statusRow("g-1", "shared-1", "CREATED", 0)));

        // When & Then
        assertThat(store.findOwner(EntityKind.LESSON, OwnerId.of("shared-1")).orElseThrow().statuses()).isEmpty();
        assertThat(store.findOwner(EntityKind.GOAL, OwnerId.of("shared-1")).orElseThrow().statuses()).hasSize(1);
        assertThat(store.findOwner(EntityKind.MILESTONE, OwnerId.of("shared-1"))).isEmpty();
    }

    @Test
    void findOwner_Unknown_ReturnsEmpty() {
        assertThat(store.findOwner(EntityKind.LESSON, OwnerId.of("missing"))).isEmpty();
    }

    // ===== 2. Append (compare-and-swap) =====

    @Test
    void appendStatus_MatchingPointer_AppendsAndMovesPointer() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.MILESTONE, "m-1",
            statusRow("s-1", "m-1", "CREATED", 0)));
        PersistedStatusRow next = statusRow("s-2", "m-1", "IN_PROGRESS", 10);

        // When
        store.appendStatus(EntityKind.MILESTONE, OwnerId.of("m-1"), next, "s-1");

        // Then
        PersistedOwnerRow found = store.findOwner(EntityKind.MILESTONE, OwnerId.of("m-1")).orElseThrow();
        assertThat(found.currentStatusId()).isEqualTo("s-2");
        assertThat(found.currentStatus()).isEqualTo(next);
        assertThat(found.statuses()).extracting(PersistedStatusRow::id).containsExactly("s-1", "s-2");
        assertThat(found.version()).isGreaterThan(0L);
        assertThat(found.updatedAt()).isEqualTo(next.createdAt());
    }

    @Test
    void appendStatus_FirstStatusOnEmptyHistory_ExpectsNullPointer() {
        // Given
        store.insertOwner(ownerWithoutStatus(EntityKind.LESSON, "lesson-1"));

        // When
        store.appendStatus(EntityKind.LESSON, OwnerId.of("lesson-1"),
            statusRow("s-1", "lesson-1", "REQUESTED", 5), null);

        // Then
        PersistedOwnerRow found = store.findOwner(EntityKind.LESSON, OwnerId.of("lesson-1")).orElseThrow();
        assertThat(found.currentStatusId()).isEqualTo("s-1");
    }

    @Test
    void appendStatus_StalePointer_ThrowsAndPersistsNothing() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, "goal-1",
            statusRow("s-1", "goal-1", "CREATED", 0)));
        store.appendStatus(EntityKind.GOAL, OwnerId.of("goal-1"),
            statusRow("s-2", "goal-1", "IN_PROGRESS", 10), "s-1");

        // When & Then
        assertThatThrownBy(() -> store.appendStatus(EntityKind.GOAL, OwnerId.of("goal-1"),
            statusRow("s-3", "goal-1", "ABANDONED", 20), "s-1"))
            .isInstanceOf(ConcurrentTransitionException.class);

        PersistedOwnerRow found = store.findOwner(EntityKind.GOAL, OwnerId.of("goal-1")).orElseThrow();
        assertThat(found.currentStatusId()).isEqualTo("s-2");
        assertThat(found.statuses()).extracting(PersistedStatusRow::id).containsExactly("s-1", "s-2");
    }

    @Test
    void appendStatus_UnknownOwner_ThrowsOwnerNotFound() {
        assertThatThrownBy(() -> store.appendStatus(EntityKind.LESSON, OwnerId.of("missing"),
            statusRow("s-1", "missing", "REQUESTED", 0), null))
            .isInstanceOf(OwnerNotFoundException.class);
    }

    // ===== 3. Repoint / Divergence =====

    @Test
    void repointCurrentStatus_ToOlderRecord_MakesOwnerDivergent() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.LESSON_PLAN, "plan-1",
            statusRow("s-1", "plan-1", "DRAFT", 0)));
        store.appendStatus(EntityKind.LESSON_PLAN, OwnerId.of("plan-1"),
            statusRow("s-2", "plan-1", "PENDING_APPROVAL", 10), "s-1");

        // When
        store.repointCurrentStatus(EntityKind.LESSON_PLAN, OwnerId.of("plan-1"), "s-2", "s-1");

        // Then
        List<PersistedOwnerRow> divergent = store.scanDivergent(EntityKind.LESSON_PLAN, 10);
        assertThat(divergent).extracting(PersistedOwnerRow::id).containsExactly("plan-1");
        assertThat(divergent.get(0).currentStatusId()).isEqualTo("s-1");
        assertThat(store.scanDivergent(EntityKind.GOAL, 10)).isEmpty();
    }

    @Test
    void repointCurrentStatus_BackToLatest_ClearsDivergence() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.LESSON_PLAN, "plan-1",
            statusRow("s-1", "plan-1", "DRAFT", 0)));
        store.appendStatus(EntityKind.LESSON_PLAN, OwnerId.of("plan-1"),
            statusRow("s-2", "plan-1", "PENDING_APPROVAL", 10), "s-1");
        store.repointCurrentStatus(EntityKind.LESSON_PLAN, OwnerId.of("plan-1"), "s-2", "s-1");

        // When
        store.repointCurrentStatus(EntityKind.LESSON_PLAN, OwnerId.of("plan-1"), "s-1", "s-2");

        // Then
        assertThat(store.scanDivergent(EntityKind.LESSON_PLAN, 10)).isEmpty();
    }

    @Test
    void repointCurrentStatus_StalePointer_ThrowsConcurrentTransition() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, "goal-1",
            statusRow("s-1", "goal-1", "CREATED", 0)));

        // When & Then
        assertThatThrownBy(() -> store.repointCurrentStatus(EntityKind.GOAL, OwnerId.of("goal-1"), "other", "s-1"))
            .isInstanceOf(ConcurrentTransitionException.class);
    }

    @Test
    void repointCurrentStatus_UnknownRecord_ThrowsIllegalArgument() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, "goal-1",
            statusRow("s-1", "goal-1", "CREATED", 0)));

        // When & Then
        assertThatThrownBy(() -> store.repointCurrentStatus(EntityKind.GOAL, OwnerId.of("goal-1"), "s-1", "nope"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scanDivergent_RespectsBatchSize() {
        // Given
        for (int i = 0; i < 3; i++) {
            String ownerId = "goal-" + i;
            store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, ownerId,
                statusRow(ownerId + "-s1", ownerId, "CREATED", 0)));
            store.appendStatus(EntityKind.GOAL, OwnerId.of(ownerId),
                statusRow(ownerId + "-s2", ownerId, "IN_PROGRESS", 10), ownerId + "-s1");
            store.repointCurrentStatus(EntityKind.GOAL, OwnerId.of(ownerId), ownerId + "-s2", ownerId + "-s1");
        }

        // When & Then
        assertThat(store.scanDivergent(EntityKind.GOAL, 2)).hasSize(2);
        assertThat(store.scanDivergent(EntityKind.GOAL, 10)).hasSize(3);
    }

    @Test
    void scanDivergent_NonPositiveBatchSize_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> store.scanDivergent(EntityKind.LESSON, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ===== 4. Delete =====

    @Test
    void deleteOwner_RemovesOwnerAndHistory() {
        // Given
        store.insertOwner(ownerWithInitialStatus(EntityKind.MILESTONE, "m-1",
            statusRow("s-1", "m-1", "CREATED", 0)));
        store.appendStatus(EntityKind.MILESTONE, OwnerId.of("m-1"),
            statusRow("s-2", "m-1", "IN_PROGRESS", 10), "s-1");

        // When
        boolean deleted = store.deleteOwner(EntityKind.MILESTONE, OwnerId.of("m-1"));

        // Then
        assertThat(deleted).isTrue();
        assertThat(store.findOwner(EntityKind.MILESTONE, OwnerId.of("m-1"))).isEmpty();
        assertThat(store.deleteOwner(EntityKind.MILESTONE, OwnerId.of("m-1"))).isFalse();

        // 같은 ID로 재생성하면 이전 이력이 남아 있지 않아야 함
        store.insertOwner(ownerWithoutStatus(EntityKind.MILESTONE, "m-1"));
        assertThat(store.findOwner(EntityKind.MILESTONE, OwnerId.of("m-1")).orElseThrow().statuses()).isEmpty();
    }

    // ===== 5. Concurrency =====

    @Test
    void appendStatus_ConcurrentWritersWithSamePointer_ExactlyOneWins() throws Exception {
        // Given
        int writers = 8;
        store.insertOwner(ownerWithInitialStatus(EntityKind.GOAL, "goal-1",
            statusRow("s-0", "goal-1", "CREATED", 0)));
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger losses = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 1; i <= writers; i++) {
                PersistedStatusRow row = statusRow("s-" + i, "goal-1", "IN_PROGRESS", i);
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.appendStatus(EntityKind.GOAL, OwnerId.of("goal-1"), row, "s-0");
                        wins.incrementAndGet();
                    } catch (ConcurrentTransitionException e) {
                        losses.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(wins.get()).isEqualTo(1);
        assertThat(losses.get()).isEqualTo(writers - 1);
        assertThat(store.findOwner(EntityKind.GOAL, OwnerId.of("goal-1")).orElseThrow().statuses()).hasSize(2);
    }
}
