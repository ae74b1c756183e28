package com.ryuqq.lifecycle.core.statemachine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransitionTable 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TransitionTableTest {

    @Test
    void creationRules_PerKind() {
        assertFalse(EntityKind.LESSON.table().requiresInitialStatus());
        assertEquals(Optional.empty(), EntityKind.LESSON.table().defaultInitialStatus());

        assertTrue(EntityKind.LESSON_PLAN.table().requiresInitialStatus());
        assertEquals(Optional.of(LessonPlanStatus.DRAFT), EntityKind.LESSON_PLAN.table().defaultInitialStatus());
        assertEquals(Optional.of(MilestoneStatus.CREATED), EntityKind.MILESTONE.table().defaultInitialStatus());
        assertEquals(Optional.of(GoalStatus.CREATED), EntityKind.GOAL.table().defaultInitialStatus());
    }

    @Test
    void fallbackStatus_PerKind() {
        assertEquals(LessonStatus.REQUESTED, EntityKind.LESSON.table().fallbackStatus());
        assertEquals(LessonPlanStatus.DRAFT, EntityKind.LESSON_PLAN.table().fallbackStatus());
        assertEquals(MilestoneStatus.CREATED, EntityKind.MILESTONE.table().fallbackStatus());
        assertEquals(GoalStatus.CREATED, EntityKind.GOAL.table().fallbackStatus());
    }

    @Test
    void actionsFrom_KeepsDeclarationOrder() {
        List<String> actions = List.copyOf(
            EntityKind.LESSON_PLAN.table().actionsFrom(LessonPlanStatus.PENDING_APPROVAL).keySet());

        assertEquals(List.of("APPROVE", "REJECT", "REVISE", "CANCEL_PLAN"), actions);
    }

    @Test
    void actionFor_ExistingEdge_ReturnsActionName() {
        assertEquals(Optional.of("VOID"),
            EntityKind.LESSON.table().actionFor(LessonStatus.COMPLETED, LessonStatus.VOIDED));
        assertEquals(Optional.empty(),
            EntityKind.LESSON.table().actionFor(LessonStatus.VOIDED, LessonStatus.COMPLETED));
    }

    @Test
    void builder_ExplicitSelfLoop_IsAllowed() {
        // Given
        TransitionTable<GoalStatus> table = TransitionTable.builder("CUSTOM", GoalStatus.class)
            .edge(GoalStatus.IN_PROGRESS, "TOUCH", GoalStatus.IN_PROGRESS)
            .initial(GoalStatus.CREATED)
            .fallback(GoalStatus.CREATED)
            .build();

        // When & Then
        assertTrue(table.allows(GoalStatus.IN_PROGRESS, GoalStatus.IN_PROGRESS));
        assertFalse(table.allows(GoalStatus.CREATED, GoalStatus.CREATED));
    }

    @Test
    void builder_DuplicateActionFromSameStatus_Throws() {
        TransitionTable.Builder<GoalStatus> builder = TransitionTable.builder("CUSTOM", GoalStatus.class)
            .edge(GoalStatus.CREATED, "START", GoalStatus.IN_PROGRESS);

        assertThrows(IllegalArgumentException.class,
            () -> builder.edge(GoalStatus.CREATED, "START", GoalStatus.ABANDONED));
    }

    @Test
    void builder_DefaultInitialOutsideInitialSet_Throws() {
        TransitionTable.Builder<GoalStatus> builder = TransitionTable.builder("CUSTOM", GoalStatus.class)
            .initial(GoalStatus.CREATED)
            .defaultInitial(GoalStatus.IN_PROGRESS)
            .fallback(GoalStatus.CREATED);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void builder_MissingFallback_Throws() {
        TransitionTable.Builder<GoalStatus> builder = TransitionTable.builder("CUSTOM", GoalStatus.class)
            .initial(GoalStatus.CREATED);

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
