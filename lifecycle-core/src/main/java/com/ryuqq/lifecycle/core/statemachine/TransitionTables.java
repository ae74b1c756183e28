package com.ryuqq.lifecycle.core.statemachine;

/**
 * 엔티티 종류별 전이 테이블 정의.
 *
 * <p>테이블에 없는 전이는 모두 거부되며, 어떤 테이블도 자기 자신으로의 전이를 포함하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TransitionTables {

    static final TransitionTable<LessonStatus> LESSON =
        TransitionTable.builder("LESSON", LessonStatus.class)
            .edge(LessonStatus.REQUESTED, "ACCEPT", LessonStatus.ACCEPTED)
            .edge(LessonStatus.REQUESTED, "REJECT", LessonStatus.REJECTED)
            .edge(LessonStatus.ACCEPTED, "COMPLETE", LessonStatus.COMPLETED)
            .edge(LessonStatus.ACCEPTED, "VOID", LessonStatus.VOIDED)
            .edge(LessonStatus.REJECTED, "VOID", LessonStatus.VOIDED)
            .edge(LessonStatus.COMPLETED, "VOID", LessonStatus.VOIDED)
            // 레슨은 상태 없이 생성 가능 (기본 첫 상태 없음)
            .initial(LessonStatus.REQUESTED, LessonStatus.ACCEPTED)
            .fallback(LessonStatus.REQUESTED)
            .build();

    static final TransitionTable<LessonPlanStatus> LESSON_PLAN =
        TransitionTable.builder("LESSON_PLAN", LessonPlanStatus.class)
            .edge(LessonPlanStatus.DRAFT, "SUBMIT_FOR_APPROVAL", LessonPlanStatus.PENDING_APPROVAL)
            .edge(LessonPlanStatus.DRAFT, "CANCEL_PLAN", LessonPlanStatus.CANCELLED)
            .edge(LessonPlanStatus.PENDING_APPROVAL, "APPROVE", LessonPlanStatus.ACTIVE)
            .edge(LessonPlanStatus.PENDING_APPROVAL, "REJECT", LessonPlanStatus.REJECTED)
            .edge(LessonPlanStatus.PENDING_APPROVAL, "REVISE", LessonPlanStatus.DRAFT)
            .edge(LessonPlanStatus.PENDING_APPROVAL, "CANCEL_PLAN", LessonPlanStatus.CANCELLED)
            .edge(LessonPlanStatus.ACTIVE, "COMPLETE_PLAN", LessonPlanStatus.COMPLETED)
            .edge(LessonPlanStatus.ACTIVE, "CANCEL_PLAN", LessonPlanStatus.CANCELLED)
            .edge(LessonPlanStatus.REJECTED, "REVISE", LessonPlanStatus.DRAFT)
            .edge(LessonPlanStatus.REJECTED, "CANCEL_PLAN", LessonPlanStatus.CANCELLED)
            .initial(LessonPlanStatus.DRAFT)
            .defaultInitial(LessonPlanStatus.DRAFT)
            .fallback(LessonPlanStatus.DRAFT)
            .build();

    static final TransitionTable<MilestoneStatus> MILESTONE =
        TransitionTable.builder("MILESTONE", MilestoneStatus.class)
            .edge(MilestoneStatus.CREATED, "START_PROGRESS", MilestoneStatus.IN_PROGRESS)
            .edge(MilestoneStatus.CREATED, "CANCEL_MILESTONE", MilestoneStatus.CANCELLED)
            .edge(MilestoneStatus.IN_PROGRESS, "MARK_COMPLETED", MilestoneStatus.COMPLETED)
            .edge(MilestoneStatus.IN_PROGRESS, "CANCEL_MILESTONE", MilestoneStatus.CANCELLED)
            .edge(MilestoneStatus.IN_PROGRESS, "RESET_TO_CREATED", MilestoneStatus.CREATED)
            .edge(MilestoneStatus.COMPLETED, "CANCEL_MILESTONE", MilestoneStatus.CANCELLED)
            .initial(MilestoneStatus.CREATED)
            .defaultInitial(MilestoneStatus.CREATED)
            .fallback(MilestoneStatus.CREATED)
            .build();

    static final TransitionTable<GoalStatus> GOAL =
        TransitionTable.builder("GOAL", GoalStatus.class)
            .edge(GoalStatus.CREATED, "START", GoalStatus.IN_PROGRESS)
            .edge(GoalStatus.CREATED, "ABANDON", GoalStatus.ABANDONED)
            .edge(GoalStatus.IN_PROGRESS, "COMPLETE", GoalStatus.ACHIEVED)
            .edge(GoalStatus.IN_PROGRESS, "ABANDON", GoalStatus.ABANDONED)
            .edge(GoalStatus.ACHIEVED, "ABANDON", GoalStatus.ABANDONED)
            .initial(GoalStatus.CREATED)
            .defaultInitial(GoalStatus.CREATED)
            .fallback(GoalStatus.CREATED)
            .build();

    private TransitionTables() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
