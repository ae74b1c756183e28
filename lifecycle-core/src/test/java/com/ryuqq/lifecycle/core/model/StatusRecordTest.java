package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.GoalStatus;
import com.ryuqq.lifecycle.core.statemachine.LessonStatus;
import com.ryuqq.lifecycle.core.statemachine.MilestoneStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusRecord 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StatusRecordTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final OwnerId OWNER = OwnerId.of("lesson-1");

    @Test
    void create_AssignsServerIdAndTimestamp() {
        // When
        StatusRecord<LessonStatus> record =
            StatusRecord.create(EntityKind.LESSON, OWNER, LessonStatus.REQUESTED, null, CLOCK);

        // Then
        assertNotNull(record.getId());
        assertEquals(NOW, record.getCreatedAt());
        assertEquals(LessonStatus.REQUESTED, record.getStatus());
        assertEquals(StatusContext.empty(), record.getContext());
        assertSame(EntityKind.LESSON, record.getKind());
    }

    @Test
    void of_StoredTimestampAheadOfServerClock_Accepted() {
        // Given: 시계가 앞선 노드가 기록한 레코드
        Instant written = NOW.plusMillis(5);

        // When
        StatusRecord<LessonStatus> record = StatusRecord.of(
            StatusRecordId.of("s-1"), EntityKind.LESSON, OWNER, LessonStatus.REQUESTED,
            StatusContext.empty(), written, CLOCK);

        // Then
        assertEquals(written, record.getCreatedAt());
    }

    @Test
    void create_ClockStepsBackDuringCreation_ThrowsValidationException() {
        // Given: 시각 부여 직후 시계가 되돌아감
        Deque<Instant> instants = new ArrayDeque<>(List.of(NOW.plusSeconds(1), NOW));
        Clock steppingBack = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return instants.size() > 1 ? instants.poll() : instants.peek();
            }
        };

        // When & Then
        assertThrows(ValidationException.class,
            () -> StatusRecord.create(EntityKind.LESSON, OWNER, LessonStatus.REQUESTED, null, steppingBack));
    }

    @Test
    void of_TimestampEqualToNow_Accepted() {
        assertDoesNotThrow(() -> StatusRecord.of(
            StatusRecordId.of("s-1"), EntityKind.LESSON, OWNER, LessonStatus.REQUESTED,
            StatusContext.empty(), NOW, CLOCK));
    }

    @Test
    void of_MissingRequiredField_ThrowsValidationException() {
        assertThrows(ValidationException.class, () -> StatusRecord.of(
            null, EntityKind.LESSON, OWNER, LessonStatus.REQUESTED, null, NOW, CLOCK));
        assertThrows(ValidationException.class, () -> StatusRecord.of(
            StatusRecordId.of("s-1"), EntityKind.LESSON, null, LessonStatus.REQUESTED, null, NOW, CLOCK));
        assertThrows(ValidationException.class, () -> StatusRecord.<LessonStatus>of(
            StatusRecordId.of("s-1"), EntityKind.LESSON, OWNER, null, null, NOW, CLOCK));
        assertThrows(ValidationException.class, () -> StatusRecord.of(
            StatusRecordId.of("s-1"), EntityKind.LESSON, OWNER, LessonStatus.REQUESTED, null, null, CLOCK));
    }

    @Test
    void of_StatusOfAnotherKind_ThrowsValidationException() {
        // Given: raw 타입으로 컴파일 타임 검사를 우회
        EntityKind rawKind = EntityKind.GOAL;

        // When & Then
        assertThrows(ValidationException.class, () -> StatusRecord.of(
            StatusRecordId.of("s-1"), rawKind, OWNER, MilestoneStatus.CREATED, null, NOW, CLOCK));
    }

    @Test
    void equals_AllFieldsEqual_ReturnsTrue() {
        // Given
        StatusRecord<GoalStatus> first = StatusRecord.of(StatusRecordId.of("s-1"), EntityKind.GOAL,
            OWNER, GoalStatus.CREATED, StatusContext.parse("{\"x\":1}"), NOW, CLOCK);
        StatusRecord<GoalStatus> second = StatusRecord.of(StatusRecordId.of("s-1"), EntityKind.GOAL,
            OWNER, GoalStatus.CREATED, StatusContext.parse("{\"x\":1}"), NOW, CLOCK);
        StatusRecord<GoalStatus> differentContext = StatusRecord.of(StatusRecordId.of("s-1"), EntityKind.GOAL,
            OWNER, GoalStatus.CREATED, StatusContext.parse("{\"x\":2}"), NOW, CLOCK);

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, differentContext);
    }
}
