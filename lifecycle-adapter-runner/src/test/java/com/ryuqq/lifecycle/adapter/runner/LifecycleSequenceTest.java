package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryStatusStore;
import com.ryuqq.lifecycle.application.authorization.AllowAllTransitionAuthorizer;
import com.ryuqq.lifecycle.application.authorization.Caller;
import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import com.ryuqq.lifecycle.core.statemachine.TransitionValidator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 허용된 전이만으로 이루어진 임의 시퀀스에 대한 불변식 테스트.
 *
 * <p>매 전이 후 다음을 확인합니다:</p>
 * <ul>
 *   <li>현재 상태 = 이력의 마지막 레코드 상태</li>
 *   <li>저장된 포인터 = 이력의 마지막 레코드 ID</li>
 *   <li>이력 길이 = 성공한 전이 수 + 첫 상태</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LifecycleSequenceTest {

    private static final int SEQUENCES_PER_KIND = 25;
    private static final int MAX_STEPS = 12;

    @Test
    void 임의의_허용_전이_시퀀스에서_현재_상태는_항상_마지막_레코드() {
        Random random = new Random(20240301L);
        for (EntityKind<?> kind : EntityKind.values()) {
            for (int i = 0; i < SEQUENCES_PER_KIND; i++) {
                runSequence(kind, OwnerId.of(kind.name().toLowerCase(Locale.ROOT) + "-" + i), random);
            }
        }
    }

    private <S extends Enum<S> & LifecycleStatus> void runSequence(EntityKind<S> kind, OwnerId ownerId, Random random) {
        InMemoryStatusStore store = new InMemoryStatusStore();
        StatusTransitionRunner runner = new StatusTransitionRunner(
            store, AllowAllTransitionAuthorizer.INSTANCE, new TickingClock(Instant.parse("2024-03-01T09:00:00Z")),
            new RunnerConfig());

        LifecycleEntity<S> entity = runner.register(kind, ownerId, "parent-1", null, null, Caller.system());
        int expectedSize = entity.getStatuses().size();

        for (int step = 0; step < MAX_STEPS; step++) {
            S current = entity.currentStatus().orElse(null);
            Set<S> next = TransitionValidator.nextStatuses(kind, current);
            if (next.isEmpty()) {
                assertThat(TransitionValidator.isTerminal(kind, current)).isTrue();
                break;
            }
            List<S> candidates = new ArrayList<>(next);
            S target = candidates.get(random.nextInt(candidates.size()));

            StatusRecord<S> record = runner.transition(kind, ownerId, target, null, Caller.system());
            expectedSize++;

            entity = runner.load(kind, ownerId);
            PersistedOwnerRow row = store.findOwner(kind, ownerId).orElseThrow();
            List<StatusRecord<S>> history = entity.getStatuses().toList();

            assertThat(entity.currentStatus()).contains(target);
            assertThat(history).hasSize(expectedSize);
            assertThat(history.get(history.size() - 1)).isEqualTo(record);
            assertThat(row.currentStatusId()).isEqualTo(record.getId().getValue());
            assertThat(entity.isPointerDivergent()).isFalse();
        }
    }
}
