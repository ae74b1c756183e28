package com.ryuqq.lifecycle.application.authorization;

import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

/**
 * 상태 전이 인가 훅.
 *
 * <p>전이 테이블 검증보다 먼저 호출됩니다. false를 반환하면 전이는
 * {@link com.ryuqq.lifecycle.core.exception.TransitionNotPermittedException}으로 거부되고
 * 아무것도 저장되지 않습니다. 등록도 같은 훅을 거치며, 이때 from은 null입니다.</p>
 *
 * <p><strong>구현 예:</strong> 레슨 ACCEPT는 교사만, 레슨 플랜 APPROVE는 학생만 허용.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionAuthorizer {

    /**
     * 전이 허용 여부.
     *
     * @param caller 검증된 호출자
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param from 현재 상태 (등록이거나 이력이 비어 있으면 null)
     * @param to 요청 상태 (상태 없이 등록하면 null)
     * @return 허용하면 true
     */
    boolean permits(Caller caller, EntityKind<?> kind, OwnerId ownerId, LifecycleStatus from, LifecycleStatus to);
}
