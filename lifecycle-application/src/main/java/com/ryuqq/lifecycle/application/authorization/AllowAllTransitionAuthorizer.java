package com.ryuqq.lifecycle.application.authorization;

import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

/**
 * 모든 전이를 허용하는 기본 인가 훅.
 *
 * <p>인가가 상위 계층(라우터 미들웨어 등)에서 이미 끝난 경우에 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AllowAllTransitionAuthorizer implements TransitionAuthorizer {

    public static final AllowAllTransitionAuthorizer INSTANCE = new AllowAllTransitionAuthorizer();

    private AllowAllTransitionAuthorizer() {
    }

    @Override
    public boolean permits(Caller caller, EntityKind<?> kind, OwnerId ownerId, LifecycleStatus from, LifecycleStatus to) {
        return true;
    }
}
