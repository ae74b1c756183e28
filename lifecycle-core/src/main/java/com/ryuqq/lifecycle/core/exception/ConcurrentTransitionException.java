package com.ryuqq.lifecycle.core.exception;

/**
 * 동일 소유자에 대한 동시 전이 경쟁에서 패배.
 *
 * <p>저장소의 현재 상태 포인터가 요청이 읽은 값과 달라진 경우 발생합니다.
 * 호출자는 최신 현재 상태를 다시 읽고 재시도해야 하며, 코어는 자동 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConcurrentTransitionException extends LifecycleException {

    private final String ownerId;
    private final String expectedCurrentStatusId;
    private final String actualCurrentStatusId;

    public ConcurrentTransitionException(String ownerId, String expectedCurrentStatusId, String actualCurrentStatusId) {
        super(ErrorCode.CONCURRENT_TRANSITION, String.format(
            "Concurrent transition on owner %s: expected current status %s but was %s",
            ownerId, expectedCurrentStatusId, actualCurrentStatusId));
        this.ownerId = ownerId;
        this.expectedCurrentStatusId = expectedCurrentStatusId;
        this.actualCurrentStatusId = actualCurrentStatusId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getExpectedCurrentStatusId() {
        return expectedCurrentStatusId;
    }

    public String getActualCurrentStatusId() {
        return actualCurrentStatusId;
    }
}
