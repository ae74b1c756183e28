package com.ryuqq.lifecycle.core.exception;

/**
 * 요청한 소유 엔티티가 저장소에 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OwnerNotFoundException extends LifecycleException {

    public OwnerNotFoundException(String entityKind, String ownerId) {
        super(ErrorCode.OWNER_NOT_FOUND, String.format("%s with ID %s not found", entityKind, ownerId));
    }
}
