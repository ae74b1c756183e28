package com.ryuqq.lifecycle.application.authorization;

/**
 * 외부 인증 계층이 검증한 호출자.
 *
 * <p>코어는 토큰이나 세션을 다루지 않으며, 이미 검증된 ID와 역할만 전달받습니다.</p>
 *
 * @param userId 사용자 ID
 * @param role 역할
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Caller(String userId, CallerRole role) {

    private static final Caller SYSTEM = new Caller("system", CallerRole.SYSTEM);

    public Caller {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    /**
     * 내부 호출자.
     *
     * @return SYSTEM 역할의 호출자
     */
    public static Caller system() {
        return SYSTEM;
    }

    public boolean isSystem() {
        return role == CallerRole.SYSTEM;
    }
}
