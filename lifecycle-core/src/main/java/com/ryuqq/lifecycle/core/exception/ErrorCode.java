package com.ryuqq.lifecycle.core.exception;

/**
 * 외부 API 계층에 전달되는 안정적인 오류 코드.
 *
 * <p>코드 값은 한 번 공개되면 변경하지 않습니다. API 계층은 이 코드를
 * HTTP 상태 및 응답 본문에 매핑합니다.</p>
 *
 * <p><strong>코드 목록:</strong></p>
 * <ul>
 *   <li>LC-400: 잘못된 입력 (알 수 없는 상태 값, 미래 시각, 잘못된 JSON 등)</li>
 *   <li>LC-403: 권한 없음 (인가 훅이 거부)</li>
 *   <li>LC-404: 소유 엔티티 없음</li>
 *   <li>LC-409-T: 허용되지 않은 상태 전이</li>
 *   <li>LC-409-C: 동시 전이 경쟁에서 패배</li>
 *   <li>LC-500-O: 상태 이력 시각 역행</li>
 *   <li>LC-500-M: 저장 데이터 무결성 위반</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    VALIDATION("LC-400"),
    NOT_PERMITTED("LC-403"),
    OWNER_NOT_FOUND("LC-404"),
    INVALID_TRANSITION("LC-409-T"),
    CONCURRENT_TRANSITION("LC-409-C"),
    ORDERING("LC-500-O"),
    MAPPING("LC-500-M");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 오류 코드 문자열 조회.
     *
     * @return 오류 코드 (예: LC-409-T)
     */
    public String code() {
        return code;
    }

    /**
     * 클라이언트가 새로운 현재 상태로 재시도하면 성공할 수 있는 오류인지 확인.
     *
     * @return CONCURRENT_TRANSITION인 경우 true
     */
    public boolean isRetryableByCaller() {
        return this == CONCURRENT_TRANSITION;
    }
}
