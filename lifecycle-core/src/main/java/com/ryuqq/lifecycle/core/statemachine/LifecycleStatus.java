package com.ryuqq.lifecycle.core.statemachine;

import java.util.Locale;

/**
 * 상태 이력을 가지는 엔티티 종류별 상태 열거형의 공통 계약.
 *
 * <p>각 엔티티 종류({@link EntityKind})는 이 인터페이스를 구현한 enum 하나를 가집니다.
 * 전이 규칙은 {@link TransitionTable}이 소유하며, 상태 enum은 값과 표시 이름만 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LifecycleStatus {

    /**
     * 저장소에 기록되는 상태 이름.
     *
     * @return enum 상수 이름 (예: PENDING_APPROVAL)
     */
    String name();

    /**
     * 화면 표시용 이름.
     *
     * <p>기본 구현은 단어별 첫 글자를 대문자로 바꿉니다 (PENDING_APPROVAL → "Pending Approval").</p>
     *
     * @return 표시 이름
     */
    default String displayLabel() {
        String[] words = name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder label = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }
}
