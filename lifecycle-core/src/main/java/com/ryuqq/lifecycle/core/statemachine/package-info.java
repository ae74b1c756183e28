/**
 * 상태 머신 패키지.
 *
 * <p>엔티티 종류별 상태 enum과 허용 전이 테이블, 그리고 모든 쓰기가 통과하는
 * {@link com.ryuqq.lifecycle.core.statemachine.TransitionValidator}를 제공합니다.</p>
 *
 * <p><strong>엔티티 종류:</strong></p>
 * <ul>
 *   <li>LESSON: 상태 없이 생성 가능, 첫 상태는 REQUESTED 또는 ACCEPTED</li>
 *   <li>LESSON_PLAN: DRAFT로 생성</li>
 *   <li>MILESTONE: CREATED로 생성</li>
 *   <li>GOAL: CREATED로 생성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.statemachine;
