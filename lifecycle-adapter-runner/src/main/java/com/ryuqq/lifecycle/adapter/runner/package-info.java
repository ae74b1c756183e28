/**
 * 상태 생명주기 실행 어댑터.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.StatusTransitionRunner}: LifecycleService 구현 (유일한 쓰기 경로)</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.PointerReconciler}: 포인터 어긋남 주기 복구</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.RunnerConfig}, {@link com.ryuqq.lifecycle.adapter.runner.ReconcilerConfig}: 불변 설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.runner;
