package com.ryuqq.lifecycle.application.lifecycle;

import com.ryuqq.lifecycle.application.authorization.Caller;
import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusContext;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

import java.util.Set;

/**
 * 상태 레코드와 현재 상태 포인터의 유일한 쓰기 경로.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Lesson lesson = (Lesson) service.register(EntityKind.LESSON, OwnerId.of("lesson-1"), "quote-1",
 *     LessonStatus.REQUESTED, StatusContext.empty(), student);
 *
 * StatusRecord&lt;LessonStatus&gt; accepted = service.transition(EntityKind.LESSON, lesson.getId(),
 *     LessonStatus.ACCEPTED, StatusContext.empty(), teacher);
 * </pre>
 *
 * <p><strong>전이 절차:</strong></p>
 * <ol>
 *   <li>소유 엔티티 조회 및 쓰기 경로 매핑</li>
 *   <li>인가 훅 호출</li>
 *   <li>전이 테이블 검증</li>
 *   <li>서버 ID/시각으로 레코드 생성, 이력 순서 검증</li>
 *   <li>레코드 저장과 포인터 교체를 원자적으로 수행 (compare-and-swap)</li>
 * </ol>
 *
 * <p>거부된 전이는 아무것도 저장하지 않습니다. 자동 재시도는 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LifecycleService {

    /**
     * 소유 엔티티 등록.
     *
     * @param kind 엔티티 종류
     * @param ownerId 새 엔티티 ID
     * @param parentId 상위 엔티티 ID
     * @param initialStatus 첫 상태 (null이면 종류별 기본값, 기본값이 없으면 상태 없이 생성)
     * @param context 첫 상태의 context (null 허용, 상태 없이 생성할 때는 비어 있어야 함)
     * @param caller 검증된 호출자
     * @param <S> 상태 enum 타입
     * @return 등록된 엔티티
     * @throws com.ryuqq.lifecycle.core.exception.InvalidTransitionException 첫 상태로 허용되지 않는 상태인 경우
     * @throws com.ryuqq.lifecycle.core.exception.ValidationException 같은 ID의 엔티티가 이미 있거나,
     *     상태 없이 생성하면서 context를 전달한 경우
     * @throws com.ryuqq.lifecycle.core.exception.TransitionNotPermittedException 인가 훅이 거부한 경우
     */
    <S extends Enum<S> & LifecycleStatus> LifecycleEntity<S> register(
        EntityKind<S> kind, OwnerId ownerId, String parentId, S initialStatus, StatusContext context, Caller caller);

    /**
     * 상태 전이.
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param requestedStatus 요청 상태
     * @param context 전이 context (null 허용)
     * @param caller 검증된 호출자
     * @param <S> 상태 enum 타입
     * @return 추가된 상태 레코드
     * @throws com.ryuqq.lifecycle.core.exception.OwnerNotFoundException 엔티티가 없는 경우
     * @throws com.ryuqq.lifecycle.core.exception.InvalidTransitionException 허용되지 않은 전이인 경우
     * @throws com.ryuqq.lifecycle.core.exception.ConcurrentTransitionException 동시 전이에 밀린 경우
     */
    <S extends Enum<S> & LifecycleStatus> StatusRecord<S> transition(
        EntityKind<S> kind, OwnerId ownerId, S requestedStatus, StatusContext context, Caller caller);

    /**
     * 타입 없는 요청으로 상태 전이.
     *
     * @param request 전이 요청
     * @return 추가된 상태 레코드
     * @throws com.ryuqq.lifecycle.core.exception.ValidationException 알 수 없는 종류/상태 또는 잘못된 context인 경우
     */
    StatusRecord<?> transition(TransitionRequest request);

    /**
     * 액션 이름으로 상태 전이 (예: ACCEPT, SUBMIT_FOR_APPROVAL).
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param action 액션 이름
     * @param context 전이 context (null 허용)
     * @param caller 검증된 호출자
     * @param <S> 상태 enum 타입
     * @return 추가된 상태 레코드
     * @throws com.ryuqq.lifecycle.core.exception.InvalidTransitionException 현재 상태에서 사용할 수 없는 액션인 경우
     */
    <S extends Enum<S> & LifecycleStatus> StatusRecord<S> apply(
        EntityKind<S> kind, OwnerId ownerId, String action, StatusContext context, Caller caller);

    /**
     * 엔티티 조회 (읽기 경로).
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param <S> 상태 enum 타입
     * @return 엔티티
     * @throws com.ryuqq.lifecycle.core.exception.OwnerNotFoundException 엔티티가 없는 경우
     * @throws com.ryuqq.lifecycle.core.exception.MappingException 저장 데이터가 불변식을 위반한 경우
     */
    <S extends Enum<S> & LifecycleStatus> LifecycleEntity<S> load(EntityKind<S> kind, OwnerId ownerId);

    /**
     * 현재 상태에서 요청 가능한 상태.
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param <S> 상태 enum 타입
     * @return 읽기 전용 집합
     */
    <S extends Enum<S> & LifecycleStatus> Set<S> availableTransitions(EntityKind<S> kind, OwnerId ownerId);

    /**
     * 엔티티와 상태 이력 전체 삭제.
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @return 삭제되었으면 true, 없었으면 false
     */
    boolean delete(EntityKind<?> kind, OwnerId ownerId);
}
