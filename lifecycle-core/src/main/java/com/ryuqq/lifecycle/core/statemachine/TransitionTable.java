package com.ryuqq.lifecycle.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 엔티티 종류 하나의 허용 전이 테이블.
 *
 * <p>(from, to) 간선마다 액션 이름을 가지며, 첫 상태로 허용되는 상태 집합,
 * 생성 시 기본 상태, 읽기 경로의 대체(fallback) 상태를 함께 보관합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>테이블에 명시되지 않은 (from, to) 쌍은 모두 거부</li>
 *   <li>자기 자신으로의 전이는 명시적으로 등록된 경우에만 허용</li>
 *   <li>같은 from에서 액션 이름은 유일</li>
 *   <li>생성 후 변경 불가</li>
 * </ul>
 *
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionTable<S extends Enum<S> & LifecycleStatus> {

    private final String entityKindName;
    private final Class<S> statusType;
    private final Map<S, Map<S, String>> edges;
    private final Set<S> initialStatuses;
    private final S defaultInitialStatus;
    private final S fallbackStatus;

    private TransitionTable(Builder<S> builder) {
        this.entityKindName = builder.entityKindName;
        this.statusType = builder.statusType;
        EnumMap<S, Map<S, String>> copy = new EnumMap<>(statusType);
        for (S status : statusType.getEnumConstants()) {
            Map<S, String> targets = builder.edges.get(status);
            copy.put(status, targets == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(targets)));
        }
        this.edges = Collections.unmodifiableMap(copy);
        this.initialStatuses = Collections.unmodifiableSet(EnumSet.copyOf(builder.initialStatuses));
        this.defaultInitialStatus = builder.defaultInitialStatus;
        this.fallbackStatus = builder.fallbackStatus;
    }

    /**
     * 테이블 빌더 생성.
     *
     * @param entityKindName 엔티티 종류 이름 (오류 메시지에 사용)
     * @param statusType 상태 enum 클래스
     * @param <S> 상태 enum 타입
     * @return 빌더
     */
    public static <S extends Enum<S> & LifecycleStatus> Builder<S> builder(String entityKindName, Class<S> statusType) {
        return new Builder<>(entityKindName, statusType);
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태, 이력이 비어 있으면 null
     * @param to 요청 상태
     * @return from이 null이면 첫 상태 허용 여부, 아니면 간선 존재 여부
     */
    public boolean allows(S from, S to) {
        if (to == null) {
            return false;
        }
        if (from == null) {
            return initialStatuses.contains(to);
        }
        return edges.get(from).containsKey(to);
    }

    /**
     * from에서 도달 가능한 상태 집합 (읽기 전용).
     *
     * @param from 현재 상태, null이면 첫 상태 집합
     * @return 다음 상태 집합
     */
    public Set<S> nextStatuses(S from) {
        if (from == null) {
            return initialStatuses;
        }
        Map<S, String> targets = edges.get(from);
        if (targets.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(statusType));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(targets.keySet()));
    }

    /**
     * from에서 사용 가능한 액션과 대상 상태 (선언 순서 유지).
     *
     * @param from 현재 상태
     * @return 액션 이름 → 대상 상태, from이 null이면 빈 맵
     */
    public Map<String, S> actionsFrom(S from) {
        if (from == null) {
            return Collections.emptyMap();
        }
        Map<String, S> actions = new LinkedHashMap<>();
        edges.get(from).forEach((to, action) -> actions.put(action, to));
        return Collections.unmodifiableMap(actions);
    }

    /**
     * 액션이 가리키는 대상 상태.
     *
     * @param from 현재 상태
     * @param action 액션 이름
     * @return 대상 상태, 사용할 수 없는 액션이면 empty
     */
    public Optional<S> targetOf(S from, String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actionsFrom(from).get(action));
    }

    /**
     * (from, to) 간선의 액션 이름.
     *
     * @param from 현재 상태
     * @param to 대상 상태
     * @return 액션 이름, 간선이 없으면 empty
     */
    public Optional<String> actionFor(S from, S to) {
        if (from == null || to == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(edges.get(from).get(to));
    }

    /**
     * 종료 상태 여부 (나가는 간선 없음).
     *
     * @param status 상태
     * @return 종료 상태이면 true
     */
    public boolean isTerminal(S status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return edges.get(status).isEmpty();
    }

    public String entityKindName() {
        return entityKindName;
    }

    public Class<S> statusType() {
        return statusType;
    }

    public Set<S> initialStatuses() {
        return initialStatuses;
    }

    /**
     * 생성 시 상태를 생략했을 때 사용하는 상태.
     *
     * @return 기본 첫 상태, 상태 없이 생성 가능한 종류이면 empty
     */
    public Optional<S> defaultInitialStatus() {
        return Optional.ofNullable(defaultInitialStatus);
    }

    /**
     * 생성 시 첫 상태 레코드가 반드시 필요한지.
     *
     * @return 기본 첫 상태가 정의되어 있으면 true
     */
    public boolean requiresInitialStatus() {
        return defaultInitialStatus != null;
    }

    /**
     * 읽기 경로에서 알 수 없는 저장 값을 대체할 상태.
     *
     * @return fallback 상태
     */
    public S fallbackStatus() {
        return fallbackStatus;
    }

    /**
     * {@link TransitionTable} 빌더.
     *
     * @param <S> 상태 enum 타입
     */
    public static final class Builder<S extends Enum<S> & LifecycleStatus> {

        private final String entityKindName;
        private final Class<S> statusType;
        private final Map<S, Map<S, String>> edges;
        private final Set<S> initialStatuses;
        private S defaultInitialStatus;
        private S fallbackStatus;

        private Builder(String entityKindName, Class<S> statusType) {
            if (entityKindName == null || entityKindName.isBlank()) {
                throw new IllegalArgumentException("entityKindName cannot be null or blank");
            }
            if (statusType == null) {
                throw new IllegalArgumentException("statusType cannot be null");
            }
            this.entityKindName = entityKindName;
            this.statusType = statusType;
            this.edges = new EnumMap<>(statusType);
            this.initialStatuses = EnumSet.noneOf(statusType);
        }

        /**
         * 간선 등록.
         *
         * @param from 출발 상태
         * @param action 액션 이름
         * @param to 도착 상태
         * @return this
         * @throws IllegalArgumentException 같은 from에 같은 액션 또는 같은 도착 상태가 이미 있는 경우
         */
        public Builder<S> edge(S from, String action, S to) {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Edge states cannot be null (from: " + from + ", to: " + to + ")");
            }
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("action cannot be null or blank");
            }
            Map<S, String> targets = edges.computeIfAbsent(from, key -> new EnumMap<>(statusType));
            if (targets.containsKey(to) || targets.containsValue(action)) {
                throw new IllegalArgumentException(
                    String.format("Duplicate edge from %s: %s → %s", from, action, to));
            }
            targets.put(to, action);
            return this;
        }

        @SafeVarargs
        public final Builder<S> initial(S... statuses) {
            for (S status : statuses) {
                if (status == null) {
                    throw new IllegalArgumentException("initial status cannot be null");
                }
                initialStatuses.add(status);
            }
            return this;
        }

        public Builder<S> defaultInitial(S status) {
            this.defaultInitialStatus = status;
            return this;
        }

        public Builder<S> fallback(S status) {
            this.fallbackStatus = status;
            return this;
        }

        public TransitionTable<S> build() {
            if (fallbackStatus == null) {
                throw new IllegalArgumentException("fallback status cannot be null");
            }
            if (initialStatuses.isEmpty()) {
                throw new IllegalArgumentException("initial statuses cannot be empty");
            }
            if (defaultInitialStatus != null && !initialStatuses.contains(defaultInitialStatus)) {
                throw new IllegalArgumentException(
                    "default initial status must be one of the initial statuses: " + defaultInitialStatus);
            }
            return new TransitionTable<>(this);
        }
    }
}
