package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.application.authorization.AllowAllTransitionAuthorizer;
import com.ryuqq.lifecycle.application.authorization.Caller;
import com.ryuqq.lifecycle.application.authorization.TransitionAuthorizer;
import com.ryuqq.lifecycle.application.lifecycle.LifecycleService;
import com.ryuqq.lifecycle.application.lifecycle.TransitionRequest;
import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionException;
import com.ryuqq.lifecycle.core.exception.OwnerNotFoundException;
import com.ryuqq.lifecycle.core.exception.TransitionNotPermittedException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.mapper.EntityMapper;
import com.ryuqq.lifecycle.core.mapper.EntityMappers;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.mapper.PersistedStatusRow;
import com.ryuqq.lifecycle.core.mapper.StatusRecordMapper;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusContext;
import com.ryuqq.lifecycle.core.model.StatusHistory;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.spi.StatusStore;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import com.ryuqq.lifecycle.core.statemachine.TransitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@link LifecycleService} 구현.
 *
 * <p>상태 레코드 생성과 현재 상태 포인터 변경은 모두 이 클래스를 거칩니다.
 * 레코드 ID와 시각은 서버가 부여하며, 호출자는 시각을 지정할 수 없습니다.</p>
 *
 * <p><strong>전이 처리 흐름:</strong></p>
 * <pre>
 * 1. store.findOwner(kind, id)             → 소유자 행 + 이력 (포인터 P 관찰)
 * 2. mapper.toDomainForWrite(row)          → 엔티티 (알 수 없는 상태는 실패)
 * 3. authorizer.permits(...)               → 거부 시 TransitionNotPermittedException
 * 4. TransitionValidator.validateOrFail    → 거부 시 InvalidTransitionException
 * 5. StatusRecord.create + history.append  → 순서 검증
 * 6. store.appendStatus(..., expected = P) → 레코드 저장 + 포인터 교체 (원자적)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>같은 소유자에 대한 동시 전이는 포인터 compare-and-swap으로 직렬화</li>
 *   <li>패배한 요청은 ConcurrentTransitionException, 아무것도 저장되지 않음</li>
 *   <li>자동 재시도 없음 (호출자가 최신 상태를 다시 읽고 판단)</li>
 *   <li>내부 스레드를 생성하지 않음</li>
 * </ul>
 *
 * <p><strong>조회 시 복구:</strong> 포인터가 이력의 최신 레코드를 가리키지 않거나,
 * 이력이 있는데 포인터가 비어 있으면 {@link RunnerConfig#readRepairStrategy()}가 REPAIR일 때
 * 포인터를 옮긴 뒤 다시 조회합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransitionRunner implements LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(StatusTransitionRunner.class);

    private final StatusStore store;
    private final TransitionAuthorizer authorizer;
    private final Clock clock;
    private final RunnerConfig config;
    private final EntityMappers mappers;

    /**
     * 기본 설정 생성자 (모든 전이 허용, 시스템 UTC 시계).
     *
     * @param store 저장소
     */
    public StatusTransitionRunner(StatusStore store) {
        this(store, AllowAllTransitionAuthorizer.INSTANCE, Clock.systemUTC(), new RunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param authorizer 인가 훅
     * @param clock 서버 시계
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StatusTransitionRunner(StatusStore store, TransitionAuthorizer authorizer, Clock clock, RunnerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.authorizer = authorizer;
        this.clock = clock;
        this.config = config;
        this.mappers = EntityMappers.create(clock);
    }

    @Override
    public <S extends Enum<S> & LifecycleStatus> LifecycleEntity<S> register(
        EntityKind<S> kind, OwnerId ownerId, String parentId, S initialStatus, StatusContext context, Caller caller) {
        requireTarget(kind, ownerId, caller);
        if (parentId == null || parentId.isBlank()) {
            throw new ValidationException(kind + " " + ownerId.getValue() + " requires a parent id");
        }

        S initial = initialStatus != null
            ? initialStatus
            : kind.table().defaultInitialStatus().orElse(null);

        PersistedOwnerRow row;
        if (initial == null) {
            // 첫 상태 없이 생성 가능한 종류 (레슨)
            if (context != null && !context.isEmpty()) {
                throw new ValidationException(
                    kind + " " + ownerId.getValue() + " registered without a status cannot carry a context");
            }
            authorize(caller, kind, ownerId, null, null);
            row = PersistedOwnerRow.withoutStatuses(kind.name(), ownerId.getValue(), parentId, clock.instant());
        } else {
            authorize(caller, kind, ownerId, null, initial);
            TransitionValidator.validateOrFail(kind, null, initial);
            StatusRecord<S> record = StatusRecord.create(kind, ownerId, initial, context, clock);
            PersistedStatusRow statusRow = StatusRecordMapper.toRow(record);
            row = new PersistedOwnerRow(
                kind.name(),
                ownerId.getValue(),
                parentId,
                statusRow.id(),
                statusRow,
                List.of(statusRow),
                0L,
                record.getCreatedAt(),
                record.getCreatedAt()
            );
        }

        store.insertOwner(row);
        log.info("Registered {} {} with initial status {}", kind, ownerId.getValue(), initial);
        return mappers.forKind(kind).toDomainForWrite(row);
    }

    @Override
    public <S extends Enum<S> & LifecycleStatus> StatusRecord<S> transition(
        EntityKind<S> kind, OwnerId ownerId, S requestedStatus, StatusContext context, Caller caller) {
        requireTarget(kind, ownerId, caller);
        if (requestedStatus == null) {
            throw new ValidationException("requested status cannot be null");
        }

        PersistedOwnerRow row = findOwnerOrThrow(kind, ownerId);
        LifecycleEntity<S> entity = mappers.forKind(kind).toDomainForWrite(row);
        return append(kind, row, entity, requestedStatus, context, caller);
    }

    @Override
    public StatusRecord<?> transition(TransitionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        EntityKind<?> kind = EntityKind.fromName(request.entityKind())
            .orElseThrow(() -> new ValidationException("Unknown entity kind: " + request.entityKind()));
        return transitionUntyped(kind, request);
    }

    @Override
    public <S extends Enum<S> & LifecycleStatus> StatusRecord<S> apply(
        EntityKind<S> kind, OwnerId ownerId, String action, StatusContext context, Caller caller) {
        requireTarget(kind, ownerId, caller);

        PersistedOwnerRow row = findOwnerOrThrow(kind, ownerId);
        LifecycleEntity<S> entity = mappers.forKind(kind).toDomainForWrite(row);
        S target = TransitionValidator.resolveAction(kind, entity.currentStatus().orElse(null), action);
        return append(kind, row, entity, target, context, caller);
    }

    @Override
    public <S extends Enum<S> & LifecycleStatus> LifecycleEntity<S> load(EntityKind<S> kind, OwnerId ownerId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }

        EntityMapper<S, ? extends LifecycleEntity<S>> mapper = mappers.forKind(kind);
        PersistedOwnerRow row = findOwnerOrThrow(kind, ownerId);
        if (config.readRepairStrategy() != ReconcileStrategy.REPAIR) {
            return mapper.toDomain(row);
        }

        // 첫 전이가 포인터 갱신 전에 중단된 행은 toDomain이 거부하므로 먼저 복구
        Optional<StatusRecordId> detached = mapper.findDetachedLatest(row);
        if (detached.isPresent()) {
            repairPointer(kind, ownerId, null, detached.get());
            return mapper.toDomain(findOwnerOrThrow(kind, ownerId));
        }

        LifecycleEntity<S> entity = mapper.toDomain(row);
        if (!entity.isPointerDivergent()) {
            return entity;
        }
        StatusRecordId latest = entity.getStatuses().latestId().orElseThrow();
        if (!repairPointer(kind, ownerId, row.currentStatusId(), latest)) {
            // 이력 기준 엔티티는 그대로 유효
            return entity;
        }
        return mapper.toDomain(findOwnerOrThrow(kind, ownerId));
    }

    @Override
    public <S extends Enum<S> & LifecycleStatus> Set<S> availableTransitions(EntityKind<S> kind, OwnerId ownerId) {
        LifecycleEntity<S> entity = load(kind, ownerId);
        return TransitionValidator.nextStatuses(kind, entity.currentStatus().orElse(null));
    }

    @Override
    public boolean delete(EntityKind<?> kind, OwnerId ownerId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        boolean deleted = store.deleteOwner(kind, ownerId);
        if (deleted) {
            log.info("Deleted {} {} with its status history", kind, ownerId.getValue());
        }
        return deleted;
    }

    private <S extends Enum<S> & LifecycleStatus> StatusRecord<S> transitionUntyped(
        EntityKind<S> kind, TransitionRequest request) {
        OwnerId ownerId;
        try {
            ownerId = OwnerId.of(request.ownerId());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid owner id: " + e.getMessage(), e);
        }
        String rawStatus = request.requestedStatus() == null
            ? null
            : request.requestedStatus().trim().toUpperCase(Locale.ROOT);
        S requested = kind.parseStatus(rawStatus)
            .orElseThrow(() -> new ValidationException(
                String.format("Unknown %s status: %s", kind, request.requestedStatus())));
        StatusContext context = StatusContext.parse(request.context());
        return transition(kind, ownerId, requested, context, request.caller());
    }

    private <S extends Enum<S> & LifecycleStatus> StatusRecord<S> append(
        EntityKind<S> kind,
        PersistedOwnerRow row,
        LifecycleEntity<S> entity,
        S requested,
        StatusContext context,
        Caller caller
    ) {
        S current = entity.currentStatus().orElse(null);
        authorize(caller, kind, entity.getId(), current, requested);
        TransitionValidator.validateOrFail(kind, current, requested);

        StatusRecord<S> record = StatusRecord.create(
            kind, entity.getId(), requested, context, stampingClock(kind, entity));
        // 순서 검증
        StatusHistory<S> appended = entity.getStatuses().append(record);

        store.appendStatus(kind, entity.getId(), StatusRecordMapper.toRow(record), row.currentStatusId());
        log.info("{} {} transitioned {} → {} by {} ({}), {} records",
            kind, entity.getId().getValue(), current, requested, caller.userId(), caller.role(), appended.size());
        return record;
    }

    /**
     * 새 레코드 시각에 쓸 시계.
     *
     * <p>현재 레코드가 서버 시각보다 미래이고 그 차이가 {@link RunnerConfig#maxClockSkew()} 이내이면
     * 차이만큼 앞당긴 시계를 돌려줍니다. 차이가 더 크면 서버 시계를 그대로 써서
     * 이력 추가 시 OrderingException이 나도록 둡니다.</p>
     */
    private <S extends Enum<S> & LifecycleStatus> Clock stampingClock(EntityKind<S> kind, LifecycleEntity<S> entity) {
        Optional<StatusRecord<S>> currentRecord = entity.getStatuses().current();
        if (currentRecord.isEmpty()) {
            return clock;
        }
        Instant now = clock.instant();
        Instant latest = currentRecord.get().getCreatedAt();
        if (!latest.isAfter(now)) {
            return clock;
        }
        Duration behind = Duration.between(now, latest);
        if (behind.compareTo(config.maxClockSkew()) > 0) {
            return clock;
        }
        log.warn("Clock skew: {} {} current record is {} ahead of server time, stamping at its time",
            kind, entity.getId().getValue(), behind);
        return Clock.offset(clock, behind);
    }

    /**
     * 포인터를 이력의 최신 레코드로 옮김 (compare-and-swap).
     *
     * @return 옮겼으면 true, 다른 요청이 먼저 포인터를 바꿨으면 false
     */
    private boolean repairPointer(EntityKind<?> kind, OwnerId ownerId, String observed, StatusRecordId latest) {
        try {
            store.repointCurrentStatus(kind, ownerId, observed, latest.getValue());
        } catch (ConcurrentTransitionException e) {
            log.warn("Read repair of {} {} skipped: {}", kind, ownerId.getValue(), e.getMessage());
            return false;
        }
        log.warn("Read repair: moved {} {} current status pointer {} → {}",
            kind, ownerId.getValue(), observed, latest.getValue());
        return true;
    }

    private void authorize(Caller caller, EntityKind<?> kind, OwnerId ownerId, LifecycleStatus from, LifecycleStatus to) {
        if (!authorizer.permits(caller, kind, ownerId, from, to)) {
            log.warn("Transition of {} {} to {} not permitted for {} ({})",
                kind, ownerId.getValue(), to, caller.userId(), caller.role());
            throw new TransitionNotPermittedException(String.format(
                "%s (%s) is not permitted to move %s %s to %s",
                caller.userId(), caller.role(), kind, ownerId.getValue(), to));
        }
    }

    private PersistedOwnerRow findOwnerOrThrow(EntityKind<?> kind, OwnerId ownerId) {
        return store.findOwner(kind, ownerId)
            .orElseThrow(() -> new OwnerNotFoundException(kind.name(), ownerId.getValue()));
    }

    private static void requireTarget(EntityKind<?> kind, OwnerId ownerId, Caller caller) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
    }
}
