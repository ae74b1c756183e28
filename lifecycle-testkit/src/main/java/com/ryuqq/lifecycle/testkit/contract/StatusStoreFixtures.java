package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.mapper.PersistedStatusRow;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;

import java.time.Instant;
import java.util.List;

/**
 * Row fixtures shared by store contract tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusStoreFixtures {

    /**
     * Fixed base instant; fixtures offset from it so ordering is deterministic.
     */
    public static final Instant BASE_TIME = Instant.parse("2024-03-01T09:00:00Z");

    private StatusStoreFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a status row {@code secondsAfterBase} seconds after {@link #BASE_TIME}.
     *
     * @param id the record id
     * @param ownerId the owner id
     * @param status the raw status string
     * @param secondsAfterBase offset from the base time
     * @return a status row without context
     */
    public static PersistedStatusRow statusRow(String id, String ownerId, String status, long secondsAfterBase) {
        return new PersistedStatusRow(id, ownerId, status, null, BASE_TIME.plusSeconds(secondsAfterBase));
    }

    /**
     * Creates an owner row without any status.
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @return an owner row with a null pointer and empty history
     */
    public static PersistedOwnerRow ownerWithoutStatus(EntityKind<?> kind, String ownerId) {
        return PersistedOwnerRow.withoutStatuses(kind.name(), ownerId, "parent-" + ownerId, BASE_TIME);
    }

    /**
     * Creates an owner row whose pointer references its single initial status.
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @param initial the initial status row
     * @return an owner row with one status
     */
    public static PersistedOwnerRow ownerWithInitialStatus(EntityKind<?> kind, String ownerId, PersistedStatusRow initial) {
        return new PersistedOwnerRow(
            kind.name(),
            ownerId,
            "parent-" + ownerId,
            initial.id(),
            initial,
            List.of(initial),
            0L,
            initial.createdAt(),
            initial.createdAt()
        );
    }
}
