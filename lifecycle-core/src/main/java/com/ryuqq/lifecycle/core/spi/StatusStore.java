package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionException;
import com.ryuqq.lifecycle.core.exception.OwnerNotFoundException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.mapper.PersistedStatusRow;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for owner entities and their status histories.
 *
 * <p>The store persists raw rows only. It never interprets status strings or context JSON;
 * validation and mapping happen in the core before and after every call.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Owner creation together with its optional initial status record</li>
 *   <li>Atomic status append plus compare-and-swap of the current-status pointer</li>
 *   <li>Owner retrieval joined with the full status history and the resolved current status</li>
 *   <li>Divergence scanning and pointer repair (PointerReconciler)</li>
 *   <li>Cascading owner deletion</li>
 * </ul>
 *
 * <p><strong>Pointer Compare-And-Swap:</strong></p>
 * <pre>
 * 1. findOwner(kind, id)                           → pointer P observed
 * 2. appendStatus(kind, id, row, expected = P)     → INSERT row, pointer P → row.id
 * 3. concurrent writer with expected = P           → ConcurrentTransitionException
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: appendStatus and deleteOwner must be all-or-nothing</li>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Insertion order: statuses are returned in the order they were appended</li>
 *   <li>Records are never updated or deleted except by deleteOwner</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StatusStore {

    /**
     * Inserts a new owner together with its status rows (zero or one on creation).
     *
     * <p><strong>Transaction Boundary:</strong></p>
     * <pre>
     * BEGIN TRANSACTION;
     *   INSERT INTO milestones (id, lesson_plan_id, current_status_id, version, ...) VALUES (?, ?, NULL, 0, ...);
     *   INSERT INTO milestone_statuses (id, milestone_id, status, context, created_at) VALUES (?, ?, 'CREATED', ?, ?);
     *   UPDATE milestones SET current_status_id = ? WHERE id = ?;
     * COMMIT;
     * </pre>
     *
     * @param row the owner row; {@code currentStatusId} must reference one of {@code statuses} or be null
     * @throws IllegalArgumentException if row is null or its pointer does not reference one of its statuses
     * @throws ValidationException if an owner of the same kind with the same id already exists
     */
    void insertOwner(PersistedOwnerRow row);

    /**
     * Retrieves an owner joined with its status history.
     *
     * <p>The returned row's {@code currentStatus} is the row the pointer references,
     * or null when the pointer is null or cannot be resolved.</p>
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @return the owner row, or empty if it does not exist
     * @throws IllegalArgumentException if kind or ownerId is null
     */
    Optional<PersistedOwnerRow> findOwner(EntityKind<?> kind, OwnerId ownerId);

    /**
     * Appends a status row and swaps the current-status pointer to it in one atomic step.
     *
     * <p><strong>Transaction Boundary:</strong></p>
     * <pre>
     * BEGIN TRANSACTION;
     *   UPDATE lessons SET current_status_id = ?, version = version + 1, updated_at = ?
     *    WHERE id = ? AND current_status_id IS NOT DISTINCT FROM ?;   -- 0 rows → concurrent transition
     *   INSERT INTO lesson_statuses (id, lesson_id, status, context, created_at) VALUES (?, ?, ?, ?, ?);
     * COMMIT;
     * </pre>
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @param row the new status row
     * @param expectedCurrentStatusId the pointer observed before the transition (null when history was empty)
     * @throws OwnerNotFoundException if the owner does not exist
     * @throws ConcurrentTransitionException if the pointer no longer equals {@code expectedCurrentStatusId};
     *         nothing is persisted in that case
     */
    void appendStatus(EntityKind<?> kind, OwnerId ownerId, PersistedStatusRow row, String expectedCurrentStatusId);

    /**
     * Moves the current-status pointer to an existing record (compare-and-swap).
     *
     * <p>Used only to repair divergence; it never creates a record.</p>
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @param expectedCurrentStatusId the pointer observed by the caller
     * @param newCurrentStatusId id of a record already in the owner's history
     * @throws OwnerNotFoundException if the owner does not exist
     * @throws ConcurrentTransitionException if the pointer no longer equals {@code expectedCurrentStatusId}
     * @throws IllegalArgumentException if {@code newCurrentStatusId} is not part of the owner's history
     */
    void repointCurrentStatus(EntityKind<?> kind, OwnerId ownerId, String expectedCurrentStatusId, String newCurrentStatusId);

    /**
     * Scans for owners whose pointer does not reference their latest status record.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT l.* FROM lessons l
     *  WHERE l.current_status_id IS DISTINCT FROM (
     *        SELECT s.id FROM lesson_statuses s WHERE s.lesson_id = l.id
     *         ORDER BY s.created_at DESC, s.seq DESC LIMIT 1)
     *  LIMIT ?;
     * </pre>
     *
     * @param kind the entity kind
     * @param batchSize maximum number of owners to return
     * @return divergent owner rows (may be empty)
     * @throws IllegalArgumentException if kind is null or batchSize is not positive
     */
    List<PersistedOwnerRow> scanDivergent(EntityKind<?> kind, int batchSize);

    /**
     * Deletes an owner and its whole status history atomically.
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @return true if the owner existed and was deleted
     */
    boolean deleteOwner(EntityKind<?> kind, OwnerId ownerId);
}
