package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionException;
import com.ryuqq.lifecycle.core.exception.OwnerNotFoundException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.mapper.PersistedStatusRow;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.spi.StatusStore;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link StatusStore} SPI for testing and reference purposes.
 *
 * <p>Each owner is held as one immutable {@link OwnerEntry}. Every mutation replaces the entry
 * through {@link ConcurrentHashMap#compute}, so the status insert and the pointer swap of
 * {@link #appendStatus} become visible together or not at all.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>owners:</strong> ConcurrentHashMap&lt;OwnerKey, OwnerEntry&gt; - owner row with its status rows in insertion order</li>
 * </ul>
 *
 * <p><strong>Compare-And-Swap:</strong></p>
 * <ul>
 *   <li>The remapping function compares the stored pointer with the expected pointer</li>
 *   <li>On mismatch it throws {@link ConcurrentTransitionException}; the mapping is left unchanged</li>
 *   <li>Different owners never contend: compute locks only the owner's bin</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StatusStore store = new InMemoryStatusStore();
 * store.insertOwner(PersistedOwnerRow.withoutStatuses("LESSON", "lesson-1", "quote-1", now));
 * store.appendStatus(EntityKind.LESSON, OwnerId.of("lesson-1"), requestedRow, null);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStatusStore implements StatusStore {

    private final ConcurrentHashMap<OwnerKey, OwnerEntry> owners;

    /**
     * Creates a new InMemoryStatusStore with empty storage.
     */
    public InMemoryStatusStore() {
        this.owners = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>putIfAbsent keeps duplicate detection atomic</li>
     *   <li>Status rows must belong to the owner</li>
     * </ul>
     */
    @Override
    public void insertOwner(PersistedOwnerRow row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        for (PersistedStatusRow status : row.statuses()) {
            if (!status.ownerId().equals(row.id())) {
                throw new IllegalArgumentException(String.format(
                    "Status %s belongs to owner %s, not %s", status.id(), status.ownerId(), row.id()));
            }
        }
        if (row.currentStatusId() != null && findStatus(row.statuses(), row.currentStatusId()) == null) {
            throw new IllegalArgumentException(String.format(
                "Current status %s is not one of the statuses of %s", row.currentStatusId(), row.id()));
        }

        OwnerEntry entry = new OwnerEntry(
            row.kind(), row.id(), row.parentId(), row.currentStatusId(),
            row.statuses(), row.version(), row.createdAt(), row.updatedAt());
        OwnerEntry existing = owners.putIfAbsent(new OwnerKey(row.kind(), row.id()), entry);
        if (existing != null) {
            throw new ValidationException(String.format("%s with ID %s already exists", row.kind(), row.id()));
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<PersistedOwnerRow> findOwner(EntityKind<?> kind, OwnerId ownerId) {
        OwnerKey key = keyOf(kind, ownerId);
        OwnerEntry entry = owners.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.toRow());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Pointer comparison and replacement happen inside one compute call</li>
     *   <li>version is incremented and updatedAt set to the record's createdAt</li>
     * </ul>
     */
    @Override
    public void appendStatus(EntityKind<?> kind, OwnerId ownerId, PersistedStatusRow row, String expectedCurrentStatusId) {
        OwnerKey key = keyOf(kind, ownerId);
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        if (!row.ownerId().equals(ownerId.getValue())) {
            throw new IllegalArgumentException(String.format(
                "Status %s belongs to owner %s, not %s", row.id(), row.ownerId(), ownerId.getValue()));
        }

        OwnerEntry updated = owners.computeIfPresent(key, (k, entry) -> {
            if (!Objects.equals(entry.currentStatusId(), expectedCurrentStatusId)) {
                throw new ConcurrentTransitionException(
                    ownerId.getValue(), expectedCurrentStatusId, entry.currentStatusId());
            }
            if (findStatus(entry.statuses(), row.id()) != null) {
                throw new IllegalArgumentException("Status " + row.id() + " already exists");
            }
            List<PersistedStatusRow> statuses = new ArrayList<>(entry.statuses());
            statuses.add(row);
            return entry.withStatuses(statuses, row.id(), row.createdAt());
        });
        if (updated == null) {
            throw new OwnerNotFoundException(kind.name(), ownerId.getValue());
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void repointCurrentStatus(EntityKind<?> kind, OwnerId ownerId, String expectedCurrentStatusId, String newCurrentStatusId) {
        OwnerKey key = keyOf(kind, ownerId);
        if (newCurrentStatusId == null) {
            throw new IllegalArgumentException("newCurrentStatusId cannot be null");
        }

        OwnerEntry updated = owners.computeIfPresent(key, (k, entry) -> {
            if (!Objects.equals(entry.currentStatusId(), expectedCurrentStatusId)) {
                throw new ConcurrentTransitionException(
                    ownerId.getValue(), expectedCurrentStatusId, entry.currentStatusId());
            }
            PersistedStatusRow target = findStatus(entry.statuses(), newCurrentStatusId);
            if (target == null) {
                throw new IllegalArgumentException(String.format(
                    "Status %s is not part of the history of %s", newCurrentStatusId, ownerId.getValue()));
            }
            return entry.withStatuses(entry.statuses(), newCurrentStatusId, entry.updatedAt());
        });
        if (updated == null) {
            throw new OwnerNotFoundException(kind.name(), ownerId.getValue());
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Latest record: greatest createdAt, ties resolved by insertion order</li>
     *   <li>Owners without statuses are never divergent</li>
     *   <li>Performance: O(N) over all owners of the kind</li>
     * </ul>
     */
    @Override
    public List<PersistedOwnerRow> scanDivergent(EntityKind<?> kind, int batchSize) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        return owners.values().stream()
            .filter(entry -> entry.kind().equals(kind.name()))
            .filter(OwnerEntry::isDivergent)
            .limit(batchSize)
            .map(OwnerEntry::toRow)
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Status rows live inside the owner entry, so removing the entry removes the history.</p>
     */
    @Override
    public boolean deleteOwner(EntityKind<?> kind, OwnerId ownerId) {
        return owners.remove(keyOf(kind, ownerId)) != null;
    }

    /**
     * Appends a status row without moving the current-status pointer.
     *
     * <p>This method simulates a crash between status insert and pointer swap for testing purposes.</p>
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @param row the detached status row
     * @throws OwnerNotFoundException if the owner does not exist
     */
    public void insertDetachedStatus(EntityKind<?> kind, OwnerId ownerId, PersistedStatusRow row) {
        OwnerKey key = keyOf(kind, ownerId);
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        OwnerEntry updated = owners.computeIfPresent(key, (k, entry) -> {
            List<PersistedStatusRow> statuses = new ArrayList<>(entry.statuses());
            statuses.add(row);
            return entry.withStatuses(statuses, entry.currentStatusId(), entry.updatedAt());
        });
        if (updated == null) {
            throw new OwnerNotFoundException(kind.name(), ownerId.getValue());
        }
    }

    /**
     * Returns the number of status rows stored for the owner.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @param kind the entity kind
     * @param ownerId the owner id
     * @return the number of status rows, or 0 if the owner does not exist
     */
    public int statusCount(EntityKind<?> kind, OwnerId ownerId) {
        OwnerEntry entry = owners.get(keyOf(kind, ownerId));
        return entry == null ? 0 : entry.statuses().size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        owners.clear();
    }

    private static OwnerKey keyOf(EntityKind<?> kind, OwnerId ownerId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        return new OwnerKey(kind.name(), ownerId.getValue());
    }

    private static PersistedStatusRow findStatus(List<PersistedStatusRow> statuses, String id) {
        for (PersistedStatusRow status : statuses) {
            if (status.id().equals(id)) {
                return status;
            }
        }
        return null;
    }

    /**
     * Owner identity within the store.
     *
     * @param kind the entity kind name
     * @param ownerId the owner id
     */
    private record OwnerKey(String kind, String ownerId) {
    }

    /**
     * Immutable snapshot of one owner and its status rows.
     */
    private record OwnerEntry(
        String kind,
        String id,
        String parentId,
        String currentStatusId,
        List<PersistedStatusRow> statuses,
        long version,
        Instant createdAt,
        Instant updatedAt
    ) {

        OwnerEntry {
            statuses = List.copyOf(statuses);
        }

        OwnerEntry withStatuses(List<PersistedStatusRow> newStatuses, String newCurrentStatusId, Instant newUpdatedAt) {
            return new OwnerEntry(kind, id, parentId, newCurrentStatusId, newStatuses, version + 1, createdAt, newUpdatedAt);
        }

        PersistedStatusRow latest() {
            PersistedStatusRow latest = null;
            for (PersistedStatusRow status : statuses) {
                if (latest == null || !status.createdAt().isBefore(latest.createdAt())) {
                    latest = status;
                }
            }
            return latest;
        }

        boolean isDivergent() {
            PersistedStatusRow latest = latest();
            return latest != null && !latest.id().equals(currentStatusId);
        }

        PersistedOwnerRow toRow() {
            PersistedStatusRow current = currentStatusId == null ? null : findStatus(statuses, currentStatusId);
            return new PersistedOwnerRow(
                kind, id, parentId, currentStatusId, current, statuses, version, createdAt, updatedAt);
        }
    }
}
