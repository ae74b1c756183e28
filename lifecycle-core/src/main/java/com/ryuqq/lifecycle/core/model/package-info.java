/**
 * Core domain model: identifiers, status records and per-owner status history.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.OwnerId} - Owner entity identifier</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StatusRecordId} - Opaque status record identifier</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StatusContext} - Opaque JSON payload of a transition</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StatusRecord} - One immutable history entry</li>
 * </ul>
 *
 * <h2>Aggregates</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StatusHistory} - Append-only, time-ordered history of one owner</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records are never updated; appending returns a new history</li>
 *   <li><strong>Type Safety:</strong> histories are parameterised by the kind's status enum</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.model;
