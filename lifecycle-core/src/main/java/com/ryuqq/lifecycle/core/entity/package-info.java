/**
 * Owner entities that carry a status history.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.entity.Lesson} - parent: quote</li>
 *   <li>{@link com.ryuqq.lifecycle.core.entity.LessonPlan} - parent: lesson</li>
 *   <li>{@link com.ryuqq.lifecycle.core.entity.Milestone} - parent: lesson plan</li>
 *   <li>{@link com.ryuqq.lifecycle.core.entity.Goal} - parent: lesson</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.entity;
