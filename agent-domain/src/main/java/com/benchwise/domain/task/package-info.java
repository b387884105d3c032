/**
 * Task domain: durable agent tasks and their execution ledger.
 *
 * <h3>Core concepts</h3>
 * <ul>
 *   <li>Task: the current projection of a unit of agent work</li>
 *   <li>Execution: one append-only ledger entry per attempt</li>
 *   <li>State machine: pending, running, then completed / failed / cancelled</li>
 * </ul>
 *
 * <h3>Aggregate root</h3>
 * <ul>
 *   <li>{@link com.benchwise.domain.task.model.entity.AgentTaskEntity}</li>
 * </ul>
 *
 * <h3>Domain services</h3>
 * <ul>
 *   <li>TaskLifecycleDomainService - the single writer of task and execution status</li>
 * </ul>
 *
 * @author benchwise
 * @since 2026-03-02
 */
package com.benchwise.domain.task;
