package herald.engine.repository;

import herald.engine.model.DispatchOutcome;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskFilter;
import herald.engine.model.TaskStatus;
import herald.engine.model.TransitionResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for scheduled task records.
 * Owns task identity and history, including terminal outcomes.
 * All status changes are conditional on the current status, so concurrent
 * callers race safely: exactly one of them observes {@link TransitionResult#APPLIED}.
 */
public interface TaskRepository {

    /**
     * Persist a new task. The task must be SCHEDULED.
     *
     * @param task the task to insert
     */
    void insert(ScheduledTask task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the decoded task if found
     */
    Optional<ScheduledTask> findById(String taskId);

    /**
     * Lazily list tasks matching the filter, ordered by scheduledAt then id.
     * Each call to {@code iterator()} on the returned sequence restarts from
     * the beginning and reads the store page by page.
     *
     * @param filter criteria; {@link TaskFilter#all()} for everything
     * @return restartable sequence of tasks
     */
    Iterable<ScheduledTask> list(TaskFilter filter);

    /**
     * SCHEDULED -> CANCELLED.
     *
     * @param taskId the task ID
     * @return APPLIED, NOT_FOUND, or CONFLICT if the task is not SCHEDULED
     */
    TransitionResult cancel(String taskId);

    /**
     * SCHEDULED -> RUNNING. The single serialization point that guarantees
     * at-most-once dispatch.
     *
     * @param taskId the task ID
     * @return APPLIED, NOT_FOUND, or CONFLICT if the task is not SCHEDULED
     */
    TransitionResult markRunning(String taskId);

    /**
     * Stamp startedAt with the current time on a RUNNING task, just before its
     * publisher is called. Claim and dispatch can be apart when the dispatch
     * pool is busy; the reaper measures from this stamp.
     *
     * @param taskId the task ID
     * @return APPLIED, NOT_FOUND, or CONFLICT if the task is no longer RUNNING
     */
    TransitionResult beginDispatch(String taskId);

    /**
     * RUNNING -> SUCCEEDED | FAILED, recording the outcome's result.
     *
     * @param taskId  the task ID
     * @param outcome the dispatch outcome
     * @return APPLIED, NOT_FOUND, or CONFLICT if the task is not RUNNING
     */
    TransitionResult markTerminal(String taskId, DispatchOutcome outcome);

    /**
     * RUNNING -> FAILED for a task whose startedAt is still before the cutoff.
     * Checked in the same UPDATE, so a task whose dispatch began after the
     * reaper read it is left alone.
     *
     * @return APPLIED, NOT_FOUND, or CONFLICT if the task is not RUNNING or started recently
     */
    TransitionResult failStuck(String taskId, Instant startedBefore, DispatchOutcome outcome);

    /**
     * Delete a task record. Only used to compensate a creation whose trigger
     * could not be registered.
     *
     * @param taskId the task ID
     * @return true if a row was deleted
     */
    boolean delete(String taskId);

    /**
     * Find RUNNING tasks started before the given instant.
     * Used by the reaper to close out dispatches lost to a crash.
     *
     * @param startedBefore cutoff
     * @return tasks ordered by startedAt
     */
    List<ScheduledTask> findStuckRunning(Instant startedBefore);

    /**
     * Count tasks in a status.
     */
    int countByStatus(TaskStatus status);
}
