package herald.engine.repository;

import herald.engine.model.JobTrigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for pending job triggers ("fire task T at time S").
 * References tasks by id but never owns them.
 */
public interface TriggerRepository {

    /**
     * Register a trigger. Idempotent: a second registration for the same task
     * overwrites {@code fireAt} instead of adding another alarm.
     *
     * @param taskId the owning task
     * @param fireAt when the task is due
     */
    void register(String taskId, Instant fireAt);

    /**
     * Triggers with {@code fireAt <= before}, ordered by fireAt then taskId.
     *
     * @param before inclusive upper bound
     * @param limit  maximum number of triggers returned
     * @return due triggers in firing order
     */
    List<JobTrigger> due(Instant before, int limit);

    /**
     * Remove the trigger for a task, due or not.
     *
     * @param taskId the owning task
     * @return true if a trigger was removed
     */
    boolean remove(String taskId);

    Optional<JobTrigger> findByTaskId(String taskId);

    int countPending();
}
