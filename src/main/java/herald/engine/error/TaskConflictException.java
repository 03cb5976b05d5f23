package herald.engine.error;

import herald.engine.model.TaskStatus;

/**
 * A status transition was rejected because the task is no longer in the
 * state the operation requires.
 */
public class TaskConflictException extends HeraldException {
    private final String taskId;
    private final TaskStatus currentStatus;

    public TaskConflictException(String taskId, TaskStatus currentStatus, String operation) {
        super("cannot " + operation + " task " + taskId + " in status " + currentStatus);
        this.taskId = taskId;
        this.currentStatus = currentStatus;
    }

    public String taskId() {
        return taskId;
    }

    /** Status observed when the conflict was detected; may be null if the row vanished. */
    public TaskStatus currentStatus() {
        return currentStatus;
    }
}
