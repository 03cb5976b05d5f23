package herald.engine.error;

public class TaskNotFoundException extends HeraldException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
