package herald.engine.service;

import herald.engine.dispatch.PublisherRegistry;
import herald.engine.error.TaskConflictException;
import herald.engine.error.TaskNotFoundException;
import herald.engine.error.ValidationException;
import herald.engine.model.CreateTaskCommand;
import herald.engine.model.PlatformRef;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskFilter;
import herald.engine.model.TaskStatus;
import herald.engine.model.TaskView;
import herald.engine.model.TransitionResult;
import herald.engine.repository.TaskRepository;
import herald.engine.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.UUID;

/**
 * Business logic for scheduled tasks: creation (record + trigger), lookup,
 * listing and cancellation. Execution is the scheduler's job.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final TriggerRepository triggerRepository;
    private final PublisherRegistry publishers;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository,
            TriggerRepository triggerRepository,
            PublisherRegistry publishers,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.triggerRepository = triggerRepository;
        this.publishers = publishers;
        this.clock = clock;
    }

    /**
     * Validate the command, store the task as SCHEDULED and register its trigger.
     *
     * @return the new task id
     * @throws ValidationException if the command is invalid or the trigger could not be registered
     */
    public String createTask(CreateTaskCommand command) {
        Instant now = clock.instant();
        validate(command, now);

        String taskId = UUID.randomUUID().toString();
        ScheduledTask task = ScheduledTask.builder()
                .id(taskId)
                .userId(command.userId())
                .platform(command.platform())
                .payload(command.payload())
                .credentials(command.credentials())
                .scheduledAt(command.scheduledAt())
                .status(TaskStatus.SCHEDULED)
                .createdAt(now)
                .updatedAt(now)
                .build();

        taskRepository.insert(task);

        try {
            triggerRepository.register(taskId, task.scheduledAt());
        } catch (RuntimeException e) {
            compensate(taskId, e);
            throw new ValidationException("task could not be scheduled", e);
        }

        log.info("Scheduled task {} for user {} on '{}' at {}", taskId, task.userId(), task.platform().name(),
                task.scheduledAt());
        return taskId;
    }

    /**
     * Lazy sequence of matching tasks ordered by (scheduledAt, id).
     */
    public Iterable<TaskView> listTasks(TaskFilter filter) {
        Iterable<ScheduledTask> tasks = taskRepository.list(filter != null ? filter : TaskFilter.all());
        return () -> {
            Iterator<ScheduledTask> it = tasks.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public TaskView next() {
                    return TaskView.of(it.next());
                }
            };
        };
    }

    /**
     * @throws TaskNotFoundException if no task has this id
     */
    public TaskView getTask(String taskId) {
        return taskRepository.findById(taskId)
                .map(TaskView::of)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Cancel a task that has not fired yet.
     *
     * @throws TaskNotFoundException if no task has this id
     * @throws TaskConflictException if the task already left SCHEDULED
     */
    public void cancelTask(String taskId) {
        TransitionResult res = taskRepository.cancel(taskId);
        switch (res) {
            case APPLIED -> {
                // a leftover trigger is dropped by the poller anyway
                try {
                    triggerRepository.remove(taskId);
                } catch (RuntimeException e) {
                    log.warn("Cancelled task {} but its trigger was not removed: {}", taskId, e.getMessage());
                }
                log.info("Cancelled task {}", taskId);
            }
            case NOT_FOUND -> throw new TaskNotFoundException(taskId);
            case CONFLICT -> {
                TaskStatus current = taskRepository.findById(taskId)
                        .map(ScheduledTask::status)
                        .orElse(null);
                log.warn("Cannot cancel task {} - status {}", taskId, current);
                throw new TaskConflictException(taskId, current, "cancel");
            }
        }
    }

    private void validate(CreateTaskCommand command, Instant now) {
        if (command == null) {
            throw new ValidationException("request is required");
        }
        if (command.userId() == null || command.userId().isBlank()) {
            throw new ValidationException("userId is required");
        }
        PlatformRef platform = command.platform();
        if (platform == null || platform.name().isBlank()) {
            throw new ValidationException("platform name is required");
        }
        if (platform.accountId().isBlank()) {
            throw new ValidationException("platform accountId is required");
        }
        if (!publishers.supports(platform.name())) {
            throw new ValidationException("unknown platform: " + platform.name());
        }
        if (command.payload() == null || command.payload().isEmpty()) {
            throw new ValidationException("payload is required");
        }
        if (command.scheduledAt() == null) {
            throw new ValidationException("scheduledAt is required");
        }
        if (!command.scheduledAt().isAfter(now)) {
            throw new ValidationException("scheduledAt must be in the future (got "
                    + command.scheduledAt() + ", now " + now + ")");
        }
    }

    private void compensate(String taskId, RuntimeException cause) {
        log.error("Trigger registration failed for task {}, removing record", taskId, cause);
        try {
            if (taskRepository.delete(taskId)) {
                return;
            }
        } catch (RuntimeException e) {
            log.error("Could not delete orphaned task {}, cancelling instead", taskId, e);
        }
        try {
            taskRepository.cancel(taskId);
        } catch (RuntimeException e) {
            log.error("Task {} left SCHEDULED without a trigger", taskId, e);
        }
    }
}
