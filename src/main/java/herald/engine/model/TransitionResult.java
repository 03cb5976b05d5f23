package herald.engine.model;

/**
 * Result of a conditional status transition in the task store.
 */
public enum TransitionResult {
    /** The row was in the expected state and has been moved */
    APPLIED,

    /** No task with that id */
    NOT_FOUND,

    /** The task exists but is not in the state the transition requires */
    CONFLICT
}
