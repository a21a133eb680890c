package io.a2a.lite.server.tasks;

import io.a2a.lite.spec.TaskFinalStateError;
import io.a2a.lite.spec.TaskState;

/**
 * The single place where task state changes are validated.
 * <p>
 * Status updates follow the protocol's transition table ({@link TaskState#successors()}) exactly.
 * The only other move is the engine's own: it may force any non-final state to {@code failed}
 * when a processor dies.
 */
public final class TaskStateMachine {

    private TaskStateMachine() {
    }

    public static boolean canTransition(TaskState from, TaskState to) {
        if (from.isFinal()) {
            return false;
        }
        return from.successors().contains(to);
    }

    /**
     * @throws TaskFinalStateError if {@code from} is final or the move is not allowed
     */
    public static void checkTransition(String taskId, TaskState from, TaskState to) {
        if (from.isFinal()) {
            throw new TaskFinalStateError(taskId, from);
        }
        if (!canTransition(from, to)) {
            throw new TaskFinalStateError(taskId, from, to);
        }
    }

    /**
     * Checks that a task may still be changed at all (used for artifacts and history).
     *
     * @throws TaskFinalStateError if {@code current} is final
     */
    public static void checkMutable(String taskId, TaskState current) {
        if (current.isFinal()) {
            throw new TaskFinalStateError(taskId, current);
        }
    }

    /**
     * Checks the engine-initiated move to {@code failed} after a processor error.
     *
     * @throws TaskFinalStateError if {@code current} is final
     */
    public static void checkForcedFailure(String taskId, TaskState current) {
        checkMutable(taskId, current);
    }
}
