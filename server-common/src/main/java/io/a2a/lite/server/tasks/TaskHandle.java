package io.a2a.lite.server.tasks;

import java.time.Duration;

import io.a2a.lite.spec.Artifact;
import io.a2a.lite.spec.Message;
import io.a2a.lite.spec.Task;
import io.a2a.lite.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Gives a {@link TaskProcessor} write access to its task. Every change is applied to the stored
 * task and broadcast to the task's subscribers in the same order.
 */
public interface TaskHandle {

    String taskId();

    /**
     * Moves the task to {@code state}, optionally attaching an agent message to the status.
     *
     * @return the updated task
     * @throws io.a2a.lite.spec.TaskFinalStateError if the task is final or the transition is not allowed
     */
    Task updateStatus(TaskState state, @Nullable Message message);

    default Task updateStatus(TaskState state) {
        return updateStatus(state, null);
    }

    /**
     * Adds an artifact to the task, or extends the one at the same index when
     * {@link Artifact#isAppend()} is set.
     *
     * @return the updated task
     * @throws io.a2a.lite.spec.TaskFinalStateError if the task is final
     */
    Task addArtifact(Artifact artifact);

    /**
     * @return {@code true} once the task has been canceled
     */
    boolean isCanceled();

    /**
     * Waits for the next message sent to this task with {@code tasks/send} or
     * {@code tasks/sendSubscribe} after it was created, typically after moving to
     * {@link TaskState#INPUT_REQUIRED}.
     *
     * @param timeout the maximum time to wait
     * @return the message, or {@code null} if none arrived in time
     * @throws InterruptedException if interrupted while waiting, e.g. because the task was canceled
     */
    @Nullable Message awaitInput(Duration timeout) throws InterruptedException;
}
