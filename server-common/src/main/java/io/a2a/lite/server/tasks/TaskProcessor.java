package io.a2a.lite.server.tasks;

import io.a2a.lite.spec.Message;

/**
 * The agent logic behind a task.
 * <p>
 * The task manager invokes {@link #process} exactly once per newly created task, on its own
 * thread. The processor reports progress through the {@link TaskHandle} and is expected to bring
 * the task to a final state before returning. If it throws, or returns while the task is still
 * non-final, the task is failed on its behalf.
 * <p>
 * Cancellation is cooperative: after {@code tasks/cancel}, {@link TaskHandle#isCanceled()}
 * returns {@code true}, the processor's thread is interrupted, and every further mutation
 * through the handle fails with {@link io.a2a.lite.spec.TaskFinalStateError}.
 */
@FunctionalInterface
public interface TaskProcessor {

    /**
     * @param taskId the task ID
     * @param message the message that created the task
     * @param handle the handle used to report status changes and artifacts
     * @throws Exception any failure; the task is moved to {@code failed}
     */
    void process(String taskId, Message message, TaskHandle handle) throws Exception;
}
