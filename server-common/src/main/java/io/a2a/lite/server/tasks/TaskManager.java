package io.a2a.lite.server.tasks;

import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.Task;
import io.a2a.lite.spec.TaskIdParams;
import io.a2a.lite.spec.TaskPushNotificationConfig;
import io.a2a.lite.spec.TaskQueryParams;
import io.a2a.lite.spec.TaskSendParams;
import io.a2a.lite.util.EventChannel;

/**
 * Server-side entry point of the task protocol. One method per JSON-RPC method.
 * <p>
 * Failures are reported with the {@link io.a2a.lite.spec.A2AError} subclass matching the
 * protocol error code.
 */
public interface TaskManager {

    /**
     * Creates a task and starts its processor, or resumes an existing non-final task with a new
     * message.
     *
     * @return the task as stored when the call returns
     * @throws io.a2a.lite.spec.InvalidParamsError if the ID is blank or the message has no parts
     * @throws io.a2a.lite.spec.TaskFinalStateError if the task exists and is final
     */
    Task onSendTask(TaskSendParams params);

    /**
     * @throws io.a2a.lite.spec.TaskNotFoundError if the task does not exist
     */
    Task onGetTask(TaskQueryParams params);

    /**
     * Cancels a non-final task and signals its processor.
     *
     * @throws io.a2a.lite.spec.TaskNotFoundError if the task does not exist
     * @throws io.a2a.lite.spec.TaskFinalStateError if the task is already final
     */
    Task onCancelTask(TaskIdParams params);

    /**
     * Same as {@link #onSendTask(TaskSendParams)}, returning the task's live events. The channel
     * is registered before the processor can emit anything and is completed after the final
     * status event.
     */
    EventChannel<TaskEvent> onSendTaskSubscribe(TaskSendParams params);

    /**
     * Joins the event stream of an existing task. A live task delivers only events emitted from
     * now on; a final task delivers one final status event and completes.
     *
     * @throws io.a2a.lite.spec.TaskNotFoundError if the task does not exist
     */
    EventChannel<TaskEvent> onResubscribe(TaskIdParams params);

    /**
     * @throws io.a2a.lite.spec.TaskNotFoundError if the task does not exist
     * @throws io.a2a.lite.spec.InvalidParamsError if the URL is blank
     */
    TaskPushNotificationConfig onPushNotificationSet(TaskPushNotificationConfig params);

    /**
     * @throws io.a2a.lite.spec.TaskNotFoundError if the task does not exist
     * @throws io.a2a.lite.spec.PushNotificationNotConfiguredError if no configuration is stored
     */
    TaskPushNotificationConfig onPushNotificationGet(TaskIdParams params);
}
