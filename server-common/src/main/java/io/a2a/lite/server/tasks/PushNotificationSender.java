package io.a2a.lite.server.tasks;

import io.a2a.lite.spec.Task;

/**
 * Interface for sending push notifications for tasks.
 */
public interface PushNotificationSender {

    /**
     * Sends a push notification containing the latest task state. Implementations must not
     * throw: delivery failures are logged and never affect the task.
     *
     * @param task the task
     */
    void sendNotification(Task task);
}
