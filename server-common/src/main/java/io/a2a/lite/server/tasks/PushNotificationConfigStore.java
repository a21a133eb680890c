package io.a2a.lite.server.tasks;

import io.a2a.lite.spec.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

/**
 * Interface for storing and retrieving push notification configurations for tasks.
 */
public interface PushNotificationConfigStore {

    /**
     * Sets or updates the push notification configuration for a task.
     *
     * @param taskId the task ID
     * @param notificationConfig the push notification configuration
     */
    void setInfo(String taskId, PushNotificationConfig notificationConfig);

    /**
     * Retrieves the push notification configuration for a task.
     *
     * @param taskId the task ID
     * @return the configuration, or {@code null} if none is stored
     */
    @Nullable PushNotificationConfig getInfo(String taskId);

    /**
     * Deletes the push notification configuration for a task.
     *
     * @param taskId the task ID
     */
    void deleteInfo(String taskId);
}
