package io.a2a.lite.server.tasks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.a2a.lite.spec.PushNotificationConfig;
import io.a2a.lite.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * In-memory implementation of the PushNotificationConfigStore interface.
 */
public class InMemoryPushNotificationConfigStore implements PushNotificationConfigStore {

    private final Map<String, PushNotificationConfig> pushNotificationInfos = new ConcurrentHashMap<>();

    @Override
    public void setInfo(String taskId, PushNotificationConfig notificationConfig) {
        Assert.checkNotNullParam("taskId", taskId);
        Assert.checkNotNullParam("notificationConfig", notificationConfig);
        pushNotificationInfos.put(taskId, notificationConfig);
    }

    @Override
    public @Nullable PushNotificationConfig getInfo(String taskId) {
        return pushNotificationInfos.get(taskId);
    }

    @Override
    public void deleteInfo(String taskId) {
        pushNotificationInfos.remove(taskId);
    }
}
