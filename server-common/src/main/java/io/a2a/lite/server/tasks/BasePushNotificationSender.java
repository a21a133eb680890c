package io.a2a.lite.server.tasks;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.a2a.lite.client.http.A2AHttpClient;
import io.a2a.lite.client.http.A2AHttpResponse;
import io.a2a.lite.client.http.jdk.JdkA2AHttpClient;
import io.a2a.lite.server.config.A2AConfigProvider;
import io.a2a.lite.spec.PushNotificationConfig;
import io.a2a.lite.spec.Task;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts the task snapshot as JSON to the webhook configured for the task. Delivery runs on the
 * sender's executor; {@link #sendNotification(Task)} returns immediately.
 */
public class BasePushNotificationSender implements PushNotificationSender {

    private static final Logger LOGGER = LoggerFactory.getLogger(BasePushNotificationSender.class);

    public static final String PUSH_TIMEOUT_MS = "a2a.push.timeout-ms";

    private final PushNotificationConfigStore configStore;
    private final A2AHttpClient httpClient;
    private final Executor executor;

    public BasePushNotificationSender(PushNotificationConfigStore configStore, A2AHttpClient httpClient,
                                      Executor executor) {
        this.configStore = Assert.checkNotNullParam("configStore", configStore);
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
        this.executor = Assert.checkNotNullParam("executor", executor);
    }

    public BasePushNotificationSender(PushNotificationConfigStore configStore, A2AConfigProvider configProvider) {
        this(configStore,
                new JdkA2AHttpClient(Duration.ofMillis(configProvider.getLongValue(PUSH_TIMEOUT_MS))),
                ForkJoinPool.commonPool());
    }

    @Override
    public void sendNotification(Task task) {
        PushNotificationConfig pushConfig = configStore.getInfo(task.id());
        if (pushConfig == null) {
            return;
        }
        CompletableFuture.supplyAsync(() -> dispatchNotification(task, pushConfig), executor)
                .whenComplete((sent, throwable) -> {
                    if (throwable != null) {
                        LOGGER.warn("Push notification failed for taskId {}: {}", task.id(), throwable.getMessage(),
                                throwable);
                    } else if (!sent) {
                        LOGGER.warn("Push notification failed to send for taskId: {}", task.id());
                    }
                });
    }

    boolean dispatchNotification(Task task, PushNotificationConfig pushInfo) {
        final String url = pushInfo.url();
        final String token = pushInfo.token();

        String body;
        try {
            body = Utils.toJsonString(task);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Error writing value as string: {}", e.getMessage(), e);
            return false;
        }

        A2AHttpClient.PostBuilder postBuilder = httpClient.createPost()
                .url(url)
                .addHeader(A2AHttpClient.CONTENT_TYPE, A2AHttpClient.APPLICATION_JSON_UTF8)
                .body(body);
        if (token != null && !token.isBlank()) {
            postBuilder.addHeader(A2AHttpClient.AUTHORIZATION, "Bearer " + token);
        }

        try {
            A2AHttpResponse response = postBuilder.post();
            if (!response.success()) {
                LOGGER.debug("Push notification to {} answered with status {}", url, response.status());
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Interrupted while pushing data to {}", url);
            return false;
        } catch (Exception e) {
            LOGGER.debug("Error pushing data to {}: {}", url, e.getMessage(), e);
            return false;
        }
        return true;
    }
}
