package io.a2a.lite.server.tasks;

import java.time.Duration;

import io.a2a.lite.server.config.A2AConfigProvider;
import io.a2a.lite.server.config.DefaultValuesConfigProvider;

/**
 * Settings of an {@link InMemoryTaskManager}.
 *
 * @param subscriberBufferSize capacity of each streaming subscriber's channel
 * @param subscriberSendTimeout how long a broadcast waits on a full subscriber before dropping it
 * @param processorThreads number of threads of the default processor executor
 */
public record TaskManagerConfig(int subscriberBufferSize, Duration subscriberSendTimeout, int processorThreads) {

    public static final String SUBSCRIBER_BUFFER_SIZE = "a2a.tasks.subscriber-buffer-size";
    public static final String SUBSCRIBER_SEND_TIMEOUT_MS = "a2a.tasks.subscriber-send-timeout-ms";
    public static final String PROCESSOR_THREADS = "a2a.tasks.processor-threads";

    public TaskManagerConfig {
        if (subscriberBufferSize <= 0) {
            throw new IllegalArgumentException("subscriberBufferSize must be greater than 0");
        }
        if (subscriberSendTimeout == null || subscriberSendTimeout.isNegative()) {
            throw new IllegalArgumentException("subscriberSendTimeout must not be negative");
        }
        if (processorThreads <= 0) {
            throw new IllegalArgumentException("processorThreads must be greater than 0");
        }
    }

    public static TaskManagerConfig fromConfig(A2AConfigProvider configProvider) {
        return new TaskManagerConfig(
                configProvider.getIntValue(SUBSCRIBER_BUFFER_SIZE),
                Duration.ofMillis(configProvider.getLongValue(SUBSCRIBER_SEND_TIMEOUT_MS)),
                configProvider.getIntValue(PROCESSOR_THREADS));
    }

    public static TaskManagerConfig defaults() {
        return fromConfig(new DefaultValuesConfigProvider());
    }
}
