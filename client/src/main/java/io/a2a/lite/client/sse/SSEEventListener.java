package io.a2a.lite.client.sse;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.a2a.lite.client.http.A2AHttpStreamResponse;
import io.a2a.lite.client.http.sse.ServerSentEvent;
import io.a2a.lite.client.http.sse.SseEventReader;
import io.a2a.lite.spec.TaskArtifactUpdateEvent;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.TaskStatusUpdateEvent;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.EventChannel;
import io.a2a.lite.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the task events of one streaming response and pushes them onto the caller's channel.
 * <p>
 * Status and artifact events are decoded into {@link TaskEvent}s. An event whose JSON cannot be
 * decoded, or whose type is unknown, is skipped with a warning and the stream goes on. A
 * {@value #CLOSE_EVENT} event ends the stream at once. The channel is completed and the
 * response closed when the stream ends for any reason.
 */
public class SSEEventListener implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SSEEventListener.class);

    public static final String CLOSE_EVENT = "close";

    private final String streamId;
    private final A2AHttpStreamResponse response;
    private final EventChannel<TaskEvent> channel;

    public SSEEventListener(String streamId, A2AHttpStreamResponse response, EventChannel<TaskEvent> channel) {
        this.streamId = Assert.checkNotNullParam("streamId", streamId);
        this.response = Assert.checkNotNullParam("response", response);
        this.channel = Assert.checkNotNullParam("channel", channel);
    }

    @Override
    public void run() {
        try (SseEventReader reader = new SseEventReader(response.body())) {
            ServerSentEvent event;
            while (!channel.isCancelled() && (event = reader.next()) != null) {
                if (CLOSE_EVENT.equals(event.eventType())) {
                    LOGGER.debug("Stream {} closed by server: {}", streamId, event.dataAsString());
                    return;
                }
                TaskEvent taskEvent = decode(event);
                if (taskEvent != null && !channel.send(taskEvent)) {
                    return;
                }
            }
            LOGGER.debug("Stream {} ended", streamId);
        } catch (IOException e) {
            if (!channel.isCancelled()) {
                LOGGER.warn("Stream {} failed: {}", streamId, e.getMessage(), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            response.close();
            channel.complete();
        }
    }

    private @Nullable TaskEvent decode(ServerSentEvent event) {
        Class<? extends TaskEvent> type = switch (event.eventType()) {
            case TaskStatusUpdateEvent.STATUS_UPDATE -> TaskStatusUpdateEvent.class;
            case TaskArtifactUpdateEvent.ARTIFACT_UPDATE -> TaskArtifactUpdateEvent.class;
            default -> null;
        };
        if (type == null) {
            LOGGER.warn("Skipping event of unknown type '{}' in stream {}", event.eventType(), streamId);
            return null;
        }
        try {
            return Utils.OBJECT_MAPPER.readValue(event.data(), type);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Skipping malformed {} event in stream {}: {}", event.eventType(), streamId,
                    event.dataAsString());
            return null;
        } catch (IOException e) {
            LOGGER.warn("Skipping unreadable {} event in stream {}: {}", event.eventType(), streamId, e.getMessage());
            return null;
        }
    }
}
