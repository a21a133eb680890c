package io.a2a.lite.transport.jsonrpc.handler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.a2a.lite.server.util.sse.SseFormatter;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.TaskStatusUpdateEvent;
import io.a2a.lite.util.EventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a streaming result to an HTTP response body as Server-Sent Events.
 * <p>
 * Every event is written as its own frame and flushed. When the subscription ends a {@code close}
 * frame is written whose reason is the task's final state. If the client goes away the
 * subscription is cancelled, which removes it from the task's subscribers.
 */
public class SseResponseWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseResponseWriter.class);

    public static final String CONTENT_TYPE = "text/event-stream";
    public static final String STREAM_ENDED = "stream ended";

    /**
     * Writes events until the subscription ends or the client goes away.
     *
     * @param result the streaming result returned by {@link JSONRPCHandler}
     * @param out the response body
     * @return {@code true} if the stream was written to its end, {@code false} if it was cut short
     */
    public boolean write(JSONRPCHandlerResult.Streaming result, OutputStream out) {
        EventChannel<TaskEvent> events = result.events();
        String taskId = result.taskId();
        String reason = STREAM_ENDED;
        try {
            TaskEvent event;
            while ((event = events.receive()) != null) {
                String frame;
                try {
                    frame = SseFormatter.format(event);
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Skipping {} event of task {} that cannot be serialised: {}",
                            event.eventType(), taskId, e.getOriginalMessage());
                    continue;
                }
                writeFrame(out, frame);
                if (event.isFinal() && event instanceof TaskStatusUpdateEvent statusEvent) {
                    reason = statusEvent.status().state().asString();
                }
            }
            writeFrame(out, SseFormatter.formatClose(taskId, reason));
            LOGGER.debug("Event stream of task {} closed: {}", taskId, reason);
            return true;
        } catch (IOException e) {
            LOGGER.debug("Client of task {} went away: {}", taskId, e.getMessage());
            events.cancel();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.cancel();
            return false;
        }
    }

    private static void writeFrame(OutputStream out, String frame) throws IOException {
        out.write(frame.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
