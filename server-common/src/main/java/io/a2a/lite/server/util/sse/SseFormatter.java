package io.a2a.lite.server.util.sse;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.Utils;

/**
 * Encodes task events as Server-Sent Events frames.
 * <p>
 * A frame is an {@code event:} line naming the event type, one {@code data:} line per line of
 * the JSON payload, and a terminating blank line.
 */
public final class SseFormatter {

    public static final String CLOSE_EVENT = "close";

    private SseFormatter() {
    }

    /**
     * @param event the event to encode
     * @return the frame
     * @throws JsonProcessingException if the event cannot be serialised
     */
    public static String format(TaskEvent event) throws JsonProcessingException {
        Assert.checkNotNullParam("event", event);
        return frame(event.eventType(), Utils.toJsonString(event));
    }

    /**
     * Builds the frame telling the client that the stream is over.
     *
     * @param taskId the task whose stream ends
     * @param reason why the stream ends, e.g. the task's final state
     * @return the frame
     */
    public static String formatClose(String taskId, String reason) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("reason", reason);
        try {
            return frame(CLOSE_EVENT, Utils.toJsonString(payload));
        } catch (JsonProcessingException e) {
            // a map of strings always serialises
            throw new IllegalStateException(e);
        }
    }

    /**
     * @param eventType the event name
     * @param data the payload, split into one {@code data:} line per line
     * @return the frame
     */
    public static String frame(String eventType, String data) {
        Assert.checkNotNullParam("eventType", eventType);
        Assert.checkNotNullParam("data", data);
        StringBuilder frame = new StringBuilder();
        frame.append("event: ").append(eventType).append('\n');
        for (String line : data.split("\r\n|\r|\n", -1)) {
            frame.append("data: ").append(line).append('\n');
        }
        frame.append('\n');
        return frame.toString();
    }
}
