package io.a2a.lite.client.http.sse;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.a2a.lite.util.Assert;

/**
 * One decoded Server-Sent Event: the event name and the raw payload bytes.
 *
 * @param eventType the value of the {@code event:} field, {@value SseEventReader#DEFAULT_EVENT_TYPE} when absent
 * @param data the payload, the {@code data:} lines joined with {@code \n}; may be empty
 */
public record ServerSentEvent(String eventType, byte[] data) {

    public ServerSentEvent {
        Assert.checkNotNullParam("eventType", eventType);
        Assert.checkNotNullParam("data", data);
    }

    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public boolean hasData() {
        return data.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerSentEvent other)) {
            return false;
        }
        return eventType.equals(other.eventType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * eventType.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ServerSentEvent{eventType=" + eventType + ", data=" + dataAsString() + "}";
    }
}
