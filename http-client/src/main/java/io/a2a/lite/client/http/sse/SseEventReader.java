package io.a2a.lite.client.http.sse;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import io.a2a.lite.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Incremental decoder for a {@code text/event-stream} body.
 * <p>
 * Lines are terminated by {@code \n}, {@code \r\n} or {@code \r}. A blank line dispatches the
 * pending event when it has at least one {@code data:} line or an explicit {@code event:} field.
 * Lines starting with {@code :} are comments. A single space after the colon is stripped from the
 * field value. Fields other than {@code event} and {@code data} are ignored. A frame that is not
 * terminated by a blank line before end of stream is discarded.
 * </p>
 */
public class SseEventReader implements Closeable {

    public static final String DEFAULT_EVENT_TYPE = "message";

    private static final char BOM = '\uFEFF';

    private final BufferedReader reader;
    private boolean firstLine = true;
    private boolean eof;

    public SseEventReader(InputStream inputStream) {
        Assert.checkNotNullParam("inputStream", inputStream);
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    /**
     * Reads the next complete event.
     *
     * @return the event, or {@code null} at end of stream
     * @throws IOException if reading the underlying stream fails
     */
    public @Nullable ServerSentEvent next() throws IOException {
        if (eof) {
            return null;
        }
        String eventType = null;
        StringBuilder data = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (firstLine) {
                firstLine = false;
                if (!line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
            }
            if (line.isEmpty()) {
                if (data != null || eventType != null) {
                    String type = eventType == null || eventType.isEmpty() ? DEFAULT_EVENT_TYPE : eventType;
                    String payload = data == null ? "" : data.toString();
                    return new ServerSentEvent(type, payload.getBytes(StandardCharsets.UTF_8));
                }
                continue;
            }
            if (line.charAt(0) == ':') {
                continue;
            }

            String field;
            String value;
            int colon = line.indexOf(':');
            if (colon < 0) {
                field = line;
                value = "";
            } else {
                field = line.substring(0, colon);
                value = line.substring(colon + 1);
                if (value.startsWith(" ")) {
                    value = value.substring(1);
                }
            }

            switch (field) {
                case "event" -> eventType = value;
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                    // id, retry and unknown fields are not used
                }
            }
        }
        eof = true;
        return null;
    }

    @Override
    public void close() throws IOException {
        eof = true;
        reader.close();
    }
}
