package io.a2a.lite.client.http;

import java.io.InputStream;

import org.jspecify.annotations.Nullable;

/**
 * An HTTP response whose body has not been read yet.
 * <p>
 * The body stream belongs to whoever holds this response. {@link #close()} releases the
 * underlying connection and must be called on every path, including error paths.
 */
public interface A2AHttpStreamResponse extends AutoCloseable {

    int status();

    default boolean success() {
        return status() >= 200 && status() < 300;
    }

    @Nullable String header(String name);

    /**
     * @return the response body; reads block until data arrives
     */
    InputStream body();

    @Override
    void close();
}
