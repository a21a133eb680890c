package io.a2a.lite.client.http;

import org.jspecify.annotations.Nullable;

/**
 * HTTP response wrapper containing status code, headers and the response body.
 */
public interface A2AHttpResponse {
    /**
     * Returns the HTTP status code.
     *
     * @return the HTTP status code (e.g., 200, 404, 500)
     */
    int status();

    /**
     * Indicates whether the request was successful.
     *
     * @return {@code true} for 2xx status codes, {@code false} otherwise
     */
    default boolean success() {
        return status() >= 200 && status() < 300;
    }

    /**
     * Returns the first value of a response header.
     *
     * @param name the header name, case-insensitive
     * @return the value, or {@code null} if absent
     */
    @Nullable String header(String name);

    /**
     * Returns the response body content as a string.
     *
     * @return the response body, may be empty but not null
     */
    String body();
}
