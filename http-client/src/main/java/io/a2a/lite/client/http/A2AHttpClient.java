package io.a2a.lite.client.http;

import java.io.IOException;
import java.util.Map;

/**
 * HTTP client interface for making JSON-RPC calls to A2A agents.
 *
 * <p>Provides a fluent builder API for POST requests, answered either as a fully read
 * {@link A2AHttpResponse} or as a {@link A2AHttpStreamResponse} whose body is consumed
 * incrementally (used for Server-Sent Events).
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * A2AHttpClient client = new JdkA2AHttpClient();
 *
 * A2AHttpResponse response = client.createPost()
 *     .url("http://localhost:9999/")
 *     .addHeader(CONTENT_TYPE, APPLICATION_JSON)
 *     .body("{\"jsonrpc\":\"2.0\",\"id\":\"t1\",\"method\":\"tasks/get\",\"params\":{\"id\":\"t1\"}}")
 *     .post();
 *
 * try (A2AHttpStreamResponse stream = client.createPost()
 *         .url("http://localhost:9999/")
 *         .addHeader(ACCEPT, EVENT_STREAM)
 *         .body(jsonBody)
 *         .postForStream()) {
 *     SseEventReader reader = new SseEventReader(stream.body());
 *     // read events
 * }
 * }</pre>
 */
public interface A2AHttpClient {

    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** JSON content type value with an explicit charset, as sent by the client. */
    String APPLICATION_JSON_UTF8 = "application/json; charset=utf-8";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** HTTP User-Agent header name. */
    String USER_AGENT = "User-Agent";
    /** HTTP Authorization header name. */
    String AUTHORIZATION = "Authorization";
    /** SSE event stream content type. */
    String EVENT_STREAM = "text/event-stream";

    /**
     * Creates a builder for POST requests.
     *
     * @return a new PostBuilder instance
     */
    PostBuilder createPost();

    /**
     * Builder for HTTP POST requests.
     */
    interface PostBuilder {
        /**
         * Sets the target URL for the request.
         *
         * @param url the URL string
         * @return this builder for chaining
         */
        PostBuilder url(String url);

        /**
         * Adds a single HTTP header to the request.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder for chaining
         */
        PostBuilder addHeader(String name, String value);

        /**
         * Adds multiple HTTP headers to the request.
         *
         * @param headers map of header names to values
         * @return this builder for chaining
         */
        PostBuilder addHeaders(Map<String, String> headers);

        /**
         * Sets the request body content.
         *
         * @param body the request body string (typically JSON)
         * @return this builder for chaining
         */
        PostBuilder body(String body);

        /**
         * Executes the request and reads the whole response body.
         *
         * @return the HTTP response
         * @throws IOException if an I/O error occurs
         * @throws InterruptedException if the operation is interrupted
         */
        A2AHttpResponse post() throws IOException, InterruptedException;

        /**
         * Executes the request and returns as soon as the response headers arrive. The caller
         * owns the returned response and must close it.
         *
         * @return the streaming HTTP response
         * @throws IOException if an I/O error occurs
         * @throws InterruptedException if the operation is interrupted
         */
        A2AHttpStreamResponse postForStream() throws IOException, InterruptedException;
    }
}
