package io.a2a.lite.client;

import static io.a2a.lite.client.http.A2AHttpClient.ACCEPT;
import static io.a2a.lite.client.http.A2AHttpClient.APPLICATION_JSON;
import static io.a2a.lite.client.http.A2AHttpClient.APPLICATION_JSON_UTF8;
import static io.a2a.lite.client.http.A2AHttpClient.CONTENT_TYPE;
import static io.a2a.lite.client.http.A2AHttpClient.EVENT_STREAM;
import static io.a2a.lite.client.http.A2AHttpClient.USER_AGENT;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.a2a.lite.client.http.A2AHttpClient;
import io.a2a.lite.client.http.A2AHttpResponse;
import io.a2a.lite.client.http.A2AHttpStreamResponse;
import io.a2a.lite.client.http.jdk.JdkA2AHttpClient;
import io.a2a.lite.client.sse.SSEEventListener;
import io.a2a.lite.spec.A2AClientException;
import io.a2a.lite.spec.A2AError;
import io.a2a.lite.spec.A2AMethods;
import io.a2a.lite.spec.JSONRPCRequest;
import io.a2a.lite.spec.JSONRPCResponse;
import io.a2a.lite.spec.Task;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.TaskIdParams;
import io.a2a.lite.spec.TaskPushNotificationConfig;
import io.a2a.lite.spec.TaskQueryParams;
import io.a2a.lite.spec.TaskSendParams;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.EventChannel;
import io.a2a.lite.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for an agent speaking the task protocol over JSON-RPC.
 *
 * <p>The unary calls block until the agent answers. They return the decoded result, throw the
 * {@link A2AError} subclass matching an error reported by the agent, or throw
 * {@link A2AClientException} when the call fails below the protocol level.
 *
 * <p>The streaming calls check the response before returning: anything other than a
 * {@code 200} {@code text/event-stream} response fails with {@link A2AClientException}. Events are
 * then read on a background thread and delivered on the returned channel, which is completed
 * when the stream ends. Cancelling the channel stops the reader and releases the connection;
 * the agent is not told.
 *
 * <pre>{@code
 * try (A2AClient client = new A2AClient("http://localhost:9999/")) {
 *     EventChannel<TaskEvent> events = client.streamTask(
 *             new TaskSendParams("task-1", null, Message.text(Message.Role.USER, "hello")));
 *     for (TaskEvent event : events) {
 *         // handle event
 *     }
 * }
 * }</pre>
 */
public class A2AClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AClient.class);

    private static final int MAX_ERROR_BODY_BYTES = 64 * 1024;

    private static final TypeReference<JSONRPCResponse> JSONRPC_RESPONSE_REFERENCE = new TypeReference<>() {};

    private final String agentUrl;
    private final A2AClientConfig config;
    private final A2AHttpClient httpClient;
    private final ExecutorService streamExecutor;

    public A2AClient(String agentUrl) {
        this(agentUrl, A2AClientConfig.builder().build());
    }

    public A2AClient(String agentUrl, A2AClientConfig config) {
        this(agentUrl, config, new JdkA2AHttpClient(config.getTimeout()));
    }

    public A2AClient(String agentUrl, A2AClientConfig config, A2AHttpClient httpClient) {
        this.agentUrl = Assert.checkNotBlankParam("agentUrl", agentUrl);
        this.config = Assert.checkNotNullParam("config", config);
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
        this.streamExecutor = Executors.newCachedThreadPool(new StreamThreadFactory());
    }

    public String getAgentUrl() {
        return agentUrl;
    }

    /**
     * Creates a task, or sends a follow-up message to an existing one ({@code tasks/send}).
     */
    public Task sendTask(TaskSendParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return call(A2AMethods.SEND_TASK, params.id(), params, Task.class);
    }

    /**
     * Gets a task ({@code tasks/get}).
     */
    public Task getTask(TaskQueryParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK, params.id(), params, Task.class);
    }

    /**
     * Cancels a task ({@code tasks/cancel}).
     */
    public Task cancelTask(TaskIdParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return call(A2AMethods.CANCEL_TASK, params.id(), params, Task.class);
    }

    public TaskPushNotificationConfig setTaskPushNotification(TaskPushNotificationConfig params)
            throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return call(A2AMethods.SET_TASK_PUSH_NOTIFICATION, params.id(), params, TaskPushNotificationConfig.class);
    }

    public TaskPushNotificationConfig getTaskPushNotification(TaskIdParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK_PUSH_NOTIFICATION, params.id(), params, TaskPushNotificationConfig.class);
    }

    /**
     * Creates or resumes a task and streams its events ({@code tasks/sendSubscribe}).
     *
     * @return the events; completed when the stream ends
     * @throws A2AClientException if the request fails or the agent does not answer with an event stream
     */
    public EventChannel<TaskEvent> streamTask(TaskSendParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return stream(A2AMethods.SEND_TASK_SUBSCRIBE, params.id(), params);
    }

    /**
     * Streams the future events of an existing task ({@code tasks/resubscribe}). For a final task
     * the agent sends a single final status event.
     */
    public EventChannel<TaskEvent> resubscribeTask(TaskIdParams params) throws A2AClientException {
        Assert.checkNotNullParam("params", params);
        return stream(A2AMethods.RESUBSCRIBE_TASK, params.id(), params);
    }

    /**
     * Stops the readers of all open streams.
     */
    @Override
    public void close() {
        streamExecutor.shutdownNow();
    }

    private <T> T call(String method, String id, Object params, Class<T> resultType) throws A2AClientException {
        String body = toRequestBody(method, id, params);
        LOGGER.debug("A2A client request -> method: {}, id: {}, url: {}", method, id, agentUrl);

        A2AHttpResponse response;
        try {
            response = createPost(body)
                    .addHeader(ACCEPT, APPLICATION_JSON)
                    .post();
        } catch (IOException e) {
            throw new A2AClientException("Failed to send " + method + " request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientException("Interrupted while sending " + method + " request", e);
        }
        LOGGER.debug("A2A client response <- status: {}, id: {}", response.status(), id);

        if (!response.success()) {
            throw new A2AClientException("Unexpected HTTP status " + response.status() + " for " + method
                    + ": " + response.body());
        }
        JSONRPCResponse envelope;
        try {
            envelope = Utils.unmarshalFrom(response.body(), JSONRPC_RESPONSE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Malformed JSON-RPC response for " + method + ": " + e.getOriginalMessage(), e);
        }
        if (envelope.error() != null) {
            throw A2AError.fromJSONRPCError(envelope.error());
        }
        if (envelope.result() == null) {
            throw new A2AClientException("JSON-RPC response for " + method + " has neither result nor error");
        }
        try {
            return Utils.OBJECT_MAPPER.treeToValue(envelope.result(), resultType);
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Malformed " + method + " result: " + e.getOriginalMessage(), e);
        }
    }

    private EventChannel<TaskEvent> stream(String method, String id, Object params) throws A2AClientException {
        String body = toRequestBody(method, id, params);
        LOGGER.debug("A2A client stream request -> method: {}, id: {}, url: {}", method, id, agentUrl);

        A2AHttpStreamResponse response;
        try {
            response = createPost(body)
                    .addHeader(ACCEPT, EVENT_STREAM)
                    .postForStream();
        } catch (IOException e) {
            throw new A2AClientException("Failed to send " + method + " request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientException("Interrupted while sending " + method + " request", e);
        }

        try {
            checkStreamResponse(method, response);
        } catch (A2AClientException e) {
            response.close();
            throw e;
        }
        LOGGER.debug("A2A client stream response <- status: {}, id: {}. Stream established.", response.status(), id);

        EventChannel<TaskEvent> channel = new EventChannel<>(config.getStreamBufferSize());
        Future<?> reader;
        try {
            reader = streamExecutor.submit(new SSEEventListener(id, response, channel));
        } catch (RejectedExecutionException e) {
            response.close();
            throw new A2AClientException("Client is closed", e);
        }
        channel.onCancel(() -> {
            reader.cancel(true);
            response.close();
        });
        return channel;
    }

    private void checkStreamResponse(String method, A2AHttpStreamResponse response) throws A2AClientException {
        String contentType = response.header(CONTENT_TYPE);
        if (response.status() != HttpURLConnection.HTTP_OK) {
            A2AError error = readServerError(contentType, response);
            throw streamSetupFailure("Unexpected HTTP status " + response.status() + " for " + method, error);
        }
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains(EVENT_STREAM)) {
            A2AError error = readServerError(contentType, response);
            throw streamSetupFailure("Expected " + EVENT_STREAM + " response for " + method + " but got "
                    + contentType, error);
        }
    }

    private static A2AClientException streamSetupFailure(String message, @Nullable A2AError error) {
        if (error == null) {
            return new A2AClientException(message);
        }
        return new A2AClientException(message + ": " + error.getMessage(), error);
    }

    /**
     * Reads the JSON-RPC error an agent may send instead of an event stream. Only JSON bodies are
     * read, at most {@value #MAX_ERROR_BODY_BYTES} bytes and within the client timeout, so a body
     * that never ends cannot hold up the caller. The caller closes the response afterwards.
     */
    private @Nullable A2AError readServerError(@Nullable String contentType, A2AHttpStreamResponse response) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(APPLICATION_JSON)) {
            return null;
        }
        Future<byte[]> read;
        try {
            read = streamExecutor.submit(() -> {
                try (InputStream in = response.body()) {
                    return in.readNBytes(MAX_ERROR_BODY_BYTES);
                }
            });
        } catch (RejectedExecutionException e) {
            return null;
        }
        try {
            byte[] body = read.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            JSONRPCResponse envelope = Utils.unmarshalFrom(new String(body, StandardCharsets.UTF_8),
                    JSONRPC_RESPONSE_REFERENCE);
            return envelope.error() != null ? A2AError.fromJSONRPCError(envelope.error()) : null;
        } catch (TimeoutException e) {
            read.cancel(true);
            LOGGER.debug("Gave up reading the error body after {}", config.getTimeout());
            return null;
        } catch (InterruptedException e) {
            read.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException | IOException | RuntimeException e) {
            LOGGER.debug("No JSON-RPC error in non-stream response: {}", e.getMessage());
            return null;
        }
    }

    private A2AHttpClient.PostBuilder createPost(String body) {
        return httpClient.createPost()
                .url(agentUrl)
                .addHeaders(config.getHeaders())
                .addHeader(CONTENT_TYPE, APPLICATION_JSON_UTF8)
                .addHeader(USER_AGENT, config.getUserAgent())
                .body(body);
    }

    private static String toRequestBody(String method, String id, Object params) throws A2AClientException {
        try {
            return Utils.toJsonString(JSONRPCRequest.of(id, method, params));
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Failed to prepare " + method + " request: " + e.getOriginalMessage(), e);
        }
    }

    private static final class StreamThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "a2a-client-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
