package io.a2a.lite.transport.jsonrpc.handler;

import io.a2a.lite.spec.JSONRPCResponse;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.util.EventChannel;

/**
 * What the HTTP layer sends back for one JSON-RPC request: a single JSON response, or a stream of
 * task events to be written as Server-Sent Events.
 */
public sealed interface JSONRPCHandlerResult {

    /**
     * @param response the response to send as {@code application/json}
     */
    record Unary(JSONRPCResponse response) implements JSONRPCHandlerResult {
    }

    /**
     * @param requestId the ID of the request that opened the stream
     * @param taskId the task whose events are streamed
     * @param events the subscription; cancelling it unsubscribes
     */
    record Streaming(Object requestId, String taskId, EventChannel<TaskEvent> events) implements JSONRPCHandlerResult {
    }
}
