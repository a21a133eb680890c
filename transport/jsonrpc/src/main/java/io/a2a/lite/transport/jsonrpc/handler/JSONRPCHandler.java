package io.a2a.lite.transport.jsonrpc.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.lite.server.tasks.TaskManager;
import io.a2a.lite.spec.A2AError;
import io.a2a.lite.spec.A2AMethods;
import io.a2a.lite.spec.InternalError;
import io.a2a.lite.spec.InvalidParamsError;
import io.a2a.lite.spec.InvalidRequestError;
import io.a2a.lite.spec.JSONParseError;
import io.a2a.lite.spec.JSONRPCMessage;
import io.a2a.lite.spec.JSONRPCResponse;
import io.a2a.lite.spec.MethodNotFoundError;
import io.a2a.lite.spec.TaskIdParams;
import io.a2a.lite.spec.TaskPushNotificationConfig;
import io.a2a.lite.spec.TaskQueryParams;
import io.a2a.lite.spec.TaskSendParams;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 transport handler for the task protocol.
 *
 * <p>The handler parses a request body, binds the parameters of the requested method, and
 * calls the matching {@link TaskManager} operation. It does not deal with HTTP itself: the host
 * sends a {@link JSONRPCHandlerResult.Unary} as {@code application/json} and writes a
 * {@link JSONRPCHandlerResult.Streaming} with {@link SseResponseWriter}.
 *
 * <h2>Error Handling</h2>
 * <p>Every {@link A2AError} becomes a JSON-RPC error response carrying its code. Malformed JSON,
 * malformed envelopes, unknown methods and unbindable parameters map to the standard JSON-RPC
 * codes. Any other exception is logged and answered with an {@link InternalError}.
 *
 * <p>A streaming method that fails before the stream exists (e.g. resubscribing to an unknown
 * task) is answered with a unary error response.
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    private final TaskManager taskManager;

    public JSONRPCHandler(TaskManager taskManager) {
        this.taskManager = Assert.checkNotNullParam("taskManager", taskManager);
    }

    public JSONRPCHandlerResult handle(String body) {
        JsonNode root;
        try {
            root = Utils.OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return error(null, new JSONParseError(e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return error(null, new InvalidRequestError("request must be a JSON object"));
        }

        JsonNode idNode = root.get("id");
        Object id;
        if (idNode == null || idNode.isNull()) {
            id = null;
        } else if (idNode.isTextual()) {
            id = idNode.asText();
        } else if (idNode.isIntegralNumber()) {
            id = idNode.longValue();
        } else {
            return error(null, new InvalidRequestError("'id' must be a string or an integer"));
        }

        JsonNode version = root.get("jsonrpc");
        if (version == null || !JSONRPCMessage.JSONRPC_VERSION.equals(version.asText())) {
            return error(id, new InvalidRequestError("'jsonrpc' must be \"" + JSONRPCMessage.JSONRPC_VERSION + "\""));
        }
        JsonNode methodNode = root.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            return error(id, new InvalidRequestError("'method' is required"));
        }
        String method = methodNode.asText();
        LOGGER.debug("Handling {} (id {})", method, id);

        try {
            return dispatch(id, method, root.get("params"));
        } catch (A2AError e) {
            return error(id, e);
        } catch (Throwable t) {
            LOGGER.error("Unexpected error handling {} (id {})", method, id, t);
            return error(id, new InternalError(t.getMessage()));
        }
    }

    private JSONRPCHandlerResult dispatch(@Nullable Object id, String method, @Nullable JsonNode params) {
        switch (method) {
            case A2AMethods.SEND_TASK:
                return success(id, taskManager.onSendTask(bind(params, TaskSendParams.class)));
            case A2AMethods.GET_TASK:
                return success(id, taskManager.onGetTask(bind(params, TaskQueryParams.class)));
            case A2AMethods.CANCEL_TASK:
                return success(id, taskManager.onCancelTask(bind(params, TaskIdParams.class)));
            case A2AMethods.SET_TASK_PUSH_NOTIFICATION:
                return success(id, taskManager.onPushNotificationSet(bind(params, TaskPushNotificationConfig.class)));
            case A2AMethods.GET_TASK_PUSH_NOTIFICATION:
                return success(id, taskManager.onPushNotificationGet(bind(params, TaskIdParams.class)));
            case A2AMethods.SEND_TASK_SUBSCRIBE: {
                TaskSendParams sendParams = bind(params, TaskSendParams.class);
                return new JSONRPCHandlerResult.Streaming(streamId(id, sendParams.id()), sendParams.id(),
                        taskManager.onSendTaskSubscribe(sendParams));
            }
            case A2AMethods.RESUBSCRIBE_TASK: {
                TaskIdParams idParams = bind(params, TaskIdParams.class);
                return new JSONRPCHandlerResult.Streaming(streamId(id, idParams.id()), idParams.id(),
                        taskManager.onResubscribe(idParams));
            }
            default:
                throw new MethodNotFoundError(method);
        }
    }

    private static Object streamId(@Nullable Object id, String taskId) {
        return id != null ? id : taskId;
    }

    private static <T> T bind(@Nullable JsonNode params, Class<T> type) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            throw new InvalidParamsError("params are required");
        }
        try {
            return Utils.OBJECT_MAPPER.treeToValue(params, type);
        } catch (JsonProcessingException e) {
            throw new InvalidParamsError(e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsError(e.getMessage());
        }
    }

    private static JSONRPCHandlerResult success(@Nullable Object id, Object result) {
        return new JSONRPCHandlerResult.Unary(JSONRPCResponse.success(id, result));
    }

    private static JSONRPCHandlerResult error(@Nullable Object id, A2AError error) {
        LOGGER.debug("Answering request {} with {}", id, error.toString());
        return new JSONRPCHandlerResult.Unary(JSONRPCResponse.failure(id, error));
    }
}
