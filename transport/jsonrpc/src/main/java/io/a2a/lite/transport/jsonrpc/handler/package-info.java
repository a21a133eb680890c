/**
 * JSON-RPC transport of the task protocol.
 *
 * <h2>Supported Methods</h2>
 * <ul>
 *   <li>{@code tasks/send} - create or resume a task</li>
 *   <li>{@code tasks/get} - get a task</li>
 *   <li>{@code tasks/cancel} - cancel a task</li>
 *   <li>{@code tasks/sendSubscribe} - create or resume a task and stream its events</li>
 *   <li>{@code tasks/resubscribe} - stream the events of an existing task</li>
 *   <li>{@code tasks/pushNotification/set} - store a task's push notification config</li>
 *   <li>{@code tasks/pushNotification/get} - get a task's push notification config</li>
 * </ul>
 *
 * @see io.a2a.lite.transport.jsonrpc.handler.JSONRPCHandler
 */
@NullMarked
package io.a2a.lite.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
