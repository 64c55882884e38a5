/**
 * JSON-RPC 2.0 binding of the request handler.
 *
 * <h2>Methods</h2>
 * <ul>
 *   <li>{@code message/send} - send a message, answered with a task or a message</li>
 *   <li>{@code message/stream} - send a message, answered with a stream of task events</li>
 *   <li>{@code tasks/get} - read a task</li>
 *   <li>{@code tasks/cancel} - cancel a task</li>
 *   <li>{@code tasks/resubscribe} - re-attach to the event stream of a running task</li>
 * </ul>
 *
 * @see io.taskrelay.transport.jsonrpc.handler.JSONRPCDispatcher
 */
@NullMarked
package io.taskrelay.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
