package io.taskrelay.spec;

import org.jspecify.annotations.Nullable;

/**
 * Sends a message and waits for the task or message the agent answers with.
 */
public final class SendMessageRequest extends JSONRPCRequest<MessageSendParams> {

    public static final String METHOD = "message/send";

    public SendMessageRequest(@Nullable String jsonrpc, @Nullable Object id, MessageSendParams params) {
        super(jsonrpc, id, METHOD, params);
    }

    public SendMessageRequest(@Nullable Object id, MessageSendParams params) {
        this(JSONRPC_VERSION, id, params);
    }
}
