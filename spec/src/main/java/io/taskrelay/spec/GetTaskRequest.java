package io.taskrelay.spec;

import org.jspecify.annotations.Nullable;

/**
 * Reads the stored state of a task.
 */
public final class GetTaskRequest extends JSONRPCRequest<TaskQueryParams> {

    public static final String METHOD = "tasks/get";

    public GetTaskRequest(@Nullable String jsonrpc, @Nullable Object id, TaskQueryParams params) {
        super(jsonrpc, id, METHOD, params);
    }

    public GetTaskRequest(@Nullable Object id, TaskQueryParams params) {
        this(JSONRPC_VERSION, id, params);
    }
}
