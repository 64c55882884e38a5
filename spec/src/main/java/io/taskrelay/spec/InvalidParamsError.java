package io.taskrelay.spec;

import static io.taskrelay.spec.A2AErrorCodes.INVALID_PARAMS_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The request parameters are invalid.
 */
public class InvalidParamsError extends A2AError {

    public InvalidParamsError() {
        this(null, null);
    }

    public InvalidParamsError(@Nullable String message) {
        this(message, null);
    }

    public InvalidParamsError(@Nullable String message, @Nullable Object data) {
        super(INVALID_PARAMS_ERROR_CODE, message == null ? "Invalid parameters" : message, data);
    }
}
