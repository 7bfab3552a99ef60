package com.codesandbox.engine.api.dto;

/**
 * Envelope of every response under /v1/sandbox.
 *
 * code 0 means the request was handled (the snippet itself may still have
 * failed; see data.error). Negative codes mirror the HTTP status of the
 * refusal, e.g. -401, -422, -503. -400 is the one refusal sent with HTTP 200:
 * an unsupported language.
 */
public record ApiResponse<T>(int code, String message, T data) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(0, "success", data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }
}
