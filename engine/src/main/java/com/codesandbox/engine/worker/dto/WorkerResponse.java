package com.codesandbox.engine.worker.dto;

import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;

/**
 * One line a worker process writes back on its stdout per request.
 *
 * {@code retire} is set when the run left something behind in the worker
 * (a thread started by the snippet that is still alive). The parent must
 * not send that worker another request.
 */
public record WorkerResponse(
        String      id,
        boolean     success,
        String      stdout,
        String      error,
        FailureKind failure,
        boolean     retire
) {
    public static WorkerResponse of(String id, ExecutionResult result) {
        return of(id, result, false);
    }

    public static WorkerResponse of(String id, ExecutionResult result, boolean retire) {
        return new WorkerResponse(id, result.success(), result.stdout(), result.error(), result.failure(), retire);
    }

    public ExecutionResult toResult() {
        return new ExecutionResult(success, stdout, error, failure);
    }
}
