package com.codesandbox.engine.api.dto;

import com.codesandbox.engine.model.ExecutionResult;

/** {@code data} of a completed run; {@code error} is "" when there is none. */
public record RunCodeData(String stdout, String error) {

    public static RunCodeData from(ExecutionResult result) {
        return new RunCodeData(result.stdout(), result.errorOrEmpty());
    }
}
