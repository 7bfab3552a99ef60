package com.codesandbox.engine.model;

/**
 * One accepted request to run a snippet.
 *
 * {@code language} is kept exactly as the client sent it so that unsupported
 * tags reach the coordinator's validation. {@code preload} and
 * {@code enableNetwork} are accepted and logged but not enforced by any runner.
 */
public record ExecutionRequest(
        String  language,
        String  source,
        String  preload,
        boolean enableNetwork
) {
    public ExecutionRequest {
        if (source == null) source = "";
    }

    public ExecutionRequest(String language, String source) {
        this(language, source, null, false);
    }
}
