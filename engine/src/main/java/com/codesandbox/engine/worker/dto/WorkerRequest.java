package com.codesandbox.engine.worker.dto;

/**
 * One line sent to a worker process on its stdin.
 *
 * @param id       echoed back in the response so stale replies are detected
 * @param language wire tag, e.g. "java" or "nodejs"
 * @param source   the snippet to run
 */
public record WorkerRequest(
        String id,
        String language,
        String source
) {}
