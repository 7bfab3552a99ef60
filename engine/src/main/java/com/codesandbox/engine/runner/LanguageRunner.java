package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.ExecutionResult;

/**
 * Executes one snippet of source code and reports what happened.
 *
 * Runners are invoked inside a worker process, one call at a time. They
 * must never throw: every failure, including their own plumbing errors, is
 * converted into an unsuccessful {@link ExecutionResult}.
 *
 * This is also the seam for stronger isolation: a container- or
 * namespace-backed runner implements the same contract.
 */
public interface LanguageRunner {

    ExecutionResult run(String source);
}
