package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.Diagnostics;
import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import jdk.jshell.Diag;
import jdk.jshell.EvalException;
import jdk.jshell.JShell;
import jdk.jshell.JShellException;
import jdk.jshell.Snippet;
import jdk.jshell.SnippetEvent;
import jdk.jshell.SourceCodeAnalysis;
import jdk.jshell.SourceCodeAnalysis.Completeness;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Runs Java snippets with JShell's local execution engine, inside the
 * current (worker) JVM.
 *
 * Each call gets a brand-new JShell, so nothing declared by one request is
 * visible to the next. The source is split into snippets with JShell's own
 * source analysis and evaluated in order; evaluation stops at the first
 * snippet that throws or fails to compile, like a script would.
 *
 * System.out and System.err are swapped for in-memory buffers while the
 * snippets run and always restored afterwards. That redirection is
 * process-wide, which is why this runner only ever executes inside a worker
 * process that runs one request at a time.
 */
public class EmbeddedJavaRunner implements LanguageRunner {

    private static final String EXECUTION_ENGINE = "local";

    @Override
    public ExecutionResult run(String source) {
        ByteArrayOutputStream stdoutBuffer = new ByteArrayOutputStream();
        ByteArrayOutputStream stderrBuffer = new ByteArrayOutputStream();
        PrintStream capturedOut = new PrintStream(stdoutBuffer, true, StandardCharsets.UTF_8);
        PrintStream capturedErr = new PrintStream(stderrBuffer, true, StandardCharsets.UTF_8);

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        String failure;

        System.setOut(capturedOut);
        System.setErr(capturedErr);
        try (JShell shell = JShell.builder()
                .executionEngine(EXECUTION_ENGINE)
                .in(InputStream.nullInputStream())
                .out(capturedOut)
                .err(capturedErr)
                .build()) {
            failure = evaluate(shell, source);
        } catch (RuntimeException e) {
            // JShell itself broke (e.g. compiler unavailable); report it with whatever was printed so far.
            capturedOut.flush();
            return new ExecutionResult(false, stdoutBuffer.toString(StandardCharsets.UTF_8),
                    Diagnostics.withTraceback("Embedded interpreter failed: " + e.getMessage(), e),
                    FailureKind.INFRASTRUCTURE);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }

        capturedOut.flush();
        capturedErr.flush();
        String stdout = stdoutBuffer.toString(StandardCharsets.UTF_8);
        String stderr = stderrBuffer.toString(StandardCharsets.UTF_8);

        if (failure == null) {
            return ExecutionResult.ok(stdout, stderr);
        }
        return ExecutionResult.codeFailure(stdout, failure);
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    /** Evaluates every snippet in order; returns the error text of the first failure, or null. */
    private String evaluate(JShell shell, String source) {
        SourceCodeAnalysis analysis = shell.sourceCodeAnalysis();
        String remaining = source;

        while (!remaining.isBlank()) {
            SourceCodeAnalysis.CompletionInfo info = analysis.analyzeCompletion(remaining);
            Completeness completeness = info.completeness();
            if (completeness == Completeness.EMPTY) {
                break;
            }

            String snippetSource;
            if (completeness.isComplete()) {
                snippetSource = info.source();
                remaining     = info.remaining();
            } else {
                // Incomplete or unparseable tail: hand it over whole so the compiler reports it.
                snippetSource = remaining;
                remaining     = "";
            }

            for (SnippetEvent event : shell.eval(snippetSource)) {
                String error = describeFailure(shell, event);
                if (error != null) {
                    return error;
                }
            }
        }
        return null;
    }

    private static String describeFailure(JShell shell, SnippetEvent event) {
        // Events for dependent snippets (causeSnippet != null) are side effects, not failures.
        if (event.causeSnippet() != null) {
            return null;
        }
        JShellException thrown = event.exception();
        if (thrown != null) {
            return describeException(thrown, event.snippet());
        }
        if (event.status() == Snippet.Status.REJECTED) {
            return describeRejection(shell, event.snippet());
        }
        return null;
    }

    private static String describeException(JShellException thrown, Snippet snippet) {
        String header;
        if (thrown instanceof EvalException eval) {
            header = eval.getMessage() == null
                    ? eval.getExceptionClassName()
                    : eval.getExceptionClassName() + ": " + eval.getMessage();
        } else {
            header = "Unresolved reference in: " + snippet.source().strip();
        }
        return Diagnostics.withTraceback(header, thrown);
    }

    private static String describeRejection(JShell shell, Snippet snippet) {
        String diagnostics = shell.diagnostics(snippet)
                .map(EmbeddedJavaRunner::formatDiag)
                .collect(Collectors.joining("\n"));
        return "Compilation failed:\n" + snippet.source().strip()
                + (diagnostics.isEmpty() ? "" : "\n" + diagnostics);
    }

    private static String formatDiag(Diag diag) {
        return (diag.isError() ? "error: " : "warning: ") + diag.getMessage(Locale.ROOT);
    }
}
