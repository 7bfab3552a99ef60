package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.Diagnostics;
import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Runs a snippet by spawning an external interpreter against a temporary
 * source file.
 *
 * Every run gets its own temporary directory holding the source file and
 * the two capture files the child's stdout and stderr are redirected to.
 * Redirecting to files instead of pipes means both streams are captured in
 * full without a reader thread per stream. The directory is deleted in
 * {@code finally}, including when the interpreter could not be spawned.
 *
 * There is no timeout here: the coordinator's deadline kills the whole
 * worker process tree, this interpreter included.
 */
public class ExternalProcessRunner implements LanguageRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessRunner.class);

    private final Language language;
    private final String   interpreter;
    private final Path     tempRoot;

    /**
     * @param interpreter binary name or path, e.g. "node" or "/usr/bin/python3"
     * @param tempRoot    parent for per-run directories; null means the system temp dir
     */
    public ExternalProcessRunner(Language language, String interpreter, Path tempRoot) {
        this.language    = language;
        this.interpreter = interpreter;
        this.tempRoot    = tempRoot;
    }

    public ExternalProcessRunner(Language language, String interpreter) {
        this(language, interpreter, null);
    }

    @Override
    public ExecutionResult run(String source) {
        Path workDir = null;
        Process process = null;
        try {
            workDir = tempRoot == null
                    ? Files.createTempDirectory("sandbox-" + language.wireName() + "-")
                    : Files.createTempDirectory(tempRoot, "sandbox-" + language.wireName() + "-");
            Path script     = workDir.resolve("main" + language.fileSuffix());
            Path stdoutFile = workDir.resolve("stdout.txt");
            Path stderrFile = workDir.resolve("stderr.txt");
            Files.writeString(script, source, StandardCharsets.UTF_8);

            process = new ProcessBuilder(interpreter, script.toString())
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            // Snippets get no stdin; close it so reads see EOF instead of blocking.
            process.getOutputStream().close();

            int exitCode = process.waitFor();
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);

            if (exitCode == 0) {
                return ExecutionResult.ok(stdout, stderr);
            }
            log.debug("{} exited with code {}", interpreter, exitCode);
            return ExecutionResult.codeFailure(stdout,
                    stderr.isEmpty() ? "Process exited with code " + exitCode : stderr);

        } catch (IOException e) {
            log.error("Could not run {} snippet with '{}': {}", language.displayName(), interpreter, e.getMessage());
            return ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                    Diagnostics.withTraceback(language.displayName() + " execution failed: " + e.getMessage(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                    language.displayName() + " execution was interrupted");
        } finally {
            if (workDir != null) {
                deleteRecursively(workDir);
            }
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
