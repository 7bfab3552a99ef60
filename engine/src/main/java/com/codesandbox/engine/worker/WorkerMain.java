package com.codesandbox.engine.worker;

import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.model.Diagnostics;
import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.model.RunnerKind;
import com.codesandbox.engine.runner.LanguageRunner;
import com.codesandbox.engine.runner.RunnerRegistry;
import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point of a worker process.
 *
 * Reads one JSON request per line from stdin, runs it, and writes one JSON
 * response per line to stdout. Anything else the process prints (logging,
 * stray output of submitted code) is pointed at stderr before the loop
 * starts, so stdout carries protocol lines only. The process exits when its
 * stdin closes, or is killed by the parent when a reply asks to retire it.
 */
public final class WorkerMain {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    private final RunnerRegistry registry;
    private final ObjectMapper   json = new ObjectMapper();

    WorkerMain(RunnerRegistry registry) {
        this.registry = registry;
    }

    public static void main(String[] args) throws IOException {
        PrintStream protocol = System.out;
        InputStream requests = System.in;
        System.setOut(System.err);
        System.setIn(InputStream.nullInputStream());

        new WorkerMain(RunnerRegistry.fromSystemProperties()).serve(requests, protocol);
    }

    /** Serve requests until {@code in} reaches EOF. */
    void serve(InputStream in, OutputStream out) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            WorkerResponse response;
            try {
                response = respond(json.readValue(line, WorkerRequest.class));
            } catch (JsonProcessingException e) {
                // Answered without an id; the parent treats the mismatch as a protocol error.
                log.error("Unparseable request line: {}", e.getOriginalMessage());
                response = WorkerResponse.of(null, ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                        "Unparseable request: " + e.getOriginalMessage()));
            }
            writer.write(json.writeValueAsString(response));
            writer.newLine();
            writer.flush();
        }
        log.debug("Request stream closed; worker exiting");
    }

    /**
     * Runs the request and checks for threads the snippet left running.
     * Such a thread would keep printing into, and competing with, the next
     * request, so its presence retires the worker.
     */
    WorkerResponse respond(WorkerRequest request) {
        boolean embedded = Language.fromWireName(request.language())
                .map(l -> l.kind() == RunnerKind.EMBEDDED)
                .orElse(false);
        Set<Thread> before = embedded ? liveThreads() : Set.of();

        ExecutionResult result = handle(request);

        boolean retire = false;
        if (embedded) {
            Set<Thread> stray = liveThreads();
            stray.removeAll(before);
            if (!stray.isEmpty()) {
                log.warn("Request {} left {} thread(s) running ({}); retiring this worker",
                        request.id(), stray.size(),
                        stray.stream().map(Thread::getName).collect(Collectors.joining(", ")));
                retire = true;
            }
        }
        return WorkerResponse.of(request.id(), result, retire);
    }

    ExecutionResult handle(WorkerRequest request) {
        Optional<LanguageRunner> runner = registry.find(request.language());
        if (runner.isEmpty()) {
            return ExecutionResult.failure(FailureKind.UNSUPPORTED_LANGUAGE,
                    "Unsupported language: " + request.language());
        }
        try {
            return runner.get().run(request.source() == null ? "" : request.source());
        } catch (RuntimeException e) {
            log.error("Runner for {} failed on request {}", request.language(), request.id(), e);
            return ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                    Diagnostics.withTraceback("Runner failed: " + e.getMessage(), e));
        }
    }

    private static Set<Thread> liveThreads() {
        Set<Thread> threads = new HashSet<>();
        for (Thread t : Thread.getAllStackTraces().keySet()) {
            if (t.isAlive()) threads.add(t);
        }
        return threads;
    }
}
