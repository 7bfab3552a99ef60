package com.codesandbox.engine.worker;

import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A worker JVM spoken to over its stdin/stdout, one JSON object per line.
 *
 * Any failure of the exchange (broken pipe, EOF, unparseable or mismatched
 * reply) terminates the process: after a partial exchange there is no way
 * to tell which line belongs to which request.
 */
public class ProcessWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorker.class);

    // How long to wait for an exit code after the worker closed its stdout.
    private static final long EXIT_WAIT_SECONDS = 2;

    private static final int MAX_KILL_PASSES = 10;

    private final int            slotId;
    private final Process        process;
    private final BufferedWriter toWorker;
    private final BufferedReader fromWorker;
    private final ObjectMapper   json;

    private volatile boolean terminated;

    public ProcessWorker(int slotId, Process process, ObjectMapper json) {
        this.slotId     = slotId;
        this.process    = process;
        this.json       = json;
        this.toWorker   = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.fromWorker = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public WorkerResponse handle(WorkerRequest request) {
        try {
            toWorker.write(json.writeValueAsString(request));
            toWorker.newLine();
            toWorker.flush();
        } catch (IOException e) {
            terminate();
            throw new WorkerException(WorkerException.Kind.CRASHED,
                    describe() + " is not accepting requests: " + e.getMessage(), e);
        }

        String line;
        try {
            line = fromWorker.readLine();
        } catch (IOException e) {
            terminate();
            throw new WorkerException(WorkerException.Kind.CRASHED,
                    describe() + " broke off while executing: " + e.getMessage(), e);
        }
        if (line == null) {
            String exit = exitDescription();
            terminate();
            throw new WorkerException(WorkerException.Kind.CRASHED,
                    describe() + " died while executing (" + exit + ")");
        }

        WorkerResponse response;
        try {
            response = json.readValue(line, WorkerResponse.class);
        } catch (JsonProcessingException e) {
            terminate();
            throw new WorkerException(WorkerException.Kind.PROTOCOL_ERROR,
                    describe() + " sent an unreadable reply", e);
        }
        if (!request.id().equals(response.id())) {
            terminate();
            throw new WorkerException(WorkerException.Kind.PROTOCOL_ERROR,
                    describe() + " answered request " + response.id() + " instead of " + request.id());
        }
        if (response.retire()) {
            log.info("Retiring {} after request {}", describe(), request.id());
            terminate();
        }
        return response;
    }

    @Override
    public boolean isHealthy() {
        return !terminated && process.isAlive();
    }

    @Override
    public void terminate() {
        if (terminated) return;
        terminated = true;
        // Children first: once the worker is gone its interpreters are reparented and out of reach.
        destroyDescendants();
        process.destroyForcibly();
        closeQuietly();
        log.debug("Terminated {}", describe());
    }

    @Override
    public String describe() {
        return "worker-" + slotId + " (pid " + process.pid() + ")";
    }

    /** Handle of the worker JVM itself. */
    ProcessHandle processHandle() {
        return process.toHandle();
    }

    /**
     * Kills every descendant, re-listing after each pass so that a child
     * forked while the previous pass ran is caught as well.
     */
    private void destroyDescendants() {
        Set<Long> killed = new HashSet<>();
        boolean foundNew = true;
        for (int pass = 0; foundNew && pass < MAX_KILL_PASSES; pass++) {
            foundNew = false;
            for (ProcessHandle child : process.descendants().toList()) {
                if (killed.add(child.pid())) {
                    child.destroyForcibly();
                    foundNew = true;
                }
            }
        }
        if (foundNew) {
            log.warn("{} kept spawning children after {} kill passes", describe(), MAX_KILL_PASSES);
        }
    }

    private String exitDescription() {
        try {
            if (process.waitFor(EXIT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                return "exit code " + process.exitValue();
            }
            return "still running but closed its output";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "exit code unknown";
        }
    }

    private void closeQuietly() {
        try {
            toWorker.close();
        } catch (IOException e) {
            log.debug("Closing stdin of {}: {}", describe(), e.getMessage());
        }
        // fromWorker is left alone: a dispatch thread may still hold its lock in readLine(),
        // and the killed process closes that pipe anyway.
    }
}
