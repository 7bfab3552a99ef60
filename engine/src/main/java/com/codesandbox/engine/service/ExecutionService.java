package com.codesandbox.engine.service;

import com.codesandbox.engine.admission.AdmissionController;
import com.codesandbox.engine.admission.SlotPermit;
import com.codesandbox.engine.model.Diagnostics;
import com.codesandbox.engine.model.ExecutionRequest;
import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.runner.RuntimeAvailability;
import com.codesandbox.engine.worker.WorkerException;
import com.codesandbox.engine.worker.WorkerPool;
import com.codesandbox.engine.worker.dto.WorkerRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one snippet end to end and turns whatever happens into an
 * {@link ExecutionResult}.
 *
 * Order of checks:
 *   1. language tag known           else UNSUPPORTED_LANGUAGE (no permit, no pool)
 *   2. runtime installed            else RUNTIME_UNAVAILABLE  (no permit, no pool)
 *   3. hold an execution permit, dispatch to the pool under the deadline
 *
 * {@link #execute} never throws. Admission to the in-flight ceiling happens
 * one level up, in the transport, before this service is called.
 *
 * Metrics:
 * <pre>
 *   sandbox.executions{language, outcome="success|code_error|timeout|..."}
 *   sandbox.execution.duration{language}
 * </pre>
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    static final String MDC_REQUEST_ID = "requestId";

    private final RuntimeAvailability availability;
    private final WorkerPool          pool;
    private final AdmissionController admission;
    private final MeterRegistry       meterRegistry;
    private final Duration            timeout;

    @Autowired
    public ExecutionService(RuntimeAvailability availability,
                            WorkerPool pool,
                            AdmissionController admission,
                            MeterRegistry meterRegistry,
                            @Value("${sandbox.worker-timeout}") long timeoutSeconds) {
        this(availability, pool, admission, meterRegistry, Duration.ofSeconds(timeoutSeconds));
    }

    public ExecutionService(RuntimeAvailability availability,
                            WorkerPool pool,
                            AdmissionController admission,
                            MeterRegistry meterRegistry,
                            Duration timeout) {
        this.availability  = availability;
        this.pool          = pool;
        this.admission     = admission;
        this.meterRegistry = meterRegistry;
        this.timeout       = timeout;
    }

    public ExecutionResult execute(ExecutionRequest request) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_REQUEST_ID, requestId);
        Timer.Sample sample = Timer.start(meterRegistry);
        String languageTag = "unknown";
        ExecutionResult result = null;
        try {
            log.info("Executing {} snippet ({} chars)", request.language(), request.source().length());
            log.debug("Source: {}", LogPreview.truncate(request.source()));
            if (request.preload() != null && !request.preload().isEmpty()) {
                log.debug("Ignoring preload ({} chars); not supported", request.preload().length());
            }
            if (request.enableNetwork()) {
                log.debug("enable_network requested; not enforced");
            }

            Optional<Language> language = Language.fromWireName(request.language());
            if (language.isEmpty()) {
                result = ExecutionResult.failure(FailureKind.UNSUPPORTED_LANGUAGE,
                        "Unsupported language: " + request.language());
                return result;
            }
            languageTag = language.get().wireName();

            if (!availability.isAvailable(language.get())) {
                result = ExecutionResult.failure(FailureKind.RUNTIME_UNAVAILABLE,
                        language.get().displayName() + " runtime is unavailable");
                return result;
            }

            result = dispatch(requestId, language.get(), request.source());
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected failure while executing request {}", requestId, e);
            result = ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                    Diagnostics.withTraceback("Internal error: " + e.getMessage(), e));
            return result;
        } finally {
            // No result means an Error escaped; it is not a success.
            String outcome = result == null
                    ? FailureKind.INFRASTRUCTURE.name().toLowerCase()
                    : result.success() ? "success" : result.failure().name().toLowerCase();
            sample.stop(meterRegistry.timer("sandbox.execution.duration", "language", languageTag));
            meterRegistry.counter("sandbox.executions", "language", languageTag, "outcome", outcome).increment();
            log.info("Finished: outcome={} stdout={} chars", outcome,
                    result == null ? 0 : result.stdout().length());
            if (result != null && result.error() != null) {
                log.debug("Error text: {}", LogPreview.truncate(result.error()));
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private ExecutionResult dispatch(String requestId, Language language, String source) {
        try (SlotPermit permit = admission.acquireSlot()) {
            return pool.execute(new WorkerRequest(requestId, language.wireName(), source), timeout);
        } catch (WorkerException e) {
            if (e.getKind() == WorkerException.Kind.TIMEOUT) {
                log.warn("Execution timed out after {}", describe(timeout));
                return ExecutionResult.failure(FailureKind.TIMEOUT,
                        "Execution timed out (>" + describe(timeout) + ")");
            }
            log.error("Worker failure: {}", e.getMessage(), e);
            return ExecutionResult.failure(FailureKind.INFRASTRUCTURE, Diagnostics.withTraceback(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(FailureKind.INFRASTRUCTURE,
                    Diagnostics.withTraceback("Execution interrupted", e));
        }
    }

    static String describe(Duration d) {
        long millis = d.toMillis();
        if (millis < 1000 || millis % 1000 != 0) {
            return millis + "ms";
        }
        return (millis / 1000) + "s";
    }
}
