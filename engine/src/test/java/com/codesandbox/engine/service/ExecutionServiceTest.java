package com.codesandbox.engine.service;

import com.codesandbox.engine.admission.AdmissionController;
import com.codesandbox.engine.model.ExecutionRequest;
import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.runner.RuntimeAvailability;
import com.codesandbox.engine.worker.WorkerException;
import com.codesandbox.engine.worker.WorkerPool;
import com.codesandbox.engine.worker.dto.WorkerRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionService.
 *
 * The worker pool is a Mockito mock; the admission controller is a real one
 * wrapped in a spy so permit accounting can be both observed and verified.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionServiceTest {

    static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Mock WorkerPool pool;

    SimpleMeterRegistry meters;
    AdmissionController admission;
    ExecutionService    service;

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        admission = spy(new AdmissionController(10, 2, meters));
        service   = new ExecutionService(
                new RuntimeAvailability(EnumSet.of(Language.JAVA, Language.PYTHON3)),
                pool, admission, meters, TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        admission.close();
    }

    // ------------------------------------------------------------------
    // Refusals before dispatch
    // ------------------------------------------------------------------

    @Test
    void execute_unsupportedLanguage_failsWithoutPermitOrPool() throws Exception {
        ExecutionResult result = service.execute(new ExecutionRequest("ruby", "puts 1"));

        assertThat(result.success()).isFalse();
        assertThat(result.failure()).isEqualTo(FailureKind.UNSUPPORTED_LANGUAGE);
        assertThat(result.error()).isEqualTo("Unsupported language: ruby");
        assertThat(result.stdout()).isEmpty();
        verifyNoInteractions(pool);
        verify(admission, never()).acquireSlot();
    }

    @Test
    void execute_blankLanguage_isUnsupported() throws Exception {
        ExecutionResult result = service.execute(new ExecutionRequest("", "1"));

        assertThat(result.failure()).isEqualTo(FailureKind.UNSUPPORTED_LANGUAGE);
        assertThat(result.error()).isEqualTo("Unsupported language: ");
        verifyNoInteractions(pool);
    }

    @Test
    void execute_runtimeUnavailable_failsWithoutPermitOrPool() throws Exception {
        ExecutionResult result = service.execute(new ExecutionRequest("nodejs", "console.log(1)"));

        assertThat(result.failure()).isEqualTo(FailureKind.RUNTIME_UNAVAILABLE);
        assertThat(result.error()).isEqualTo("Node.js runtime is unavailable");
        verifyNoInteractions(pool);
        verify(admission, never()).acquireSlot();
    }

    // ------------------------------------------------------------------
    // Dispatch outcomes
    // ------------------------------------------------------------------

    @Test
    void execute_success_returnsWorkerResultAndReleasesPermit() throws Exception {
        when(pool.execute(any(), eq(TIMEOUT))).thenReturn(ExecutionResult.ok("hi\n", null));

        ExecutionResult result = service.execute(new ExecutionRequest("java", "System.out.println(\"hi\");"));

        assertThat(result.success()).isTrue();
        assertThat(result.stdout()).isEqualTo("hi\n");
        assertThat(admission.availableSlots()).isEqualTo(2);

        ArgumentCaptor<WorkerRequest> sent = ArgumentCaptor.forClass(WorkerRequest.class);
        verify(pool).execute(sent.capture(), eq(TIMEOUT));
        assertThat(sent.getValue().language()).isEqualTo("java");
        assertThat(sent.getValue().source()).isEqualTo("System.out.println(\"hi\");");
        assertThat(sent.getValue().id()).isNotBlank();
    }

    @Test
    void execute_codeFailure_isPassedThrough() throws Exception {
        when(pool.execute(any(), any())).thenReturn(ExecutionResult.codeFailure("partial", "Traceback ..."));

        ExecutionResult result = service.execute(new ExecutionRequest("python3", "raise Exception()"));

        assertThat(result.failure()).isEqualTo(FailureKind.CODE_ERROR);
        assertThat(result.stdout()).isEqualTo("partial");
    }

    @Test
    void execute_timeout_mapsToTimeoutFailureAndReleasesPermit() throws Exception {
        when(pool.execute(any(), any()))
                .thenThrow(new WorkerException(WorkerException.Kind.TIMEOUT, "request exceeded 2000 ms"));

        ExecutionResult result = service.execute(new ExecutionRequest("java", "while (true) {}"));

        assertThat(result.failure()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(result.error()).isEqualTo("Execution timed out (>2s)");
        assertThat(admission.availableSlots()).isEqualTo(2);
    }

    @Test
    void execute_workerCrash_mapsToInfrastructureWithTraceback() throws Exception {
        when(pool.execute(any(), any()))
                .thenThrow(new WorkerException(WorkerException.Kind.CRASHED, "worker-0 died"));

        ExecutionResult result = service.execute(new ExecutionRequest("java", "Runtime.getRuntime().halt(1);"));

        assertThat(result.failure()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(result.error()).contains("[CRASHED] worker-0 died").contains("Traceback:");
        assertThat(admission.availableSlots()).isEqualTo(2);
    }

    @Test
    void execute_unexpectedException_mapsToInfrastructure() throws Exception {
        when(pool.execute(any(), any())).thenThrow(new IllegalStateException("bug"));

        ExecutionResult result = service.execute(new ExecutionRequest("java", "1"));

        assertThat(result.failure()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(result.error()).contains("bug");
        assertThat(admission.availableSlots()).isEqualTo(2);
    }

    @Test
    void execute_interrupted_restoresInterruptFlag() throws Exception {
        when(pool.execute(any(), any())).thenThrow(new InterruptedException());

        ExecutionResult result = service.execute(new ExecutionRequest("java", "1"));

        assertThat(Thread.interrupted()).isTrue();
        assertThat(result.failure()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(admission.availableSlots()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Logging context and metrics
    // ------------------------------------------------------------------

    @Test
    void execute_clearsRequestIdFromMdc() throws Exception {
        when(pool.execute(any(), any())).thenReturn(ExecutionResult.ok("", null));

        service.execute(new ExecutionRequest("java", ""));

        assertThat(MDC.get(ExecutionService.MDC_REQUEST_ID)).isNull();
    }

    @Test
    void execute_recordsOutcomeCounters() throws Exception {
        when(pool.execute(any(), any())).thenReturn(ExecutionResult.ok("", null));

        service.execute(new ExecutionRequest("java", ""));
        service.execute(new ExecutionRequest("ruby", ""));

        assertThat(meters.counter("sandbox.executions", "language", "java", "outcome", "success").count())
                .isEqualTo(1.0);
        assertThat(meters.counter("sandbox.executions", "language", "unknown", "outcome", "unsupported_language").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("sandbox.execution.duration", "language", "java").count()).isEqualTo(1);
    }

    @Test
    void execute_errorEscapingDispatch_isCountedAsInfrastructure() throws Exception {
        when(pool.execute(any(), any())).thenThrow(new OutOfMemoryError("unable to create native thread"));

        assertThatThrownBy(() -> service.execute(new ExecutionRequest("java", "1")))
                .isInstanceOf(OutOfMemoryError.class);

        assertThat(meters.counter("sandbox.executions", "language", "java", "outcome", "infrastructure").count())
                .isEqualTo(1.0);
        assertThat(meters.counter("sandbox.executions", "language", "java", "outcome", "success").count())
                .isZero();
        assertThat(admission.availableSlots()).isEqualTo(2);
    }

    @Test
    void describe_subSecondTimeout_usesMilliseconds() {
        assertThat(ExecutionService.describe(Duration.ofMillis(500))).isEqualTo("500ms");
        assertThat(ExecutionService.describe(Duration.ofSeconds(30))).isEqualTo("30s");
    }

    // ------------------------------------------------------------------
    // Concurrency bound
    // ------------------------------------------------------------------

    @Test
    void execute_onePastPermitCount_waitsForAFreeSlot() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak    = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        when(pool.execute(any(), any())).thenAnswer(inv -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            release.await(5, TimeUnit.SECONDS);
            running.decrementAndGet();
            return ExecutionResult.ok("", null);
        });

        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Future<ExecutionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(callers.submit(() -> service.execute(new ExecutionRequest("java", ""))));
            }

            Thread.sleep(300);
            assertThat(running.get()).isEqualTo(2);
            assertThat(admission.availableSlots()).isZero();

            release.countDown();
            for (Future<ExecutionResult> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS).success()).isTrue();
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(peak.get()).isEqualTo(2);
        assertThat(admission.availableSlots()).isEqualTo(2);
        verify(pool, times(3)).execute(any(), any());
    }
}
