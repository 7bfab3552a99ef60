package com.codesandbox.engine.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Two-tier gate in front of the worker pool.
 *
 * <ol>
 *   <li>In-flight ceiling: at most {@code maxRequests} admitted requests,
 *       running or waiting. Anything beyond is rejected at once with
 *       {@link AdmissionRejectedException}; it is never queued.</li>
 *   <li>Concurrency semaphore: at most {@code maxWorkers} executions hold a
 *       {@link SlotPermit}. Admitted requests queue here, in arrival order.</li>
 * </ol>
 *
 * Metrics:
 * <pre>
 *   sandbox.admission.in_flight        (gauge)
 *   sandbox.admission.available_slots  (gauge)
 *   sandbox.admission.rejected         (counter)
 * </pre>
 */
public class AdmissionController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final int           maxRequests;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Semaphore     slots;
    private final Counter       rejected;

    // Admitted work waits for a permit here, never on a servlet thread.
    // Unbounded, but the ceiling caps how many threads it can hold.
    private final ExecutorService admissionThreads = Executors.newCachedThreadPool(new AdmissionThreadFactory());

    public AdmissionController(int maxRequests, int maxWorkers, MeterRegistry meterRegistry) {
        if (maxRequests < 1 || maxWorkers < 1) {
            throw new IllegalArgumentException(
                    "maxRequests and maxWorkers must be positive, got " + maxRequests + " and " + maxWorkers);
        }
        this.maxRequests = maxRequests;
        this.slots       = new Semaphore(maxWorkers, true);

        Gauge.builder("sandbox.admission.in_flight", inFlight, AtomicInteger::get)
                .description("Admitted requests that have not completed")
                .register(meterRegistry);
        Gauge.builder("sandbox.admission.available_slots", slots, Semaphore::availablePermits)
                .description("Free execution permits")
                .register(meterRegistry);
        this.rejected = Counter.builder("sandbox.admission.rejected")
                .description("Requests refused at the in-flight ceiling")
                .register(meterRegistry);
    }

    /**
     * Reserve a place under the in-flight ceiling.
     *
     * @throws AdmissionRejectedException when the ceiling is reached; nothing is reserved
     */
    public AdmissionTicket admit() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxRequests) {
                rejected.increment();
                log.warn("Rejecting request: {} in flight (ceiling {})", current, maxRequests);
                throw new AdmissionRejectedException(maxRequests);
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return new AdmissionTicket(inFlight::decrementAndGet);
            }
        }
    }

    /**
     * Admit, then run {@code work} on an admission thread.
     * The ticket is released when the returned future completes, however it completes.
     *
     * @throws AdmissionRejectedException when the ceiling is reached; {@code work} never runs
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        AdmissionTicket ticket = admit();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(work, admissionThreads);
        } catch (RejectedExecutionException e) {
            ticket.close();
            throw e;
        }
        return future.whenComplete((result, error) -> ticket.close());
    }

    /** Block until an execution permit is free. */
    public SlotPermit acquireSlot() throws InterruptedException {
        slots.acquire();
        return new SlotPermit(slots);
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int maxRequests() {
        return maxRequests;
    }

    @Override
    public void close() {
        admissionThreads.shutdownNow();
    }

    private static final class AdmissionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "sandbox-admission-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
