package com.codesandbox.engine.worker;

import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Puts a wall-clock deadline on one worker exchange.
 *
 * The blocking exchange runs on a dispatch thread while the caller waits on
 * its future. When the deadline passes the caller stops waiting and the
 * worker is killed together with everything it spawned, so a timed-out
 * snippet does not keep burning CPU. The dispatch thread then sees EOF and
 * finishes on its own.
 */
public class TimeoutSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSupervisor.class);

    private final ExecutorService dispatchThreads = Executors.newCachedThreadPool(new DispatchThreadFactory());

    /**
     * @throws WorkerException TIMEOUT when the deadline passed (the worker is terminated),
     *                         or whatever the worker exchange itself threw
     */
    public WorkerResponse supervise(Worker worker, WorkerRequest request, Duration timeout)
            throws InterruptedException {
        Future<WorkerResponse> future = dispatchThreads.submit(() -> worker.handle(request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Request {} exceeded {} ms on {}; killing it",
                    request.id(), timeout.toMillis(), worker.describe());
            worker.terminate();
            future.cancel(true);
            throw new WorkerException(WorkerException.Kind.TIMEOUT,
                    "request " + request.id() + " exceeded " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof WorkerException workerException) {
                throw workerException;
            }
            worker.terminate();
            throw new WorkerException(WorkerException.Kind.CRASHED,
                    "exchange with " + worker.describe() + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            worker.terminate();
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        dispatchThreads.shutdownNow();
    }

    private static final class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "sandbox-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
