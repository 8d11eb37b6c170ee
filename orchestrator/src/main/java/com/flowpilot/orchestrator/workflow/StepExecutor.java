package com.flowpilot.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single {@link Step} and captures its outcome as a {@link StepResult}.
 *
 * Steps without a timeout run on the calling thread. Steps with a timeout are
 * handed to a pool that keeps {@code threads} warm workers and grows on demand,
 * so an action that ignores its interrupt only ever pins its own thread. The
 * timeout is measured from the moment the action starts running; on expiry the
 * task is cancelled with an interrupt and the result carries a
 * {@link StepTimeoutException}.
 *
 * Never throws for a step failure: every exception raised by the action ends
 * up in the returned result.
 */
public class StepExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ExecutorService timedPool;

    public StepExecutor(int threads) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("step-timed-");
        factory.setDaemon(true);
        this.timedPool = new ThreadPoolExecutor(threads, Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), factory);
    }

    public StepResult execute(Step step, Context context) {
        long start = System.nanoTime();
        try {
            Object output = step.timeout() == null
                    ? step.invoke(context)
                    : invokeWithTimeout(step, context);
            return StepResult.success(output, since(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failure(e, since(start));
        } catch (Exception e) {
            return StepResult.failure(e, since(start));
        }
    }

    private Object invokeWithTimeout(Step step, Context context) throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        Future<Object> future = timedPool.submit(() -> {
            started.countDown();
            return step.invoke(context);
        });
        try {
            started.await();
            return future.get(step.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Step '{}' exceeded its timeout of {} ms and was cancelled",
                    step.name(), step.timeout().toMillis());
            throw new StepTimeoutException(step.name(), step.timeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            // Unwrap so callers see what the action actually threw.
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        timedPool.shutdownNow();
    }
}
