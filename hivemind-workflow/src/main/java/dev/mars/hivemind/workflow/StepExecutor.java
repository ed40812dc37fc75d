/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.hivemind.workflow;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a single step handler with a bounded timeout and optional retries.
 * <p>
 * Each attempt races the handler against a timer. Whichever settles first wins; a handler
 * that loses to its timer keeps running on its worker thread but its result is discarded.
 * Failed attempts are retried after {@code retryDelayMs * 2^(attempt - 1)} unless the
 * execution has been cancelled in the meantime. Steps still pending when the executor is
 * shut down complete as failed rather than being dropped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class StepExecutor {

    private static final Logger logger = Logger.getLogger(StepExecutor.class.getName());
    private static final int MAX_BACKOFF_SHIFT = 20;

    /**
     * Notified when an attempt failed and another will follow.
     */
    @FunctionalInterface
    interface RetryListener {
        void onRetry(WorkflowStep step, int failedAttempt, Throwable error);
    }

    private final ExecutorService handlerExecutor;
    private final ScheduledExecutorService timer;
    private final Set<Attempt> pending = ConcurrentHashMap.newKeySet();

    StepExecutor() {
        this(Executors.newCachedThreadPool(daemonThreads("hivemind-step-")),
             Executors.newSingleThreadScheduledExecutor(daemonThreads("hivemind-step-timer-")));
    }

    StepExecutor(ExecutorService handlerExecutor, ScheduledExecutorService timer) {
        this.handlerExecutor = handlerExecutor;
        this.timer = timer;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Runs the step. The returned future always completes normally.
     *
     * @param step the step to run
     * @param input the workflow input
     * @param context the context for the first attempt
     * @param timeoutMs per-attempt timeout
     * @param retries additional attempts after the first failure
     * @param retryDelayMs base delay before the first retry
     * @param retryListener notified before each retry, may be null
     */
    CompletableFuture<StepOutcome> execute(WorkflowStep step, Object input, StepContext context,
                                                  long timeoutMs, int retries, long retryDelayMs,
                                                  RetryListener retryListener) {
        CompletableFuture<StepOutcome> result = new CompletableFuture<>();
        Attempt run = new Attempt(step, input, context, timeoutMs, retries, retryDelayMs, retryListener, result);
        pending.add(run);
        result.whenComplete((outcome, error) -> pending.remove(run));
        runAttempt(run, 1);
        return result;
    }

    private void runAttempt(Attempt run, int attempt) {
        run.attempt = attempt;
        StepContext attemptContext = run.context.forAttempt(attempt);
        CompletableFuture<Object> attemptFuture = new CompletableFuture<>();
        ScheduledFuture<?> deadline;
        try {
            deadline = timer.schedule(
                    () -> attemptFuture.completeExceptionally(new StepTimeoutException(run.step.getId(), run.timeoutMs)),
                    run.timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            run.result.complete(StepOutcome.failure(new StepExecutionException(run.step.getId(), attempt, e), attempt));
            return;
        }
        try {
            handlerExecutor.execute(() -> invokeHandler(run, attemptContext, attemptFuture));
        } catch (RejectedExecutionException e) {
            deadline.cancel(false);
            run.result.complete(StepOutcome.failure(new StepExecutionException(run.step.getId(), attempt, e), attempt));
            return;
        }

        attemptFuture.whenComplete((output, error) -> {
            deadline.cancel(false);
            if (error == null) {
                logger.fine("Step " + run.step.getId() + " succeeded on attempt " + attempt);
                run.result.complete(StepOutcome.success(output, attempt));
            } else {
                onAttemptFailed(run, attempt, unwrap(error));
            }
        });
    }

    private void invokeHandler(Attempt run, StepContext attemptContext, CompletableFuture<Object> attemptFuture) {
        try {
            attemptFuture.complete(run.step.getHandler().execute(run.input, attemptContext));
        } catch (Exception e) {
            attemptFuture.completeExceptionally(e);
        } catch (Error e) {
            attemptFuture.completeExceptionally(e);
            throw e;
        }
    }

    private void onAttemptFailed(Attempt run, int attempt, Throwable error) {
        String stepId = run.step.getId();
        boolean cancelled = run.context.getCancellationToken().isCancellationRequested();

        if (attempt <= run.retries && !cancelled) {
            long delay = run.retryDelayMs * (1L << Math.min(attempt - 1, MAX_BACKOFF_SHIFT));
            logger.log(Level.WARNING, String.format("Step %s attempt %d failed, retrying in %dms: %s",
                    stepId, attempt, delay, error.getMessage()));
            logger.log(Level.FINE, "Step " + stepId + " attempt failure", error);
            if (run.retryListener != null) {
                run.retryListener.onRetry(run.step, attempt, error);
            }
            try {
                timer.schedule(() -> {
                    if (run.context.getCancellationToken().isCancellationRequested()) {
                        run.result.complete(failureOf(stepId, attempt, error));
                    } else {
                        runAttempt(run, attempt + 1);
                    }
                }, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                run.result.complete(failureOf(stepId, attempt, error));
            }
            return;
        }

        logger.log(Level.WARNING, String.format("Step %s failed after %d attempt(s): %s",
                stepId, attempt, error.getMessage()));
        logger.log(Level.FINE, "Step " + stepId + " failure", error);
        run.result.complete(failureOf(stepId, attempt, error));
    }

    private static StepOutcome failureOf(String stepId, int attempts, Throwable error) {
        if (error instanceof StepTimeoutException) {
            return StepOutcome.failure(error, attempts);
        }
        return StepOutcome.failure(new StepExecutionException(stepId, attempts, error), attempts);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    int getPendingCount() {
        return pending.size();
    }

    /**
     * Stops both pools. Steps still waiting on a handler, a deadline or a retry complete as
     * failed; abandoned handlers still running are interrupted.
     */
    void shutdown() {
        handlerExecutor.shutdown();
        timer.shutdownNow();
        failPending();
        try {
            if (!handlerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Step handlers did not finish within 5s, forcing shutdown");
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlerExecutor.shutdownNow();
        }
    }

    private void failPending() {
        for (Attempt run : pending) {
            int attempts = run.attempt;
            StepOutcome outcome = StepOutcome.failure(new StepExecutionException(run.step.getId(), attempts,
                    new IllegalStateException("Step executor shut down")), attempts);
            if (run.result.complete(outcome)) {
                logger.warning("Step " + run.step.getId() + " abandoned by shutdown after " + attempts + " attempt(s)");
            }
        }
    }

    private static final class Attempt {
        private final WorkflowStep step;
        private final Object input;
        private final StepContext context;
        private final long timeoutMs;
        private final int retries;
        private final long retryDelayMs;
        private final RetryListener retryListener;
        private final CompletableFuture<StepOutcome> result;
        private volatile int attempt = 1;

        private Attempt(WorkflowStep step, Object input, StepContext context, long timeoutMs, int retries,
                        long retryDelayMs, RetryListener retryListener, CompletableFuture<StepOutcome> result) {
            this.step = step;
            this.input = input;
            this.context = context;
            this.timeoutMs = timeoutMs;
            this.retries = retries;
            this.retryDelayMs = retryDelayMs;
            this.retryListener = retryListener;
            this.result = result;
        }
    }
}
