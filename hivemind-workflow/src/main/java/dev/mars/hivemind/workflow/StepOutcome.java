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

/**
 * Settled result of running a step through the {@link StepExecutor}, after all retries.
 */
final class StepOutcome {

    private final Object output;
    private final Throwable error;
    private final int attempts;
    private final boolean timedOut;

    private StepOutcome(Object output, Throwable error, int attempts, boolean timedOut) {
        this.output = output;
        this.error = error;
        this.attempts = attempts;
        this.timedOut = timedOut;
    }

    static StepOutcome success(Object output, int attempts) {
        return new StepOutcome(output, null, attempts, false);
    }

    static StepOutcome failure(Throwable error, int attempts) {
        return new StepOutcome(null, error, attempts, error instanceof StepTimeoutException);
    }

    boolean isSuccess() {
        return error == null;
    }

    Object getOutput() {
        return output;
    }

    /**
     * Either a {@link StepTimeoutException} or a {@link StepExecutionException}.
     */
    Throwable getError() {
        return error;
    }

    int getAttempts() {
        return attempts;
    }

    boolean isTimedOut() {
        return timedOut;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "StepOutcome{success, attempts=" + attempts + "}"
                : "StepOutcome{failure='" + error.getMessage() + "', attempts=" + attempts + "}";
    }
}
