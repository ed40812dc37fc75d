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

import dev.mars.hivemind.core.exceptions.HivemindException;

/**
 * Exception recorded when a step handler throws. Wraps the handler's original exception.
 */
public class StepExecutionException extends HivemindException {

    private final String stepId;
    private final int attempts;

    public StepExecutionException(String stepId, int attempts, Throwable cause) {
        super("Step '" + stepId + "' failed after " + attempts + " attempt(s): " +
              (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.stepId = stepId;
        this.attempts = attempts;
    }

    public String getStepId() {
        return stepId;
    }

    public int getAttempts() {
        return attempts;
    }
}
