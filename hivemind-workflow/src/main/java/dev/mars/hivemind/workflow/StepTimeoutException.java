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
 * Exception recorded when a step does not settle within its timeout.
 * The underlying handler is abandoned, not interrupted.
 */
public class StepTimeoutException extends HivemindException {

    private final String stepId;
    private final long timeoutMs;

    public StepTimeoutException(String stepId, long timeoutMs) {
        super("Step '" + stepId + "' timed out after " + timeoutMs + "ms");
        this.stepId = stepId;
        this.timeoutMs = timeoutMs;
    }

    public String getStepId() {
        return stepId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
