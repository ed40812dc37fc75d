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
 * The unit of work performed by a workflow step.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Executes the step.
     *
     * @param input the input the workflow was executed with
     * @param context outputs of previously succeeded steps plus the cancellation signal
     * @return the step output, may be null
     * @throws Exception if the step fails
     */
    Object execute(Object input, StepContext context) throws Exception;
}
