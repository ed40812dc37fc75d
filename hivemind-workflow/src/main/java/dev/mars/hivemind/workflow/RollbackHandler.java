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
 * Compensating action that undoes the effect of a succeeded step after a later
 * step in the same execution fails.
 */
@FunctionalInterface
public interface RollbackHandler {

    /**
     * @param output the output the step produced when it succeeded
     * @param context context describing the execution being rolled back
     * @throws Exception if compensation fails; the failure is recorded and the sweep continues
     */
    void rollback(Object output, StepContext context) throws Exception;
}
