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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes compensating actions for succeeded steps in reverse completion order.
 * A failing rollback handler is logged and recorded; the sweep always continues.
 */
class RollbackCoordinator {

    private static final Logger logger = Logger.getLogger(RollbackCoordinator.class.getName());

    /**
     * @param completedInOrder succeeded steps, oldest completion first
     * @param outputs step outputs keyed by step id
     * @param contextFactory builds the context passed to each rollback handler
     * @return one outcome per step that declared a rollback handler, in the order they were invoked
     */
    List<RollbackOutcome> rollback(String executionId, List<WorkflowStep> completedInOrder,
                                   Map<String, Object> outputs,
                                   Function<WorkflowStep, StepContext> contextFactory) {
        List<RollbackOutcome> outcomes = new ArrayList<>();

        for (int i = completedInOrder.size() - 1; i >= 0; i--) {
            WorkflowStep step = completedInOrder.get(i);
            Optional<RollbackHandler> handler = step.getRollback();
            if (handler.isEmpty()) {
                logger.fine("No rollback handler for step " + step.getId() + " in execution " + executionId);
                continue;
            }

            try {
                handler.get().rollback(outputs.get(step.getId()), contextFactory.apply(step));
                logger.fine("Rolled back step " + step.getId() + " in execution " + executionId);
                outcomes.add(new RollbackOutcome(step.getId(), null));
            } catch (Exception e) {
                logger.log(Level.WARNING, "Rollback of step " + step.getId() + " failed in execution " + executionId, e);
                outcomes.add(new RollbackOutcome(step.getId(), e));
            }
        }

        return outcomes;
    }

    static final class RollbackOutcome {
        private final String stepId;
        private final Throwable error;

        RollbackOutcome(String stepId, Throwable error) {
            this.stepId = stepId;
            this.error = error;
        }

        String getStepId() {
            return stepId;
        }

        Optional<Throwable> getError() {
            return Optional.ofNullable(error);
        }

        boolean isCompensated() {
            return error == null;
        }
    }
}
