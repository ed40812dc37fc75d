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

package dev.mars.hivemind.workflow.event;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event sink that writes lifecycle events to the java.util.logging framework.
 * Failures are logged at WARNING, everything else at FINE.
 */
public class LoggingWorkflowEventSink implements WorkflowEventSink {

    private static final Logger logger = Logger.getLogger(LoggingWorkflowEventSink.class.getName());

    @Override
    public void emit(WorkflowEvent event) {
        Level level = event.getError().isPresent() ? Level.WARNING : Level.FINE;
        if (logger.isLoggable(level)) {
            logger.log(level, "Workflow event: " + event);
        }
    }
}
