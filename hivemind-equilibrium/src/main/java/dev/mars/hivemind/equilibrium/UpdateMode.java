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


package dev.mars.hivemind.equilibrium;

import java.util.Locale;

/**
 * How participation updates within one iteration see each other.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum UpdateMode {

    /**
     * Every agent's update is computed from the levels at the start of the iteration,
     * then all updates are committed together. Agent order does not affect the outcome.
     */
    SNAPSHOT,

    /**
     * Agents are updated one at a time in pool order and each new level is immediately
     * visible to the agents updated after it in the same iteration.
     */
    SEQUENTIAL;

    /**
     * Parse an update mode, case-insensitively. Blank values map to {@link #SNAPSHOT}.
     *
     * @throws IllegalArgumentException if the value is not a known mode
     */
    public static UpdateMode fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return SNAPSHOT;
        }
        try {
            return UpdateMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid equilibrium update mode: " + value);
        }
    }
}
