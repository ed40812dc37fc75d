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

package dev.mars.hivemind.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a task offered to the agent pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TaskPriority {

    /**
     * Background work, handled when nothing more pressing is queued.
     */
    LOW("low", 1),

    /**
     * The default priority.
     */
    MEDIUM("medium", 5),

    /**
     * Important work that should be picked up ahead of routine tasks.
     */
    HIGH("high", 8),

    /**
     * Time-sensitive work, handled immediately.
     */
    CRITICAL("critical", 10);

    private final String wireName;
    private final int value;

    TaskPriority(String wireName, int value) {
        this.wireName = wireName;
        this.value = value;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Numeric weight of this priority; higher means more urgent.
     */
    public int getValue() {
        return value;
    }

    public boolean isHigherThan(TaskPriority other) {
        return this.value > other.value;
    }

    @JsonCreator
    public static TaskPriority fromWireName(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (TaskPriority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + value);
    }
}
