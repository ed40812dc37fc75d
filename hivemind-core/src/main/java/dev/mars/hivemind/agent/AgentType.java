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

package dev.mars.hivemind.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Roles an agent can play in a multi-agent team.
 * Each role carries the task-description keywords that mark a task as
 * falling within that role's speciality.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum AgentType {

    /**
     * Gathers information and analyzes requirements.
     */
    RESEARCHER("researcher", "research"),

    /**
     * Implements features and writes code.
     */
    CODER("coder", "code", "implement"),

    /**
     * Writes and runs tests.
     */
    TESTER("tester", "test"),

    /**
     * Analyzes data and patterns.
     */
    ANALYST("analyst", "analyze"),

    /**
     * Designs system architecture.
     */
    ARCHITECT("architect", "architect", "design"),

    /**
     * Reviews code and provides feedback.
     */
    REVIEWER("reviewer", "review"),

    /**
     * Orchestrates multi-agent workflows.
     */
    COORDINATOR("coordinator", "coordinate"),

    /**
     * Optimizes performance and resources.
     */
    OPTIMIZER("optimizer", "optimize"),

    /**
     * Generates documentation.
     */
    DOCUMENTER("documenter", "document"),

    /**
     * Plans and sequences tasks.
     */
    PLANNER("planner", "plan");

    private final String wireName;
    private final List<String> keywords;

    AgentType(String wireName, String... keywords) {
        this.wireName = wireName;
        this.keywords = List.of(keywords);
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Keywords that associate a task description with this role.
     */
    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * Checks whether a task description mentions one of this role's keywords.
     * Matching is a case-insensitive substring test, so "testing" matches "test".
     *
     * @param description the task description, may be null
     * @return true if any keyword occurs in the description
     */
    public boolean matchesDescription(String description) {
        if (description == null || description.isEmpty()) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @JsonCreator
    public static AgentType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Agent type cannot be null");
        }
        for (AgentType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
