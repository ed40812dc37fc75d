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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Capability descriptor for an agent that can be assigned work.
 * This is all the orchestration core needs to know about an agent; concrete
 * agent implementations live outside it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class AgentInfo {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("type")
    private final AgentType type;

    @JsonProperty("capabilities")
    private final Set<String> capabilities;

    /**
     * Creates an agent descriptor.
     *
     * @param id unique identifier for the agent
     * @param type the agent's role
     * @param capabilities declared capabilities, may be null or empty
     */
    @JsonCreator
    public AgentInfo(@JsonProperty("id") String id,
                     @JsonProperty("type") AgentType type,
                     @JsonProperty("capabilities") Collection<String> capabilities) {
        this.id = Objects.requireNonNull(id, "Agent ID cannot be null");
        this.type = Objects.requireNonNull(type, "Agent type cannot be null");
        this.capabilities = capabilities != null
                ? Set.copyOf(new LinkedHashSet<>(capabilities))
                : Set.of();
    }

    public static AgentInfo of(String id, AgentType type, String... capabilities) {
        return new AgentInfo(id, type, Arrays.asList(capabilities));
    }

    public String getId() {
        return id;
    }

    public AgentType getType() {
        return type;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentInfo that = (AgentInfo) o;
        return Objects.equals(id, that.id) &&
               type == that.type &&
               Objects.equals(capabilities, that.capabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, capabilities);
    }

    @Override
    public String toString() {
        return "AgentInfo{" +
               "id='" + id + '\'' +
               ", type=" + type +
               ", capabilities=" + capabilities +
               '}';
    }
}
