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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.hivemind.agent.AgentType;

import java.util.Objects;

/**
 * One agent's standing at the end of an equilibrium computation.
 * Instances are created per computation and never shared between calls.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class AgentParticipation {

    @JsonProperty("agentId")
    private final String agentId;

    @JsonProperty("agentType")
    private final AgentType agentType;

    @JsonProperty("participationLevel")
    private final double participationLevel;

    @JsonProperty("effectivenessScore")
    private final double effectivenessScore;

    @JsonProperty("redundancyPenalty")
    private final double redundancyPenalty;

    @JsonProperty("utility")
    private final double utility;

    @JsonCreator
    public AgentParticipation(@JsonProperty("agentId") String agentId,
                              @JsonProperty("agentType") AgentType agentType,
                              @JsonProperty("participationLevel") double participationLevel,
                              @JsonProperty("effectivenessScore") double effectivenessScore,
                              @JsonProperty("redundancyPenalty") double redundancyPenalty,
                              @JsonProperty("utility") double utility) {
        this.agentId = Objects.requireNonNull(agentId, "Agent ID cannot be null");
        this.agentType = Objects.requireNonNull(agentType, "Agent type cannot be null");
        this.participationLevel = participationLevel;
        this.effectivenessScore = effectivenessScore;
        this.redundancyPenalty = redundancyPenalty;
        this.utility = utility;
    }

    public String getAgentId() {
        return agentId;
    }

    public AgentType getAgentType() {
        return agentType;
    }

    /**
     * Share of the task the agent takes on, within [0, 1].
     */
    public double getParticipationLevel() {
        return participationLevel;
    }

    /**
     * How well the agent fits the task, within [0, 1]. Constant for a given task.
     */
    public double getEffectivenessScore() {
        return effectivenessScore;
    }

    public double getRedundancyPenalty() {
        return redundancyPenalty;
    }

    /**
     * Net utility from the last update. May be negative.
     */
    public double getUtility() {
        return utility;
    }

    @JsonIgnore
    public boolean isParticipating() {
        return participationLevel > 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentParticipation that = (AgentParticipation) o;
        return Double.compare(that.participationLevel, participationLevel) == 0 &&
               Double.compare(that.effectivenessScore, effectivenessScore) == 0 &&
               Double.compare(that.redundancyPenalty, redundancyPenalty) == 0 &&
               Double.compare(that.utility, utility) == 0 &&
               Objects.equals(agentId, that.agentId) &&
               agentType == that.agentType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentId, agentType, participationLevel, effectivenessScore, redundancyPenalty, utility);
    }

    @Override
    public String toString() {
        return "AgentParticipation{" +
               "agentId='" + agentId + '\'' +
               ", agentType=" + agentType +
               ", participationLevel=" + participationLevel +
               ", effectivenessScore=" + effectivenessScore +
               ", redundancyPenalty=" + redundancyPenalty +
               ", utility=" + utility +
               '}';
    }
}
