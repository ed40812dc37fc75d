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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of an equilibrium computation. Participants are the agents with a positive
 * participation level, highest level first. Non-convergence is reported through
 * {@link #isConverged()} and is not an error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class EquilibriumResult {

    @JsonProperty("participants")
    private final List<AgentParticipation> participants;

    @JsonProperty("iterations")
    private final int iterations;

    @JsonProperty("converged")
    private final boolean converged;

    @JsonProperty("totalUtility")
    private final double totalUtility;

    @JsonProperty("history")
    private final List<IterationSnapshot> history;

    @JsonCreator
    public EquilibriumResult(@JsonProperty("participants") List<AgentParticipation> participants,
                             @JsonProperty("iterations") int iterations,
                             @JsonProperty("converged") boolean converged,
                             @JsonProperty("totalUtility") double totalUtility,
                             @JsonProperty("history") List<IterationSnapshot> history) {
        this.participants = participants != null ? List.copyOf(participants) : List.of();
        this.iterations = iterations;
        this.converged = converged;
        this.totalUtility = totalUtility;
        this.history = history != null ? List.copyOf(history) : List.of();
    }

    static EquilibriumResult empty() {
        return new EquilibriumResult(List.of(), 0, true, 0.0, List.of());
    }

    public List<AgentParticipation> getParticipants() {
        return participants;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }

    public double getTotalUtility() {
        return totalUtility;
    }

    public List<IterationSnapshot> getHistory() {
        return history;
    }

    public Optional<AgentParticipation> getParticipant(String agentId) {
        return participants.stream()
                .filter(p -> p.getAgentId().equals(agentId))
                .findFirst();
    }

    @JsonIgnore
    public List<String> getParticipantIds() {
        return participants.stream()
                .map(AgentParticipation::getAgentId)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public double getParticipationSum() {
        return participants.stream()
                .mapToDouble(AgentParticipation::getParticipationLevel)
                .sum();
    }

    @Override
    public String toString() {
        return "EquilibriumResult{" +
               "participants=" + getParticipantIds() +
               ", iterations=" + iterations +
               ", converged=" + converged +
               ", totalUtility=" + totalUtility +
               '}';
    }
}
