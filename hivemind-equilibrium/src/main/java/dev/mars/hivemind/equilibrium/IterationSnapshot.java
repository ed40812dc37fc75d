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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate state recorded after one iteration of the update loop.
 */
public final class IterationSnapshot {

    @JsonProperty("iteration")
    private final int iteration;

    @JsonProperty("totalUtility")
    private final double totalUtility;

    @JsonProperty("participationSum")
    private final double participationSum;

    @JsonProperty("maxDelta")
    private final double maxDelta;

    @JsonCreator
    public IterationSnapshot(@JsonProperty("iteration") int iteration,
                             @JsonProperty("totalUtility") double totalUtility,
                             @JsonProperty("participationSum") double participationSum,
                             @JsonProperty("maxDelta") double maxDelta) {
        this.iteration = iteration;
        this.totalUtility = totalUtility;
        this.participationSum = participationSum;
        this.maxDelta = maxDelta;
    }

    /**
     * 1-based iteration number.
     */
    public int getIteration() {
        return iteration;
    }

    public double getTotalUtility() {
        return totalUtility;
    }

    public double getParticipationSum() {
        return participationSum;
    }

    /**
     * Largest absolute change of any agent's level during this iteration.
     */
    public double getMaxDelta() {
        return maxDelta;
    }

    @Override
    public String toString() {
        return "IterationSnapshot{" +
               "iteration=" + iteration +
               ", totalUtility=" + totalUtility +
               ", participationSum=" + participationSum +
               ", maxDelta=" + maxDelta +
               '}';
    }
}
