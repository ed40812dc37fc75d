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

import dev.mars.hivemind.agent.AgentInfo;
import dev.mars.hivemind.agent.AgentType;
import dev.mars.hivemind.core.Task;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Selects agents for a task by iterating participation levels toward a stable point.
 * <p>
 * Each agent starts with an equal share. On every iteration an agent's level moves by
 * {@code learningRate * (utility - competition)} where utility rewards task fit and
 * competition grows with the participation of agents whose capabilities overlap its own.
 * Agents dominated by better-fitting competitors fall below the minimum participation and
 * drop out. Levels are scaled down whenever their sum exceeds 1.
 * <p>
 * The selector holds no state between calls, so one instance may serve concurrent callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class AgentEquilibriumSelector {

    private static final Logger logger = Logger.getLogger(AgentEquilibriumSelector.class.getName());

    private static final double CAPABILITY_WEIGHT = 0.7;
    private static final double TYPE_WEIGHT = 0.3;
    private static final double NO_REQUIREMENTS_MATCH = 0.5;
    private static final double TYPE_MATCH_BOOST = 1.0;
    private static final double TYPE_MISMATCH_BOOST = 0.3;
    private static final double SAME_TYPE_OVERLAP = 0.8;
    private static final double DIFFERENT_TYPE_OVERLAP = 0.2;
    private static final double REDUNDANCY_WEIGHT = 0.5;
    // Headroom so any summation order of scaled levels stays at or below 1.
    private static final double SCALED_SUM_CEILING = 1.0 - 8 * Math.ulp(1.0);

    private final EquilibriumConfig config;

    public AgentEquilibriumSelector() {
        this(EquilibriumConfig.defaults());
    }

    public AgentEquilibriumSelector(EquilibriumConfig config) {
        this.config = Objects.requireNonNull(config, "Equilibrium config cannot be null");
    }

    public EquilibriumConfig getConfig() {
        return config;
    }

    /**
     * Agents with positive participation at equilibrium, highest level first.
     *
     * @param task the task being allocated
     * @param agents the candidate pool, in a fixed order
     * @return the participating agents, empty if the pool is empty
     * @throws IllegalArgumentException if two agents share an id
     */
    public List<AgentParticipation> findEquilibrium(Task task, List<AgentInfo> agents) {
        return computeEquilibrium(task, agents).getParticipants();
    }

    /**
     * Picks at most {@code n} agents in descending order of participation.
     * Fewer are returned when fewer agents participate.
     */
    public List<AgentInfo> selectTopAgents(Task task, List<AgentInfo> agents, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of agents to select cannot be negative: " + n);
        }
        EquilibriumResult result = computeEquilibrium(task, agents);

        Map<String, AgentInfo> byId = new LinkedHashMap<>();
        for (AgentInfo agent : agents) {
            byId.put(agent.getId(), agent);
        }
        return result.getParticipants().stream()
                .limit(n)
                .map(p -> byId.get(p.getAgentId()))
                .collect(Collectors.toList());
    }

    /**
     * Runs the full computation and reports iteration count, convergence and per-iteration history.
     */
    public EquilibriumResult computeEquilibrium(Task task, List<AgentInfo> agents) {
        Objects.requireNonNull(task, "Task cannot be null");
        Objects.requireNonNull(agents, "Agents cannot be null");
        requireUniqueIds(agents);

        if (agents.isEmpty()) {
            logger.fine("No agents available for task " + task.getId());
            return EquilibriumResult.empty();
        }

        if (agents.size() == 1) {
            AgentInfo agent = agents.get(0);
            double effectiveness = calculateEffectiveness(agent, task);
            AgentParticipation only = new AgentParticipation(
                    agent.getId(), agent.getType(), 1.0, effectiveness, 0.0, effectiveness);
            logger.fine("Single agent " + agent.getId() + " takes task " + task.getId());
            return new EquilibriumResult(List.of(only), 0, true, effectiveness, List.of());
        }

        return iterate(task, agents);
    }

    private EquilibriumResult iterate(Task task, List<AgentInfo> agents) {
        int size = agents.size();
        double[] effectiveness = new double[size];
        double[] levels = new double[size];
        double[] penalties = new double[size];
        double[] utilities = new double[size];
        double[][] overlaps = new double[size][size];

        for (int i = 0; i < size; i++) {
            effectiveness[i] = calculateEffectiveness(agents.get(i), task);
            levels[i] = 1.0 / size;
            for (int j = 0; j < size; j++) {
                if (i != j) {
                    overlaps[i][j] = capabilityOverlap(agents.get(i), agents.get(j));
                }
            }
        }

        boolean sequential = config.getUpdateMode() == UpdateMode.SEQUENTIAL;
        List<IterationSnapshot> history = new ArrayList<>();
        boolean converged = false;
        int iterations = 0;

        for (int iteration = 1; iteration <= config.getMaxIterations(); iteration++) {
            double[] previous = levels.clone();
            double[] source = sequential ? levels : previous;

            for (int i = 0; i < size; i++) {
                double competition = 0.0;
                for (int j = 0; j < size; j++) {
                    if (j != i) {
                        competition += overlaps[i][j] * source[j];
                    }
                }
                penalties[i] = competition * REDUNDANCY_WEIGHT;
                utilities[i] = effectiveness[i] * source[i] - penalties[i];

                double updated = source[i] + config.getLearningRate() * (utilities[i] - competition);
                updated = Math.max(0.0, Math.min(1.0, updated));
                if (updated < config.getMinParticipation()) {
                    updated = 0.0;
                }
                levels[i] = updated;
            }

            double sum = normalize(levels);
            double maxDelta = 0.0;
            for (int i = 0; i < size; i++) {
                maxDelta = Math.max(maxDelta, Math.abs(levels[i] - previous[i]));
            }

            iterations = iteration;
            history.add(new IterationSnapshot(iteration, sum(utilities), sum, maxDelta));
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Task " + task.getId() + " iteration " + iteration +
                           ": participationSum=" + sum + ", maxDelta=" + maxDelta);
            }

            if (maxDelta < config.getConvergenceThreshold()) {
                converged = true;
                break;
            }
        }

        List<AgentParticipation> participants = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (levels[i] > 0.0) {
                AgentInfo agent = agents.get(i);
                participants.add(new AgentParticipation(agent.getId(), agent.getType(),
                        levels[i], effectiveness[i], penalties[i], utilities[i]));
            }
        }
        participants.sort(Comparator.comparingDouble(AgentParticipation::getParticipationLevel).reversed());

        if (converged) {
            logger.info("Equilibrium for task " + task.getId() + " converged after " + iterations +
                       " iteration(s) with " + participants.size() + " of " + size + " agent(s) participating");
        } else {
            logger.info("Equilibrium for task " + task.getId() + " did not converge after " + iterations +
                       " iteration(s); returning current participation");
        }
        return new EquilibriumResult(participants, iterations, converged, sum(utilities), history);
    }

    /**
     * Scales levels down so they sum to at most 1. Sums below 1 are left as they are.
     * Rounding left over from the division is taken off the largest level.
     *
     * @return the sum after scaling
     */
    private static double normalize(double[] levels) {
        double total = sum(levels);
        if (total <= 1.0) {
            return total;
        }
        for (int i = 0; i < levels.length; i++) {
            levels[i] = levels[i] / total;
        }
        double excess = sum(levels) - SCALED_SUM_CEILING;
        while (excess > 0.0) {
            int largest = 0;
            for (int i = 1; i < levels.length; i++) {
                if (levels[i] > levels[largest]) {
                    largest = i;
                }
            }
            double step = Math.max(excess, Math.ulp(levels[largest]));
            levels[largest] = Math.max(0.0, levels[largest] - step);
            excess = sum(levels) - SCALED_SUM_CEILING;
        }
        return sum(levels);
    }

    private static double sum(double[] values) {
        return Arrays.stream(values).sum();
    }

    /**
     * Task fit in [0, 1]: 70% capability match and 30% role boost.
     * With no required capabilities the capability match counts as 0.5.
     */
    public double calculateEffectiveness(AgentInfo agent, Task task) {
        Set<String> required = task.getRequiredCapabilities();
        double capabilityMatch;
        if (required.isEmpty()) {
            capabilityMatch = NO_REQUIREMENTS_MATCH;
        } else {
            long matched = required.stream().filter(agent::hasCapability).count();
            capabilityMatch = (double) matched / required.size();
        }
        return capabilityMatch * CAPABILITY_WEIGHT + typeBoost(agent.getType(), task) * TYPE_WEIGHT;
    }

    /**
     * 1.0 when the task description mentions one of the role's keywords, otherwise 0.3.
     */
    public double typeBoost(AgentType type, Task task) {
        return type.matchesDescription(task.getDescription()) ? TYPE_MATCH_BOOST : TYPE_MISMATCH_BOOST;
    }

    /**
     * Shared capabilities divided by the larger capability set. When either agent declares
     * no capabilities the roles stand in: 0.8 for the same role, 0.2 otherwise.
     */
    public double capabilityOverlap(AgentInfo a, AgentInfo b) {
        Set<String> capsA = a.getCapabilities();
        Set<String> capsB = b.getCapabilities();
        if (capsA.isEmpty() || capsB.isEmpty()) {
            return a.getType() == b.getType() ? SAME_TYPE_OVERLAP : DIFFERENT_TYPE_OVERLAP;
        }
        long shared = capsA.stream().filter(capsB::contains).count();
        return (double) shared / Math.max(capsA.size(), capsB.size());
    }

    private static void requireUniqueIds(List<AgentInfo> agents) {
        Set<String> seen = new HashSet<>();
        for (AgentInfo agent : agents) {
            Objects.requireNonNull(agent, "Agent cannot be null");
            if (!seen.add(agent.getId())) {
                throw new IllegalArgumentException("Duplicate agent id in pool: " + agent.getId());
            }
        }
    }
}
