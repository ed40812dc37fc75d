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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link AgentEquilibriumSelector}.
 * Expected levels were worked out by hand-iterating the update rule with the default configuration.
 */
@DisplayName("AgentEquilibriumSelector Tests")
class AgentEquilibriumSelectorTest {

    private static final double TOLERANCE = 1e-3;

    private final AgentInfo tester = AgentInfo.of("t1", AgentType.TESTER, "test");
    private final AgentInfo coder = AgentInfo.of("c1", AgentType.CODER, "code");
    private final AgentInfo secondTester = AgentInfo.of("t2", AgentType.TESTER, "test");

    private final Task testTask = Task.builder("task-1")
            .description("Write unit test coverage")
            .requiredCapability("test")
            .build();

    private static AgentEquilibriumSelector selector(UpdateMode mode) {
        return new AgentEquilibriumSelector(EquilibriumConfig.builder().updateMode(mode).build());
    }

    private static double level(EquilibriumResult result, String agentId) {
        return result.getParticipant(agentId)
                .map(AgentParticipation::getParticipationLevel)
                .orElse(0.0);
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        private final AgentEquilibriumSelector selector = new AgentEquilibriumSelector();

        @Test
        @DisplayName("Effectiveness combines capability match and role boost")
        void testEffectiveness() {
            assertThat(selector.calculateEffectiveness(tester, testTask)).isCloseTo(1.0, within(1e-9));
            assertThat(selector.calculateEffectiveness(coder, testTask)).isCloseTo(0.09, within(1e-9));
        }

        @Test
        @DisplayName("Missing requirements count as a half match")
        void testEffectivenessWithoutRequirements() {
            Task task = Task.builder("misc").description("misc").build();

            assertThat(selector.calculateEffectiveness(coder, task)).isCloseTo(0.44, within(1e-9));
        }

        @Test
        @DisplayName("Partial capability match is proportional")
        void testPartialMatch() {
            Task task = Task.builder("t").description("implement the parser")
                    .requiredCapability("code")
                    .requiredCapability("parse")
                    .build();

            // 0.5 * 0.7 + 1.0 * 0.3
            assertThat(selector.calculateEffectiveness(coder, task)).isCloseTo(0.65, within(1e-9));
        }

        @Test
        @DisplayName("Role boost follows description keywords")
        void testTypeBoost() {
            Task design = Task.builder("d").description("Design the storage layer").build();

            assertThat(selector.typeBoost(AgentType.ARCHITECT, design)).isEqualTo(1.0);
            assertThat(selector.typeBoost(AgentType.CODER, design)).isEqualTo(0.3);
            assertThat(selector.typeBoost(AgentType.TESTER, testTask)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Overlap uses the larger capability set")
        void testCapabilityOverlap() {
            AgentInfo fullStack = AgentInfo.of("fs", AgentType.CODER, "code", "test", "deploy", "review");

            assertThat(selector.capabilityOverlap(tester, secondTester)).isEqualTo(1.0);
            assertThat(selector.capabilityOverlap(tester, coder)).isEqualTo(0.0);
            assertThat(selector.capabilityOverlap(coder, fullStack)).isEqualTo(0.25);
            assertThat(selector.capabilityOverlap(fullStack, tester)).isEqualTo(0.25);
        }

        @Test
        @DisplayName("Roles stand in for overlap when capabilities are missing")
        void testOverlapWithoutCapabilities() {
            AgentInfo bareCoder = AgentInfo.of("b1", AgentType.CODER);
            AgentInfo otherBareCoder = AgentInfo.of("b2", AgentType.CODER);
            AgentInfo bareTester = AgentInfo.of("b3", AgentType.TESTER);

            assertThat(selector.capabilityOverlap(bareCoder, otherBareCoder)).isEqualTo(0.8);
            assertThat(selector.capabilityOverlap(bareCoder, bareTester)).isEqualTo(0.2);
            assertThat(selector.capabilityOverlap(bareCoder, coder)).isEqualTo(0.8);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        private final AgentEquilibriumSelector selector = new AgentEquilibriumSelector();

        @Test
        @DisplayName("Empty pool yields no participants")
        void testEmptyPool() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of());

            assertThat(result.getParticipants()).isEmpty();
            assertThat(result.getIterations()).isZero();
            assertThat(result.getHistory()).isEmpty();
            assertThat(selector.findEquilibrium(testTask, List.of())).isEmpty();
        }

        @Test
        @DisplayName("Single agent takes the whole task without iterating")
        void testSingleAgent() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(coder));

            assertThat(result.getParticipants()).hasSize(1);
            AgentParticipation only = result.getParticipants().get(0);
            assertThat(only.getAgentId()).isEqualTo("c1");
            assertThat(only.getParticipationLevel()).isEqualTo(1.0);
            assertThat(only.getRedundancyPenalty()).isZero();
            assertThat(only.getUtility()).isCloseTo(0.09, within(1e-9));
            assertThat(result.getIterations()).isZero();
            assertThat(result.isConverged()).isTrue();
            assertThat(result.getHistory()).isEmpty();
        }

        @Test
        @DisplayName("Duplicate agent ids are rejected")
        void testDuplicateIds() {
            AgentInfo impostor = AgentInfo.of("t1", AgentType.CODER, "code");

            assertThatThrownBy(() -> selector.findEquilibrium(testTask, List.of(tester, impostor)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("t1");
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void testNullArguments() {
            assertThatThrownBy(() -> selector.findEquilibrium(null, List.of(tester)))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> selector.findEquilibrium(testTask, null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Snapshot updates")
    class SnapshotUpdates {

        private final AgentEquilibriumSelector selector = selector(UpdateMode.SNAPSHOT);

        @Test
        @DisplayName("Better-fitting agent dominates")
        void testDominantAgent() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(tester, coder));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(48);
            assertThat(result.getParticipantIds()).containsExactly("t1", "c1");
            assertThat(level(result, "t1")).isCloseTo(0.965, within(TOLERANCE));
            assertThat(level(result, "c1")).isCloseTo(0.035, within(TOLERANCE));
            assertThat(result.getParticipant("t1").get().getEffectivenessScore()).isCloseTo(1.0, within(1e-9));
            assertThat(result.getTotalUtility()).isCloseTo(0.9673, within(TOLERANCE));
        }

        @Test
        @DisplayName("History records every iteration up to convergence")
        void testHistory() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(tester, coder));

            List<IterationSnapshot> history = result.getHistory();
            assertThat(history).hasSize(result.getIterations());
            assertThat(history.get(0).getIteration()).isEqualTo(1);
            assertThat(history.get(history.size() - 1).getIteration()).isEqualTo(48);
            assertThat(history.get(history.size() - 1).getMaxDelta()).isLessThan(0.001);
            assertThat(history.get(0).getMaxDelta()).isGreaterThanOrEqualTo(0.001);
            assertThat(history.get(history.size() - 1).getTotalUtility())
                    .isCloseTo(result.getTotalUtility(), within(1e-12));
        }

        @Test
        @DisplayName("Identical competitors are treated identically")
        void testSymmetricCompetitors() {
            AgentInfo bareCoder = AgentInfo.of("coder", AgentType.CODER);
            AgentInfo bareTester = AgentInfo.of("tester", AgentType.TESTER);
            Task misc = Task.builder("misc").description("misc").build();

            EquilibriumResult result = selector.computeEquilibrium(misc, List.of(bareCoder, bareTester));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(1);
            assertThat(level(result, "coder")).isEqualTo(level(result, "tester"));
            assertThat(level(result, "coder")).isCloseTo(0.5, within(TOLERANCE));
        }

        @Test
        @DisplayName("Redundant same-skill agents crowd each other out")
        void testRedundantAgents() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(tester, coder, secondTester));

            // the two testers fully overlap and both decay below the minimum
            assertThat(result.isConverged()).isFalse();
            assertThat(result.getIterations()).isEqualTo(100);
            assertThat(result.getParticipantIds()).containsExactly("c1");
            assertThat(level(result, "c1")).isCloseTo(0.8166, within(TOLERANCE));
        }

        @Test
        @DisplayName("Equal coders settle at equal low participation")
        void testEqualCoders() {
            Task implement = Task.builder("impl").description("implement feature").requiredCapability("code").build();
            AgentInfo a = AgentInfo.of("a", AgentType.CODER, "code");
            AgentInfo b = AgentInfo.of("b", AgentType.CODER, "code");

            EquilibriumResult result = selector.computeEquilibrium(implement, List.of(a, b));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(64);
            assertThat(level(result, "a")).isEqualTo(level(result, "b"));
            assertThat(level(result, "a")).isCloseTo(0.0188, within(TOLERANCE));
        }

        @Test
        @DisplayName("Agent order does not change the outcome")
        void testOrderIndependence() {
            EquilibriumResult forward = selector.computeEquilibrium(testTask, List.of(tester, coder, secondTester));
            EquilibriumResult reversed = selector.computeEquilibrium(testTask, List.of(secondTester, coder, tester));

            assertThat(level(reversed, "c1")).isCloseTo(level(forward, "c1"), within(1e-12));
            assertThat(reversed.getIterations()).isEqualTo(forward.getIterations());
        }
    }

    @Nested
    @DisplayName("Sequential updates")
    class SequentialUpdates {

        private final AgentEquilibriumSelector selector = selector(UpdateMode.SEQUENTIAL);

        @Test
        @DisplayName("Dominant agent matches the snapshot outcome when competitors do not overlap")
        void testDominantAgent() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(tester, coder));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(48);
            assertThat(level(result, "t1")).isCloseTo(0.965, within(TOLERANCE));
            assertThat(level(result, "c1")).isCloseTo(0.035, within(TOLERANCE));
        }

        @Test
        @DisplayName("Later agent wins a tie between identical competitors")
        void testOrderSensitivity() {
            EquilibriumResult result = selector.computeEquilibrium(testTask, List.of(tester, coder, secondTester));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(65);
            assertThat(result.getParticipantIds()).containsExactly("t2", "c1");
            assertThat(level(result, "t2")).isCloseTo(0.9647, within(TOLERANCE));
            assertThat(level(result, "c1")).isCloseTo(0.0353, within(TOLERANCE));
            assertThat(result.getParticipant("t1")).isEmpty();
        }

        @Test
        @DisplayName("Second of two equal coders takes the task")
        void testEqualCoders() {
            Task implement = Task.builder("impl").description("implement feature").requiredCapability("code").build();
            AgentInfo a = AgentInfo.of("a", AgentType.CODER, "code");
            AgentInfo b = AgentInfo.of("b", AgentType.CODER, "code");

            EquilibriumResult result = selector.computeEquilibrium(implement, List.of(a, b));

            assertThat(result.isConverged()).isTrue();
            assertThat(result.getIterations()).isEqualTo(24);
            assertThat(result.getParticipantIds()).containsExactly("b");
            assertThat(level(result, "b")).isCloseTo(1.0, within(TOLERANCE));
        }
    }

    @Nested
    @DisplayName("Iteration limits and invariants")
    class Invariants {

        @Test
        @DisplayName("Stops at the iteration limit and reports non-convergence")
        void testIterationLimit() {
            AgentEquilibriumSelector limited = new AgentEquilibriumSelector(
                    EquilibriumConfig.builder().maxIterations(3).build());

            EquilibriumResult result = limited.computeEquilibrium(testTask, List.of(tester, coder));

            assertThat(result.isConverged()).isFalse();
            assertThat(result.getIterations()).isEqualTo(3);
            assertThat(result.getHistory()).hasSize(3);
            assertThat(level(result, "t1")).isCloseTo(0.5644, within(TOLERANCE));
            assertThat(level(result, "c1")).isCloseTo(0.4356, within(TOLERANCE));
        }

        @Test
        @DisplayName("Participation never sums above one and stays within bounds")
        void testNormalization() {
            List<AgentInfo> pool = List.of(
                    AgentInfo.of("r", AgentType.RESEARCHER, "research", "analyze"),
                    AgentInfo.of("a", AgentType.ANALYST, "analyze"),
                    AgentInfo.of("c", AgentType.CODER, "code"),
                    AgentInfo.of("c2", AgentType.CODER, "code", "test"),
                    AgentInfo.of("t", AgentType.TESTER, "test"),
                    AgentInfo.of("d", AgentType.DOCUMENTER));
            Task task = Task.builder("mixed").description("Analyze and implement the parser")
                    .requiredCapability("analyze")
                    .requiredCapability("code")
                    .build();

            for (UpdateMode mode : UpdateMode.values()) {
                EquilibriumResult result = selector(mode).computeEquilibrium(task, pool);

                assertThat(result.getHistory())
                        .allSatisfy(snapshot -> assertThat(snapshot.getParticipationSum()).isLessThanOrEqualTo(1.0));
                assertThat(result.getParticipationSum()).isLessThanOrEqualTo(1.0);
                assertThat(result.getParticipants()).allSatisfy(p -> {
                    assertThat(p.getParticipationLevel()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
                    assertThat(p.getEffectivenessScore()).isBetween(0.0, 1.0);
                    assertThat(p.getRedundancyPenalty()).isGreaterThanOrEqualTo(0.0);
                });
                assertThat(result.getParticipants())
                        .isSortedAccordingTo((x, y) -> Double.compare(y.getParticipationLevel(), x.getParticipationLevel()));
            }
        }

        @Test
        @DisplayName("Scaled participation never rounds above one")
        void testScaledSumStaysAtOrBelowOne() {
            // Disjoint specialists all grow, so every pool size goes through rescaling.
            for (int size = 2; size <= 16; size++) {
                List<AgentInfo> pool = new ArrayList<>();
                Task.Builder task = Task.builder("wide-" + size).description("implement every module");
                for (int i = 0; i < size; i++) {
                    pool.add(AgentInfo.of("c" + i, AgentType.CODER, "module" + i));
                    task.requiredCapability("module" + i);
                }

                for (UpdateMode mode : UpdateMode.values()) {
                    EquilibriumResult result = selector(mode).computeEquilibrium(task.build(), pool);

                    assertThat(result.getHistory())
                            .anySatisfy(snapshot -> assertThat(snapshot.getParticipationSum()).isCloseTo(1.0, within(1e-9)))
                            .allSatisfy(snapshot -> assertThat(snapshot.getParticipationSum()).isLessThanOrEqualTo(1.0));
                    assertThat(result.getParticipationSum()).isLessThanOrEqualTo(1.0);
                }
            }
        }

        @Test
        @DisplayName("Concurrent computations do not interfere")
        void testConcurrentCalls() throws Exception {
            AgentEquilibriumSelector shared = new AgentEquilibriumSelector();
            EquilibriumResult expected = shared.computeEquilibrium(testTask, List.of(tester, coder));

            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Callable<EquilibriumResult>> calls = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    calls.add(() -> shared.computeEquilibrium(testTask, List.of(tester, coder)));
                }
                for (Future<EquilibriumResult> future : pool.invokeAll(calls)) {
                    EquilibriumResult result = future.get(10, TimeUnit.SECONDS);
                    assertThat(result.getParticipants()).isEqualTo(expected.getParticipants());
                    assertThat(result.getIterations()).isEqualTo(expected.getIterations());
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Top agent selection")
    class TopAgents {

        private final AgentEquilibriumSelector selector = new AgentEquilibriumSelector();

        @Test
        @DisplayName("Returns the highest participants first")
        void testSelectTop() {
            assertThat(selector.selectTopAgents(testTask, List.of(coder, tester), 1)).containsExactly(tester);
            assertThat(selector.selectTopAgents(testTask, List.of(coder, tester), 5)).containsExactly(tester, coder);
        }

        @Test
        @DisplayName("Excluded agents are never selected")
        void testExcludedAgents() {
            List<AgentInfo> selected = selector.selectTopAgents(testTask, List.of(tester, coder, secondTester), 3);

            assertThat(selected).containsExactly(coder);
        }

        @Test
        @DisplayName("Zero or negative counts")
        void testCounts() {
            assertThat(selector.selectTopAgents(testTask, List.of(tester, coder), 0)).isEmpty();
            assertThatThrownBy(() -> selector.selectTopAgents(testTask, List.of(tester), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
