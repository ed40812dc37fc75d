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

package dev.mars.hivemind.workflow;

import java.util.*;

/**
 * Dependency graph over the steps of one workflow definition.
 * Used at registration for structural validation and depth-first cycle detection;
 * the scheduler itself launches steps as their dependencies succeed.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, WorkflowStep> steps = new LinkedHashMap<>();
    private final List<String> duplicateIds = new ArrayList<>();

    public DependencyGraph(List<WorkflowStep> workflowSteps) {
        Objects.requireNonNull(workflowSteps, "Steps cannot be null");
        for (WorkflowStep step : workflowSteps) {
            addStep(step);
        }
    }

    public static DependencyGraph of(WorkflowDefinition definition) {
        return new DependencyGraph(definition.getSteps());
    }

    private void addStep(WorkflowStep step) {
        Objects.requireNonNull(step, "Workflow step cannot be null");
        String stepId = step.getId();
        if (steps.containsKey(stepId)) {
            duplicateIds.add(stepId);
            return;
        }
        steps.put(stepId, step);
        dependencies.put(stepId, new LinkedHashSet<>(step.getDependencies()));
    }

    public Map<String, WorkflowStep> getSteps() {
        return Collections.unmodifiableMap(steps);
    }

    public Set<String> getDependencies(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    /**
     * Validates the graph for duplicate step ids, dangling dependencies,
     * self-dependencies and cycles.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        if (steps.isEmpty()) {
            result.addWarning(null, "Workflow has no steps");
        }

        for (String duplicate : duplicateIds) {
            result.addError(duplicate, "Duplicate step id '" + duplicate + "'");
        }

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String stepId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (dependency.equals(stepId)) {
                    result.addError(stepId, "Step cannot depend on itself");
                } else if (!steps.containsKey(dependency)) {
                    result.addError(stepId, "Dependency '" + dependency + "' not found");
                }
            }
        }

        List<String> cycle = findCycle();
        if (!cycle.isEmpty()) {
            result.setCycle(cycle);
            result.addError("Circular dependency detected: " + String.join(" -> ", cycle));
        }

        return result;
    }

    /**
     * Depth-first search with recursion-stack marking. Self-dependencies and
     * dependencies on unknown steps are reported by {@link #validate()} and skipped here.
     *
     * @return the first cycle found as a path whose first and last element are the same
     *         step, or an empty list if the graph is acyclic
     */
    public List<String> findCycle() {
        Set<String> visited = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();

        for (String stepId : steps.keySet()) {
            if (!visited.contains(stepId)) {
                List<String> cycle = visit(stepId, visited, path, onPath);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<String> visit(String stepId, Set<String> visited, Deque<String> path, Set<String> onPath) {
        visited.add(stepId);
        path.addLast(stepId);
        onPath.add(stepId);

        for (String dependency : getDependencies(stepId)) {
            if (dependency.equals(stepId) || !steps.containsKey(dependency)) {
                continue;
            }
            if (onPath.contains(dependency)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String node : path) {
                    if (node.equals(dependency)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(node);
                    }
                }
                cycle.add(dependency);
                return cycle;
            }
            if (!visited.contains(dependency)) {
                List<String> cycle = visit(dependency, visited, path, onPath);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }

        path.removeLast();
        onPath.remove(stepId);
        return List.of();
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "steps=" + steps.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
