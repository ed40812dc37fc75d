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

import dev.mars.hivemind.config.HivemindConfiguration;

import java.util.Objects;

/**
 * Immutable tuning for {@link AgentEquilibriumSelector}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class EquilibriumConfig {

    public static final double DEFAULT_LEARNING_RATE = 0.1;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.001;
    public static final double DEFAULT_MIN_PARTICIPATION = 0.01;

    private final double learningRate;
    private final int maxIterations;
    private final double convergenceThreshold;
    private final double minParticipation;
    private final UpdateMode updateMode;

    private EquilibriumConfig(Builder builder) {
        if (!(builder.learningRate > 0.0) || Double.isInfinite(builder.learningRate)) {
            throw new IllegalArgumentException("Learning rate must be a positive number: " + builder.learningRate);
        }
        if (builder.maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive: " + builder.maxIterations);
        }
        if (!(builder.convergenceThreshold >= 0.0)) {
            throw new IllegalArgumentException("Convergence threshold cannot be negative: " + builder.convergenceThreshold);
        }
        if (!(builder.minParticipation >= 0.0 && builder.minParticipation <= 1.0)) {
            throw new IllegalArgumentException("Min participation must be within [0, 1]: " + builder.minParticipation);
        }
        this.learningRate = builder.learningRate;
        this.maxIterations = builder.maxIterations;
        this.convergenceThreshold = builder.convergenceThreshold;
        this.minParticipation = builder.minParticipation;
        this.updateMode = Objects.requireNonNull(builder.updateMode, "Update mode cannot be null");
    }

    public static EquilibriumConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EquilibriumConfig fromConfiguration(HivemindConfiguration configuration) {
        return builder()
                .learningRate(configuration.getLearningRate())
                .maxIterations(configuration.getMaxIterations())
                .convergenceThreshold(configuration.getConvergenceThreshold())
                .minParticipation(configuration.getMinParticipation())
                .updateMode(UpdateMode.fromString(configuration.getUpdateMode()))
                .build();
    }

    public double getLearningRate() {
        return learningRate;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getConvergenceThreshold() {
        return convergenceThreshold;
    }

    /**
     * Levels that fall below this value after an update collapse to exactly zero.
     */
    public double getMinParticipation() {
        return minParticipation;
    }

    public UpdateMode getUpdateMode() {
        return updateMode;
    }

    public Builder toBuilder() {
        return builder()
                .learningRate(learningRate)
                .maxIterations(maxIterations)
                .convergenceThreshold(convergenceThreshold)
                .minParticipation(minParticipation)
                .updateMode(updateMode);
    }

    @Override
    public String toString() {
        return "EquilibriumConfig{" +
               "learningRate=" + learningRate +
               ", maxIterations=" + maxIterations +
               ", convergenceThreshold=" + convergenceThreshold +
               ", minParticipation=" + minParticipation +
               ", updateMode=" + updateMode +
               '}';
    }

    public static class Builder {
        private double learningRate = DEFAULT_LEARNING_RATE;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double convergenceThreshold = DEFAULT_CONVERGENCE_THRESHOLD;
        private double minParticipation = DEFAULT_MIN_PARTICIPATION;
        private UpdateMode updateMode = UpdateMode.SNAPSHOT;

        private Builder() {
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder convergenceThreshold(double convergenceThreshold) {
            this.convergenceThreshold = convergenceThreshold;
            return this;
        }

        public Builder minParticipation(double minParticipation) {
            this.minParticipation = minParticipation;
            return this;
        }

        public Builder updateMode(UpdateMode updateMode) {
            this.updateMode = updateMode;
            return this;
        }

        public EquilibriumConfig build() {
            return new EquilibriumConfig(this);
        }
    }
}
