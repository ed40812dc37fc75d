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

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filter for {@link WorkflowEngine#list(WorkflowQuery)}. Unset criteria match everything.
 */
public class WorkflowQuery {

    private final Set<String> tags;
    private final Pattern versionPattern;
    private final Pattern namePattern;
    private final int offset;
    private final int limit;

    private WorkflowQuery(Builder builder) {
        if (builder.offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + builder.offset);
        }
        if (builder.limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + builder.limit);
        }
        this.tags = Set.copyOf(builder.tags);
        this.versionPattern = builder.versionRegex != null ? Pattern.compile(builder.versionRegex) : null;
        this.namePattern = builder.nameRegex != null
                ? Pattern.compile(builder.nameRegex, Pattern.CASE_INSENSITIVE)
                : null;
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    public static WorkflowQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tag match is any-of; version and name patterns must match the whole value.
     */
    public boolean matches(WorkflowDefinition definition) {
        if (!tags.isEmpty() && definition.getTags().stream().noneMatch(tags::contains)) {
            return false;
        }
        if (versionPattern != null && !versionPattern.matcher(definition.getVersion()).matches()) {
            return false;
        }
        return namePattern == null || namePattern.matcher(definition.getName()).matches();
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Maximum number of results, 0 for no limit.
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Builder for WorkflowQuery.
     */
    public static class Builder {
        private Set<String> tags = Set.of();
        private String versionRegex;
        private String nameRegex;
        private int offset;
        private int limit;

        public Builder tags(String... tags) {
            this.tags = Set.of(tags);
            return this;
        }

        public Builder version(String versionRegex) {
            this.versionRegex = versionRegex;
            return this;
        }

        public Builder name(String nameRegex) {
            this.nameRegex = nameRegex;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public WorkflowQuery build() {
            return new WorkflowQuery(this);
        }
    }
}
