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

package dev.mars.hivemind.core.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotFoundExceptionTest {

    @Test
    void testMessageNamesResource() {
        NotFoundException e = new NotFoundException("workflow", "sync-graph");

        assertEquals("workflow", e.getResourceType());
        assertEquals("sync-graph", e.getResourceId());
        assertEquals("Workflow not found: sync-graph", e.getMessage());
        assertInstanceOf(HivemindException.class, e);
    }

    @Test
    void testMessageWithoutResourceType() {
        assertEquals("Resource not found: x", new NotFoundException(null, "x").getMessage());
    }

    @Test
    void testBaseExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        HivemindException e = new HivemindException("wrapped", cause);

        assertSame(cause, e.getCause());
        assertEquals("wrapped", e.getMessage());
    }
}
