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

package dev.mars.stepwise.workflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlowParseExceptionTest {

    @Test
    void testPlainMessage() {
        FlowParseException exception = new FlowParseException("Empty or invalid YAML content");

        assertEquals("Empty or invalid YAML content", exception.getMessage());
        assertNull(exception.getFlowName());
        assertNull(exception.getFieldPath());
        assertEquals(-1, exception.getLineNumber());
    }

    @Test
    void testMessageWithContext() {
        IllegalStateException cause = new IllegalStateException("boom");
        FlowParseException exception = new FlowParseException("orders", 12, "spec.steps[2].tool", "Unknown tool 'x'", cause);

        assertEquals("Flow 'orders': Line 12: Field 'spec.steps[2].tool': Unknown tool 'x'", exception.getMessage());
        assertEquals("Unknown tool 'x'", exception.getRawMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testMessageWithoutLine() {
        FlowParseException exception = new FlowParseException("orders", "metadata.name", "Required field 'name' is missing");

        assertEquals("Flow 'orders': Field 'metadata.name': Required field 'name' is missing", exception.getMessage());
        assertEquals(-1, exception.getLineNumber());
    }
}
