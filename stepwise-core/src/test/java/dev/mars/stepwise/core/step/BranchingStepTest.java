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

package dev.mars.stepwise.core.step;

import dev.mars.stepwise.core.conversation.ConversationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class BranchingStepTest {

    private BranchingStep step;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        Map<String, String> mapping = new HashMap<>();
        mapping.put("yes", "accepted");
        mapping.put("y", "accepted");
        mapping.put("no", "declined");
        mapping.put("1", "numeric");
        step = new BranchingStep("decide", mapping);
        context = mock(ConversationContext.class);
    }

    private String branchFor(Object selector) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put(BranchingStep.DEFAULT_INPUT, selector);
        StepResult.Completed result = (StepResult.Completed) step.invoke(inputs, context);
        return result.branch();
    }

    @ParameterizedTest
    @CsvSource({
            "yes, accepted",
            "y, accepted",
            "no, declined",
            "maybe, default",
            "YES, default"
    })
    void testExactMatchSelectsBranch(String selector, String expectedBranch) {
        assertEquals(expectedBranch, branchFor(selector));
    }

    @Test
    void testAbsentSelectorTakesDefault() {
        assertEquals(BranchingStep.DEFAULT_BRANCH, branchFor(null));
    }

    @Test
    void testNonStringSelectorIsMatchedByText() {
        assertEquals("numeric", branchFor(1));
    }

    @Test
    void testBranchesAreDistinctMappingValuesPlusDefault() {
        assertEquals(4, step.getBranches().size());
        assertTrue(step.getBranches().containsAll(List.of("accepted", "declined", "numeric", "default")));
        assertTrue(step.isBranching());
    }

    @Test
    void testProducesNoOutputsAndDoesNotTouchContext() {
        StepResult.Completed result = (StepResult.Completed) step.invoke(Map.of(), context);

        assertTrue(result.outputs().isEmpty());
        verifyNoInteractions(context);
    }
}
