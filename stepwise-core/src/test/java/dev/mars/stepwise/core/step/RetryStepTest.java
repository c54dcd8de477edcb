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

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryStepTest {

    private SimpleFlowEngine engine;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
        attempts = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    /**
     * Fails on the first {@code failures} attempts, then succeeds.
     */
    private Flow flakyFlow(int failures) throws GraphException {
        FunctionStep attempt = FunctionStep.builder("attempt")
                .output("ok", DescriptorType.bool())
                .compute(inputs -> Map.of("ok", attempts.incrementAndGet() > failures))
                .build();
        return Flow.builder("flaky").addStep(attempt).endEdge(attempt).build();
    }

    private Flow retryFlow(RetryStep retry) throws GraphException {
        OutputMessageStep won = new OutputMessageStep("won", "success", "result");
        OutputMessageStep lost = new OutputMessageStep("lost", "failure", "result");
        return Flow.builder("retrying")
                .beginStep(retry)
                .controlEdge(retry, RetryStep.SUCCESS_BRANCH, won)
                .controlEdge(retry, RetryStep.FAILURE_BRANCH, lost)
                .endEdge(won)
                .endEdge(lost)
                .build();
    }

    @Test
    void testSucceedsWithinBound() throws Exception {
        RetryStep retry = new RetryStep("retry", flakyFlow(2), "ok", 3);
        Conversation conversation = engine.startConversation(retryFlow(retry), Map.of());

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("won", finished.completeStepName());
        assertEquals("success", finished.output("result"));
        assertEquals(3, finished.output(RetryStep.ATTEMPTS_OUTPUT));
        assertEquals(true, finished.output("ok"));
        assertEquals(3, attempts.get());
    }

    @Test
    void testGivesUpAfterMaxTrials() throws Exception {
        RetryStep retry = new RetryStep("retry", flakyFlow(2), "ok", 2);
        Conversation conversation = engine.startConversation(retryFlow(retry), Map.of());

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("lost", finished.completeStepName());
        assertEquals("failure", finished.output("result"));
        assertEquals(2, finished.output(RetryStep.ATTEMPTS_OUTPUT));
        assertEquals(2, attempts.get());
    }

    @Test
    void testFirstAttemptSuccess() throws Exception {
        RetryStep retry = new RetryStep("retry", flakyFlow(0), "ok");
        Conversation conversation = engine.startConversation(retryFlow(retry), Map.of());

        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals(1, finished.output(RetryStep.ATTEMPTS_OUTPUT));
        assertEquals(RetryStep.DEFAULT_MAX_NUM_TRIALS, retry.getMaxNumTrials());
    }

    @Test
    void testSuspendedAttemptIsResumedNotRestarted() throws Exception {
        FunctionStep count = FunctionStep.builder("count")
                .output("n", DescriptorType.integer())
                .compute(inputs -> Map.of("n", attempts.incrementAndGet()))
                .build();
        InputMessageStep ask = new InputMessageStep("ask", "Try again?");
        FunctionStep decide = FunctionStep.builder("decide")
                .input(InputMessageStep.DEFAULT_OUTPUT, DescriptorType.string())
                .output("ok", DescriptorType.bool())
                .compute(inputs -> Map.of("ok", "yes".equals(inputs.get(InputMessageStep.DEFAULT_OUTPUT))))
                .build();
        Flow asking = Flow.builder("asking")
                .controlEdge(count, ask)
                .controlEdge(ask, decide)
                .endEdge(decide)
                .dataEdge(ask, InputMessageStep.DEFAULT_OUTPUT, decide, InputMessageStep.DEFAULT_OUTPUT)
                .build();
        RetryStep retry = new RetryStep("retry", asking, "ok", 3);
        Conversation conversation = engine.startConversation(retryFlow(retry), Map.of());

        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, conversation.execute());
        conversation.supplyUserMessage("no");
        assertInstanceOf(ExecutionStatus.NeedsExternalInput.class, conversation.execute());
        conversation.supplyUserMessage("yes");
        ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

        assertEquals("won", finished.completeStepName());
        assertEquals(2, finished.output(RetryStep.ATTEMPTS_OUTPUT));
        assertEquals(2, attempts.get());
    }

    @Test
    void testRejectsNonBooleanCondition() {
        FunctionStep produce = FunctionStep.builder("produce")
                .output("count", DescriptorType.integer())
                .compute(inputs -> Map.of("count", 1))
                .build();

        assertThrows(IllegalArgumentException.class, () -> new RetryStep("retry",
                Flow.builder("counting").addStep(produce).endEdge(produce).build(), "count"));
        assertThrows(IllegalArgumentException.class, () -> new RetryStep("retry", flakyFlow(0), "missing"));
        assertThrows(IllegalArgumentException.class, () -> new RetryStep("retry", flakyFlow(0), "ok", 0));
    }
}
