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
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.graph.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a nested flow until its boolean success output is {@code true}, at most
 * {@code maxNumTrials} times. Each attempt gets a fresh nested conversation; an
 * attempt that suspends is resumed, not restarted. Completes through
 * {@value #SUCCESS_BRANCH} or {@value #FAILURE_BRANCH} with the outputs of the
 * last attempt and the number of attempts made.
 */
public class RetryStep extends Step {

    private static final Logger logger = LoggerFactory.getLogger(RetryStep.class);

    public static final String SUCCESS_BRANCH = "success";
    public static final String FAILURE_BRANCH = "failure";
    public static final String ATTEMPTS_OUTPUT = "retry_attempts";
    public static final int DEFAULT_MAX_NUM_TRIALS = 5;

    private static final String ATTEMPT = "attempt";

    private final Flow flow;
    private final String successCondition;
    private final int maxNumTrials;

    public RetryStep(String name, Flow flow, String successCondition) {
        this(name, flow, successCondition, DEFAULT_MAX_NUM_TRIALS);
    }

    public RetryStep(String name, Flow flow, String successCondition, int maxNumTrials) {
        super(name, flow.getInputDescriptors(), outputsOf(flow), List.of(SUCCESS_BRANCH, FAILURE_BRANCH));
        Descriptor condition = flow.getOutputDescriptors().stream()
                .filter(d -> d.getName().equals(successCondition))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Flow '" + flow.getName()
                        + "' has no output '" + successCondition + "'"));
        if (!DescriptorType.bool().isAssignableFrom(condition.getType())) {
            throw new IllegalArgumentException("Success condition '" + successCondition + "' must be a bool, got "
                    + condition.getType());
        }
        if (maxNumTrials < 1) {
            throw new IllegalArgumentException("maxNumTrials must be at least 1: " + maxNumTrials);
        }
        this.flow = flow;
        this.successCondition = successCondition;
        this.maxNumTrials = maxNumTrials;
    }

    private static List<Descriptor> outputsOf(Flow flow) {
        List<Descriptor> outputs = new ArrayList<>(flow.getOutputDescriptors());
        outputs.add(Descriptor.withDefault(ATTEMPTS_OUTPUT, DescriptorType.integer(), 0));
        return outputs;
    }

    public Flow getFlow() {
        return flow;
    }

    public int getMaxNumTrials() {
        return maxNumTrials;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        Map<String, Object> stepState = context.getStepState();
        int attempt = stepState.containsKey(ATTEMPT) ? ((Number) stepState.get(ATTEMPT)).intValue() : 0;

        while (true) {
            ConversationState substate = context.getSubstate(getName());
            if (substate == null) {
                attempt++;
                stepState.put(ATTEMPT, attempt);
                substate = context.getOrCreateSubstate(getName(), flow, inputs);
            }

            ExecutionStatus status = context.runNested(flow, substate);
            if (!(status instanceof ExecutionStatus.Finished finished)) {
                return StepResult.fromStatus(status);
            }
            context.removeSubstate(getName());

            boolean success = Boolean.TRUE.equals(finished.outputValues().get(successCondition));
            if (success || attempt >= maxNumTrials) {
                Map<String, Object> outputs = new LinkedHashMap<>(finished.outputValues());
                outputs.put(ATTEMPTS_OUTPUT, attempt);
                logger.debug("Retry step '{}' finished after {} attempts, success={}", getName(), attempt, success);
                return StepResult.completed(outputs, success ? SUCCESS_BRANCH : FAILURE_BRANCH);
            }
            logger.debug("Retry step '{}' attempt {} of {} did not succeed", getName(), attempt, maxNumTrials);
        }
    }
}
