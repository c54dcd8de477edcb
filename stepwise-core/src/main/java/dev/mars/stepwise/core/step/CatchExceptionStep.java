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
import dev.mars.stepwise.core.exceptions.StepFailure;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.graph.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a nested flow and routes its failures to branches by failure kind.
 *
 * <p>A failure whose kind is mapped completes the step through the mapped branch;
 * with {@code catchAllExceptions} an unmapped failure completes through
 * {@value #DEFAULT_EXCEPTION_BRANCH}. In both cases the outputs carry the failure
 * kind and message and the nested flow outputs hold their defaults. Any other
 * failure propagates. Engine errors such as missing inputs are never caught.</p>
 */
public class CatchExceptionStep extends Step {

    private static final Logger logger = LoggerFactory.getLogger(CatchExceptionStep.class);

    public static final String DEFAULT_EXCEPTION_BRANCH = "default_exception_branch";
    public static final String EXCEPTION_NAME_OUTPUT = "exception_name";
    public static final String EXCEPTION_PAYLOAD_OUTPUT = "exception_payload";

    private final Flow flow;
    private final Map<String, String> exceptOn;
    private final boolean catchAllExceptions;

    public CatchExceptionStep(String name, Flow flow, Map<String, String> exceptOn, boolean catchAllExceptions) {
        super(name, flow.getInputDescriptors(), outputsOf(flow), branchesOf(flow, exceptOn, catchAllExceptions));
        this.flow = flow;
        this.exceptOn = new LinkedHashMap<>(exceptOn);
        this.catchAllExceptions = catchAllExceptions;
    }

    private static List<Descriptor> outputsOf(Flow flow) {
        List<Descriptor> outputs = new ArrayList<>(flow.getOutputDescriptors());
        outputs.add(Descriptor.withDefault(EXCEPTION_NAME_OUTPUT, DescriptorType.string(), ""));
        outputs.add(Descriptor.withDefault(EXCEPTION_PAYLOAD_OUTPUT, DescriptorType.string(), ""));
        return outputs;
    }

    private static List<String> branchesOf(Flow flow, Map<String, String> exceptOn, boolean catchAll) {
        Set<String> branches = new LinkedHashSet<>(FlowExecutionStep.exitBranchesOf(flow));
        branches.addAll(exceptOn.values());
        if (catchAll) {
            branches.add(DEFAULT_EXCEPTION_BRANCH);
        }
        return new ArrayList<>(branches);
    }

    public Flow getFlow() {
        return flow;
    }

    public Map<String, String> getExceptOn() {
        return Map.copyOf(exceptOn);
    }

    public boolean isCatchAllExceptions() {
        return catchAllExceptions;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        ConversationState substate = context.getOrCreateSubstate(getName(), flow, inputs);
        ExecutionStatus status;
        try {
            status = context.runNested(flow, substate);
        } catch (StepFailure | RuntimeException e) {
            context.removeSubstate(getName());
            String kind = StepFailure.kindOf(e);
            String branch = exceptOn.get(kind);
            if (branch == null && catchAllExceptions) {
                branch = DEFAULT_EXCEPTION_BRANCH;
            }
            if (branch == null) {
                throw e;
            }
            logger.debug("Step '{}' caught {} and routes to '{}'", getName(), kind, branch);
            Map<String, Object> outputs = new LinkedHashMap<>();
            for (Descriptor output : flow.getOutputDescriptors()) {
                outputs.put(output.getName(), output.getDefaultValue());
            }
            outputs.put(EXCEPTION_NAME_OUTPUT, kind);
            outputs.put(EXCEPTION_PAYLOAD_OUTPUT, e.getMessage() != null ? e.getMessage() : "");
            return StepResult.completed(outputs, branch);
        }

        if (status instanceof ExecutionStatus.Finished finished) {
            Map<String, Object> outputs = new LinkedHashMap<>(finished.outputValues());
            outputs.put(EXCEPTION_NAME_OUTPUT, "");
            outputs.put(EXCEPTION_PAYLOAD_OUTPUT, "");
            return StepResult.completed(outputs, finished.terminalBranch());
        }
        return StepResult.fromStatus(status);
    }
}
