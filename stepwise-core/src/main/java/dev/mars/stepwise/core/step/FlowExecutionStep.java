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
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.graph.Flow;

import java.util.List;
import java.util.Map;

/**
 * Runs a nested flow as a single step. The nested conversation is kept under the
 * step name until it finishes, so a nested suspension suspends this step and the
 * next invocation resumes it. The nested exit branch becomes this step's branch.
 */
public class FlowExecutionStep extends Step {

    private final Flow flow;

    public FlowExecutionStep(String name, Flow flow) {
        super(name, flow.getInputDescriptors(), flow.getOutputDescriptors(), exitBranchesOf(flow));
        this.flow = flow;
    }

    static List<String> exitBranchesOf(Flow flow) {
        return flow.getExitBranches().isEmpty() ? List.of(NEXT) : flow.getExitBranches();
    }

    public Flow getFlow() {
        return flow;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        ConversationState substate = context.getOrCreateSubstate(getName(), flow, inputs);
        ExecutionStatus status = context.runNested(flow, substate);
        if (status instanceof ExecutionStatus.Finished finished) {
            return StepResult.completed(finished.outputValues(), finished.terminalBranch());
        }
        return StepResult.fromStatus(status);
    }
}
