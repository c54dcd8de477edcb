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

package dev.mars.stepwise.core.context;

import dev.mars.stepwise.core.conversation.ConversationContext;
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.graph.Flow;

import java.util.List;
import java.util.Map;

/**
 * Provides the outputs of a flow run to completion. The flow must not need inputs
 * without defaults and must not suspend.
 */
public class FlowContextProvider implements ContextProvider {

    private final String name;
    private final Flow flow;

    public FlowContextProvider(String name, Flow flow) {
        if (flow.getInputDescriptors().stream().anyMatch(Descriptor::isRequired)) {
            throw new IllegalArgumentException("Flow '" + flow.getName()
                    + "' has required inputs and cannot back a context provider");
        }
        this.name = name;
        this.flow = flow;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Descriptor> getOutputDescriptors() {
        return flow.getOutputDescriptors();
    }

    @Override
    public Map<String, Object> provide(ConversationContext context) throws StepwiseException {
        String instanceId = "provider:" + name;
        ConversationState substate = context.getOrCreateSubstate(instanceId, flow, Map.of());
        ExecutionStatus status = context.runNested(flow, substate);
        context.removeSubstate(instanceId);
        if (status instanceof ExecutionStatus.Finished finished) {
            return finished.outputValues();
        }
        throw new StepwiseException("Context provider flow '" + flow.getName() + "' suspended with " + status);
    }
}
