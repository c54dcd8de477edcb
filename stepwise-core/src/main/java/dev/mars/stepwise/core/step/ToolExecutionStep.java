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
import dev.mars.stepwise.core.conversation.Message;
import dev.mars.stepwise.core.conversation.ToolDecision;
import dev.mars.stepwise.core.conversation.ToolRequest;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.exceptions.ToolRejectedFailure;
import dev.mars.stepwise.core.exceptions.ValidationFailure;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.core.tool.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a tool with the step inputs as arguments.
 *
 * <p>A {@link ServerTool} runs in-process. Any other tool is executed by the caller:
 * the step suspends with a tool request and completes once the result has been
 * supplied. Tools that require confirmation first suspend for an approve or reject
 * decision; a rejection fails the step with {@link ToolRejectedFailure}.</p>
 */
public class ToolExecutionStep extends Step {

    private static final Logger logger = LoggerFactory.getLogger(ToolExecutionStep.class);

    private static final String REQUEST_ID = "requestId";

    private final Tool tool;

    public ToolExecutionStep(String name, Tool tool) {
        super(name, tool.getInputDescriptors(), tool.getOutputDescriptors());
        this.tool = tool;
    }

    public Tool getTool() {
        return tool;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        Map<String, Object> stepState = context.getStepState();
        String requestId = (String) stepState.get(REQUEST_ID);
        ToolRequest request;
        if (requestId == null) {
            request = new ToolRequest(context.nextToolRequestId(), tool.getName(), inputs, tool.requiresConfirmation());
            stepState.put(REQUEST_ID, request.requestId());
            context.appendMessage(new Message(Message.Role.TOOL_REQUEST,
                    tool.getName() + " " + request.arguments(), request.requestId()));
            logger.debug("Step '{}' requested tool '{}' as {}", getName(), tool.getName(), request.requestId());
        } else {
            request = new ToolRequest(requestId, tool.getName(), inputs, tool.requiresConfirmation());
        }

        if (tool.requiresConfirmation()) {
            ToolDecision decision = context.getToolDecision(request.requestId());
            if (decision == null) {
                return StepResult.awaitingConfirmation(List.of(request));
            }
            if (!decision.approved()) {
                throw new ToolRejectedFailure(tool.getName(), decision.reason());
            }
        }

        Object result;
        if (tool instanceof ServerTool serverTool) {
            result = serverTool.call(inputs);
        } else if (context.hasToolResult(request.requestId())) {
            result = context.getToolResult(request.requestId());
        } else {
            return StepResult.awaitingToolResults(List.of(request));
        }

        context.appendMessage(new Message(Message.Role.TOOL_RESULT, String.valueOf(result), request.requestId()));
        return StepResult.completed(toOutputs(result));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toOutputs(Object result) throws ValidationFailure {
        List<Descriptor> outputs = getOutputDescriptors();
        if (outputs.size() == 1) {
            Map<String, Object> single = new HashMap<>();
            single.put(outputs.get(0).getName(), result);
            return single;
        }
        if (!(result instanceof Map)) {
            throw new ValidationFailure(getName(), "Tool '" + tool.getName() + "' declares " + outputs.size()
                    + " outputs and must return a map, got " + result);
        }
        return new LinkedHashMap<>((Map<String, Object>) result);
    }
}
