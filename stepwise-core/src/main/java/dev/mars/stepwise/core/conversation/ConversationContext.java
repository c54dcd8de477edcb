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

package dev.mars.stepwise.core.conversation;

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.exceptions.ConcurrentVariableWriteException;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.execution.FlowExecutor;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Everything a step may touch while it runs: its own private state, the variables
 * and message history of the conversation, supplied tool results and decisions,
 * and the nested conversations of composite steps.
 *
 * <p>A context is passed explicitly to every {@code invoke} call; steps never reach
 * conversation state through globals. Contexts of nested flows point to the root
 * conversation for message history, tool results and tool decisions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public final class ConversationContext {

    private final FlowExecutor executor;
    private final Flow flow;
    private final ConversationState state;
    private final ConversationState rootState;
    private final String stepName;
    private final SharedVariableScope sharedScope;

    private ConversationContext(FlowExecutor executor, Flow flow, ConversationState state,
                                ConversationState rootState, String stepName, SharedVariableScope sharedScope) {
        this.executor = Objects.requireNonNull(executor, "Flow executor cannot be null");
        this.flow = Objects.requireNonNull(flow, "Flow cannot be null");
        this.state = Objects.requireNonNull(state, "Conversation state cannot be null");
        this.rootState = rootState != null ? rootState : state;
        this.stepName = stepName;
        this.sharedScope = sharedScope;
    }

    /**
     * Context of a top-level conversation.
     */
    public static ConversationContext root(FlowExecutor executor, Flow flow, ConversationState state) {
        return new ConversationContext(executor, flow, state, null, null, null);
    }

    /**
     * The same conversation seen by one of its steps.
     */
    public ConversationContext forStep(String name) {
        return new ConversationContext(executor, flow, state, rootState, name, sharedScope);
    }

    public Flow getFlow() {
        return flow;
    }

    public ConversationState getState() {
        return state;
    }

    public String getStepName() {
        return stepName;
    }

    public String getConversationId() {
        return rootState.getConversationId();
    }

    public StepwiseConfiguration getConfiguration() {
        return executor.getConfiguration();
    }

    /**
     * Executor that runs nested conversations of parallel map steps.
     */
    public ExecutorService getExecutorService() {
        return executor.getExecutorService();
    }

    // Step state

    /**
     * Private state of the current step, kept until the step completes. Values must
     * be plain JSON data (strings, numbers, booleans, lists and string-keyed maps).
     */
    public Map<String, Object> getStepState() {
        if (stepName == null) {
            throw new IllegalStateException("No step is running in this context");
        }
        return state.getStepStates().computeIfAbsent(stepName, k -> new LinkedHashMap<>());
    }

    // Messages

    public void appendMessage(Message message) {
        List<Message> messages = rootState.getMessages();
        synchronized (messages) {
            messages.add(message);
        }
    }

    public List<Message> getMessages() {
        List<Message> messages = rootState.getMessages();
        synchronized (messages) {
            return new ArrayList<>(messages);
        }
    }

    public int getMessageCount() {
        List<Message> messages = rootState.getMessages();
        synchronized (messages) {
            return messages.size();
        }
    }

    // Tool requests

    /**
     * Deterministic id for a new tool request: the state path followed by a sequence number.
     */
    public String nextToolRequestId() {
        return state.getPath() + "tool-" + state.nextSequence();
    }

    public boolean hasToolResult(String requestId) {
        return rootState.getToolResults().containsKey(requestId);
    }

    public Object getToolResult(String requestId) {
        return rootState.getToolResults().get(requestId);
    }

    public ToolDecision getToolDecision(String requestId) {
        return rootState.getToolDecisions().get(requestId);
    }

    // Variables

    public Object getVariable(String name) {
        if (sharedScope != null && sharedScope.isShared(name)) {
            return sharedScope.read(name);
        }
        Map<String, Object> variables = state.getVariables();
        synchronized (variables) {
            return variables.get(name);
        }
    }

    /**
     * Stores a variable value. Type checks are the caller's concern.
     *
     * @throws ConcurrentVariableWriteException if a shared variable was already
     *                                          written by a sibling in a parallel map
     */
    public void setVariable(String name, Object value) throws ConcurrentVariableWriteException {
        if (sharedScope != null && sharedScope.isShared(name)) {
            sharedScope.write(name, value);
            return;
        }
        Map<String, Object> variables = state.getVariables();
        synchronized (variables) {
            variables.put(name, value);
        }
    }

    // Nested conversations

    public ConversationState getSubstate(String instanceId) {
        return state.getSubstates().get(instanceId);
    }

    /**
     * Returns the nested state stored under {@code instanceId}, creating it for
     * {@code nestedFlow} with the given inputs if there is none. Variables of the
     * nested flow start from an isolated copy of the same-named variables of this
     * conversation, or from their defaults.
     */
    public ConversationState getOrCreateSubstate(String instanceId, Flow nestedFlow, Map<String, Object> inputs) {
        ConversationState existing = state.getSubstates().get(instanceId);
        if (existing != null) {
            return existing;
        }
        ConversationState substate = new ConversationState(rootState.getConversationId(), nestedFlow.getId(),
                state.getPath() + instanceId + "/");
        Map<String, Object> flowInputs = new LinkedHashMap<>();
        nestedFlow.getInputDescriptors().forEach(d -> {
            if (inputs.containsKey(d.getName())) {
                flowInputs.put(d.getName(), inputs.get(d.getName()));
            }
        });
        substate.setFlowInputs(flowInputs);
        for (Variable variable : nestedFlow.getVariables()) {
            Object value = flow.getVariable(variable.getName()).isPresent()
                    ? deepCopy(getVariable(variable.getName()))
                    : variable.getDefaultValue();
            substate.getVariables().put(variable.getName(), value);
        }
        state.getSubstates().put(instanceId, substate);
        return substate;
    }

    public void removeSubstate(String instanceId) {
        state.getSubstates().remove(instanceId);
    }

    /**
     * Runs or resumes a nested conversation until it finishes or suspends.
     * Step failures inside the nested flow propagate unchanged.
     */
    public ExecutionStatus runNested(Flow nestedFlow, ConversationState substate) throws StepwiseException {
        return runNested(nestedFlow, substate, null);
    }

    public ExecutionStatus runNested(Flow nestedFlow, ConversationState substate, SharedVariableScope scope)
            throws StepwiseException {
        ConversationContext nested = new ConversationContext(executor, nestedFlow, substate, rootState, null, scope);
        return executor.execute(nested, List.of());
    }

    /**
     * Copies lists and maps recursively so nested conversations cannot alias parent values.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) map).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        return value;
    }
}
