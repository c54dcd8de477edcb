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

import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.ConversationFailedException;
import dev.mars.stepwise.core.exceptions.StepFailure;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.execution.ExecutionInterrupt;
import dev.mars.stepwise.core.execution.FlowExecutor;
import dev.mars.stepwise.core.graph.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One execution of a flow, driven by its caller.
 *
 * <p>{@link #execute()} runs the flow until it finishes, needs something from the
 * caller or is interrupted. When a status other than {@code Finished} is returned,
 * the caller supplies the missing user message, tool results or tool decisions and
 * calls {@code execute()} again. The full state is available through
 * {@link #getState()} and can be persisted between calls.</p>
 *
 * <p>A step failure that escapes the flow marks the conversation {@code FAILED};
 * a failed conversation refuses further execution.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class Conversation {

    private static final Logger logger = LoggerFactory.getLogger(Conversation.class);

    private final Flow flow;
    private final ConversationState state;
    private final FlowExecutor executor;

    public Conversation(Flow flow, ConversationState state, FlowExecutor executor) {
        this.flow = Objects.requireNonNull(flow, "Flow cannot be null");
        this.state = Objects.requireNonNull(state, "Conversation state cannot be null");
        this.executor = Objects.requireNonNull(executor, "Flow executor cannot be null");
        if (!flow.getId().equals(state.getFlowId())) {
            throw new IllegalArgumentException("State of flow '" + state.getFlowId()
                    + "' cannot run flow '" + flow.getId() + "'");
        }
    }

    public ExecutionStatus execute() throws StepwiseException {
        return execute(List.of());
    }

    /**
     * Runs the conversation, checking the given interrupts after every completed step.
     *
     * @throws ConversationFailedException if a step failure escaped the flow
     * @throws StepwiseException           for engine errors such as a missing input or an exceeded loop cap
     * @throws IllegalStateException       if the conversation has already failed
     */
    public synchronized ExecutionStatus execute(List<ExecutionInterrupt> interrupts) throws StepwiseException {
        if (state.getStatus() == ConversationStatus.FAILED) {
            throw new IllegalStateException("Conversation " + getId() + " has failed with "
                    + state.getFailureKind() + ": " + state.getFailureMessage());
        }

        ExecutionStatus status;
        try {
            status = executor.execute(ConversationContext.root(executor, flow, state), interrupts);
        } catch (StepFailure | RuntimeException e) {
            markFailed(e);
            logger.error("Conversation {} failed in step '{}' with {}: {}",
                    getId(), state.getPosition(), StepFailure.kindOf(e), e.getMessage());
            throw new ConversationFailedException(getId(), state.getPosition(), e);
        } catch (StepwiseException e) {
            markFailed(e);
            logger.error("Conversation {} stopped by engine error in step '{}': {}",
                    getId(), state.getPosition(), e.getMessage());
            throw e;
        }

        if (status instanceof ExecutionStatus.NeedsToolResult toolResult) {
            state.setPendingToolRequests(new ArrayList<>(toolResult.toolRequests()));
        } else if (status instanceof ExecutionStatus.NeedsConfirmation confirmation) {
            state.setPendingToolRequests(new ArrayList<>(confirmation.toolRequests()));
        } else {
            state.getPendingToolRequests().clear();
        }

        if (status.isFinished()) {
            logger.info("Conversation {} finished through '{}'", getId(),
                    ((ExecutionStatus.Finished) status).terminalBranch());
        } else if (!(status instanceof ExecutionStatus.Interrupted)) {
            logger.info("Conversation {} suspended at step '{}': {}", getId(), state.getPosition(),
                    status.getClass().getSimpleName());
        }
        return status;
    }

    // Caller-supplied values

    public synchronized void supplyUserMessage(String text) {
        ensureOpen();
        ConversationContext.root(executor, flow, state).appendMessage(Message.user(text));
    }

    /**
     * Supplies the result of a pending client-side tool call.
     *
     * @throws IllegalArgumentException if no pending request has this id
     */
    public synchronized void supplyToolResult(String requestId, Object value) {
        ensureOpen();
        pendingRequest(requestId)
                .orElseThrow(() -> new IllegalArgumentException("No pending tool request with id " + requestId));
        state.getToolResults().put(requestId, DescriptorType.any().normalize(value));
    }

    public synchronized void confirmTool(String requestId) {
        decide(requestId, ToolDecision.approve());
    }

    public synchronized void rejectTool(String requestId, String reason) {
        decide(requestId, ToolDecision.reject(reason));
    }

    private void decide(String requestId, ToolDecision decision) {
        ensureOpen();
        ToolRequest request = pendingRequest(requestId)
                .orElseThrow(() -> new IllegalArgumentException("No pending tool request with id " + requestId));
        if (!request.requiresConfirmation()) {
            throw new IllegalArgumentException("Tool request " + requestId + " does not require confirmation");
        }
        state.getToolDecisions().put(requestId, decision);
    }

    private Optional<ToolRequest> pendingRequest(String requestId) {
        return state.getPendingToolRequests().stream()
                .filter(request -> request.requestId().equals(requestId))
                .findFirst();
    }

    private void ensureOpen() {
        if (state.getStatus().isTerminal()) {
            throw new IllegalStateException("Conversation " + getId() + " is " + state.getStatus());
        }
    }

    private void markFailed(Exception e) {
        state.setStatus(ConversationStatus.FAILED);
        state.setFailureKind(StepFailure.kindOf(e));
        state.setFailureMessage(e.getMessage());
    }

    // Accessors

    public String getId() {
        return state.getConversationId();
    }

    public Flow getFlow() {
        return flow;
    }

    public ConversationState getState() {
        return state;
    }

    public ConversationStatus getStatus() {
        return state.getStatus();
    }

    public List<Message> getMessages() {
        return ConversationContext.root(executor, flow, state).getMessages();
    }

    @Override
    public String toString() {
        return "Conversation{" +
                "id='" + getId() + '\'' +
                ", flow='" + flow.getId() + '\'' +
                ", status=" + state.getStatus() +
                ", position='" + state.getPosition() + '\'' +
                '}';
    }
}
