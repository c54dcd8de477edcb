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

package dev.mars.stepwise.core.execution;

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.ConversationContext;
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.conversation.ConversationStatus;
import dev.mars.stepwise.core.conversation.ExecutionEvent;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.IterationLimitExceededException;
import dev.mars.stepwise.core.exceptions.StepFailure;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.exceptions.ValidationFailure;
import dev.mars.stepwise.core.graph.ControlEdge;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Walks the graph of one conversation, top-level or nested.
 *
 * <p>Each iteration resolves the inputs of the step at the current position, invokes
 * it and either returns its suspension or records its outputs and follows the control
 * edge of the produced branch. A terminal control edge finishes the conversation.
 * A suspended step is re-invoked on the next call; completed steps never run again
 * unless a control edge leads back to them.</p>
 *
 * <p>Step failures propagate to the caller unchanged so that composite steps can
 * route them; the top-level {@code Conversation} turns them into a conversation failure.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class FlowExecutor {

    private static final Logger logger = LoggerFactory.getLogger(FlowExecutor.class);

    private final StepwiseConfiguration configuration;
    private final ExecutorService executorService;
    private final InputResolver inputResolver;

    public FlowExecutor(StepwiseConfiguration configuration, ExecutorService executorService) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.executorService = Objects.requireNonNull(executorService, "Executor service cannot be null");
        this.inputResolver = new InputResolver();
    }

    public StepwiseConfiguration getConfiguration() {
        return configuration;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /**
     * Runs the conversation of {@code context} until it finishes, suspends or is interrupted.
     *
     * @throws StepwiseException   engine errors and step failures
     * @throws IllegalStateException if the conversation has already failed
     */
    public ExecutionStatus execute(ConversationContext context, List<ExecutionInterrupt> interrupts)
            throws StepwiseException {
        Flow flow = context.getFlow();
        ConversationState state = context.getState();

        switch (state.getStatus()) {
            case FINISHED:
                return finishedStatus(state);
            case FAILED:
                throw new IllegalStateException("Conversation " + state.getConversationId() + " has failed");
            case NOT_STARTED:
                start(flow, state);
                break;
            default:
                break;
        }

        long startedAt = System.nanoTime();
        int stepsExecuted = 0;
        while (true) {
            String stepName = state.getPosition();
            Step step = flow.getStep(stepName);
            if (step == null) {
                throw new StepwiseException("Position '" + stepName + "' is not a step of flow '" + flow.getId() + "'");
            }

            boolean resuming = state.getStatus() == ConversationStatus.SUSPENDED;
            state.setStatus(ConversationStatus.RUNNING);
            if (resuming) {
                record(state, ExecutionEvent.Type.STEP_RESUMED, stepName, null);
            } else {
                countVisit(flow, state, stepName);
                record(state, ExecutionEvent.Type.STEP_STARTED, stepName, null);
            }

            StepResult result;
            try {
                Map<String, Object> inputs = inputResolver.resolve(step, context);
                result = step.invoke(inputs, context.forStep(stepName));
            } catch (StepwiseException | RuntimeException e) {
                record(state, ExecutionEvent.Type.STEP_FAILED, stepName, StepFailure.kindOf(e));
                throw e;
            }

            if (result instanceof StepResult.Suspended suspended) {
                state.setStatus(ConversationStatus.SUSPENDED);
                record(state, ExecutionEvent.Type.STEP_SUSPENDED, stepName, suspended.kind().name());
                logger.debug("Step '{}' of {} suspended: {}", stepName, describe(state), suspended.kind());
                return suspended.toStatus();
            }

            StepResult.Completed completed = (StepResult.Completed) result;
            Map<String, Object> outputs = validateOutputs(step, completed);
            state.getProducedOutputs().put(stepName, outputs);
            state.getProductionOrder().put(stepName, state.nextSequence());
            state.getStepStates().remove(stepName);
            state.getSubstates().keySet().removeIf(key -> key.equals(stepName) || key.startsWith(stepName + "["));
            record(state, ExecutionEvent.Type.STEP_COMPLETED, stepName, completed.branch());
            stepsExecuted++;

            ControlEdge edge = flow.getControlEdge(stepName, completed.branch());
            if (edge == null) {
                throw new StepwiseException("Step '" + stepName + "' has no control edge for branch '"
                        + completed.branch() + "'");
            }
            logger.debug("Step '{}' of {} completed through '{}'", stepName, describe(state), completed.branch());

            if (edge.isTerminal()) {
                return finish(flow, state, stepName, completed.branch());
            }
            state.setPosition(edge.destinationStep());

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            for (ExecutionInterrupt interrupt : interrupts) {
                Optional<String> reason = interrupt.check(stepsExecuted, elapsed);
                if (reason.isPresent()) {
                    record(state, ExecutionEvent.Type.CONVERSATION_INTERRUPTED, edge.destinationStep(), reason.get());
                    logger.info("Conversation {} interrupted before step '{}': {}",
                            state.getConversationId(), edge.destinationStep(), reason.get());
                    return new ExecutionStatus.Interrupted(reason.get());
                }
            }
        }
    }

    private void start(Flow flow, ConversationState state) {
        for (Variable variable : flow.getVariables()) {
            if (!state.getVariables().containsKey(variable.getName())) {
                state.getVariables().put(variable.getName(), ConversationContext.deepCopy(variable.getDefaultValue()));
            }
        }
        state.setPosition(flow.getBeginStep());
        state.setStatus(ConversationStatus.RUNNING);
        record(state, ExecutionEvent.Type.CONVERSATION_STARTED, flow.getBeginStep(), flow.getId());
    }

    private void countVisit(Flow flow, ConversationState state, String stepName) throws IterationLimitExceededException {
        int visits = state.getStepVisits().merge(stepName, 1, Integer::sum);
        int limit = flow.getLoopLimit(stepName) > 0 ? flow.getLoopLimit(stepName) : configuration.getMaxStepVisits();
        if (visits > limit) {
            throw new IterationLimitExceededException(stepName, limit);
        }
    }

    private Map<String, Object> validateOutputs(Step step, StepResult.Completed completed) throws ValidationFailure {
        if (!step.getBranches().contains(completed.branch())) {
            throw new ValidationFailure(step.getName(), "Step '" + step.getName() + "' completed through undeclared branch '"
                    + completed.branch() + "'");
        }
        Map<String, Object> produced = completed.outputs();
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (Descriptor output : step.getOutputDescriptors()) {
            if (produced.containsKey(output.getName())) {
                Object value = produced.get(output.getName());
                if (!output.getType().accepts(value)) {
                    throw new ValidationFailure(step.getName(), "Output '" + output.getName() + "' of step '"
                            + step.getName() + "' expects " + output.getType() + " but got " + value);
                }
                outputs.put(output.getName(), output.getType().normalize(value));
            } else {
                outputs.put(output.getName(), ConversationContext.deepCopy(output.getDefaultValue()));
            }
        }
        for (String name : produced.keySet()) {
            if (step.getOutputDescriptor(name).isEmpty()) {
                logger.debug("Dropping undeclared output '{}' of step '{}'", name, step.getName());
            }
        }
        return outputs;
    }

    private ExecutionStatus finish(Flow flow, ConversationState state, String stepName, String branch) {
        Map<String, Object> finalOutputs = new LinkedHashMap<>();
        for (Descriptor output : flow.getOutputDescriptors()) {
            finalOutputs.put(output.getName(), latestValue(state, output));
        }
        state.setFinalOutputs(finalOutputs);
        state.setTerminalBranch(branch);
        state.setCompleteStepName(stepName);
        state.setStatus(ConversationStatus.FINISHED);
        record(state, ExecutionEvent.Type.CONVERSATION_FINISHED, stepName, branch);
        logger.debug("{} finished through '{}' of step '{}'", describe(state), branch, stepName);
        return finishedStatus(state);
    }

    private Object latestValue(ConversationState state, Descriptor output) {
        Object value = ConversationContext.deepCopy(output.getDefaultValue());
        long latest = -1;
        for (Map.Entry<String, Map<String, Object>> entry : state.getProducedOutputs().entrySet()) {
            long order = state.getProductionOrder().getOrDefault(entry.getKey(), 0L);
            if (entry.getValue().containsKey(output.getName()) && order > latest) {
                latest = order;
                value = entry.getValue().get(output.getName());
            }
        }
        return value;
    }

    private static ExecutionStatus finishedStatus(ConversationState state) {
        Map<String, Object> outputs = state.getFinalOutputs() != null ? state.getFinalOutputs() : Map.of();
        return new ExecutionStatus.Finished(outputs, state.getTerminalBranch(), state.getCompleteStepName());
    }

    private void record(ConversationState state, ExecutionEvent.Type type, String stepName, String detail) {
        List<ExecutionEvent> events = state.getEvents();
        events.add(new ExecutionEvent(type, stepName, detail, state.getSequence()));
        int maxEvents = configuration.getMaxEvents();
        if (maxEvents > 0 && events.size() > maxEvents) {
            events.subList(0, events.size() - maxEvents).clear();
        }
    }

    private static String describe(ConversationState state) {
        return state.getPath().isEmpty()
                ? "conversation " + state.getConversationId()
                : "nested conversation " + state.getConversationId() + "/" + state.getPath();
    }
}
