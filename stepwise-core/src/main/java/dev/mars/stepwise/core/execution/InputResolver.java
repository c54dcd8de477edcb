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

import dev.mars.stepwise.core.context.ContextProvider;
import dev.mars.stepwise.core.conversation.ConversationContext;
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.MissingInputException;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.exceptions.ValidationFailure;
import dev.mars.stepwise.core.graph.DataEdge;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.step.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the inputs of a step. For each input the first source that has a value wins:
 * <ol>
 *   <li>data edges from steps, taking the most recently produced value</li>
 *   <li>data edges from context providers</li>
 *   <li>a context provider with an output of the input's name, if no data edge feeds the input</li>
 *   <li>flow inputs of the conversation</li>
 *   <li>the input default</li>
 * </ol>
 */
final class InputResolver {

    private static final Logger logger = LoggerFactory.getLogger(InputResolver.class);

    private static final Object UNRESOLVED = new Object();

    Map<String, Object> resolve(Step step, ConversationContext context) throws StepwiseException {
        Flow flow = context.getFlow();
        ConversationState state = context.getState();
        Map<String, Object> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (Descriptor input : step.getInputDescriptors()) {
            Object value = resolveInput(flow, step, input, context);
            if (value == UNRESOLVED) {
                missing.add(input.getName());
                continue;
            }
            if (!input.getType().accepts(value)) {
                throw new ValidationFailure(step.getName(), "Input '" + input.getName() + "' of step '"
                        + step.getName() + "' expects " + input.getType() + " but got " + value);
            }
            resolved.put(input.getName(), input.getType().normalize(value));
        }

        if (!missing.isEmpty()) {
            throw new MissingInputException(step.getName(), missing);
        }
        logger.trace("Resolved inputs of step '{}' in {}: {}", step.getName(), state.getPath(), resolved.keySet());
        return resolved;
    }

    private Object resolveInput(Flow flow, Step step, Descriptor input, ConversationContext context)
            throws StepwiseException {
        ConversationState state = context.getState();
        List<DataEdge> edges = flow.getDataEdgesInto(step.getName(), input.getName());

        Object value = UNRESOLVED;
        long latest = -1;
        for (DataEdge edge : edges) {
            Map<String, Object> produced = state.getProducedOutputs().get(edge.source());
            if (flow.getStep(edge.source()) != null && produced != null && produced.containsKey(edge.sourceOutput())) {
                long order = state.getProductionOrder().getOrDefault(edge.source(), 0L);
                if (order > latest) {
                    latest = order;
                    value = produced.get(edge.sourceOutput());
                }
            }
        }
        if (value != UNRESOLVED) {
            return value;
        }

        for (DataEdge edge : edges) {
            Optional<ContextProvider> provider = flow.getContextProvider(edge.source());
            if (provider.isPresent()) {
                return providedValue(provider.get(), edge.sourceOutput(), context);
            }
        }
        if (edges.isEmpty()) {
            Optional<ContextProvider> provider = flow.findProviderOf(input.getName());
            if (provider.isPresent()) {
                return providedValue(provider.get(), input.getName(), context);
            }
        }

        if (state.getFlowInputs().containsKey(input.getName())) {
            return state.getFlowInputs().get(input.getName());
        }
        if (input.hasDefault()) {
            return ConversationContext.deepCopy(input.getDefaultValue());
        }
        return UNRESOLVED;
    }

    private Object providedValue(ContextProvider provider, String outputName, ConversationContext context)
            throws StepwiseException {
        ConversationState state = context.getState();
        if (!state.getEvaluatedProviders().contains(provider.getName())) {
            logger.debug("Evaluating context provider '{}'", provider.getName());
            Map<String, Object> values = provider.provide(context);
            for (Descriptor output : provider.getOutputDescriptors()) {
                Object value = values.get(output.getName());
                if (!output.getType().accepts(value)) {
                    throw new ValidationFailure(provider.getName(), "Context provider '" + provider.getName()
                            + "' produced " + value + " for '" + output.getName() + "', expected " + output.getType());
                }
                state.getContextValues().put(output.getName(), output.getType().normalize(value));
            }
            state.getEvaluatedProviders().add(provider.getName());
        }
        return ConversationContext.deepCopy(state.getContextValues().get(outputName));
    }
}
