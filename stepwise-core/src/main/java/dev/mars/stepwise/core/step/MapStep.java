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
import dev.mars.stepwise.core.conversation.SharedVariableScope;
import dev.mars.stepwise.core.conversation.ToolRequest;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.StepwiseException;
import dev.mars.stepwise.core.exceptions.ValidationFailure;
import dev.mars.stepwise.core.graph.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a nested flow once per item of a list input and collects the nested outputs
 * into lists ordered by item position.
 *
 * <p>Item {@code i} runs in its own nested conversation. {@code unpackInput} maps
 * nested flow inputs to {@code "."} (the item itself) or a dotted key path into a
 * map item; other nested inputs take the value of the map step input of the same
 * name. With {@code parallelExecution} the pending items run concurrently on the
 * engine executor and are joined before the step returns.</p>
 *
 * <p>A failure of any item fails the whole step and discards all item results. If
 * items suspend, the step suspends and remembers the finished items, so resuming
 * re-enters only the unfinished ones.</p>
 *
 * <p>Each item works on an isolated copy of the parent variables except the
 * {@code sharedVariables}, which write through to the parent. Two items of one
 * parallel run writing the same shared variable fail the step with a
 * {@link dev.mars.stepwise.core.exceptions.ConcurrentVariableWriteException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class MapStep extends Step {

    private static final Logger logger = LoggerFactory.getLogger(MapStep.class);

    public static final String ITERATED_INPUT = "iterated_input";
    public static final String ITEM = ".";

    private static final String RESULTS = "results";
    private static final String SHARED_WRITERS = "sharedWriters";

    private final Flow flow;
    private final String iteratedInputName;
    private final Map<String, String> unpackInput;
    private final List<String> collectedOutputs;
    private final boolean parallelExecution;
    private final Set<String> sharedVariables;

    private MapStep(Builder builder, Map<String, String> unpackInput, List<String> collectedOutputs) {
        super(builder.name, inputsOf(builder, unpackInput), outputsOf(builder.flow, collectedOutputs));
        this.flow = builder.flow;
        this.iteratedInputName = builder.iteratedInputName;
        this.unpackInput = unpackInput;
        this.collectedOutputs = collectedOutputs;
        this.parallelExecution = builder.parallelExecution;
        this.sharedVariables = Set.copyOf(builder.sharedVariables);
    }

    public static Builder builder(String name, Flow flow) {
        return new Builder(name, flow);
    }

    private static List<Descriptor> inputsOf(Builder builder, Map<String, String> unpackInput) {
        DescriptorType itemType = DescriptorType.any();
        if (unpackInput.size() == 1 && unpackInput.containsValue(ITEM)) {
            String target = unpackInput.keySet().iterator().next();
            itemType = builder.flow.getInputDescriptors().stream()
                    .filter(d -> d.getName().equals(target))
                    .map(Descriptor::getType)
                    .findFirst()
                    .orElse(DescriptorType.any());
        }
        List<Descriptor> inputs = new ArrayList<>();
        inputs.add(Descriptor.of(builder.iteratedInputName, DescriptorType.listOf(itemType)));
        for (Descriptor input : builder.flow.getInputDescriptors()) {
            if (!unpackInput.containsKey(input.getName()) && !input.getName().equals(builder.iteratedInputName)) {
                inputs.add(input);
            }
        }
        return inputs;
    }

    private static List<Descriptor> outputsOf(Flow flow, List<String> collectedOutputs) {
        List<Descriptor> outputs = new ArrayList<>();
        for (String outputName : collectedOutputs) {
            Descriptor output = flow.getOutputDescriptors().stream()
                    .filter(d -> d.getName().equals(outputName))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Flow '" + flow.getName()
                            + "' has no output '" + outputName + "'"));
            outputs.add(Descriptor.of(outputName, DescriptorType.listOf(output.getType())));
        }
        return outputs;
    }

    public Flow getFlow() {
        return flow;
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    public Set<String> getSharedVariables() {
        return sharedVariables;
    }

    @Override
    @SuppressWarnings("unchecked")
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) throws StepwiseException {
        List<Object> items = inputs.get(iteratedInputName) != null
                ? (List<Object>) inputs.get(iteratedInputName) : List.of();
        Map<String, Object> results = (Map<String, Object>) context.getStepState()
                .computeIfAbsent(RESULTS, k -> new LinkedHashMap<String, Object>());

        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (!results.containsKey(String.valueOf(i))) {
                pending.add(i);
            }
        }

        Map<Integer, ItemOutcome> outcomes = parallelExecution
                ? runParallel(pending, items, inputs, context)
                : runSequential(pending, items, inputs, context);

        TreeMap<Integer, StepResult.Suspended> suspensions = new TreeMap<>();
        for (Map.Entry<Integer, ItemOutcome> entry : new TreeMap<>(outcomes).entrySet()) {
            ItemOutcome outcome = entry.getValue();
            if (outcome.failure != null) {
                discard(items.size(), context);
                logger.debug("Map step '{}' failed on item {}", getName(), entry.getKey());
                rethrow(outcome.failure);
            }
        }
        for (Map.Entry<Integer, ItemOutcome> entry : outcomes.entrySet()) {
            ExecutionStatus status = entry.getValue().status;
            if (status instanceof ExecutionStatus.Finished finished) {
                results.put(String.valueOf(entry.getKey()), new LinkedHashMap<>(finished.outputValues()));
                context.removeSubstate(instanceId(entry.getKey()));
            } else {
                suspensions.put(entry.getKey(), StepResult.fromStatus(status));
            }
        }

        if (!suspensions.isEmpty()) {
            logger.debug("Map step '{}' suspended with {} of {} items pending",
                    getName(), items.size() - results.size(), items.size());
            return aggregate(suspensions);
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        for (String outputName : collectedOutputs) {
            List<Object> collected = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                Map<String, Object> itemOutputs = (Map<String, Object>) results.get(String.valueOf(i));
                collected.add(itemOutputs.get(outputName));
            }
            outputs.put(outputName, collected);
        }
        return StepResult.completed(outputs);
    }

    private Map<Integer, ItemOutcome> runSequential(List<Integer> pending, List<Object> items,
                                                    Map<String, Object> inputs, ConversationContext context)
            throws StepwiseException {
        Map<Integer, ItemOutcome> outcomes = new LinkedHashMap<>();
        for (int index : pending) {
            ConversationState substate = context.getOrCreateSubstate(instanceId(index), flow,
                    itemInputs(items.get(index), inputs));
            ItemOutcome outcome = runItem(context, substate, scopeFor(context, null, index));
            outcomes.put(index, outcome);
            if (outcome.failure != null || !outcome.status.isFinished()) {
                break;
            }
        }
        return outcomes;
    }

    private Map<Integer, ItemOutcome> runParallel(List<Integer> pending, List<Object> items,
                                                  Map<String, Object> inputs, ConversationContext context)
            throws StepwiseException {
        // nested states are created up front; items only touch their own state while running
        Map<Integer, ConversationState> substates = new LinkedHashMap<>();
        for (int index : pending) {
            substates.put(index, context.getOrCreateSubstate(instanceId(index), flow,
                    itemInputs(items.get(index), inputs)));
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> writers = (Map<String, Object>) context.getStepState()
                .computeIfAbsent(SHARED_WRITERS, k -> new LinkedHashMap<String, Object>());
        SharedVariableScope.WriteGuard guard = new SharedVariableScope.WriteGuard(writers);
        Map<Integer, CompletableFuture<ItemOutcome>> futures = new LinkedHashMap<>();
        for (Map.Entry<Integer, ConversationState> entry : substates.entrySet()) {
            SharedVariableScope scope = scopeFor(context, guard, entry.getKey());
            futures.put(entry.getKey(), CompletableFuture.supplyAsync(
                    () -> runItem(context, entry.getValue(), scope), context.getExecutorService()));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<Integer, ItemOutcome> outcomes = new LinkedHashMap<>();
        futures.forEach((index, future) -> outcomes.put(index, future.join()));
        return outcomes;
    }

    private ItemOutcome runItem(ConversationContext context, ConversationState substate, SharedVariableScope scope) {
        try {
            return new ItemOutcome(context.runNested(flow, substate, scope), null);
        } catch (StepwiseException | RuntimeException e) {
            return new ItemOutcome(null, e);
        }
    }

    private SharedVariableScope scopeFor(ConversationContext context, SharedVariableScope.WriteGuard guard, int index) {
        return sharedVariables.isEmpty() ? null : new SharedVariableScope(context, sharedVariables, guard, index);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> itemInputs(Object item, Map<String, Object> inputs) throws ValidationFailure {
        Map<String, Object> itemInputs = new LinkedHashMap<>();
        for (Descriptor input : flow.getInputDescriptors()) {
            String path = unpackInput.get(input.getName());
            if (path != null) {
                itemInputs.put(input.getName(), ConversationContext.deepCopy(extract(item, path)));
            } else if (inputs.containsKey(input.getName())) {
                itemInputs.put(input.getName(), ConversationContext.deepCopy(inputs.get(input.getName())));
            }
        }
        return itemInputs;
    }

    @SuppressWarnings("unchecked")
    private Object extract(Object item, String path) throws ValidationFailure {
        if (ITEM.equals(path)) {
            return item;
        }
        Object current = item;
        for (String key : path.replaceFirst("^\\.", "").split("\\.")) {
            if (!(current instanceof Map)) {
                throw new ValidationFailure(getName(), "Cannot unpack '" + path + "' from item " + item);
            }
            current = ((Map<String, Object>) current).get(key);
        }
        return current;
    }

    private StepResult.Suspended aggregate(TreeMap<Integer, StepResult.Suspended> suspensions) {
        StepResult.Suspended first = suspensions.firstEntry().getValue();
        if (first.kind() == SuspensionKind.NEEDS_USER_MESSAGE) {
            return first;
        }
        List<ToolRequest> requests = new ArrayList<>();
        for (StepResult.Suspended suspension : suspensions.values()) {
            if (suspension.kind() == first.kind()) {
                requests.addAll(suspension.toolRequests());
            }
        }
        return new StepResult.Suspended(first.kind(), first.prompt(), requests);
    }

    private void discard(int itemCount, ConversationContext context) {
        for (int i = 0; i < itemCount; i++) {
            context.removeSubstate(instanceId(i));
        }
        context.getStepState().clear();
    }

    private static void rethrow(Exception failure) throws StepwiseException {
        if (failure instanceof StepwiseException stepwiseException) {
            throw stepwiseException;
        }
        throw (RuntimeException) failure;
    }

    private String instanceId(int index) {
        return getName() + "[" + index + "]";
    }

    private static final class ItemOutcome {
        private final ExecutionStatus status;
        private final Exception failure;

        private ItemOutcome(ExecutionStatus status, Exception failure) {
            this.status = status;
            this.failure = failure;
        }
    }

    public static final class Builder {
        private final String name;
        private final Flow flow;
        private String iteratedInputName = ITERATED_INPUT;
        private final Map<String, String> unpackInput = new LinkedHashMap<>();
        private final List<String> outputs = new ArrayList<>();
        private boolean parallelExecution;
        private final Set<String> sharedVariables = new LinkedHashSet<>();

        private Builder(String name, Flow flow) {
            this.name = name;
            this.flow = Objects.requireNonNull(flow, "Nested flow cannot be null");
        }

        public Builder iteratedInput(String inputName) {
            this.iteratedInputName = inputName;
            return this;
        }

        /**
         * Feeds nested input {@code flowInput} from the item ({@code "."}) or a key path of it.
         */
        public Builder unpack(String flowInput, String path) {
            unpackInput.put(flowInput, path);
            return this;
        }

        /**
         * Collects the given nested outputs; all nested outputs by default.
         */
        public Builder output(String outputName) {
            outputs.add(outputName);
            return this;
        }

        public Builder parallelExecution(boolean parallel) {
            this.parallelExecution = parallel;
            return this;
        }

        public Builder sharedVariable(String variableName) {
            sharedVariables.add(variableName);
            return this;
        }

        public MapStep build() {
            Map<String, String> unpack = unpackInput.isEmpty()
                    ? Map.of(iteratedInputName, ITEM)
                    : Map.copyOf(unpackInput);
            Set<String> flowInputs = new LinkedHashSet<>();
            flow.getInputDescriptors().forEach(d -> flowInputs.add(d.getName()));
            if (!unpackInput.isEmpty()) {
                for (String target : unpack.keySet()) {
                    if (!flowInputs.contains(target)) {
                        throw new IllegalArgumentException("Flow '" + flow.getName() + "' has no input '" + target + "'");
                    }
                }
            }
            List<String> collected = new ArrayList<>(outputs);
            if (collected.isEmpty()) {
                flow.getOutputDescriptors().forEach(d -> collected.add(d.getName()));
            }
            for (String shared : sharedVariables) {
                if (flow.getVariable(shared).isEmpty()) {
                    throw new IllegalArgumentException("Flow '" + flow.getName()
                            + "' does not declare shared variable '" + shared + "'");
                }
            }
            return new MapStep(this, unpack, List.copyOf(collected));
        }
    }
}
