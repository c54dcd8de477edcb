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
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.StateSerializationException;
import dev.mars.stepwise.core.execution.FlowExecutor;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.persistence.ConversationStateSerializer;
import dev.mars.stepwise.core.persistence.ConversationStore;
import dev.mars.stepwise.core.persistence.InMemoryConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link FlowEngine}. Conversations run on the calling thread; only parallel
 * map steps use the engine's executor, a cached pool of daemon threads or a fixed
 * pool of {@code stepwise.map.parallelism} threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class SimpleFlowEngine implements FlowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleFlowEngine.class);

    private final StepwiseConfiguration configuration;
    private final ExecutorService executorService;
    private final FlowExecutor executor;
    private final ConversationStateSerializer serializer;
    private final ConversationStore store;
    private volatile boolean shutdown = false;

    public SimpleFlowEngine() {
        this(new StepwiseConfiguration());
    }

    public SimpleFlowEngine(StepwiseConfiguration configuration) {
        this(configuration, new InMemoryConversationStore());
    }

    public SimpleFlowEngine(StepwiseConfiguration configuration, ConversationStore store) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.store = Objects.requireNonNull(store, "Conversation store cannot be null");
        this.executorService = createExecutorService(configuration.getMapParallelism());
        this.executor = new FlowExecutor(configuration, executorService);
        this.serializer = new ConversationStateSerializer(configuration);
    }

    @Override
    public Conversation startConversation(Flow flow, Map<String, Object> inputs) {
        return startConversation(flow, inputs, UUID.randomUUID().toString());
    }

    @Override
    public Conversation startConversation(Flow flow, Map<String, Object> inputs, String conversationId) {
        ensureRunning();
        Objects.requireNonNull(flow, "Flow cannot be null");
        Objects.requireNonNull(conversationId, "Conversation id cannot be null");
        Map<String, Object> supplied = inputs != null ? inputs : Map.of();

        Map<String, Object> flowInputs = new LinkedHashMap<>();
        for (Descriptor input : flow.getInputDescriptors()) {
            if (supplied.containsKey(input.getName())) {
                Object value = supplied.get(input.getName());
                if (!input.getType().accepts(value)) {
                    throw new IllegalArgumentException("Input '" + input.getName() + "' of flow '" + flow.getId()
                            + "' expects " + input.getType() + " but got " + value);
                }
                flowInputs.put(input.getName(), input.getType().normalize(value));
            } else if (input.isRequired()) {
                throw new IllegalArgumentException("Missing required input '" + input.getName()
                        + "' of flow '" + flow.getId() + "'");
            }
        }
        for (String name : supplied.keySet()) {
            if (flow.getInputDescriptors().stream().noneMatch(d -> d.getName().equals(name))) {
                logger.warn("Ignoring unknown input '{}' of flow '{}'", name, flow.getId());
            }
        }

        ConversationState state = new ConversationState(conversationId, flow.getId(), "");
        state.setFlowInputs(flowInputs);
        logger.info("Started conversation {} of flow '{}'", conversationId, flow.getId());
        return new Conversation(flow, state, executor);
    }

    @Override
    public String serialize(Conversation conversation) throws StateSerializationException {
        Objects.requireNonNull(conversation, "Conversation cannot be null");
        return serializer.serialize(conversation.getState(), conversation.getFlow());
    }

    @Override
    public Conversation restoreConversation(String serializedState, Flow flow) throws StateSerializationException {
        ensureRunning();
        ConversationState state = serializer.deserialize(serializedState, flow);
        logger.info("Restored conversation {} of flow '{}' at step '{}'",
                state.getConversationId(), flow.getId(), state.getPosition());
        return new Conversation(flow, state, executor);
    }

    @Override
    public void saveConversation(Conversation conversation) throws StateSerializationException {
        store.save(conversation.getId(), serialize(conversation));
    }

    @Override
    public Optional<Conversation> loadConversation(String conversationId, Flow flow) throws StateSerializationException {
        Optional<String> serialized = store.load(conversationId);
        if (serialized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(restoreConversation(serialized.get(), flow));
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        logger.info("SimpleFlowEngine shutdown initiated");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public StepwiseConfiguration getConfiguration() {
        return configuration;
    }

    public ConversationStore getStore() {
        return store;
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Flow engine is shutdown");
        }
    }

    private static ExecutorService createExecutorService(int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "stepwise-map-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return parallelism > 0
                ? Executors.newFixedThreadPool(parallelism, threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
    }
}
