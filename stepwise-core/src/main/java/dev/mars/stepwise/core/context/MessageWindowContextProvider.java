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
import dev.mars.stepwise.core.conversation.Message;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provides the contents of the last messages of the conversation history.
 */
public class MessageWindowContextProvider implements ContextProvider {

    private final String name;
    private final String outputName;
    private final int windowSize;

    public MessageWindowContextProvider(String name, String outputName, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.name = name;
        this.outputName = outputName;
        this.windowSize = windowSize;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Descriptor> getOutputDescriptors() {
        return List.of(Descriptor.of(outputName, DescriptorType.listOf(DescriptorType.string())));
    }

    @Override
    public Map<String, Object> provide(ConversationContext context) {
        List<Message> messages = context.getMessages();
        List<Object> window = new ArrayList<>();
        for (Message message : messages.subList(Math.max(0, messages.size() - windowSize), messages.size())) {
            window.add(message.content());
        }
        Map<String, Object> values = new HashMap<>();
        values.put(outputName, window);
        return values;
    }
}
