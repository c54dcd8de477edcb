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
import dev.mars.stepwise.core.descriptor.Descriptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provides a fixed value.
 */
public class ConstantContextProvider implements ContextProvider {

    private final String name;
    private final Descriptor output;
    private final Object value;

    public ConstantContextProvider(String name, Descriptor output, Object value) {
        if (!output.getType().accepts(value)) {
            throw new IllegalArgumentException("Value " + value + " is not a " + output.getType());
        }
        this.name = name;
        this.output = output;
        this.value = output.getType().normalize(value);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Descriptor> getOutputDescriptors() {
        return List.of(output);
    }

    @Override
    public Map<String, Object> provide(ConversationContext context) {
        Map<String, Object> values = new HashMap<>();
        values.put(output.getName(), ConversationContext.deepCopy(value));
        return values;
    }
}
