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
import dev.mars.stepwise.core.exceptions.StepFailure;
import dev.mars.stepwise.core.exceptions.ToolFailure;
import dev.mars.stepwise.core.tool.ServerTool;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provides the result of calling a server tool without arguments. The provider
 * is named after the tool and outputs the tool outputs.
 */
public class ToolContextProvider implements ContextProvider {

    private final ServerTool tool;

    public ToolContextProvider(ServerTool tool) {
        if (!tool.getInputDescriptors().stream().allMatch(Descriptor::hasDefault)) {
            throw new IllegalArgumentException("Tool '" + tool.getName()
                    + "' needs arguments and cannot back a context provider");
        }
        this.tool = tool;
    }

    @Override
    public String getName() {
        return tool.getName();
    }

    @Override
    public List<Descriptor> getOutputDescriptors() {
        return tool.getOutputDescriptors();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> provide(ConversationContext context) throws StepFailure {
        Map<String, Object> arguments = new HashMap<>();
        tool.getInputDescriptors().forEach(d -> arguments.put(d.getName(), d.getDefaultValue()));
        Object result = tool.call(arguments);
        List<Descriptor> outputs = tool.getOutputDescriptors();
        if (outputs.size() == 1) {
            Map<String, Object> values = new HashMap<>();
            values.put(outputs.get(0).getName(), result);
            return values;
        }
        if (!(result instanceof Map)) {
            throw new ToolFailure(tool.getName(), "Tool '" + tool.getName() + "' must return a map of "
                    + outputs.size() + " outputs");
        }
        return new LinkedHashMap<>((Map<String, Object>) result);
    }
}
