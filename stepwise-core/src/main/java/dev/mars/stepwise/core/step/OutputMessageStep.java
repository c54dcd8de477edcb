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
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.util.TemplateResolver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appends an agent message to the conversation. Every {@code {{name}}} placeholder
 * of the template becomes an input of the step.
 */
public class OutputMessageStep extends Step {

    public static final String DEFAULT_OUTPUT = "output_message";

    private final String template;
    private final String outputName;

    public OutputMessageStep(String name, String template) {
        this(name, template, DEFAULT_OUTPUT);
    }

    public OutputMessageStep(String name, String template, String outputName) {
        super(name, placeholderInputs(template), List.of(Descriptor.string(outputName)));
        this.template = template;
        this.outputName = outputName;
    }

    static List<Descriptor> placeholderInputs(String template) {
        return TemplateResolver.getVariableNames(template).stream()
                .map(Descriptor::any)
                .collect(Collectors.toList());
    }

    static String render(String template, Map<String, Object> inputs) {
        Map<String, Object> values = new HashMap<>();
        inputs.forEach((key, value) -> values.put(key, value != null ? value : ""));
        return new TemplateResolver(values).resolve(template);
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) {
        String message = render(template, inputs);
        context.appendMessage(Message.agent(message));
        return StepResult.completed(Map.of(outputName, message));
    }
}
