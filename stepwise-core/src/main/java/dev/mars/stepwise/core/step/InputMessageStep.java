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

import java.util.List;
import java.util.Map;

/**
 * Asks the user for a message. The first invocation posts the prompt and suspends;
 * the step completes once a user message arrived after the prompt.
 */
public class InputMessageStep extends Step {

    public static final String DEFAULT_OUTPUT = "user_provided_input";

    private static final String AWAITING_FROM = "awaitingFrom";
    private static final String PROMPT = "prompt";

    private final String promptTemplate;
    private final String outputName;

    public InputMessageStep(String name, String promptTemplate) {
        this(name, promptTemplate, DEFAULT_OUTPUT);
    }

    public InputMessageStep(String name, String promptTemplate, String outputName) {
        super(name, OutputMessageStep.placeholderInputs(promptTemplate), List.of(Descriptor.string(outputName)));
        this.promptTemplate = promptTemplate != null ? promptTemplate : "";
        this.outputName = outputName;
    }

    @Override
    public StepResult invoke(Map<String, Object> inputs, ConversationContext context) {
        Map<String, Object> stepState = context.getStepState();
        if (!stepState.containsKey(AWAITING_FROM)) {
            String prompt = OutputMessageStep.render(promptTemplate, inputs);
            if (!prompt.isEmpty()) {
                context.appendMessage(Message.agent(prompt));
            }
            stepState.put(AWAITING_FROM, context.getMessageCount());
            stepState.put(PROMPT, prompt);
            return StepResult.awaitingUserMessage(prompt);
        }

        int awaitingFrom = ((Number) stepState.get(AWAITING_FROM)).intValue();
        List<Message> messages = context.getMessages();
        for (int i = awaitingFrom; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.role() == Message.Role.USER) {
                return StepResult.completed(Map.of(outputName, message.content()));
            }
        }
        return StepResult.awaitingUserMessage((String) stepState.get(PROMPT));
    }
}
