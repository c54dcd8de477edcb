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
import dev.mars.stepwise.core.exceptions.StepwiseException;

import java.util.List;
import java.util.Map;

/**
 * Source of named values that are not tied to a step output. A provider is
 * evaluated lazily the first time a step needs one of its values, at most once per
 * conversation, and the values are cached in the conversation state.
 *
 * <p>A step input is fed by a provider through an explicit data edge, or implicitly
 * when no data edge feeds the input and the provider outputs a value of the same name.</p>
 */
public interface ContextProvider {

    String getName();

    List<Descriptor> getOutputDescriptors();

    /**
     * Computes the provided values, keyed by output name.
     */
    Map<String, Object> provide(ConversationContext context) throws StepwiseException;
}
