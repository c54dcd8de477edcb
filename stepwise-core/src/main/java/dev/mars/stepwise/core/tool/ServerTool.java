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

package dev.mars.stepwise.core.tool;

import dev.mars.stepwise.core.exceptions.StepFailure;
import dev.mars.stepwise.core.exceptions.ToolFailure;

import java.util.Map;
import java.util.Objects;

/**
 * Tool executed in-process by the engine.
 *
 * <pre>{@code
 * ServerTool sum = ServerTool.builder("sum")
 *         .input("a", DescriptorType.integer())
 *         .input("b", DescriptorType.integer())
 *         .output("sum", DescriptorType.integer())
 *         .function(args -> (Integer) args.get("a") + (Integer) args.get("b"))
 *         .build();
 * }</pre>
 */
public final class ServerTool extends AbstractTool {

    private final ToolFunction function;

    private ServerTool(Builder builder) {
        super(builder);
        this.function = Objects.requireNonNull(builder.function, "Tool function cannot be null");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Calls the tool. Step failures and runtime exceptions propagate unchanged so
     * their kind survives; other checked exceptions become a {@link ToolFailure}.
     */
    public Object call(Map<String, Object> arguments) throws StepFailure {
        try {
            return function.call(arguments);
        } catch (StepFailure | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolFailure(getName(), "Tool '" + getName() + "' failed: " + e.getMessage(), e);
        }
    }

    public static final class Builder extends AbstractTool.Builder<Builder> {
        private ToolFunction function;

        private Builder(String name) {
            super(name);
        }

        public Builder function(ToolFunction function) {
            this.function = function;
            return this;
        }

        public ServerTool build() {
            return new ServerTool(this);
        }
    }
}
