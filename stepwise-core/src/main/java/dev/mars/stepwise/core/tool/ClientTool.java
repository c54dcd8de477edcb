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

/**
 * Tool executed by the caller. Invoking it suspends the conversation until the
 * result is supplied.
 */
public final class ClientTool extends AbstractTool {

    private ClientTool(Builder builder) {
        super(builder);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder extends AbstractTool.Builder<Builder> {
        private Builder(String name) {
            super(name);
        }

        public ClientTool build() {
            return new ClientTool(this);
        }
    }
}
