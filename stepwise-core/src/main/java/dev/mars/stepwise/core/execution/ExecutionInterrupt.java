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

package dev.mars.stepwise.core.execution;

import java.time.Duration;
import java.util.Optional;

/**
 * Stops a top-level {@code execute()} call between two steps. The conversation
 * stays resumable at the next step.
 */
public interface ExecutionInterrupt {

    /**
     * Checked after every completed step of the top-level flow.
     *
     * @param stepsExecuted steps completed during the current {@code execute()} call
     * @param elapsed       time spent in the current {@code execute()} call
     * @return the reason to stop, or empty to continue
     */
    Optional<String> check(int stepsExecuted, Duration elapsed);
}
