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
 * Interrupts after a fixed number of steps per {@code execute()} call.
 */
public class StepBudgetInterrupt implements ExecutionInterrupt {

    private final int maxSteps;

    public StepBudgetInterrupt(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("Step budget must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    @Override
    public Optional<String> check(int stepsExecuted, Duration elapsed) {
        if (stepsExecuted >= maxSteps) {
            return Optional.of("Step budget of " + maxSteps + " exhausted");
        }
        return Optional.empty();
    }
}
