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
import java.util.Objects;
import java.util.Optional;

/**
 * Interrupts once an {@code execute()} call has run for longer than a time budget.
 */
public class TimeBudgetInterrupt implements ExecutionInterrupt {

    private final Duration budget;

    public TimeBudgetInterrupt(Duration budget) {
        this.budget = Objects.requireNonNull(budget, "Time budget cannot be null");
    }

    @Override
    public Optional<String> check(int stepsExecuted, Duration elapsed) {
        if (elapsed.compareTo(budget) >= 0) {
            return Optional.of("Time budget of " + budget.toMillis() + "ms exhausted");
        }
        return Optional.empty();
    }
}
