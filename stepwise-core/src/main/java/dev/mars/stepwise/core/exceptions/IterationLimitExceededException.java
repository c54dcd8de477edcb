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

package dev.mars.stepwise.core.exceptions;

/**
 * A step was entered more often than its loop limit allows within one conversation.
 */
public class IterationLimitExceededException extends StepwiseException {

    private final String stepName;
    private final int limit;

    public IterationLimitExceededException(String stepName, int limit) {
        super("Step '" + stepName + "' exceeded its limit of " + limit + " visits");
        this.stepName = stepName;
        this.limit = limit;
    }

    public String getStepName() {
        return stepName;
    }

    public int getLimit() {
        return limit;
    }
}
