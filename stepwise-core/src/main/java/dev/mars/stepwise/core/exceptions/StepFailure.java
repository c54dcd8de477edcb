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

import java.util.Objects;

/**
 * Failure raised by a step body. The {@code kind} names the failure for routing
 * by a {@code CatchExceptionStep}; it defaults to the simple class name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class StepFailure extends StepwiseException {

    private final String kind;

    public StepFailure(String kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null");
    }

    public StepFailure(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null");
    }

    /**
     * For subclasses whose kind is their simple class name.
     */
    protected StepFailure(String message, Throwable cause) {
        super(message, cause);
        this.kind = null;
    }

    public String getKind() {
        return kind != null ? kind : getClass().getSimpleName();
    }

    /**
     * Returns the failure kind of any throwable: the explicit kind of a
     * {@link StepFailure}, the simple class name otherwise.
     */
    public static String kindOf(Throwable throwable) {
        if (throwable instanceof StepFailure failure) {
            return failure.getKind();
        }
        return throwable.getClass().getSimpleName();
    }
}
