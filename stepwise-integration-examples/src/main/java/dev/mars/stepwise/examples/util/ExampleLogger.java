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

package dev.mars.stepwise.examples.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Console output helper for the Stepwise examples.
 *
 * <p>Formatted lines go to the console; the same content is logged through SLF4J
 * so runs can also be captured by the configured appenders.</p>
 *
 * <p>Usage:
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("My Example");
 * log.step(1, "Building flow...");
 * log.success("Flow finished");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_ARROW = "→";

    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private ExampleLogger(Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.out = System.out;
        this.err = System.err;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz);
    }

    // ========== Headers ==========

    /**
     * Example: === My Example ===
     */
    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: {}", title);
    }

    /**
     * Example: --- Sub Section ---
     */
    public void section(String title) {
        out.println();
        out.println("--- " + title + " ---");
        logger.debug("Section: {}", title);
    }

    /**
     * Example: 1. Building flow...
     */
    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.info("Step {}: {}", stepNumber, description);
    }

    // ========== Messages ==========

    public void info(String message) {
        out.println(message);
        logger.info(message);
    }

    public void detail(String message) {
        out.println(INDENT + message);
        logger.debug(message);
    }

    public void keyValue(String key, Object value) {
        out.println(INDENT + key + ": " + value);
        logger.debug("{}={}", key, value);
    }

    public void arrow(String from, String to) {
        out.println(INDENT + from + " " + SYMBOL_ARROW + " " + to);
        logger.debug("{} -> {}", from, to);
    }

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.info("SUCCESS: {}", message);
    }

    public void failure(String message) {
        out.println(INDENT + SYMBOL_FAILURE + " " + message);
        logger.warn("FAILURE: {}", message);
    }

    /**
     * For scenarios that demonstrate error handling.
     */
    public void expectedFailure(String message, Exception e) {
        out.println(INDENT + SYMBOL_SUCCESS + " EXPECTED: " + message + " - " + e.getMessage());
        logger.info("EXPECTED FAILURE: {} - {}", message, e.getMessage());
    }

    // ========== Completion ==========

    public void completed(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed successfully! ===");
        logger.info("Completed: {}", exampleName);
    }

    /**
     * Reports an error that means the example itself is broken.
     */
    public void unexpectedError(String exampleName, Throwable t) {
        err.println();
        err.println("UNEXPECTED ERROR occurred during " + exampleName + ":");
        err.println("Error: " + t.getMessage());
        logger.error("Unexpected error in {}", exampleName, t);
    }
}
