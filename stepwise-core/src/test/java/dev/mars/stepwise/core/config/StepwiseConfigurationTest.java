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

package dev.mars.stepwise.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StepwiseConfiguration defaults, overrides and type conversion.
 */
class StepwiseConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(StepwiseConfiguration.MAX_STEP_VISITS);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultMapParallelism() {
        assertEquals(0, StepwiseConfiguration.defaults().getMapParallelism());
    }

    @Test
    void testDefaultMaxStepVisits() {
        assertEquals(1000, StepwiseConfiguration.defaults().getMaxStepVisits());
    }

    @Test
    void testDefaultMaxEvents() {
        assertEquals(500, StepwiseConfiguration.defaults().getMaxEvents());
    }

    @Test
    void testDefaultPrettyPrintIsOff() {
        assertFalse(StepwiseConfiguration.defaults().isStatePrettyPrint());
    }

    @Test
    void testDefaultStoreDirectoryIsUnderTemp() {
        assertEquals(Paths.get(System.getProperty("java.io.tmpdir"), "stepwise"),
                StepwiseConfiguration.defaults().getStoreDirectory());
    }

    // ========== Override Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(StepwiseConfiguration.MAP_PARALLELISM, "4");
        properties.setProperty(StepwiseConfiguration.STATE_PRETTY_PRINT, "true");

        StepwiseConfiguration config = new StepwiseConfiguration(properties);

        assertEquals(4, config.getMapParallelism());
        assertTrue(config.isStatePrettyPrint());
        assertEquals(1000, config.getMaxStepVisits());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(StepwiseConfiguration.MAX_STEP_VISITS, "42");

        assertEquals(42, new StepwiseConfiguration().getMaxStepVisits());
        assertEquals(1000, StepwiseConfiguration.defaults().getMaxStepVisits());
    }

    @Test
    void testSetProperty() {
        StepwiseConfiguration config = StepwiseConfiguration.defaults();
        config.setProperty(StepwiseConfiguration.MAX_EVENTS, "7");

        assertEquals(7, config.getMaxEvents());
        assertEquals("7", config.getProperty(StepwiseConfiguration.MAX_EVENTS));
    }

    // ========== Type Conversion Tests ==========

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(StepwiseConfiguration.MAX_STEP_VISITS, "lots");

        assertEquals(1000, new StepwiseConfiguration(properties).getMaxStepVisits());
    }

    @Test
    void testIntegerValuesAreTrimmed() {
        Properties properties = new Properties();
        properties.setProperty(StepwiseConfiguration.MAX_STEP_VISITS, " 12 ");

        assertEquals(12, new StepwiseConfiguration(properties).getMaxStepVisits());
    }

    @Test
    void testGetPropertyWithDefault() {
        StepwiseConfiguration config = StepwiseConfiguration.defaults();

        assertNull(config.getProperty("stepwise.unknown"));
        assertEquals("fallback", config.getProperty("stepwise.unknown", "fallback"));
    }

    @Test
    void testToString() {
        String text = StepwiseConfiguration.defaults().toString();

        assertTrue(text.startsWith("StepwiseConfiguration{"));
        assertTrue(text.contains("maxStepVisits=1000"));
    }
}
