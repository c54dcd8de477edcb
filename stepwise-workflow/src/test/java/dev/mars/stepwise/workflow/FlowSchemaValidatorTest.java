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

package dev.mars.stepwise.workflow;

import dev.mars.stepwise.core.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FlowSchemaValidatorTest {

    private FlowSchemaValidator validator;
    private Yaml yaml;

    @BeforeEach
    void setUp() {
        validator = new FlowSchemaValidator(new StepTypeRegistry().getStepTypes());
        yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private ValidationResult validate(String content) {
        Map<String, Object> document = yaml.load(content);
        return validator.validateFlowSchema(document);
    }

    private static Set<String> errorPaths(ValidationResult result) {
        return result.getErrors().stream()
                .map(ValidationResult.ValidationIssue::getFieldPath)
                .collect(Collectors.toSet());
    }

    @Test
    void testValidFlow() {
        ValidationResult result = validate("""
                apiVersion: v1
                kind: Flow
                metadata:
                  name: greeter
                  version: 1.2.0
                  description: Says hello
                spec:
                  beginStep: hello
                  steps:
                    - name: hello
                      type: output
                      message: Hello
                  contextProviders:
                    - name: motd
                      type: constant
                      output: { name: motd, type: string }
                      value: Welcome
                  variables:
                    - { name: count, type: int, default: 0 }
                  controlEdges:
                    - { from: hello }
                  dataEdges:
                    - { from: motd, output: motd, to: hello, input: motd }
                  loopLimits:
                    hello: 3
                """);

        assertTrue(result.isValid(), result.toString());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testMissingSections() {
        ValidationResult result = validate("apiVersion: v1\n");

        assertEquals(Set.of("metadata", "spec"), errorPaths(result));
    }

    @Test
    void testMetadataRules() {
        ValidationResult result = validate("""
                apiVersion: version-one
                kind: Workflow
                metadata:
                  name: "bad name"
                  version: one
                spec:
                  steps:
                    - { name: a, type: output }
                  controlEdges:
                    - { from: a }
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder(
                "apiVersion", "kind", "metadata.name", "metadata.version");
        assertEquals(1, result.getWarningCount());
        assertEquals("metadata.description", result.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testNameLength() {
        String longName = "a".repeat(101);
        ValidationResult result = validate("metadata:\n  name: " + longName + "\n  description: d\n"
                + "spec:\n  steps:\n    - { name: a, type: output }\n  controlEdges:\n    - { from: a }\n");

        assertEquals(1, result.getErrorCount());
        assertEquals("Name must be 100 characters or less", result.getErrors().get(0).getMessage());
    }

    @Test
    void testStepRules() {
        ValidationResult result = validate("""
                metadata:
                  name: steps
                  description: d
                spec:
                  beginStep: nowhere
                  steps:
                    - { type: output }
                    - { name: twice, type: output }
                    - { name: twice, type: output }
                    - { name: odd, type: levitate }
                    - { name: untyped }
                    - just a string
                  controlEdges:
                    - { from: twice }
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder(
                "spec.steps[0].name", "spec.steps[2].name", "spec.steps[3].type", "spec.steps[4].type",
                "spec.steps[5]", "spec.beginStep");
    }

    @Test
    void testEmptyStepList() {
        ValidationResult result = validate("metadata:\n  name: empty\n  description: d\nspec:\n  steps: []\n");

        assertEquals(1, result.getErrorCount());
        assertEquals("spec.steps", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testEdgeRules() {
        ValidationResult result = validate("""
                metadata:
                  name: edges
                  description: d
                spec:
                  steps:
                    - { name: a, type: output }
                  contextProviders:
                    - { name: clock, type: tool, tool: clock }
                  controlEdges:
                    - { from: a, to: b }
                    - { to: a }
                  dataEdges:
                    - { from: clock, output: now, to: a, input: now }
                    - { from: ghost, output: x, to: a }
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder(
                "spec.controlEdges[0].to", "spec.controlEdges[1].from",
                "spec.dataEdges[1].from", "spec.dataEdges[1].input");
    }

    @Test
    void testToolProviderNameDefaultsToTool() {
        ValidationResult result = validate("""
                metadata:
                  name: providers
                  description: d
                spec:
                  steps:
                    - { name: a, type: output }
                  contextProviders:
                    - { type: tool, tool: clock }
                    - { name: clock, type: constant }
                    - { name: other, type: oracle }
                  controlEdges:
                    - { from: a }
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder(
                "spec.contextProviders[1].name", "spec.contextProviders[2].type");
    }

    @Test
    void testVariableRules() {
        ValidationResult result = validate("""
                metadata:
                  name: variables
                  description: d
                spec:
                  steps:
                    - { name: a, type: output }
                  variables:
                    - { name: total, type: int }
                    - { name: total, type: string }
                    - { name: shape, type: "list<" }
                    - { type: int }
                    - { name: untyped }
                  controlEdges:
                    - { from: a }
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder(
                "spec.variables[1].name", "spec.variables[2].type", "spec.variables[3].name", "spec.variables[4].type");
    }

    @Test
    void testLoopLimitRules() {
        ValidationResult result = validate("""
                metadata:
                  name: limits
                  description: d
                spec:
                  steps:
                    - { name: a, type: output }
                  controlEdges:
                    - { from: a }
                  loopLimits:
                    a: 0
                    b: 2
                """);

        assertThat(errorPaths(result)).containsExactlyInAnyOrder("spec.loopLimits.a", "spec.loopLimits.b");
    }

    @Test
    void testMissingControlEdgesIsWarning() {
        ValidationResult result = validate("metadata:\n  name: open\n  description: d\n"
                + "spec:\n  steps:\n    - { name: a, type: output }\n");

        assertTrue(result.isValid());
        assertEquals("spec.controlEdges", result.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testCustomStepTypesAreKnown() {
        FlowSchemaValidator custom = new FlowSchemaValidator(Set.of("shout"));
        Map<String, Object> document = yaml.load("metadata:\n  name: loud\n  description: d\n"
                + "spec:\n  steps:\n    - { name: a, type: shout }\n  controlEdges:\n    - { from: a }\n");

        assertTrue(custom.validateFlowSchema(document).isValid());
    }
}
