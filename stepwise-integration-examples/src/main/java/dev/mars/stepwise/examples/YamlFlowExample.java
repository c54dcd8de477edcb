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

package dev.mars.stepwise.examples;

import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.core.validation.ValidationResult;
import dev.mars.stepwise.examples.util.ExampleLogger;
import dev.mars.stepwise.workflow.FlowDefinitionParser;
import dev.mars.stepwise.workflow.StepTypeRegistry;
import dev.mars.stepwise.workflow.YamlFlowDefinitionParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Example loading a flow from a YAML resource.
 * This example shows how to:
 * 1. Register the tools a YAML definition refers to
 * 2. Validate and parse the definition with parser variables
 * 3. Run the parsed flow for several tickets
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class YamlFlowExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(YamlFlowExample.class);

    static final String FLOW_RESOURCE = "/flows/ticket-triage.yaml";

    public static void main(String[] args) {
        log.header("Stepwise YAML Flow Example");

        try {
            YamlFlowExample example = new YamlFlowExample();
            Map<String, String> tickets = new LinkedHashMap<>();
            tickets.put("Invoice charged twice", "My card was billed two times this month");
            tickets.put("Site is down", "Checkout returns an error for every customer");
            tickets.put("Feature idea", "Dark mode would be nice");
            example.runExample("Acme Support", tickets);
            log.completed("YAML Flow Example");
        } catch (Exception e) {
            log.unexpectedError("YAML Flow Example", e);
            System.exit(1);
        }
    }

    /**
     * Parses the triage flow and returns the reply drafted for each ticket subject.
     */
    public Map<String, String> runExample(String team, Map<String, String> tickets) throws Exception {
        // 1. Register tools
        log.step(1, "Registering tools...");
        StepTypeRegistry registry = new StepTypeRegistry().registerTool(createClassifier());
        log.keyValue("Step types", registry.getStepTypes());

        // 2. Validate and parse
        log.step(2, "Parsing " + FLOW_RESOURCE + "...");
        String yaml = readResource(FLOW_RESOURCE);
        FlowDefinitionParser parser = new YamlFlowDefinitionParser(registry, Map.of("team", team));
        ValidationResult validation = parser.validateSchema(yaml);
        if (!validation.isValid()) {
            validation.getErrorMessages().forEach(log::failure);
            throw new IllegalStateException("Flow definition is invalid");
        }
        Flow flow = parser.parseFromString(yaml);
        log.success("Parsed flow '" + flow.getId() + "' with " + flow.getSteps().size() + " steps");

        // 3. Run every ticket
        log.step(3, "Triaging " + tickets.size() + " tickets...");
        Map<String, String> replies = new LinkedHashMap<>();
        SimpleFlowEngine engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());
        try {
            for (Map.Entry<String, String> ticket : tickets.entrySet()) {
                ExecutionStatus.Finished finished = (ExecutionStatus.Finished) engine.startConversation(flow,
                        Map.of("subject", ticket.getKey(), "body", ticket.getValue())).execute();
                String reply = (String) finished.output("reply");
                log.arrow(finished.completeStepName(), reply);
                replies.put(ticket.getKey(), reply);
            }
        } finally {
            engine.shutdown();
        }
        return replies;
    }

    static ServerTool createClassifier() {
        return ServerTool.builder("classify_ticket")
                .description("Assigns a category and priority from ticket keywords")
                .input("subject", DescriptorType.string())
                .input("body", DescriptorType.string())
                .output("category", DescriptorType.string())
                .output("priority", DescriptorType.integer())
                .function(args -> {
                    String text = (args.get("subject") + " " + args.get("body")).toLowerCase(Locale.ROOT);
                    if (text.contains("down") || text.contains("error")) {
                        return Map.of("category", "outage", "priority", 1);
                    }
                    if (text.contains("invoice") || text.contains("billed")) {
                        return Map.of("category", "billing", "priority", 3);
                    }
                    return Map.of("category", "general", "priority", 5);
                })
                .build();
    }

    private static String readResource(String name) throws IOException {
        try (InputStream in = YamlFlowExample.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Resource not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
