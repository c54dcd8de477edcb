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
import dev.mars.stepwise.core.conversation.Conversation;
import dev.mars.stepwise.core.conversation.ExecutionEvent;
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.step.BranchingStep;
import dev.mars.stepwise.core.step.OutputMessageStep;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.ToolExecutionStep;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.examples.util.ExampleLogger;

import java.util.List;
import java.util.Map;

/**
 * Basic example building a flow in code and running it to completion.
 * This example shows how to:
 * 1. Declare a server-side tool
 * 2. Wire steps with control and data edges
 * 3. Run a conversation and read the flow outputs and event log
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class BasicFlowExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(BasicFlowExample.class);

    static final double BULK_THRESHOLD = 100.0;

    public static void main(String[] args) {
        log.header("Stepwise Basic Flow Example");

        try {
            BasicFlowExample example = new BasicFlowExample();
            example.runExample(12, 9.5);
            example.runExample(3, 4.0);
            log.completed("Basic Flow Example");
        } catch (Exception e) {
            log.unexpectedError("Basic Flow Example", e);
            System.exit(1);
        }
    }

    public ExecutionStatus.Finished runExample(int quantity, double unitPrice) throws Exception {
        // 1. Build the flow
        log.step(1, "Building order pricing flow...");
        Flow flow = createOrderFlow();
        log.keyValue("Steps", flow.getSteps().keySet());
        log.keyValue("Inputs", flow.getInputDescriptors());
        log.keyValue("Outputs", flow.getOutputDescriptors());

        // 2. Create the engine
        log.step(2, "Creating flow engine...");
        SimpleFlowEngine engine = new SimpleFlowEngine(StepwiseConfiguration.defaults());

        try {
            // 3. Run a conversation
            log.step(3, "Running conversation for " + quantity + " x " + unitPrice + "...");
            Conversation conversation = engine.startConversation(flow,
                    Map.of("quantity", quantity, "unit_price", unitPrice));
            ExecutionStatus status = conversation.execute();
            if (!(status instanceof ExecutionStatus.Finished)) {
                throw new IllegalStateException("Flow did not finish: " + status);
            }
            ExecutionStatus.Finished finished = (ExecutionStatus.Finished) status;

            // 4. Display results
            log.step(4, "Results");
            log.keyValue("Completed by", finished.completeStepName());
            log.keyValue("Quote", finished.output("quote"));
            for (ExecutionEvent event : conversation.getState().getEvents()) {
                log.detail(event.sequence() + " " + event.type() + " " + event.stepName());
            }
            log.success("Conversation " + conversation.getId() + " finished");
            return finished;
        } finally {
            engine.shutdown();
        }
    }

    static Flow createOrderFlow() throws GraphException {
        ServerTool price = ServerTool.builder("price_order")
                .description("Computes the order total and its tier")
                .input("quantity", DescriptorType.integer())
                .input("unit_price", DescriptorType.floating())
                .output("total", DescriptorType.floating())
                .output("tier", DescriptorType.string())
                .function(args -> {
                    int quantity = (Integer) args.get("quantity");
                    double total = quantity * ((Number) args.get("unit_price")).doubleValue();
                    return Map.of("total", total,
                            "tier", total >= BULK_THRESHOLD ? "bulk" : "standard");
                })
                .build();

        StartStep start = new StartStep(List.of(
                Descriptor.of("quantity", DescriptorType.integer()),
                Descriptor.of("unit_price", DescriptorType.floating())));
        ToolExecutionStep pricing = new ToolExecutionStep("pricing", price);
        BranchingStep route = new BranchingStep("route", Map.of("bulk", "bulk", "standard", "standard"));
        OutputMessageStep bulk = new OutputMessageStep("bulk_quote",
                "Bulk order: {{total}} with free delivery", "quote");
        OutputMessageStep standard = new OutputMessageStep("standard_quote",
                "Order total: {{total}}", "quote");

        return Flow.builder("order-pricing")
                .description("Prices an order and picks the matching quote")
                .beginStep(start)
                .controlEdge(start, pricing)
                .controlEdge(pricing, route)
                .controlEdge(route, "bulk", bulk)
                .controlEdge(route, "standard", standard)
                .controlEdge(route, BranchingStep.DEFAULT_BRANCH, standard)
                .endEdge(bulk)
                .endEdge(standard)
                .dataEdge(start, "quantity", pricing, "quantity")
                .dataEdge(start, "unit_price", pricing, "unit_price")
                .dataEdge(pricing, "tier", route, BranchingStep.DEFAULT_INPUT)
                .dataEdge(pricing, "total", bulk, "total")
                .dataEdge(pricing, "total", standard, "total")
                .build();
    }
}
