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
import dev.mars.stepwise.core.conversation.ExecutionStatus;
import dev.mars.stepwise.core.conversation.SimpleFlowEngine;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.descriptor.DescriptorType;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.graph.WritePolicy;
import dev.mars.stepwise.core.step.FunctionStep;
import dev.mars.stepwise.core.step.MapStep;
import dev.mars.stepwise.core.step.StartStep;
import dev.mars.stepwise.core.step.StepResult;
import dev.mars.stepwise.core.step.VariableWriteStep;
import dev.mars.stepwise.examples.util.ExampleLogger;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Example of fanning a nested flow out over a list.
 * This example shows how to:
 * 1. Score every review in parallel with a map step
 * 2. Collect a nested output into a list, in item order
 * 3. Share a flow variable with sequential iterations
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class ParallelMapExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(ParallelMapExample.class);

    private static final Set<String> POSITIVE_WORDS = Set.of("great", "love", "excellent", "fast", "friendly");
    private static final Set<String> NEGATIVE_WORDS = Set.of("slow", "broken", "rude", "late", "bad");

    public static void main(String[] args) {
        log.header("Stepwise Parallel Map Example");

        try {
            ParallelMapExample example = new ParallelMapExample();
            example.runExample(List.of(
                    "Great service and fast delivery",
                    "The parcel was late and the box was broken",
                    "Friendly staff, excellent advice, love it",
                    "Okay"));
            log.completed("Parallel Map Example");
        } catch (Exception e) {
            log.unexpectedError("Parallel Map Example", e);
            System.exit(1);
        }
    }

    /**
     * Scores the reviews and returns the finished outer conversation.
     */
    public Conversation runExample(List<String> reviews) throws Exception {
        // 1. Build the flows
        log.step(1, "Building review scoring flows...");
        Variable flagged = new Variable("flagged", DescriptorType.listOf(DescriptorType.string()), List.of(),
                "Reviews that need a reply");
        Flow scoreOne = createScoreFlow(flagged);
        Flow scoreAll = createBatchFlow(scoreOne, flagged);

        // 2. Create the engine with a bounded pool for parallel iterations
        log.step(2, "Creating flow engine...");
        Properties properties = new Properties();
        properties.setProperty(StepwiseConfiguration.MAP_PARALLELISM, "4");
        SimpleFlowEngine engine = new SimpleFlowEngine(new StepwiseConfiguration(properties));

        try {
            // 3. Run
            log.step(3, "Scoring " + reviews.size() + " reviews...");
            Conversation conversation = engine.startConversation(scoreAll, Map.of("reviews", reviews));
            ExecutionStatus.Finished finished = (ExecutionStatus.Finished) conversation.execute();

            // 4. Results
            log.step(4, "Results");
            @SuppressWarnings("unchecked")
            List<Integer> scores = (List<Integer>) finished.output("score");
            for (int i = 0; i < reviews.size(); i++) {
                log.arrow(reviews.get(i), String.valueOf(scores.get(i)));
            }
            log.keyValue("Flagged", conversation.getState().getVariables().get("flagged"));
            return conversation;
        } finally {
            engine.shutdown();
        }
    }

    static int score(String review) {
        int score = 0;
        for (String word : review.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (POSITIVE_WORDS.contains(word)) {
                score++;
            } else if (NEGATIVE_WORDS.contains(word)) {
                score--;
            }
        }
        return score;
    }

    Flow createScoreFlow(Variable flagged) throws GraphException {
        StartStep start = new StartStep(List.of(Descriptor.of("review", DescriptorType.string())));
        FunctionStep scoreStep = FunctionStep.builder("score")
                .input("review", DescriptorType.string())
                .output("score", DescriptorType.integer())
                .compute(inputs -> Map.of("score", score((String) inputs.get("review"))))
                .build();
        FunctionStep triage = FunctionStep.builder("triage")
                .input("score", DescriptorType.integer())
                .branches("reply", "ignore")
                .body((inputs, context) -> (Integer) inputs.get("score") < 0
                        ? StepResult.completed(Map.of(), "reply")
                        : StepResult.completed(Map.of(), "ignore"))
                .build();
        VariableWriteStep flag = new VariableWriteStep("flag", flagged, WritePolicy.INSERT);

        return Flow.builder("score-review")
                .description("Scores one review and flags negative ones")
                .beginStep(start)
                .controlEdge(start, scoreStep)
                .controlEdge(scoreStep, triage)
                .controlEdge(triage, "reply", flag)
                .endEdge(triage, "ignore")
                .endEdge(flag)
                .dataEdge(start, "review", scoreStep, "review")
                .dataEdge(start, "review", flag, VariableWriteStep.DEFAULT_INPUT)
                .dataEdge(scoreStep, "score", triage, "score")
                .variable(flagged)
                .build();
    }

    Flow createBatchFlow(Flow scoreOne, Variable flagged) throws GraphException {
        StartStep start = new StartStep(List.of(
                Descriptor.of("reviews", DescriptorType.listOf(DescriptorType.string()))));
        MapStep parallelScores = MapStep.builder("score_all", scoreOne)
                .unpack("review", MapStep.ITEM)
                .output("score")
                .parallelExecution(true)
                .build();
        MapStep flagNegatives = MapStep.builder("flag_negatives", scoreOne)
                .unpack("review", MapStep.ITEM)
                .sharedVariable("flagged")
                .build();

        return Flow.builder("score-reviews")
                .description("Scores a batch of reviews and records the ones that need a reply")
                .beginStep(start)
                .controlEdge(start, parallelScores)
                .controlEdge(parallelScores, flagNegatives)
                .endEdge(flagNegatives)
                .dataEdge(start, "reviews", parallelScores, MapStep.ITERATED_INPUT)
                .dataEdge(start, "reviews", flagNegatives, MapStep.ITERATED_INPUT)
                .variable(flagged)
                .build();
    }
}
