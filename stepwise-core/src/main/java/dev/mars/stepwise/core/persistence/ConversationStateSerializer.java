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

package dev.mars.stepwise.core.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.stepwise.core.config.StepwiseConfiguration;
import dev.mars.stepwise.core.context.ContextProvider;
import dev.mars.stepwise.core.conversation.ConversationState;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.StateSerializationException;
import dev.mars.stepwise.core.graph.ControlEdge;
import dev.mars.stepwise.core.graph.DataEdge;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.step.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Writes conversation states as self-describing JSON documents and reads them back.
 *
 * <p>A document is an envelope with the format name, the format version, the id of
 * the flow and a fingerprint of its structure, wrapping the state itself. Map entries
 * are written in key order and no timestamp is included, so equal states always
 * produce equal documents.</p>
 *
 * <p>A document is only accepted for the flow it was written for: a different flow
 * id or a flow whose steps, edges, variables or providers changed is rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class ConversationStateSerializer {

    private static final Logger logger = LoggerFactory.getLogger(ConversationStateSerializer.class);

    public static final String FORMAT = "stepwise-conversation";
    public static final int VERSION = 1;

    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    public ConversationStateSerializer() {
        this(StepwiseConfiguration.defaults());
    }

    public ConversationStateSerializer(StepwiseConfiguration configuration) {
        this.prettyPrint = configuration.isStatePrettyPrint();
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                // skip null properties, keep null map entries
                .setDefaultPropertyInclusion(JsonInclude.Value.construct(
                        JsonInclude.Include.NON_NULL, JsonInclude.Include.ALWAYS));
    }

    public String serialize(ConversationState state, Flow flow) throws StateSerializationException {
        Objects.requireNonNull(state, "Conversation state cannot be null");
        Objects.requireNonNull(flow, "Flow cannot be null");
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("format", FORMAT);
            envelope.put("version", VERSION);
            envelope.put("flowId", flow.getId());
            envelope.put("flowFingerprint", fingerprint(flow));
            envelope.set("state", objectMapper.valueToTree(state));
            String json = prettyPrint
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope)
                    : objectMapper.writeValueAsString(envelope);
            logger.debug("Serialized conversation {} ({} characters)", state.getConversationId(), json.length());
            return json;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StateSerializationException("Failed to serialize conversation "
                    + state.getConversationId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a document written by {@link #serialize}.
     *
     * @throws StateSerializationException if the document is malformed, has an unknown
     *                                     format or a newer version, or belongs to another flow
     */
    public ConversationState deserialize(String json, Flow flow) throws StateSerializationException {
        Objects.requireNonNull(flow, "Flow cannot be null");
        if (json == null || json.isBlank()) {
            throw new StateSerializationException("Serialized conversation is empty");
        }

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StateSerializationException("Malformed conversation document: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new StateSerializationException("Conversation document is not a JSON object");
        }

        String format = envelope.path("format").asText(null);
        if (!FORMAT.equals(format)) {
            throw new StateSerializationException("Unknown document format: " + format);
        }
        int version = envelope.path("version").asInt(-1);
        if (version < 1 || version > VERSION) {
            throw new StateSerializationException("Unsupported document version " + version
                    + " (supported up to " + VERSION + ")");
        }
        String flowId = envelope.path("flowId").asText(null);
        if (!flow.getId().equals(flowId)) {
            throw new StateSerializationException("Document belongs to flow '" + flowId
                    + "', not to flow '" + flow.getId() + "'");
        }
        String expected = fingerprint(flow);
        String actual = envelope.path("flowFingerprint").asText(null);
        if (!expected.equals(actual)) {
            throw new StateSerializationException("Flow '" + flow.getId()
                    + "' has changed since the conversation was saved");
        }

        JsonNode stateNode = envelope.get("state");
        if (stateNode == null || !stateNode.isObject()) {
            throw new StateSerializationException("Conversation document has no state");
        }
        try {
            ConversationState state = objectMapper.treeToValue(stateNode, ConversationState.class);
            logger.debug("Deserialized conversation {} at step '{}'", state.getConversationId(), state.getPosition());
            return state;
        } catch (JsonProcessingException e) {
            throw new StateSerializationException("Invalid conversation state: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * SHA-256 over a canonical description of the flow structure, including nested flows
     * only through their ids.
     */
    public static String fingerprint(Flow flow) {
        StringBuilder canonical = new StringBuilder();
        canonical.append("flow:").append(flow.getId()).append('\n');
        canonical.append("begin:").append(flow.getBeginStep()).append('\n');

        for (Step step : new TreeMap<>(flow.getSteps()).values()) {
            canonical.append("step:").append(step.getName())
                    .append(':').append(step.getClass().getName())
                    .append(":in=").append(describe(step.getInputDescriptors()))
                    .append(":out=").append(describe(step.getOutputDescriptors()))
                    .append(":branches=").append(step.getBranches())
                    .append('\n');
        }
        for (ControlEdge edge : flow.getControlEdges()) {
            canonical.append("control:").append(edge.sourceStep()).append(':').append(edge.sourceBranch())
                    .append(':').append(edge.destinationStep()).append('\n');
        }
        for (DataEdge edge : flow.getDataEdges()) {
            canonical.append("data:").append(edge.source()).append(':').append(edge.sourceOutput())
                    .append(':').append(edge.destinationStep()).append(':').append(edge.destinationInput())
                    .append('\n');
        }
        for (Variable variable : flow.getVariables()) {
            canonical.append("variable:").append(variable.getName()).append(':').append(variable.getType())
                    .append('\n');
        }
        for (ContextProvider provider : flow.getContextProviders()) {
            canonical.append("provider:").append(provider.getName())
                    .append(':').append(describe(provider.getOutputDescriptors())).append('\n');
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String describe(List<Descriptor> descriptors) {
        StringBuilder sb = new StringBuilder("[");
        for (Descriptor descriptor : descriptors) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(descriptor.getName()).append(' ').append(descriptor.getType());
        }
        return sb.append(']').toString();
    }
}
