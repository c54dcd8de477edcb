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

package dev.mars.stepwise.core.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All mutable state of one conversation: position in the graph, produced values,
 * variables, per-step private state, message history and nested conversation states.
 *
 * <p>The state is a plain Jackson-mapped object so that a paused conversation can be
 * written out and picked up later, possibly by another process. Nested flows run in
 * their own state, stored under {@link #getSubstates()} by step instance id; message
 * history, tool results and tool decisions live in the root state only.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationState {

    @JsonProperty("conversationId")
    private String conversationId;

    @JsonProperty("flowId")
    private String flowId;

    @JsonProperty("path")
    private String path = "";

    @JsonProperty("status")
    private ConversationStatus status = ConversationStatus.NOT_STARTED;

    @JsonProperty("position")
    private String position;

    @JsonProperty("flowInputs")
    private Map<String, Object> flowInputs = new LinkedHashMap<>();

    @JsonProperty("variables")
    private Map<String, Object> variables = new LinkedHashMap<>();

    @JsonProperty("producedOutputs")
    private Map<String, Map<String, Object>> producedOutputs = new LinkedHashMap<>();

    @JsonProperty("productionOrder")
    private Map<String, Long> productionOrder = new LinkedHashMap<>();

    @JsonProperty("contextValues")
    private Map<String, Object> contextValues = new LinkedHashMap<>();

    @JsonProperty("evaluatedProviders")
    private List<String> evaluatedProviders = new ArrayList<>();

    @JsonProperty("stepStates")
    private Map<String, Map<String, Object>> stepStates = new LinkedHashMap<>();

    @JsonProperty("pendingToolRequests")
    private List<ToolRequest> pendingToolRequests = new ArrayList<>();

    @JsonProperty("messages")
    private List<Message> messages = new ArrayList<>();

    @JsonProperty("toolResults")
    private Map<String, Object> toolResults = new LinkedHashMap<>();

    @JsonProperty("toolDecisions")
    private Map<String, ToolDecision> toolDecisions = new LinkedHashMap<>();

    @JsonProperty("substates")
    private Map<String, ConversationState> substates = new LinkedHashMap<>();

    @JsonProperty("stepVisits")
    private Map<String, Integer> stepVisits = new LinkedHashMap<>();

    @JsonProperty("events")
    private List<ExecutionEvent> events = new ArrayList<>();

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("finalOutputs")
    private Map<String, Object> finalOutputs;

    @JsonProperty("terminalBranch")
    private String terminalBranch;

    @JsonProperty("completeStepName")
    private String completeStepName;

    @JsonProperty("failureKind")
    private String failureKind;

    @JsonProperty("failureMessage")
    private String failureMessage;

    // Default constructor for Jackson deserialization
    public ConversationState() {
    }

    public ConversationState(String conversationId, String flowId, String path) {
        this.conversationId = conversationId;
        this.flowId = flowId;
        this.path = path != null ? path : "";
    }

    /**
     * Next value of the state-local sequence used for production order and ids.
     */
    public long nextSequence() {
        return ++sequence;
    }

    @JsonIgnore
    public boolean isFinished() {
        return status == ConversationStatus.FINISHED;
    }

    // Getters and setters

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getFlowId() {
        return flowId;
    }

    public void setFlowId(String flowId) {
        this.flowId = flowId;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public ConversationStatus getStatus() {
        return status;
    }

    public void setStatus(ConversationStatus status) {
        this.status = status;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public Map<String, Object> getFlowInputs() {
        return flowInputs;
    }

    public void setFlowInputs(Map<String, Object> flowInputs) {
        this.flowInputs = flowInputs;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }

    public Map<String, Map<String, Object>> getProducedOutputs() {
        return producedOutputs;
    }

    public void setProducedOutputs(Map<String, Map<String, Object>> producedOutputs) {
        this.producedOutputs = producedOutputs;
    }

    public Map<String, Long> getProductionOrder() {
        return productionOrder;
    }

    public void setProductionOrder(Map<String, Long> productionOrder) {
        this.productionOrder = productionOrder;
    }

    public Map<String, Object> getContextValues() {
        return contextValues;
    }

    public void setContextValues(Map<String, Object> contextValues) {
        this.contextValues = contextValues;
    }

    public List<String> getEvaluatedProviders() {
        return evaluatedProviders;
    }

    public void setEvaluatedProviders(List<String> evaluatedProviders) {
        this.evaluatedProviders = evaluatedProviders;
    }

    public Map<String, Map<String, Object>> getStepStates() {
        return stepStates;
    }

    public void setStepStates(Map<String, Map<String, Object>> stepStates) {
        this.stepStates = stepStates;
    }

    public List<ToolRequest> getPendingToolRequests() {
        return pendingToolRequests;
    }

    public void setPendingToolRequests(List<ToolRequest> pendingToolRequests) {
        this.pendingToolRequests = pendingToolRequests;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public void setMessages(List<Message> messages) {
        this.messages = messages;
    }

    public Map<String, Object> getToolResults() {
        return toolResults;
    }

    public void setToolResults(Map<String, Object> toolResults) {
        this.toolResults = toolResults;
    }

    public Map<String, ToolDecision> getToolDecisions() {
        return toolDecisions;
    }

    public void setToolDecisions(Map<String, ToolDecision> toolDecisions) {
        this.toolDecisions = toolDecisions;
    }

    public Map<String, ConversationState> getSubstates() {
        return substates;
    }

    public void setSubstates(Map<String, ConversationState> substates) {
        this.substates = substates;
    }

    public Map<String, Integer> getStepVisits() {
        return stepVisits;
    }

    public void setStepVisits(Map<String, Integer> stepVisits) {
        this.stepVisits = stepVisits;
    }

    public List<ExecutionEvent> getEvents() {
        return events;
    }

    public void setEvents(List<ExecutionEvent> events) {
        this.events = events;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public Map<String, Object> getFinalOutputs() {
        return finalOutputs;
    }

    public void setFinalOutputs(Map<String, Object> finalOutputs) {
        this.finalOutputs = finalOutputs;
    }

    public String getTerminalBranch() {
        return terminalBranch;
    }

    public void setTerminalBranch(String terminalBranch) {
        this.terminalBranch = terminalBranch;
    }

    public String getCompleteStepName() {
        return completeStepName;
    }

    public void setCompleteStepName(String completeStepName) {
        this.completeStepName = completeStepName;
    }

    public String getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(String failureKind) {
        this.failureKind = failureKind;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public void setFailureMessage(String failureMessage) {
        this.failureMessage = failureMessage;
    }

    @Override
    public String toString() {
        return "ConversationState{" +
                "conversationId='" + conversationId + '\'' +
                ", flowId='" + flowId + '\'' +
                ", path='" + path + '\'' +
                ", status=" + status +
                ", position='" + position + '\'' +
                ", substates=" + substates.keySet() +
                '}';
    }
}
