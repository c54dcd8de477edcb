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

import dev.mars.stepwise.core.context.ConstantContextProvider;
import dev.mars.stepwise.core.context.ContextProvider;
import dev.mars.stepwise.core.context.FlowContextProvider;
import dev.mars.stepwise.core.context.MessageWindowContextProvider;
import dev.mars.stepwise.core.context.ToolContextProvider;
import dev.mars.stepwise.core.descriptor.Descriptor;
import dev.mars.stepwise.core.exceptions.GraphException;
import dev.mars.stepwise.core.graph.Flow;
import dev.mars.stepwise.core.graph.Variable;
import dev.mars.stepwise.core.step.Step;
import dev.mars.stepwise.core.tool.ServerTool;
import dev.mars.stepwise.core.tool.Tool;
import dev.mars.stepwise.core.util.TemplateResolver;
import dev.mars.stepwise.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML-based implementation of FlowDefinitionParser.
 * Parses flow definitions using SnakeYAML.
 *
 * <p>{@code {{name}}} placeholders in string values are replaced with parser
 * variables, falling back to system properties and environment variables. The
 * {@code message} and {@code prompt} fields are left untouched because their
 * placeholders are step inputs resolved at run time.</p>
 *
 * <p>Each parsed flow is registered on the {@link StepTypeRegistry}, so later
 * documents and later parses can use it in composite steps.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class YamlFlowDefinitionParser implements FlowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlFlowDefinitionParser.class);

    private static final Set<String> RUNTIME_TEMPLATE_FIELDS = Set.of("message", "prompt");

    private final Yaml yaml;
    private final StepTypeRegistry registry;
    private final TemplateResolver templateResolver;

    public YamlFlowDefinitionParser() {
        this(new StepTypeRegistry());
    }

    public YamlFlowDefinitionParser(StepTypeRegistry registry) {
        this(registry, Map.of());
    }

    public YamlFlowDefinitionParser(StepTypeRegistry registry, Map<String, Object> variables) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.registry = registry;
        this.templateResolver = new TemplateResolver(variables, true);
    }

    public StepTypeRegistry getRegistry() {
        return registry;
    }

    @Override
    public Flow parse(Path file) throws FlowParseException {
        return single(parseAll(file), file.toString());
    }

    @Override
    public Flow parseFromString(String content) throws FlowParseException {
        return single(parseAll(content), "content");
    }

    @Override
    public List<Flow> parseAll(Path file) throws FlowParseException {
        try {
            return parseAll(Files.readString(file));
        } catch (IOException e) {
            throw new FlowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public List<Flow> parseAll(String content) throws FlowParseException {
        List<Map<String, Object>> documents = loadDocuments(content);
        if (documents.isEmpty()) {
            throw new FlowParseException("Empty or invalid YAML content");
        }

        List<Flow> flows = new ArrayList<>();
        for (Map<String, Object> document : documents) {
            Flow flow = parseFlow(document);
            registry.registerFlow(flow);
            flows.add(flow);
        }
        logger.debug("Parsed {} flow definition(s)", flows.size());
        return flows;
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        List<Map<String, Object>> documents;
        try {
            documents = loadDocuments(content);
        } catch (FlowParseException e) {
            result.addError(e.getLineNumber(), null, e.getRawMessage());
            return result;
        }
        if (documents.isEmpty()) {
            result.addError("Empty or invalid YAML content");
            return result;
        }

        FlowSchemaValidator validator = new FlowSchemaValidator(registry.getStepTypes());
        for (int i = 0; i < documents.size(); i++) {
            String prefix = documents.size() > 1 ? "documents[" + i + "]" : "";
            try {
                result.merge(prefix, validator.validateFlowSchema(resolveTemplates(null, "", documents.get(i))));
            } catch (FlowParseException e) {
                result.addError(prefix.isEmpty() ? e.getFieldPath() : prefix + "." + e.getFieldPath(), e.getRawMessage());
            }
        }
        return result;
    }

    private Flow single(List<Flow> flows, String source) throws FlowParseException {
        if (flows.size() != 1) {
            throw new FlowParseException("Expected exactly one flow definition in " + source
                    + " but found " + flows.size());
        }
        return flows.get(0);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> loadDocuments(String content) throws FlowParseException {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<Map<String, Object>> documents = new ArrayList<>();
        try {
            int index = 0;
            for (Object document : yaml.loadAll(content)) {
                if (document == null) {
                    continue;
                }
                if (!(document instanceof Map)) {
                    throw new FlowParseException(null, "documents[" + index + "]",
                            "Flow definition must be a mapping");
                }
                documents.add((Map<String, Object>) document);
                index++;
            }
        } catch (YAMLException e) {
            int line = -1;
            if (e instanceof MarkedYAMLException marked && marked.getProblemMark() != null) {
                line = marked.getProblemMark().getLine() + 1;
            }
            throw new FlowParseException(null, line, null, "YAML parsing failed: " + e.getMessage(), e);
        }
        return documents;
    }

    private Flow parseFlow(Map<String, Object> rawDocument) throws FlowParseException {
        Map<String, Object> rawMetadata = YamlValues.getMap(rawDocument, "metadata");
        String rawName = YamlValues.getString(rawMetadata, "name");

        Map<String, Object> document = resolveTemplates(rawName, "", rawDocument);
        ValidationResult schema = new FlowSchemaValidator(registry.getStepTypes()).validateFlowSchema(document);
        Map<String, Object> metadata = YamlValues.getMap(document, "metadata");
        String name = YamlValues.getString(metadata, "name");
        if (!schema.isValid()) {
            ValidationResult.ValidationIssue first = schema.getErrors().get(0);
            StringBuilder sb = new StringBuilder("Schema validation failed:");
            for (String error : schema.getErrorMessages()) {
                sb.append("\n  - ").append(error);
            }
            throw new FlowParseException(name, first.getFieldPath(), sb.toString());
        }
        for (ValidationResult.ValidationIssue warning : schema.getWarnings()) {
            logger.debug("Flow '{}': {}", name, warning);
        }

        Map<String, Object> spec = YamlValues.getMap(document, "spec");
        Flow.Builder builder = Flow.builder(name)
                .description(YamlValues.getString(metadata, "description"));
        if (metadata.get("id") != null) {
            builder.id(metadata.get("id").toString());
        }

        Map<String, Variable> variables = parseVariables(name, spec);
        variables.values().forEach(builder::variable);
        for (ContextProvider provider : parseContextProviders(name, spec)) {
            builder.contextProvider(provider);
        }
        for (Step step : parseSteps(name, spec, variables)) {
            builder.addStep(step);
        }
        if (spec.get("beginStep") != null) {
            builder.beginStep(spec.get("beginStep").toString());
        }
        addEdges(builder, spec);
        addLimits(name, builder, spec);
        if (spec.containsKey("outputs")) {
            builder.outputs(YamlValues.toDescriptors(name, "spec.outputs", spec.get("outputs")));
        }

        try {
            Flow flow = builder.build();
            logger.debug("Built flow '{}' with {} steps", flow.getId(), flow.getSteps().size());
            return flow;
        } catch (GraphException e) {
            StringBuilder sb = new StringBuilder("Invalid flow graph:");
            for (String error : e.getErrors()) {
                sb.append("\n  - ").append(error);
            }
            throw new FlowParseException(name, "spec", sb.toString(), e);
        }
    }

    private Map<String, Variable> parseVariables(String flowName, Map<String, Object> spec) throws FlowParseException {
        Map<String, Variable> variables = new LinkedHashMap<>();
        List<?> entries = YamlValues.getList(spec, "variables");
        if (entries == null) {
            return variables;
        }
        for (int i = 0; i < entries.size(); i++) {
            @SuppressWarnings("unchecked")
            Map<String, Object> entry = (Map<String, Object>) entries.get(i);
            Descriptor descriptor = YamlValues.toDescriptor(flowName, "spec.variables[" + i + "]", entry);
            try {
                variables.put(descriptor.getName(), new Variable(descriptor.getName(), descriptor.getType(),
                        descriptor.getDefaultValue(), descriptor.getDescription()));
            } catch (IllegalArgumentException e) {
                throw new FlowParseException(flowName, "spec.variables[" + i + "]", e.getMessage(), e);
            }
        }
        return variables;
    }

    private List<ContextProvider> parseContextProviders(String flowName, Map<String, Object> spec)
            throws FlowParseException {
        List<ContextProvider> providers = new ArrayList<>();
        List<?> entries = YamlValues.getList(spec, "contextProviders");
        if (entries == null) {
            return providers;
        }
        for (int i = 0; i < entries.size(); i++) {
            @SuppressWarnings("unchecked")
            Map<String, Object> entry = (Map<String, Object>) entries.get(i);
            String path = "spec.contextProviders[" + i + "]";
            try {
                providers.add(parseContextProvider(flowName, path, entry));
            } catch (IllegalArgumentException e) {
                throw new FlowParseException(flowName, path, e.getMessage(), e);
            }
        }
        return providers;
    }

    @SuppressWarnings("unchecked")
    private ContextProvider parseContextProvider(String flowName, String path, Map<String, Object> entry)
            throws FlowParseException {
        String type = YamlValues.getString(entry, "type");
        String name = YamlValues.getString(entry, "name");
        switch (type) {
            case "constant": {
                Object output = entry.get("output");
                if (!(output instanceof Map)) {
                    throw new FlowParseException(flowName, path + ".output", "Constant provider needs an output descriptor");
                }
                Descriptor descriptor = YamlValues.toDescriptor(flowName, path + ".output", (Map<String, Object>) output);
                return new ConstantContextProvider(name, descriptor, entry.get("value"));
            }
            case "tool": {
                String toolName = YamlValues.getString(entry, "tool");
                Tool tool = registry.getTool(toolName)
                        .orElseThrow(() -> new FlowParseException(flowName, path + ".tool", "Unknown tool '" + toolName + "'"));
                if (!(tool instanceof ServerTool)) {
                    throw new FlowParseException(flowName, path + ".tool", "Tool '" + toolName + "' does not run in-process");
                }
                return new ToolContextProvider((ServerTool) tool);
            }
            case "flow": {
                String flowId = YamlValues.getString(entry, "flow");
                Flow flow = registry.getFlow(flowId)
                        .orElseThrow(() -> new FlowParseException(flowName, path + ".flow", "Unknown flow '" + flowId + "'"));
                return new FlowContextProvider(name, flow);
            }
            case "messages": {
                String output = YamlValues.getString(entry, "output");
                Object window = entry.getOrDefault("window", 10);
                if (output == null || !(window instanceof Integer)) {
                    throw new FlowParseException(flowName, path, "Message provider needs an output name and an integer window");
                }
                return new MessageWindowContextProvider(name, output, (Integer) window);
            }
            default:
                throw new FlowParseException(flowName, path + ".type", "Unknown context provider type '" + type + "'");
        }
    }

    @SuppressWarnings("unchecked")
    private List<Step> parseSteps(String flowName, Map<String, Object> spec, Map<String, Variable> variables)
            throws FlowParseException {
        List<Step> steps = new ArrayList<>();
        List<?> entries = YamlValues.getList(spec, "steps");
        for (int i = 0; i < entries.size(); i++) {
            StepDefinition definition = new StepDefinition(flowName, "spec.steps[" + i + "]",
                    (Map<String, Object>) entries.get(i), variables);
            StepFactory factory = registry.getStepFactory(definition.getType())
                    .orElseThrow(() -> definition.error("type", "Unknown step type '" + definition.getType() + "'"));
            try {
                steps.add(factory.create(definition, registry));
            } catch (IllegalArgumentException e) {
                throw new FlowParseException(flowName, definition.getFieldPath(), e.getMessage(), e);
            }
        }
        return steps;
    }

    @SuppressWarnings("unchecked")
    private void addEdges(Flow.Builder builder, Map<String, Object> spec) {
        List<?> controlEdges = YamlValues.getList(spec, "controlEdges");
        if (controlEdges != null) {
            for (Object item : controlEdges) {
                Map<String, Object> edge = (Map<String, Object>) item;
                String branch = YamlValues.getString(edge, "branch");
                builder.controlEdge(YamlValues.getString(edge, "from"), branch != null ? branch : Step.NEXT,
                        YamlValues.getString(edge, "to"));
            }
        }
        List<?> dataEdges = YamlValues.getList(spec, "dataEdges");
        if (dataEdges != null) {
            for (Object item : dataEdges) {
                Map<String, Object> edge = (Map<String, Object>) item;
                builder.dataEdge(YamlValues.getString(edge, "from"), YamlValues.getString(edge, "output"),
                        YamlValues.getString(edge, "to"), YamlValues.getString(edge, "input"));
            }
        }
    }

    private void addLimits(String flowName, Flow.Builder builder, Map<String, Object> spec) throws FlowParseException {
        Map<String, Object> loopLimits = YamlValues.getMap(spec, "loopLimits");
        if (loopLimits != null) {
            loopLimits.forEach((stepName, limit) -> builder.loopLimit(stepName, (Integer) limit));
        }
        Object maxStepVisits = spec.get("maxStepVisits");
        if (maxStepVisits != null) {
            if (!(maxStepVisits instanceof Integer) || (Integer) maxStepVisits < 0) {
                throw new FlowParseException(flowName, "spec.maxStepVisits", "Expected a non-negative integer");
            }
            builder.maxStepVisits((Integer) maxStepVisits);
        }
    }

    /**
     * Copy of a document tree with parse-time placeholders replaced.
     */
    @SuppressWarnings("unchecked")
    private <T> T resolveTemplates(String flowName, String path, T value) throws FlowParseException {
        if (value instanceof String) {
            try {
                return (T) templateResolver.resolve((String) value);
            } catch (TemplateResolver.TemplateResolutionException e) {
                throw new FlowParseException(flowName, path, e.getMessage(), e);
            }
        }
        if (value instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            // YAML keys may be numbers or booleans
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                String key = String.valueOf(entry.getKey());
                String childPath = path.isEmpty() ? key : path + "." + key;
                resolved.put(key, RUNTIME_TEMPLATE_FIELDS.contains(key)
                        ? entry.getValue()
                        : resolveTemplates(flowName, childPath, entry.getValue()));
            }
            return (T) resolved;
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            List<Object> items = (List<Object>) value;
            for (int i = 0; i < items.size(); i++) {
                resolved.add(resolveTemplates(flowName, path + "[" + i + "]", items.get(i)));
            }
            return (T) resolved;
        }
        return value;
    }
}
