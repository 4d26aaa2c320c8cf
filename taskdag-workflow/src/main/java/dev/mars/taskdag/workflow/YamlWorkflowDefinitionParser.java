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

package dev.mars.taskdag.workflow;

import dev.mars.taskdag.workflow.template.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow definitions and template catalogs using SnakeYAML.
 *
 * <p>A workflow document has the shape:</p>
 * <pre>
 * apiVersion: v1
 * kind: TaskWorkflow
 * metadata:
 *   id: ship-billing
 *   name: Ship billing
 * spec:
 *   moduleIds: [billing]
 *   nodes:
 *     - id: review
 *       taskType: feature-review
 *     - id: fix
 *       dependsOn: [review]
 *       retryPolicy: {maxRetries: 2, delayMs: 3000, backoffMultiplier: 2}
 * </pre>
 *
 * <p>A template catalog has a top-level {@code templates} list. Node keys that are not part of the
 * node model are kept as node attributes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    private static final Set<String> NODE_KEYS = Set.of("id", "label", "moduleId", "taskType", "prompt",
            "dependsOn", "parallelGroup", "retryPolicy", "conditionalNext", "attributes");

    private final Yaml yaml;
    private final WorkflowValidator validator = new WorkflowValidator();

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        Map<String, Object> data = load(yamlContent);

        Map<String, Object> metadata = getMapValue(data, "metadata", "metadata");
        if (metadata == null) {
            throw new WorkflowParseException(null, "metadata", "Required field 'metadata' is missing");
        }
        String id = requireString(metadata, "id", null, "metadata.id");
        String name = getStringValue(metadata, "name", id);

        // spec fields may also sit at the root level
        Map<String, Object> spec = data.containsKey("spec") ? getMapValue(data, "spec", "spec") : data;
        if (spec == null) {
            throw new WorkflowParseException(name, "spec", "Field 'spec' must be a mapping");
        }

        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id)
                .name(name)
                .description(getStringValue(metadata, "description", ""))
                .moduleIds(getStringList(spec, "moduleIds", name, "spec.moduleIds"))
                .nodes(parseNodes(getList(spec, "nodes", name, "spec.nodes"), name, "spec.nodes"))
                .createdAt(getInstant(metadata, "createdAt", name, "metadata.createdAt"))
                .updatedAt(getInstant(metadata, "updatedAt", name, "metadata.updatedAt"));

        Integer estimated = getInteger(spec, "estimatedMinutes", name, "spec.estimatedMinutes");
        if (estimated != null) {
            builder.estimatedMinutes(estimated);
        }

        WorkflowDefinition definition = builder.build();
        logger.debug("Parsed workflow '{}' with {} node(s)", definition.getId(), definition.getNodes().size());
        return definition;
    }

    @Override
    public List<WorkflowTemplate> parseTemplates(InputStream yamlStream) throws WorkflowParseException {
        Reader reader = new InputStreamReader(yamlStream, StandardCharsets.UTF_8);
        Object document;
        try {
            document = yaml.load(reader);
        } catch (YAMLException e) {
            throw yamlFailure(e);
        }
        return parseTemplateDocument(asDocument(document));
    }

    @Override
    public List<WorkflowTemplate> parseTemplatesFromString(String yamlContent) throws WorkflowParseException {
        return parseTemplateDocument(load(yamlContent));
    }

    @Override
    public List<ValidationError> validate(WorkflowDefinition definition) {
        return validator.validate(definition);
    }

    private List<WorkflowTemplate> parseTemplateDocument(Map<String, Object> data) throws WorkflowParseException {
        List<Object> entries = getList(data, "templates", null, "templates");
        if (entries == null) {
            throw new WorkflowParseException(null, "templates", "Required field 'templates' is missing");
        }

        List<WorkflowTemplate> templates = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String path = "templates[" + i + "]";
            Map<String, Object> entry = asMap(entries.get(i), null, path);
            templates.add(parseTemplate(entry, path));
        }
        logger.debug("Parsed {} workflow template(s)", templates.size());
        return templates;
    }

    private WorkflowTemplate parseTemplate(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", null, path + ".id");
        WorkflowTemplate.Builder builder = WorkflowTemplate.builder(id)
                .name(getStringValue(data, "name", id))
                .description(getStringValue(data, "description", ""))
                .icon(getStringValue(data, "icon", null))
                .nodes(parseNodes(getList(data, "nodes", id, path + ".nodes"), id, path + ".nodes"))
                .builtIn(getBooleanValue(data, "builtIn", false))
                .createdAt(getInstant(data, "createdAt", id, path + ".createdAt"));

        String scope = getStringValue(data, "moduleScope", null);
        if (scope != null) {
            try {
                builder.moduleScope(WorkflowTemplate.ModuleScope.fromValue(scope));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(id, -1, path + ".moduleScope", e.getMessage(), e);
            }
        }

        Integer minutes = getInteger(data, "estimatedMinutesPerModule", id, path + ".estimatedMinutesPerModule");
        if (minutes != null) {
            if (minutes < 0) {
                throw new WorkflowParseException(id, path + ".estimatedMinutesPerModule",
                        "Estimated minutes cannot be negative");
            }
            builder.estimatedMinutesPerModule(minutes);
        }

        Map<String, Object> defaults = getMapValue(data, "defaults", path + ".defaults");
        if (defaults != null) {
            Map<String, Object> retry = getMapValue(defaults, "retryPolicy", path + ".defaults.retryPolicy");
            if (retry != null) {
                builder.defaultRetryPolicy(parseRetryPolicy(retry, id, path + ".defaults.retryPolicy"));
            }
            builder.parallelExecution(getBooleanValue(defaults, "parallelExecution", false));
        }
        return builder.build();
    }

    private List<DagNode> parseNodes(List<Object> entries, String owner, String path) throws WorkflowParseException {
        if (entries == null) {
            return List.of();
        }
        List<DagNode> nodes = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String nodePath = path + "[" + i + "]";
            nodes.add(parseNode(asMap(entries.get(i), owner, nodePath), owner, nodePath));
        }
        return nodes;
    }

    private DagNode parseNode(Map<String, Object> data, String owner, String path) throws WorkflowParseException {
        String id = requireString(data, "id", owner, path + ".id");
        DagNode.Builder builder = DagNode.builder(id)
                .label(getStringValue(data, "label", null))
                .moduleId(getStringValue(data, "moduleId", null))
                .prompt(getStringValue(data, "prompt", ""))
                .dependsOn(getStringList(data, "dependsOn", owner, path + ".dependsOn"))
                .parallelGroup(getStringValue(data, "parallelGroup", null));

        String taskType = getStringValue(data, "taskType", null);
        if (taskType != null) {
            try {
                builder.taskType(TaskType.fromValue(taskType));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(owner, -1, path + ".taskType", e.getMessage(), e);
            }
        }

        Map<String, Object> retry = getMapValue(data, "retryPolicy", path + ".retryPolicy");
        if (retry != null) {
            builder.retryPolicy(parseRetryPolicy(retry, owner, path + ".retryPolicy"));
        }

        Map<String, Object> branch = getMapValue(data, "conditionalNext", path + ".conditionalNext");
        if (branch != null) {
            builder.conditionalNext(new ConditionalBranch(
                    getStringList(branch, "onSuccess", owner, path + ".conditionalNext.onSuccess"),
                    getStringList(branch, "onFailure", owner, path + ".conditionalNext.onFailure")));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!NODE_KEYS.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }
        Map<String, Object> declared = getMapValue(data, "attributes", path + ".attributes");
        if (declared != null) {
            attributes.putAll(declared);
        }
        builder.attributes(attributes);

        return builder.build();
    }

    private RetryPolicy parseRetryPolicy(Map<String, Object> data, String owner, String path)
            throws WorkflowParseException {
        Integer maxRetries = getInteger(data, "maxRetries", owner, path + ".maxRetries");
        Long delayMs = getLong(data, "delayMs", owner, path + ".delayMs");
        Number backoff = getNumber(data, "backoffMultiplier", owner, path + ".backoffMultiplier");
        try {
            return new RetryPolicy(
                    maxRetries != null ? maxRetries : 0,
                    delayMs != null ? delayMs : 0L,
                    backoff != null ? backoff.doubleValue() : 1.0);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(owner, -1, path, e.getMessage(), e);
        }
    }

    // Loading

    private Map<String, Object> load(String yamlContent) throws WorkflowParseException {
        if (yamlContent == null || yamlContent.isBlank()) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        try {
            return asDocument(yaml.load(yamlContent));
        } catch (YAMLException e) {
            throw yamlFailure(e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(Object document) throws WorkflowParseException {
        if (!(document instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content: expected a mapping at the document root");
        }
        return (Map<String, Object>) document;
    }

    private static WorkflowParseException yamlFailure(YAMLException e) {
        if (e instanceof MarkedYAMLException) {
            Mark mark = ((MarkedYAMLException) e).getProblemMark();
            if (mark != null) {
                return new WorkflowParseException(null, mark.getLine() + 1, null, "YAML parsing failed", e);
            }
        }
        return new WorkflowParseException("YAML parsing failed", e);
    }

    // Utility methods for safe type conversion

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static String requireString(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        String value = getStringValue(data, key, null);
        if (value == null || value.isBlank()) {
            throw new WorkflowParseException(owner, path, "Required field '" + key + "' is missing");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String owner, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(owner, path, "Expected a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> getMapValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        return value == null ? null : asMap(value, null, path);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getList(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(owner, path, "Expected a list");
        }
        return (List<Object>) value;
    }

    private static List<String> getStringList(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value instanceof String) {
            return List.of((String) value);
        }
        List<Object> items = getList(data, key, owner, path);
        if (items == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private static Number getNumber(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return (Number) value;
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(owner, -1, path, "Expected a number but got '" + value + "'", e);
        }
    }

    private static Integer getInteger(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        Long whole = getWholeNumber(data, key, owner, path, Integer.MIN_VALUE, Integer.MAX_VALUE);
        return whole != null ? whole.intValue() : null;
    }

    private static Long getLong(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        return getWholeNumber(data, key, owner, path, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /**
     * Reads a whole number in {@code [min, max]}. Fractions and out-of-range values are rejected
     * instead of being truncated or wrapped.
     */
    private static Long getWholeNumber(Map<String, Object> data, String key, String owner, String path,
                                       long min, long max) throws WorkflowParseException {
        Number number = getNumber(data, key, owner, path);
        if (number == null) {
            return null;
        }
        long whole;
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            whole = number.longValue();
        } else {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                throw new WorkflowParseException(owner, path, "Expected an integer but got '" + number + "'");
            }
            if (value < min || value > max) {
                throw new WorkflowParseException(owner, path,
                        "Value '" + number + "' is out of range [" + min + ", " + max + "]");
            }
            whole = (long) value;
        }
        if (whole < min || whole > max) {
            throw new WorkflowParseException(owner, path,
                    "Value '" + number + "' is out of range [" + min + ", " + max + "]");
        }
        return whole;
    }

    private static Instant getInstant(Map<String, Object> data, String key, String owner, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        try {
            return Instant.parse(value.toString().trim());
        } catch (DateTimeParseException e) {
            throw new WorkflowParseException(owner, -1, path, "Expected an ISO-8601 instant but got '" + value + "'", e);
        }
    }
}
