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

package dev.mars.taskdag.workflow.template;

import dev.mars.taskdag.workflow.WorkflowDefinitionParser;
import dev.mars.taskdag.workflow.WorkflowParseException;
import dev.mars.taskdag.workflow.YamlWorkflowDefinitionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Built-in templates loaded from the classpath, plus custom templates added at runtime.
 * Built-in templates cannot be replaced or removed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowTemplateCatalog {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowTemplateCatalog.class);

    public static final String BUILTIN_TEMPLATES_RESOURCE = "templates/builtin-workflow-templates.yaml";

    private final Map<String, WorkflowTemplate> builtIn = new LinkedHashMap<>();
    private final Map<String, WorkflowTemplate> custom = new LinkedHashMap<>();

    /**
     * Catalog backed by the bundled built-in templates.
     */
    public static WorkflowTemplateCatalog withBuiltIns() throws WorkflowParseException {
        return fromResource(BUILTIN_TEMPLATES_RESOURCE);
    }

    public static WorkflowTemplateCatalog fromResource(String resource) throws WorkflowParseException {
        ClassLoader loader = WorkflowTemplateCatalog.class.getClassLoader();
        try (InputStream input = loader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new WorkflowParseException("Template resource not found on classpath: " + resource);
            }
            List<WorkflowTemplate> templates = new YamlWorkflowDefinitionParser().parseTemplates(input);
            logger.info("Loaded {} built-in workflow template(s) from {}", templates.size(), resource);
            return new WorkflowTemplateCatalog(templates);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read template resource: " + resource, e);
        }
    }

    public static WorkflowTemplateCatalog empty() {
        return new WorkflowTemplateCatalog(List.of());
    }

    public WorkflowTemplateCatalog(List<WorkflowTemplate> builtInTemplates) {
        for (WorkflowTemplate template : builtInTemplates) {
            WorkflowTemplate marked = template.isBuiltIn() ? template : template.toBuilder().builtIn(true).build();
            if (builtIn.putIfAbsent(marked.getId(), marked) != null) {
                logger.warn("Duplicate built-in template id '{}' ignored", marked.getId());
            }
        }
    }

    /**
     * Built-in templates first, then custom ones, each in insertion order.
     */
    public synchronized List<WorkflowTemplate> getTemplates() {
        List<WorkflowTemplate> all = new ArrayList<>(builtIn.values());
        all.addAll(custom.values());
        return List.copyOf(all);
    }

    public synchronized Optional<WorkflowTemplate> findTemplate(String templateId) {
        WorkflowTemplate template = builtIn.get(templateId);
        return template != null ? Optional.of(template) : Optional.ofNullable(custom.get(templateId));
    }

    /**
     * Adds or replaces a custom template.
     *
     * @throws IllegalArgumentException if the id belongs to a built-in template
     */
    public synchronized void addCustomTemplate(WorkflowTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        if (builtIn.containsKey(template.getId())) {
            throw new IllegalArgumentException("Cannot replace built-in template: " + template.getId());
        }
        WorkflowTemplate stored = template.isBuiltIn() ? template.toBuilder().builtIn(false).build() : template;
        custom.put(stored.getId(), stored);
        logger.debug("Added custom template '{}'", stored.getId());
    }

    /**
     * @return true if a custom template with this id was removed
     */
    public synchronized boolean removeCustomTemplate(String templateId) {
        if (builtIn.containsKey(templateId)) {
            logger.warn("Refusing to remove built-in template '{}'", templateId);
            return false;
        }
        return custom.remove(templateId) != null;
    }

    /**
     * Loads custom templates from a template catalog document.
     */
    public void addCustomTemplates(InputStream yamlStream, WorkflowDefinitionParser parser)
            throws WorkflowParseException {
        for (WorkflowTemplate template : parser.parseTemplates(yamlStream)) {
            addCustomTemplate(template);
        }
    }
}
