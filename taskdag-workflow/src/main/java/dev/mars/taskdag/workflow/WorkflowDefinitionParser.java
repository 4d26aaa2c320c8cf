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

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException;

    WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException;

    /**
     * Reads a template catalog document.
     *
     * @param yamlStream the document; not closed by this method
     */
    List<WorkflowTemplate> parseTemplates(InputStream yamlStream) throws WorkflowParseException;

    List<WorkflowTemplate> parseTemplatesFromString(String yamlContent) throws WorkflowParseException;

    /**
     * Structural validation of a parsed definition; see {@link WorkflowValidator}.
     */
    List<ValidationError> validate(WorkflowDefinition definition);
}
