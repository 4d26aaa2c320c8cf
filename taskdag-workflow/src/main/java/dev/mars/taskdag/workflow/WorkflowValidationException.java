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

import dev.mars.taskdag.core.exceptions.TaskDagException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow definition fails validation. Raised before any execution begins,
 * never in the middle of a run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowValidationException extends TaskDagException {

    private final String workflowId;
    private final List<ValidationError> errors;

    public WorkflowValidationException(String workflowId, List<ValidationError> errors) {
        super(formatMessage(workflowId, errors));
        this.workflowId = workflowId;
        this.errors = List.copyOf(errors);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String formatMessage(String workflowId, List<ValidationError> errors) {
        return "Workflow '" + workflowId + "' is invalid: " + errors.stream()
                .map(ValidationError::getMessage)
                .collect(Collectors.joining("; "));
    }
}
