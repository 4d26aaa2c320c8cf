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

/**
 * Thrown when a completion or running report names a node that is not part of the workflow.
 */
public class UnknownNodeException extends TaskDagException {

    private final String executionId;
    private final String nodeId;

    public UnknownNodeException(String executionId, String nodeId) {
        super("Execution '" + executionId + "' has no node '" + nodeId + "'");
        this.executionId = executionId;
        this.nodeId = nodeId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
