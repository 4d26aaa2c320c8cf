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

import java.util.List;
import java.util.Objects;

/**
 * A single structural problem found in a workflow definition.
 */
public final class ValidationError {

    public enum Kind {
        DUPLICATE_NODE_ID,
        UNKNOWN_REFERENCE,
        CYCLE
    }

    private final Kind kind;
    private final List<String> nodeIds;
    private final String fieldPath;
    private final String message;

    public ValidationError(Kind kind, List<String> nodeIds, String fieldPath, String message) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.nodeIds = List.copyOf(nodeIds);
        this.fieldPath = fieldPath;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending node ids. For a cycle these are in path order.
     */
    public List<String> getNodeIds() {
        return nodeIds;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return kind == that.kind &&
               nodeIds.equals(that.nodeIds) &&
               Objects.equals(fieldPath, that.fieldPath) &&
               message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, nodeIds, fieldPath, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name());

        if (fieldPath != null) {
            sb.append(" [").append(fieldPath).append("]");
        }

        sb.append(": ").append(message);

        return sb.toString();
    }
}
