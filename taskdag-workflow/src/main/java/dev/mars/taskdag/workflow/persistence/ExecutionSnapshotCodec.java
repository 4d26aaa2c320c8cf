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

package dev.mars.taskdag.workflow.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.taskdag.workflow.WorkflowExecution;

import java.util.List;
import java.util.Objects;

/**
 * JSON codec for {@link WorkflowExecution} snapshots, used by whatever persists executions
 * between host restarts. Instants are written as ISO-8601 strings; unknown properties are
 * ignored on read so older readers accept newer snapshots.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExecutionSnapshotCodec {

    private static final TypeReference<List<WorkflowExecution>> EXECUTION_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ExecutionSnapshotCodec() {
        this(defaultObjectMapper());
    }

    public ExecutionSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public String toJson(WorkflowExecution execution) throws SnapshotCodecException {
        try {
            return objectMapper.writeValueAsString(execution);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Failed to serialize execution " + execution.getId(), e);
        }
    }

    public WorkflowExecution fromJson(String json) throws SnapshotCodecException {
        try {
            return objectMapper.readValue(json, WorkflowExecution.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Failed to deserialize execution snapshot", e);
        }
    }

    public String toJson(List<WorkflowExecution> executions) throws SnapshotCodecException {
        try {
            return objectMapper.writerFor(EXECUTION_LIST).writeValueAsString(executions);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Failed to serialize " + executions.size() + " execution(s)", e);
        }
    }

    public List<WorkflowExecution> listFromJson(String json) throws SnapshotCodecException {
        try {
            return objectMapper.readValue(json, EXECUTION_LIST);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Failed to deserialize execution snapshots", e);
        }
    }
}
