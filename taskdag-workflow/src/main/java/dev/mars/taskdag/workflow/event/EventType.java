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

package dev.mars.taskdag.workflow.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire names of the events an orchestrator emits.
 */
public enum EventType {

    NODE_READY("node:ready"),

    NODE_RETRY("node:retry"),

    NODE_SKIPPED("node:skipped"),

    WORKFLOW_PROGRESS("workflow:progress"),

    WORKFLOW_COMPLETED("workflow:completed"),

    WORKFLOW_FAILED("workflow:failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
