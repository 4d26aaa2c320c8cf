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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of work a node asks the external runner to perform.
 * The orchestrator never interprets it; it is carried on {@code node:ready} so the runner
 * can build the right task for the assistant session.
 */
public enum TaskType {

    CHECKLIST("checklist"),

    QUICK_ACTION("quick-action"),

    ASK_ASSISTANT("ask-assistant"),

    FEATURE_FIX("feature-fix"),

    FEATURE_REVIEW("feature-review"),

    MODULE_SCAN("module-scan");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value ({@code feature-review}) or constant name ({@code FEATURE_REVIEW}).
     *
     * @throws IllegalArgumentException if the value matches no task type
     */
    @JsonCreator
    public static TaskType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + value));
    }
}
