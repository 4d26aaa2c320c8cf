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

import dev.mars.taskdag.core.exceptions.TaskDagException;

/**
 * Thrown when an execution snapshot cannot be written to or read from JSON.
 */
public class SnapshotCodecException extends TaskDagException {

    public SnapshotCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
