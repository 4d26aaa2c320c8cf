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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Conditional routing attached to a node: the ids to release once the node
 * completes successfully, and the ids to release once it fails for good.
 * Routed ids are released even when they do not list the node in {@code dependsOn}.
 */
public final class ConditionalBranch {

    private final List<String> onSuccess;
    private final List<String> onFailure;

    public ConditionalBranch(List<String> onSuccess, List<String> onFailure) {
        this.onSuccess = distinct(onSuccess);
        this.onFailure = distinct(onFailure);
    }

    public static ConditionalBranch onSuccess(String... nodeIds) {
        return new ConditionalBranch(List.of(nodeIds), List.of());
    }

    public static ConditionalBranch onFailure(String... nodeIds) {
        return new ConditionalBranch(List.of(), List.of(nodeIds));
    }

    public List<String> getOnSuccess() {
        return onSuccess;
    }

    public List<String> getOnFailure() {
        return onFailure;
    }

    /**
     * The ids released for the given outcome.
     */
    public List<String> targetsFor(boolean success) {
        return success ? onSuccess : onFailure;
    }

    /**
     * Every id this branch can release, success targets first.
     */
    public List<String> allTargets() {
        LinkedHashSet<String> all = new LinkedHashSet<>(onSuccess);
        all.addAll(onFailure);
        return List.copyOf(all);
    }

    public boolean isEmpty() {
        return onSuccess.isEmpty() && onFailure.isEmpty();
    }

    private static List<String> distinct(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            result.add(Objects.requireNonNull(id, "Routed node id cannot be null"));
        }
        return List.copyOf(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionalBranch that = (ConditionalBranch) o;
        return onSuccess.equals(that.onSuccess) && onFailure.equals(that.onFailure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(onSuccess, onFailure);
    }

    @Override
    public String toString() {
        return "ConditionalBranch{" +
               "onSuccess=" + onSuccess +
               ", onFailure=" + onFailure +
               '}';
    }
}
