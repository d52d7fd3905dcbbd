/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.statevault.engine;

import java.util.List;

/**
 * Result of a checkpoint or shutdown pass.
 *
 * @param outcomes   one entry per component that was due, in save order
 * @param spaceError true when free space could not cover the reserve
 */
public record CheckpointReport(List<SaveOutcome> outcomes, boolean spaceError) {

    public CheckpointReport {
        outcomes = List.copyOf(outcomes);
    }

    public static CheckpointReport empty() {
        return new CheckpointReport(List.of(), false);
    }

    public List<String> savedIds() {
        return idsWith(SaveOutcome.Status.SAVED);
    }

    public List<String> skippedIds() {
        return idsWith(SaveOutcome.Status.SKIPPED);
    }

    public List<String> failedIds() {
        return idsWith(SaveOutcome.Status.FAILED);
    }

    public boolean allSaved() {
        return outcomes.stream().allMatch(SaveOutcome::saved);
    }

    private List<String> idsWith(SaveOutcome.Status status) {
        return outcomes.stream()
                .filter(o -> o.status() == status)
                .map(SaveOutcome::componentId)
                .toList();
    }
}
