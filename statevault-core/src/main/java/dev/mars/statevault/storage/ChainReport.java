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
package dev.mars.statevault.storage;

import java.util.List;

/**
 * Read-only integrity report of a component's generation chain.
 *
 * @param componentId component id
 * @param generations one entry per slot, main first
 */
public record ChainReport(String componentId, List<GenerationStatus> generations) {

    public ChainReport {
        generations = List.copyOf(generations);
    }

    /** Number of slots holding a blob that verifies. */
    public long validCount() {
        return generations.stream().filter(GenerationStatus::valid).count();
    }

    /** Slots that exist on disk but fail verification. */
    public List<GenerationStatus> corrupt() {
        return generations.stream().filter(g -> g.exists() && !g.valid()).toList();
    }

    /**
     * State of one slot.
     *
     * @param generation          0..3
     * @param exists              whether the file is present
     * @param sizeBytes           file size, 0 when absent
     * @param valid               whether the blob parses and its signature verifies
     * @param schemaVersion       stored schema version, -1 unless valid
     * @param savedAtEpochSeconds stored save time, 0 unless valid
     */
    public record GenerationStatus(int generation, boolean exists, long sizeBytes, boolean valid,
                                   int schemaVersion, long savedAtEpochSeconds) {
    }
}
