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

import dev.mars.statevault.ErrorCode;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of loading one component.
 *
 * @param found               whether any generation verified and decoded
 * @param generationUsed      0 for main, 1..3 for a backup, -1 when nothing was found
 * @param migrated            whether migration steps ran on the recovered payload
 * @param state               recovered state, empty when not found
 * @param fromVersion         schema version stored in the recovered blob (-1 when not found)
 * @param savedAtEpochSeconds save time of the recovered blob (0 when not found)
 * @param failure             why nothing was recovered; empty on success or when no file ever existed
 * @param attempts            per-generation outcomes, in the order they were tried
 * @param <T> the component state type
 */
public record RecoveryResult<T>(
        boolean found,
        int generationUsed,
        boolean migrated,
        Optional<T> state,
        int fromVersion,
        long savedAtEpochSeconds,
        Optional<ErrorCode> failure,
        List<GenerationAttempt> attempts
) {

    public RecoveryResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        state = state == null ? Optional.empty() : state;
        failure = failure == null ? Optional.empty() : failure;
    }

    public static <T> RecoveryResult<T> recovered(int generation, T state, int fromVersion, boolean migrated,
                                           long savedAt, List<GenerationAttempt> attempts) {
        return new RecoveryResult<>(true, generation, migrated, Optional.of(state), fromVersion, savedAt,
                Optional.empty(), attempts);
    }

    public static <T> RecoveryResult<T> notFound(ErrorCode failure, List<GenerationAttempt> attempts) {
        return new RecoveryResult<>(false, -1, false, Optional.empty(), -1, 0L,
                Optional.ofNullable(failure), attempts);
    }

    /** True when the state came from a backup because newer generations were unusable. */
    public boolean recoveredFromBackup() {
        return found && generationUsed > 0;
    }

    /** True when nothing was recovered even though at least one generation existed. */
    public boolean lost() {
        return !found && failure.isPresent();
    }

    /**
     * Outcome of trying one generation.
     *
     * @param generation 0..3
     * @param outcome    what happened
     * @param detail     human-readable reason
     */
    public record GenerationAttempt(int generation, Outcome outcome, String detail) {
    }

    public enum Outcome {
        MISSING,
        UNREADABLE,
        INTEGRITY_FAILED,
        MALFORMED,
        SCHEMA_FAILED,
        RECOVERED
    }
}
