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

import java.time.Duration;
import java.time.Instant;

/**
 * When a dirty component is due for a full save during {@link PersistenceCoordinator#checkpoint()}.
 * <p>
 * Triggers combine with OR: {@code everyMutations(10).orEvery(Duration.ofMinutes(60))}
 * saves after ten mutations or an hour, whichever comes first. Every policy is
 * also saved by {@link PersistenceCoordinator#shutdown()}.
 *
 * @param mutationThreshold save once this many mutations accumulated (0 = off)
 * @param interval          save once this much time passed since the last save (null = off)
 * @param onEveryCheckpoint save on every checkpoint while dirty
 */
public record CadencePolicy(int mutationThreshold, Duration interval, boolean onEveryCheckpoint) {

    public CadencePolicy {
        if (mutationThreshold < 0) {
            throw new IllegalArgumentException("mutationThreshold must be >= 0: " + mutationThreshold);
        }
        if (interval != null && (interval.isNegative() || interval.isZero())) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public static CadencePolicy everyCheckpoint() {
        return new CadencePolicy(0, null, true);
    }

    public static CadencePolicy everyMutations(int mutations) {
        if (mutations <= 0) {
            throw new IllegalArgumentException("mutations must be > 0: " + mutations);
        }
        return new CadencePolicy(mutations, null, false);
    }

    public static CadencePolicy every(Duration interval) {
        return new CadencePolicy(0, interval, false);
    }

    /** Saved only by shutdown or an explicit save. */
    public static CadencePolicy shutdownOnly() {
        return new CadencePolicy(0, null, false);
    }

    public CadencePolicy orEvery(Duration interval) {
        return new CadencePolicy(mutationThreshold, interval, onEveryCheckpoint);
    }

    public CadencePolicy orEveryMutations(int mutations) {
        return new CadencePolicy(mutations, interval, onEveryCheckpoint);
    }

    /**
     * @param mutationsSinceSave host mutations since the last successful save
     * @param lastSaveAt         time of the last successful save, null if never saved
     * @param now                current time
     */
    public boolean isDue(long mutationsSinceSave, Instant lastSaveAt, Instant now) {
        if (onEveryCheckpoint) {
            return true;
        }
        if (mutationThreshold > 0 && mutationsSinceSave >= mutationThreshold) {
            return true;
        }
        if (interval != null) {
            return lastSaveAt == null || !Duration.between(lastSaveAt, now).minus(interval).isNegative();
        }
        return false;
    }
}
