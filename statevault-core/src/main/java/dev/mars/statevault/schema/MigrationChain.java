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
package dev.mars.statevault.schema;

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordered chain of {@link Migration} steps leading up to the current schema version.
 * <p>
 * A step is registered under the version it migrates <i>from</i>. Loading a payload
 * written at version {@code v} applies steps {@code v, v+1, ..., current-1} in order;
 * if any of them is missing the load fails with {@link ErrorCode#SCHEMA_ERROR}.
 * A payload already at the current version passes through with zero steps.
 *
 * <pre>{@code
 * MigrationChain<JsonNode> chain = MigrationChain.<JsonNode>builder(2)
 *     .step(0, node -> ((ObjectNode) node).put("epsilon", 0.1))
 *     .step(1, node -> recomputeDerived(node))
 *     .build();
 * }</pre>
 *
 * @param <D> the decoded intermediate form
 */
public final class MigrationChain<D> {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationChain.class);

    private final int currentVersion;
    private final Map<Integer, Migration<D>> steps;

    private MigrationChain(int currentVersion, Map<Integer, Migration<D>> steps) {
        this.currentVersion = currentVersion;
        this.steps = Collections.unmodifiableMap(new TreeMap<>(steps));
    }

    /** A chain with no steps; only payloads at {@code currentVersion} load. */
    public static <D> MigrationChain<D> none(int currentVersion) {
        return MigrationChain.<D>builder(currentVersion).build();
    }

    public static <D> Builder<D> builder(int currentVersion) {
        return new Builder<>(currentVersion);
    }

    public int currentVersion() {
        return currentVersion;
    }

    /** Number of registered steps. */
    public int size() {
        return steps.size();
    }

    /** Whether every version in {@code [0, currentVersion)} has a step. */
    public boolean isTotal() {
        return steps.size() == currentVersion;
    }

    /**
     * Migrates {@code decoded} from {@code fromVersion} to the current version.
     *
     * @throws StateVaultException with {@link ErrorCode#SCHEMA_ERROR} if the payload is
     *                             newer than the current version, a step is missing or a
     *                             step fails
     */
    public Migrated<D> migrate(D decoded, int fromVersion) {
        if (fromVersion > currentVersion) {
            throw new StateVaultException(ErrorCode.SCHEMA_ERROR,
                    "Payload schema version " + fromVersion + " is newer than supported version " + currentVersion);
        }
        if (fromVersion < 0) {
            throw new StateVaultException(ErrorCode.SCHEMA_ERROR, "Negative schema version: " + fromVersion);
        }

        D value = decoded;
        for (int version = fromVersion; version < currentVersion; version++) {
            Migration<D> step = steps.get(version);
            if (step == null) {
                throw new StateVaultException(ErrorCode.SCHEMA_ERROR,
                        "No migration step from version " + version + " to " + (version + 1));
            }
            try {
                value = step.apply(value);
            } catch (StateVaultException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Migration v{} -> v{} failed: {}", version, version + 1, e.toString());
                throw new StateVaultException(ErrorCode.SCHEMA_ERROR,
                        "Migration step from version " + version + " to " + (version + 1) + " failed: " + e, e);
            }
            LOG.trace("Applied migration v{} -> v{}", version, version + 1);
        }

        int applied = currentVersion - fromVersion;
        if (applied > 0) {
            LOG.info("Migrated payload from v{} to v{} ({} steps)", fromVersion, currentVersion, applied);
        }
        return new Migrated<>(value, fromVersion, currentVersion, applied);
    }

    /**
     * Result of {@link #migrate}.
     *
     * @param value        migrated value
     * @param fromVersion  version the payload was written with
     * @param toVersion    current version
     * @param stepsApplied number of steps run (0 when already current)
     */
    public record Migrated<D>(D value, int fromVersion, int toVersion, int stepsApplied) {
        public boolean migrated() {
            return stepsApplied > 0;
        }
    }

    public static final class Builder<D> {
        private final int currentVersion;
        private final Map<Integer, Migration<D>> steps = new TreeMap<>();

        private Builder(int currentVersion) {
            if (currentVersion < 0) {
                throw new IllegalArgumentException("currentVersion must be >= 0: " + currentVersion);
            }
            this.currentVersion = currentVersion;
        }

        /** Registers the step migrating {@code fromVersion} to {@code fromVersion + 1}. */
        public Builder<D> step(int fromVersion, Migration<D> migration) {
            if (fromVersion < 0 || fromVersion >= currentVersion) {
                throw new IllegalArgumentException("Step from v" + fromVersion +
                        " is outside [0, " + currentVersion + ")");
            }
            if (steps.containsKey(fromVersion)) {
                throw new IllegalArgumentException("Duplicate migration step from v" + fromVersion);
            }
            steps.put(fromVersion, migration);
            return this;
        }

        public MigrationChain<D> build() {
            return new MigrationChain<>(currentVersion, steps);
        }
    }
}
