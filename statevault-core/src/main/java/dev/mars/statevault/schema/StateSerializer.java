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

/**
 * Encodes a component's in-memory state to a versioned payload and back.
 * <p>
 * Implementations are pure: no I/O, no shared mutable state.
 *
 * @param <T> the component state type
 */
public interface StateSerializer<T> {

    /** Short name of the payload format, e.g. {@code json}. */
    String format();

    /** Schema version written by {@link #encode}. */
    int schemaVersion();

    /**
     * @throws dev.mars.statevault.StateVaultException with
     *         {@link dev.mars.statevault.ErrorCode#INVALID_ARGUMENT} if the state cannot be encoded
     */
    byte[] encode(T state);

    /**
     * Decodes a payload written at {@code version}, migrating it to {@link #schemaVersion()}.
     *
     * @throws dev.mars.statevault.StateVaultException with
     *         {@link dev.mars.statevault.ErrorCode#SCHEMA_ERROR} if no migration path exists, or
     *         {@link dev.mars.statevault.ErrorCode#INTEGRITY_ERROR} if the payload is malformed
     */
    Decoded<T> decode(byte[] payload, int version);

    /**
     * A decoded state and how it got to the current schema.
     *
     * @param state        decoded state
     * @param fromVersion  version stored in the blob
     * @param stepsApplied migration steps run
     */
    record Decoded<T>(T state, int fromVersion, int stepsApplied) {
        public boolean migrated() {
            return stepsApplied > 0;
        }
    }
}
