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

/**
 * Base for serializers that migrate through an intermediate form.
 * <p>
 * Decoding runs {@code bytes -> D -> migrate(D) -> T}; encoding runs
 * {@code T -> D -> bytes}. Subclasses supply the four conversions and the
 * migration chain defines the schema version.
 *
 * @param <T> the component state type
 * @param <D> the intermediate form migrations operate on
 */
public abstract class MigratingSerializer<T, D> implements StateSerializer<T> {

    private final MigrationChain<D> chain;

    protected MigratingSerializer(MigrationChain<D> chain) {
        this.chain = chain;
    }

    public MigrationChain<D> chain() {
        return chain;
    }

    @Override
    public int schemaVersion() {
        return chain.currentVersion();
    }

    @Override
    public byte[] encode(T state) {
        if (state == null) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "Cannot encode null state");
        }
        try {
            return write(toIntermediate(state));
        } catch (StateVaultException e) {
            throw e;
        } catch (Exception e) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT,
                    "Failed to encode " + format() + " state: " + e.getMessage(), e);
        }
    }

    @Override
    public Decoded<T> decode(byte[] payload, int version) {
        D decoded;
        try {
            decoded = read(payload);
        } catch (Exception e) {
            throw new StateVaultException(ErrorCode.INTEGRITY_ERROR,
                    "Malformed " + format() + " payload: " + e.getMessage(), e);
        }

        MigrationChain.Migrated<D> migrated = chain.migrate(decoded, version);

        try {
            return new Decoded<>(fromIntermediate(migrated.value()), version, migrated.stepsApplied());
        } catch (Exception e) {
            // A migrated tree that does not bind means the chain produced the wrong shape
            throw new StateVaultException(ErrorCode.SCHEMA_ERROR,
                    "Payload v" + version + " does not bind after migration to v" + schemaVersion() +
                            ": " + e.getMessage(), e);
        }
    }

    protected abstract D read(byte[] payload) throws Exception;

    protected abstract byte[] write(D intermediate) throws Exception;

    protected abstract D toIntermediate(T state) throws Exception;

    protected abstract T fromIntermediate(D intermediate) throws Exception;
}
