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
 * Opaque binary payloads (e.g. a replay buffer the host packs itself).
 * Migrations, if any, operate on the raw bytes.
 */
public final class BytesStateSerializer extends MigratingSerializer<byte[], byte[]> {

    public BytesStateSerializer(MigrationChain<byte[]> chain) {
        super(chain);
    }

    public BytesStateSerializer(int version) {
        this(MigrationChain.none(version));
    }

    @Override
    public String format() {
        return "bytes";
    }

    @Override
    protected byte[] read(byte[] payload) {
        return payload.clone();
    }

    @Override
    protected byte[] write(byte[] intermediate) {
        return intermediate.clone();
    }

    @Override
    protected byte[] toIntermediate(byte[] state) {
        return state;
    }

    @Override
    protected byte[] fromIntermediate(byte[] intermediate) {
        return intermediate;
    }
}
