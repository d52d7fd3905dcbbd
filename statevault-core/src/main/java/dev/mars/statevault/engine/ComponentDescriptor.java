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

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultException;
import dev.mars.statevault.schema.StateSerializer;
import dev.mars.statevault.storage.ComponentFiles;

import java.util.Objects;

/**
 * Static registration of one independently persisted unit of state.
 *
 * @param id                 stable id, also the main file name
 * @param priority           save priority tier
 * @param cadence            checkpoint cadence
 * @param serializer         payload encoding and schema migrations
 * @param estimatedSizeBytes declared payload size used by the Space Guard until a real size is known
 * @param <T> the component state type
 */
public record ComponentDescriptor<T>(
        String id,
        Priority priority,
        CadencePolicy cadence,
        StateSerializer<T> serializer,
        long estimatedSizeBytes
) {

    public ComponentDescriptor {
        if (!ComponentFiles.isValidId(id)) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "Invalid component id: '" + id + "'");
        }
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(cadence, "cadence");
        Objects.requireNonNull(serializer, "serializer");
        if (estimatedSizeBytes < 0) {
            throw new IllegalArgumentException("estimatedSizeBytes must be >= 0: " + estimatedSizeBytes);
        }
    }

    public int schemaVersion() {
        return serializer.schemaVersion();
    }

    public String format() {
        return serializer.format();
    }

    public static <T> Builder<T> builder(String id, StateSerializer<T> serializer) {
        return new Builder<>(id, serializer);
    }

    public static final class Builder<T> {
        private final String id;
        private final StateSerializer<T> serializer;
        private Priority priority = Priority.NORMAL;
        private CadencePolicy cadence = CadencePolicy.everyCheckpoint();
        private long estimatedSizeBytes;

        private Builder(String id, StateSerializer<T> serializer) {
            this.id = id;
            this.serializer = serializer;
        }

        public Builder<T> priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder<T> cadence(CadencePolicy cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder<T> estimatedSizeBytes(long estimatedSizeBytes) {
            this.estimatedSizeBytes = estimatedSizeBytes;
            return this;
        }

        public ComponentDescriptor<T> build() {
            return new ComponentDescriptor<>(id, priority, cadence, serializer, estimatedSizeBytes);
        }
    }
}
