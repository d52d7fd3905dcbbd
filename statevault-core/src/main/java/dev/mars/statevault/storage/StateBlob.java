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

import java.util.Arrays;

/**
 * The on-disk atomic unit: one signed, versioned payload.
 *
 * @param schemaVersion       schema version the payload was encoded with
 * @param savedAtEpochSeconds wall-clock save time
 * @param payload             encoded component state
 */
public record StateBlob(int schemaVersion, long savedAtEpochSeconds, byte[] payload) {

    public StateBlob {
        if (schemaVersion < 0) {
            throw new IllegalArgumentException("schemaVersion must be >= 0: " + schemaVersion);
        }
        payload = payload == null ? new byte[0] : payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateBlob other)) {
            return false;
        }
        return schemaVersion == other.schemaVersion
                && savedAtEpochSeconds == other.savedAtEpochSeconds
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(schemaVersion);
        result = 31 * result + Long.hashCode(savedAtEpochSeconds);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "StateBlob{schemaVersion=" + schemaVersion +
                ", savedAt=" + savedAtEpochSeconds +
                ", payloadLength=" + payload.length + '}';
    }
}
