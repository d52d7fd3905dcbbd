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

import java.util.Optional;

/**
 * Result of saving one component. Failures are reported here, never thrown.
 *
 * @param componentId  component id
 * @param status       what happened
 * @param error        failure category for SKIPPED and FAILED
 * @param bytesWritten blob size on SAVED, otherwise 0
 * @param detail       human-readable reason
 */
public record SaveOutcome(String componentId, Status status, Optional<ErrorCode> error,
                          long bytesWritten, String detail) {

    public enum Status {
        SAVED,
        /** Deferred by the Space Guard; the component stays dirty. */
        SKIPPED,
        /** Write failed; previous main is intact and the component stays dirty. */
        FAILED
    }

    public SaveOutcome {
        error = error == null ? Optional.empty() : error;
    }

    static SaveOutcome saved(String id, long bytes) {
        return new SaveOutcome(id, Status.SAVED, Optional.empty(), bytes, "saved");
    }

    static SaveOutcome skipped(String id, String detail) {
        return new SaveOutcome(id, Status.SKIPPED, Optional.of(ErrorCode.SPACE_ERROR), 0L, detail);
    }

    static SaveOutcome failed(String id, ErrorCode code, String detail) {
        return new SaveOutcome(id, Status.FAILED, Optional.of(code), 0L, detail);
    }

    public boolean saved() {
        return status == Status.SAVED;
    }
}
