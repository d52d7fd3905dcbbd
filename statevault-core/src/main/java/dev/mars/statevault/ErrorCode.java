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
package dev.mars.statevault;

/**
 * Failure categories for state persistence.
 * <p>
 * Each code carries whether the condition is recoverable by retrying on the next
 * checkpoint cycle. Non-recoverable codes leave the affected component on a fresh
 * default state, but never stop the host.
 */
public enum ErrorCode {

    /** Open, write, fsync or rename failure. Previous content is intact; retried next cycle. */
    IO_ERROR("SV-100", "I/O failure", true),

    /** The temp file did not verify after being written back. Target untouched. */
    SELF_CHECK_FAILED("SV-101", "Write self-check failed", true),

    /** Signature mismatch on a stored generation. */
    INTEGRITY_ERROR("SV-200", "Signature mismatch", true),

    /** Missing migration step, or a blob newer than the registered schema. */
    SCHEMA_ERROR("SV-300", "Schema migration failure", false),

    /** Free space cannot cover the reserve. */
    SPACE_ERROR("SV-400", "Insufficient space budget", true),

    /** Every generation of a component was unusable. */
    UNRECOVERABLE("SV-500", "Backup chain exhausted", false),

    INVALID_ARGUMENT("SV-900", "Invalid argument", false),
    NOT_REGISTERED("SV-901", "Component not registered", false);

    private final String code;
    private final String description;
    private final boolean recoverable;

    ErrorCode(String code, String description, boolean recoverable) {
        this.code = code;
        this.description = description;
        this.recoverable = recoverable;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /** Whether the condition clears by itself on a later checkpoint. */
    public boolean recoverable() {
        return recoverable;
    }
}
