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

/**
 * Free space on the state volume and the reserve that must stay untouched.
 *
 * @param freeBytes    usable bytes on the state volume
 * @param reserveBytes bytes that must remain free after saving
 */
public record SpaceBudget(long freeBytes, long reserveBytes) {

    public SpaceBudget {
        if (reserveBytes < 0) {
            throw new IllegalArgumentException("reserveBytes must be >= 0: " + reserveBytes);
        }
    }

    /** A budget that admits everything; used when free space cannot be measured. */
    public static SpaceBudget unlimited(long reserveBytes) {
        return new SpaceBudget(Long.MAX_VALUE, reserveBytes);
    }

    /** Whether free space covers the reserve at all. */
    public boolean coversReserve() {
        return freeBytes >= reserveBytes;
    }
}
