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

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultException;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * File naming for one component inside a state root.
 * <pre>
 * state/
 *  ├─ &lt;id&gt;            // generation 0 (main)
 *  ├─ &lt;id&gt;.bak1       // generation 1
 *  ├─ &lt;id&gt;.bak2       // generation 2
 *  ├─ &lt;id&gt;.bak3       // generation 3
 *  ├─ &lt;id&gt;.tmp        // transient, only during a write
 *  └─ &lt;id&gt;.snap       // lightweight snapshot (unsigned)
 * </pre>
 */
public final class ComponentFiles {

    /** Number of backup generations kept behind main. */
    public static final int BACKUP_GENERATIONS = 3;

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private static final String TMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";
    private static final String SNAPSHOT_SUFFIX = ".snap";

    private final Path root;
    private final String id;

    public ComponentFiles(Path root, String id) {
        if (!isValidId(id)) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "Invalid component id: '" + id + "'");
        }
        this.root = root;
        this.id = id;
    }

    /**
     * Ids become file names, so they are restricted to letters, digits, '_', '-' and '.',
     * must not start with a separator, and must not end in a reserved suffix.
     */
    public static boolean isValidId(String id) {
        if (id == null || !VALID_ID.matcher(id).matches()) {
            return false;
        }
        return !id.endsWith(TMP_SUFFIX) && !id.endsWith(SNAPSHOT_SUFFIX) && !id.matches(".*\\.bak\\d+$");
    }

    public String id() {
        return id;
    }

    public Path root() {
        return root;
    }

    public Path main() {
        return root.resolve(id);
    }

    /** Path of generation {@code n}: 0 is main, 1..3 are backups. */
    public Path generation(int n) {
        if (n < 0 || n > BACKUP_GENERATIONS) {
            throw new IllegalArgumentException("Generation out of range: " + n);
        }
        return n == 0 ? main() : root.resolve(id + BACKUP_SUFFIX + n);
    }

    /** All generations, newest first. */
    public List<Path> chain() {
        return List.of(generation(0), generation(1), generation(2), generation(3));
    }

    public Path temp() {
        return tempFor(main());
    }

    public Path snapshot() {
        return root.resolve(id + SNAPSHOT_SUFFIX);
    }

    public Path snapshotTemp() {
        return tempFor(snapshot());
    }

    /** Temp path used while {@code target} is being replaced. */
    public static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName() + TMP_SUFFIX);
    }

    @Override
    public String toString() {
        return root.resolve(id).toString();
    }
}
