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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Shifts a component's backup chain one slot down before a new main is committed.
 * <p>
 * Renames run oldest first ({@code bak2 -> bak3}, {@code bak1 -> bak2},
 * {@code main -> bak1}), each one atomic on its own. The shift stops at the first
 * empty slot, so a gap left by an interrupted rotation is filled instead of
 * pushing an older generation off the end of the chain.
 * <p>
 * When main is already absent (a crash after the shift but before the commit)
 * nothing is renamed: the main slot is free and every backup stays where it is.
 * <p>
 * An interruption mid-chain can leave one slot empty or one generation out of
 * position by one; no blob is ever rewritten, so none can be corrupted.
 */
public final class BackupRotator {

    private static final Logger LOG = LoggerFactory.getLogger(BackupRotator.class);

    private final boolean syncEnabled;

    public BackupRotator(boolean syncEnabled) {
        this.syncEnabled = syncEnabled;
    }

    /**
     * Rotates the chain so that the main slot is free for the next commit.
     *
     * @return the number of renames performed
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} if a rename fails
     */
    public int rotateBeforeWrite(ComponentFiles files) {
        if (!Files.exists(files.main())) {
            LOG.debug("Main slot for {} is already free, nothing to rotate", files.id());
            return 0;
        }
        int lastSlot = ComponentFiles.BACKUP_GENERATIONS;
        int firstGap = lastSlot;
        for (int gen = 1; gen <= lastSlot; gen++) {
            if (!Files.exists(files.generation(gen))) {
                firstGap = gen;
                break;
            }
        }

        int renames = 0;
        for (int gen = firstGap; gen >= 1; gen--) {
            Path source = files.generation(gen - 1);
            Path dest = files.generation(gen);
            if (!Files.exists(source)) {
                continue;
            }
            move(source, dest);
            renames++;
        }

        if (renames > 0 && syncEnabled) {
            AtomicWriter.syncDirectory(files.root().toAbsolutePath());
        }
        LOG.debug("Rotated backup chain for {}: {} renames (first free slot {})", files.id(), renames, firstGap);
        return renames;
    }

    /**
     * Undoes a rotation after the commit that followed it failed: generation 1
     * moves back into main and each older generation moves up one slot, so the
     * chain is contiguous again with main holding its pre-save content.
     *
     * @return true if main was restored
     */
    public boolean restoreMain(ComponentFiles files) {
        Path main = files.main();
        Path gen1 = files.generation(1);
        if (Files.exists(main) || !Files.exists(gen1)) {
            return false;
        }
        try {
            move(gen1, main);
            for (int gen = 2; gen <= ComponentFiles.BACKUP_GENERATIONS; gen++) {
                Path source = files.generation(gen);
                if (Files.exists(source)) {
                    move(source, files.generation(gen - 1));
                }
            }
            if (syncEnabled) {
                AtomicWriter.syncDirectory(files.root().toAbsolutePath());
            }
            LOG.warn("Restored backup chain of {} after failed commit", files.id());
            return true;
        } catch (StateVaultException e) {
            LOG.error("Could not fully restore backup chain of {}; recovery will fall back to the backups",
                    files.id(), e);
            return Files.exists(main);
        }
    }

    private void move(Path source, Path dest) {
        try {
            Files.move(source, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", source, dest);
        } catch (IOException e) {
            LOG.error("Failed to rename {} -> {}: {}", source, dest, e.getMessage(), e);
            throw new StateVaultException(ErrorCode.IO_ERROR,
                    "Failed to rename " + source + " -> " + dest, e);
        }
    }
}
