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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Write-verify-rename for a single file.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Write the bytes to {@code <path>.tmp}, fsync and close</li>
 *   <li>Re-open the temp file, read it back and verify it. On failure the temp
 *       file is deleted and {@link ErrorCode#SELF_CHECK_FAILED} is raised</li>
 *   <li>Atomically rename the temp file over {@code <path>}, then fsync the directory</li>
 * </ol>
 * Steps 1-2 are {@link #prepare}, step 3 is {@link #commit}. Until commit's rename
 * happens the target keeps its previous content byte for byte; an interruption
 * leaves at most a stale temp file behind.
 */
public final class AtomicWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicWriter.class);

    private final BlobCodec codec;
    private final boolean syncEnabled;

    public AtomicWriter(BlobCodec codec, boolean syncEnabled) {
        this.codec = codec;
        this.syncEnabled = syncEnabled;
        if (!syncEnabled) {
            LOG.warn("AtomicWriter created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * A temp file that has been written and verified but not yet renamed into place.
     *
     * @param target final path
     * @param temp   verified temp file
     * @param size   bytes written
     */
    public record PreparedWrite(Path target, Path temp, long size) {
    }

    /**
     * Writes and commits a signed blob in one call.
     *
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} or {@link ErrorCode#SELF_CHECK_FAILED};
     *                             the target is untouched in either case
     */
    public void write(Path target, byte[] blobBytes) {
        commit(prepare(target, blobBytes));
    }

    /**
     * Steps 1-2 for a signed blob: the temp file must decode and verify under this
     * writer's signing key.
     */
    public PreparedWrite prepare(Path target, byte[] blobBytes) {
        return prepare(target, blobBytes, written -> codec.decode(written).isPresent());
    }

    /**
     * Steps 1-2 with a caller-supplied check applied to the bytes read back.
     */
    public PreparedWrite prepare(Path target, byte[] bytes, Predicate<byte[]> check) {
        Path tmpPath = ComponentFiles.tempFor(target);
        try {
            LOG.trace("Writing {} bytes to {}", bytes.length, tmpPath);
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                }
            }

            byte[] readBack = Files.readAllBytes(tmpPath);
            if (!Arrays.equals(readBack, bytes) || !check.test(readBack)) {
                LOG.error("Self-check failed for {}: wrote {} bytes, read back {} bytes",
                        tmpPath, bytes.length, readBack.length);
                deleteQuietly(tmpPath);
                throw new StateVaultException(ErrorCode.SELF_CHECK_FAILED,
                        "Temp file did not verify after write: " + tmpPath);
            }

            return new PreparedWrite(target, tmpPath, bytes.length);
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", tmpPath, e.getMessage(), e);
            deleteQuietly(tmpPath);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Failed to write " + tmpPath, e);
        }
    }

    /**
     * Step 3: atomic rename of the verified temp file over the target.
     */
    public void commit(PreparedWrite prepared) {
        try {
            Files.move(prepared.temp(), prepared.target(),
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", prepared.temp(), prepared.target());
        } catch (IOException e) {
            LOG.error("Failed to rename {} -> {}: {}", prepared.temp(), prepared.target(), e.getMessage(), e);
            deleteQuietly(prepared.temp());
            throw new StateVaultException(ErrorCode.IO_ERROR,
                    "Failed to rename " + prepared.temp() + " -> " + prepared.target(), e);
        }

        if (syncEnabled) {
            syncDirectory(prepared.target().toAbsolutePath().getParent());
        }
    }

    /**
     * Discards a prepared write without touching the target.
     */
    public void abort(PreparedWrite prepared) {
        deleteQuietly(prepared.temp());
    }

    /**
     * Fsyncs a directory so that renames inside it are durable.
     * <p>
     * On Windows this is skipped; on Linux (ext4/xfs) it is required for durability.
     */
    static void syncDirectory(Path dir) {
        if (dir == null) {
            return;
        }
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some filesystems refuse directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    static void deleteQuietly(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                LOG.debug("Deleted temp file {}", path);
            }
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
