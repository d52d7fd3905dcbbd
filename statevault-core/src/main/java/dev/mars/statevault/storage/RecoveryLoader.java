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
import dev.mars.statevault.schema.StateSerializer;
import dev.mars.statevault.schema.StateSerializer.Decoded;
import dev.mars.statevault.storage.RecoveryResult.GenerationAttempt;
import dev.mars.statevault.storage.RecoveryResult.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a component's generation chain newest first and returns the first
 * generation that verifies and decodes.
 * <p>
 * A signature mismatch, unreadable file or malformed payload only disqualifies
 * that generation; the walk moves on to the next older one. A schema error stops
 * the walk, since every older generation needs the same missing step.
 */
public final class RecoveryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryLoader.class);

    private final BlobCodec codec;

    public RecoveryLoader(BlobCodec codec) {
        this.codec = codec;
    }

    /**
     * Deletes temp files left by an interrupted write. Must run before {@link #load}.
     *
     * @return number of files removed
     */
    public int deleteStaleTemps(ComponentFiles files) {
        int removed = 0;
        for (Path tmp : List.of(files.temp(), files.snapshotTemp())) {
            try {
                if (Files.deleteIfExists(tmp)) {
                    LOG.warn("Deleted stale temp file from interrupted write: {}", tmp);
                    removed++;
                }
            } catch (IOException e) {
                LOG.warn("Could not delete stale temp file {}: {}", tmp, e.getMessage());
            }
        }
        return removed;
    }

    public <T> RecoveryResult<T> load(ComponentFiles files, StateSerializer<T> serializer) {
        List<GenerationAttempt> attempts = new ArrayList<>();
        boolean anyExisted = false;

        for (int gen = 0; gen <= ComponentFiles.BACKUP_GENERATIONS; gen++) {
            Path path = files.generation(gen);
            if (!Files.exists(path)) {
                attempts.add(new GenerationAttempt(gen, Outcome.MISSING, "absent"));
                continue;
            }
            anyExisted = true;

            byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (IOException e) {
                LOG.warn("Generation {} of {} unreadable: {}", gen, files.id(), e.getMessage());
                attempts.add(new GenerationAttempt(gen, Outcome.UNREADABLE, e.getMessage()));
                continue;
            }

            Optional<StateBlob> blob = codec.decode(bytes);
            if (blob.isEmpty()) {
                LOG.warn("Generation {} of {} failed integrity check ({} bytes), trying older generation",
                        gen, files.id(), bytes.length);
                attempts.add(new GenerationAttempt(gen, Outcome.INTEGRITY_FAILED, "signature mismatch"));
                continue;
            }

            StateBlob verified = blob.get();
            Decoded<T> decoded;
            try {
                decoded = serializer.decode(verified.payload(), verified.schemaVersion());
            } catch (StateVaultException e) {
                if (e.errorCode() == ErrorCode.SCHEMA_ERROR) {
                    LOG.error("Schema error loading {} generation {} (v{} -> v{}): {}",
                            files.id(), gen, verified.schemaVersion(), serializer.schemaVersion(), e.getMessage());
                    attempts.add(new GenerationAttempt(gen, Outcome.SCHEMA_FAILED, e.getMessage()));
                    return RecoveryResult.notFound(ErrorCode.SCHEMA_ERROR, attempts);
                }
                LOG.warn("Generation {} of {} verified but did not decode: {}", gen, files.id(), e.getMessage());
                attempts.add(new GenerationAttempt(gen, Outcome.MALFORMED, e.getMessage()));
                continue;
            }

            attempts.add(new GenerationAttempt(gen, Outcome.RECOVERED,
                    "v" + verified.schemaVersion() + (decoded.migrated() ? " migrated" : "")));
            if (gen == 0) {
                LOG.info("Loaded {} from main (v{}, savedAt={})", files.id(), verified.schemaVersion(),
                        verified.savedAtEpochSeconds());
            } else {
                LOG.warn("Loaded {} from backup generation {} (v{}, savedAt={}); newer generations were unusable",
                        files.id(), gen, verified.schemaVersion(), verified.savedAtEpochSeconds());
            }
            return RecoveryResult.recovered(gen, decoded.state(), verified.schemaVersion(), decoded.migrated(),
                    verified.savedAtEpochSeconds(), attempts);
        }

        if (!anyExisted) {
            LOG.info("No persisted state for {}, starting fresh", files.id());
            return RecoveryResult.notFound(null, attempts);
        }
        LOG.error("STATE LOST: every generation of {} is unusable, starting fresh. Attempts: {}",
                files.id(), attempts);
        return RecoveryResult.notFound(ErrorCode.UNRECOVERABLE, attempts);
    }

    /**
     * Reports the state of every slot without decoding payloads or touching files.
     */
    public ChainReport inspect(ComponentFiles files) {
        List<ChainReport.GenerationStatus> statuses = new ArrayList<>();
        for (int gen = 0; gen <= ComponentFiles.BACKUP_GENERATIONS; gen++) {
            Path path = files.generation(gen);
            if (!Files.exists(path)) {
                statuses.add(new ChainReport.GenerationStatus(gen, false, 0L, false, -1, 0L));
                continue;
            }
            try {
                byte[] bytes = Files.readAllBytes(path);
                Optional<StateBlob> blob = codec.decode(bytes);
                statuses.add(new ChainReport.GenerationStatus(gen, true, bytes.length, blob.isPresent(),
                        blob.map(StateBlob::schemaVersion).orElse(-1),
                        blob.map(StateBlob::savedAtEpochSeconds).orElse(0L)));
            } catch (IOException e) {
                LOG.warn("Could not read {} during inspection: {}", path, e.getMessage());
                statuses.add(new ChainReport.GenerationStatus(gen, true, 0L, false, -1, 0L));
            }
        }
        return new ChainReport(files.id(), statuses);
    }
}
