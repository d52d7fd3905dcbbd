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
import dev.mars.statevault.StateVaultConfig;
import dev.mars.statevault.StateVaultException;
import dev.mars.statevault.schema.StateSerializer;
import dev.mars.statevault.storage.AtomicWriter;
import dev.mars.statevault.storage.AtomicWriter.PreparedWrite;
import dev.mars.statevault.storage.BackupRotator;
import dev.mars.statevault.storage.BlobCodec;
import dev.mars.statevault.storage.ChainReport;
import dev.mars.statevault.storage.ComponentFiles;
import dev.mars.statevault.storage.IntegrityVerifier;
import dev.mars.statevault.storage.RecoveryLoader;
import dev.mars.statevault.storage.RecoveryResult;
import dev.mars.statevault.storage.SnapshotStore;
import dev.mars.statevault.storage.StateBlob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point the host calls to persist and recover its components.
 * <p>
 * <b>Save sequence</b> (per admitted component):
 * <pre>
 * encode -> sign -> write &lt;id&gt;.tmp -> fsync -> read back + verify   (prepare)
 *        -> rotate main/bak1/bak2 -> bak1/bak2/bak3                  (rotate)
 *        -> rename &lt;id&gt;.tmp -> &lt;id&gt; -> fsync dir                   (commit)
 * </pre>
 * A failure in prepare leaves the chain untouched. A failed commit moves bak1 back
 * into main. Either way the component stays {@link ComponentState#DIRTY} and is
 * retried on the next checkpoint.
 * <p>
 * <b>Threading:</b> not thread-safe. The host calls every method from its own
 * execution points (tick boundary, transaction completion, shutdown hook), and a
 * state root has exactly one writing process.
 * <p>
 * <b>Errors:</b> {@link #save}, {@link #checkpoint}, {@link #shutdown} and {@link #load}
 * report problems in their return values and never throw for I/O, integrity,
 * schema or space failures. Unknown ids and duplicate registrations throw
 * {@link StateVaultException}.
 *
 * <pre>{@code
 * PersistenceCoordinator coordinator = new PersistenceCoordinator(StateVaultConfig.load());
 * coordinator.register(ComponentDescriptor.builder("EntryAgent", serializer)
 *         .priority(Priority.CRITICAL)
 *         .cadence(CadencePolicy.everyMutations(10).orEvery(Duration.ofMinutes(60)))
 *         .build());
 *
 * RecoveryResult<AgentState> loaded = coordinator.load("EntryAgent");
 * AgentState state = loaded.state().orElseGet(AgentState::defaults);
 * ...
 * coordinator.update("EntryAgent", state);   // after each mutation
 * coordinator.checkpoint();                  // at each tick boundary
 * coordinator.shutdown();                    // from the shutdown hook
 * }</pre>
 */
public final class PersistenceCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final StateVaultConfig config;
    private final Path stateDir;
    private final BlobCodec codec;
    private final AtomicWriter writer;
    private final BackupRotator rotator;
    private final RecoveryLoader loader;
    private final SnapshotStore snapshots;
    private final SpaceGuard spaceGuard = new SpaceGuard();
    private final FreeSpaceSource freeSpace;
    private final Clock clock;
    private final Map<String, Managed<?>> components = new LinkedHashMap<>();

    /**
     * Creates a coordinator with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public PersistenceCoordinator() {
        this(StateVaultConfig.load());
    }

    public PersistenceCoordinator(StateVaultConfig config) {
        this(config, null, FreeSpaceSource.fileStore(), Clock.systemUTC());
    }

    /**
     * @param config          configuration
     * @param verifier        signing key holder; null loads or creates the key at {@link StateVaultConfig#keyFile()}
     * @param freeSpaceSource free-space source for the Space Guard
     * @param clock           time source for blob timestamps and cadence
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} if the state directory or key cannot be set up
     */
    public PersistenceCoordinator(StateVaultConfig config, IntegrityVerifier verifier,
                                  FreeSpaceSource freeSpaceSource, Clock clock) {
        this.config = config;
        this.stateDir = config.stateDir();
        this.freeSpace = freeSpaceSource;
        this.clock = clock;

        try {
            Files.createDirectories(stateDir);
        } catch (IOException e) {
            LOG.error("Failed to create state directory {}: {}", stateDir, e.getMessage(), e);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Failed to create state directory " + stateDir, e);
        }

        IntegrityVerifier signer = verifier != null ? verifier : IntegrityVerifier.loadOrCreate(config.keyFile());
        this.codec = new BlobCodec(signer, config.maxPayloadSizeBytes());
        this.writer = new AtomicWriter(codec, config.syncEnabled());
        this.rotator = new BackupRotator(config.syncEnabled());
        this.loader = new RecoveryLoader(codec);
        this.snapshots = new SnapshotStore(writer, config.maxPayloadSizeBytes());

        LOG.info("PersistenceCoordinator initialized: stateDir={}, syncEnabled={}, reserve={} bytes, maxPayloadSize={} MB",
                stateDir, config.syncEnabled(), config.reserveBytes(), config.maxPayloadSizeMb());
    }

    public StateVaultConfig config() {
        return config;
    }

    // ========================================================================
    // Registration
    // ========================================================================

    /**
     * Registers a component. Registration is static: once per component at process start.
     *
     * @throws StateVaultException with {@link ErrorCode#INVALID_ARGUMENT} if the id is already registered
     */
    public <T> void register(ComponentDescriptor<T> descriptor) {
        if (components.containsKey(descriptor.id())) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT,
                    "Component already registered: " + descriptor.id());
        }
        components.put(descriptor.id(), new Managed<>(descriptor, new ComponentFiles(stateDir, descriptor.id())));
        LOG.info("Registered component {}: priority={}, format={}, schemaVersion={}, cadence={}",
                descriptor.id(), descriptor.priority(), descriptor.format(), descriptor.schemaVersion(),
                descriptor.cadence());
    }

    public Set<String> componentIds() {
        return Set.copyOf(components.keySet());
    }

    // ========================================================================
    // Load
    // ========================================================================

    /**
     * Recovers a component from the newest usable generation.
     * <p>
     * Stale temp files from an interrupted write are deleted first. When nothing is
     * recoverable the result is not found and the component is {@link LoadState#FRESH};
     * the host must then initialize a default state and pass it to {@link #update}.
     */
    public <T> RecoveryResult<T> load(String id) {
        Managed<T> m = managed(id);
        m.loadState = LoadState.LOADING;

        RecoveryResult<T> result;
        try {
            loader.deleteStaleTemps(m.files);
            result = loader.load(m.files, m.descriptor.serializer());
        } catch (RuntimeException e) {
            LOG.error("STATE LOST: unexpected failure loading {}, starting fresh", id, e);
            result = RecoveryResult.notFound(ErrorCode.UNRECOVERABLE, List.of());
        }

        m.state = ComponentState.CLEAN;
        m.mutationsSinceSave = 0;
        if (result.found()) {
            m.latest = result.state().orElseThrow();
            m.lastSaveAt = Instant.ofEpochSecond(result.savedAtEpochSeconds());
            m.loadState = result.recoveredFromBackup() ? LoadState.LOADED_DEGRADED : LoadState.LOADED;
            LOG.info("Component {} loaded from generation {} (schema v{}{})", id, result.generationUsed(),
                    result.fromVersion(), result.migrated() ? ", migrated to v" + m.descriptor.schemaVersion() : "");
        } else {
            m.latest = null;
            m.lastSaveAt = null;
            m.loadState = LoadState.FRESH;
            if (result.lost()) {
                LOG.error("Component {} starts FRESH after {}: {}", id,
                        result.failure().map(ErrorCode::description).orElse("failure"), result.attempts());
            } else {
                LOG.info("Component {} starts fresh (no persisted state)", id);
            }
        }
        return result;
    }

    // ========================================================================
    // Mutation and saving
    // ========================================================================

    /**
     * Records a host mutation: holds {@code state} as the latest value and moves the
     * component from CLEAN to DIRTY.
     */
    public <T> void update(String id, T state) {
        if (state == null) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "State for " + id + " must not be null");
        }
        Managed<T> m = managed(id);
        m.latest = state;
        m.mutationsSinceSave++;
        if (m.state == ComponentState.CLEAN) {
            m.state = ComponentState.DIRTY;
        }
        LOG.trace("Component {} mutated ({} since last save)", id, m.mutationsSinceSave);
    }

    /**
     * Records {@code state} and saves it now, regardless of cadence, subject to the
     * space budget.
     */
    public <T> SaveOutcome save(String id, T state) {
        update(id, state);
        Managed<T> m = managed(id);
        CheckpointReport report = runPass(List.<Managed<?>>of(m), "save");
        return report.outcomes().get(0);
    }

    /**
     * Saves every dirty component whose cadence is due.
     */
    public CheckpointReport checkpoint() {
        Instant now = clock.instant();
        List<Managed<?>> due = new ArrayList<>();
        for (Managed<?> m : components.values()) {
            if (m.state == ComponentState.DIRTY && m.latest != null
                    && m.descriptor.cadence().isDue(m.mutationsSinceSave, m.lastSaveAt, now)) {
                due.add(m);
            }
        }
        if (due.isEmpty()) {
            LOG.trace("Checkpoint: nothing due");
            return CheckpointReport.empty();
        }
        return runPass(due, "checkpoint");
    }

    /**
     * Final full save pass: every component with unsaved changes, regardless of cadence.
     * Clean components are already durable and are not rewritten, which would only
     * push history out of the backup chain.
     */
    public CheckpointReport shutdown() {
        List<Managed<?>> dirty = new ArrayList<>();
        for (Managed<?> m : components.values()) {
            if (m.state != ComponentState.CLEAN && m.latest != null) {
                dirty.add(m);
            }
        }
        CheckpointReport report = dirty.isEmpty() ? CheckpointReport.empty() : runPass(dirty, "shutdown");
        if (report.allSaved()) {
            LOG.info("Shutdown save pass complete: {} components saved", report.savedIds().size());
        } else {
            LOG.error("Shutdown save pass incomplete: saved={}, skipped={}, failed={}",
                    report.savedIds(), report.skippedIds(), report.failedIds());
        }
        return report;
    }

    private CheckpointReport runPass(List<Managed<?>> due, String reason) {
        List<SpaceGuard.Candidate> candidates = new ArrayList<>();
        Map<String, Managed<?>> byId = new LinkedHashMap<>();
        for (Managed<?> m : due) {
            candidates.add(new SpaceGuard.Candidate(m.descriptor.id(), m.descriptor.priority(), estimate(m)));
            byId.put(m.descriptor.id(), m);
        }

        SpaceBudget budget = currentBudget();
        SpaceGuard.Admission admission = spaceGuard.admit(candidates, budget);

        List<SaveOutcome> outcomes = new ArrayList<>();
        for (String id : admission.admitted()) {
            outcomes.add(doSave(byId.get(id)));
        }
        for (String id : admission.skipped()) {
            String detail = admission.spaceError()
                    ? "free space " + budget.freeBytes() + " below reserve " + budget.reserveBytes()
                    : "deferred by space budget";
            outcomes.add(SaveOutcome.skipped(id, detail));
        }
        if (admission.spaceError()) {
            LOG.error("SPACE ERROR during {}: skipped components {}", reason, admission.skipped());
        }
        LOG.debug("{} pass: admitted={}, skipped={}", reason, admission.admitted(), admission.skipped());
        return new CheckpointReport(outcomes, admission.spaceError());
    }

    private <T> SaveOutcome doSave(Managed<T> m) {
        String id = m.descriptor.id();
        StateSerializer<T> serializer = m.descriptor.serializer();
        m.state = ComponentState.SAVING;
        long startNanos = System.nanoTime();

        try {
            byte[] payload = serializer.encode(m.latest);
            if (payload.length > codec.maxPayloadSize()) {
                throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "Payload too large: " +
                        payload.length + " bytes (max: " + codec.maxPayloadSize() + ")");
            }

            Instant now = clock.instant();
            byte[] blobBytes = codec.encode(new StateBlob(serializer.schemaVersion(), now.getEpochSecond(), payload));

            PreparedWrite prepared = writer.prepare(m.files.main(), blobBytes);
            try {
                rotator.rotateBeforeWrite(m.files);
            } catch (StateVaultException e) {
                writer.abort(prepared);
                throw e;
            }
            try {
                writer.commit(prepared);
            } catch (StateVaultException e) {
                rotator.restoreMain(m.files);
                throw e;
            }

            m.state = ComponentState.CLEAN;
            m.mutationsSinceSave = 0;
            m.lastSaveAt = now;
            m.lastBlobBytes = blobBytes.length;
            long elapsedMicros = (System.nanoTime() - startNanos) / 1000;
            LOG.info("Saved {}: {} bytes, schema v{}, {} us", id, blobBytes.length,
                    serializer.schemaVersion(), elapsedMicros);
            return SaveOutcome.saved(id, blobBytes.length);

        } catch (StateVaultException e) {
            m.state = ComponentState.DIRTY;
            LOG.error("Save of {} failed ({}), previous state intact, retrying next cycle: {}",
                    id, e.errorCode(), e.getMessage());
            return SaveOutcome.failed(id, e.errorCode(), e.getMessage());
        } catch (RuntimeException e) {
            m.state = ComponentState.DIRTY;
            LOG.error("Save of {} failed unexpectedly, previous state intact, retrying next cycle", id, e);
            return SaveOutcome.failed(id, ErrorCode.IO_ERROR, String.valueOf(e.getMessage()));
        }
    }

    // ========================================================================
    // Lightweight snapshots
    // ========================================================================

    /**
     * Writes an unsigned snapshot of small hot fields: no rotation, no keyed signature.
     * Does not change the component's save state; full saves remain the durable record.
     */
    public <T> SaveOutcome saveSnapshot(String id, T state) {
        Managed<T> m = managed(id);
        try {
            StateSerializer<T> serializer = m.descriptor.serializer();
            byte[] payload = serializer.encode(state);
            StateBlob blob = new StateBlob(serializer.schemaVersion(), clock.instant().getEpochSecond(), payload);
            snapshots.write(m.files, blob);
            return SaveOutcome.saved(id, payload.length);
        } catch (StateVaultException e) {
            LOG.warn("Snapshot of {} failed: {}", id, e.getMessage());
            return SaveOutcome.failed(id, e.errorCode(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Snapshot of {} failed: {}", id, e.getMessage());
            return SaveOutcome.failed(id, ErrorCode.INVALID_ARGUMENT, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Reads the latest intact snapshot, if any.
     */
    public <T> Optional<T> loadSnapshot(String id) {
        Managed<T> m = managed(id);
        Optional<StateBlob> blob = snapshots.read(m.files);
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(m.descriptor.serializer()
                    .decode(blob.get().payload(), blob.get().schemaVersion()).state());
        } catch (StateVaultException e) {
            LOG.warn("Snapshot of {} did not decode: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    // ========================================================================
    // Inspection and maintenance
    // ========================================================================

    /** Per-generation integrity report. Read-only. */
    public ChainReport inspect(String id) {
        return loader.inspect(managed(id).files);
    }

    /**
     * Factory reset of one component: deletes every generation, temp and snapshot file
     * and drops the held state.
     *
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} if a file cannot be deleted
     */
    public void reset(String id) {
        Managed<?> m = managed(id);
        List<Path> paths = new ArrayList<>(m.files.chain());
        paths.add(m.files.temp());
        paths.add(m.files.snapshot());
        paths.add(m.files.snapshotTemp());
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.error("Reset of {} failed deleting {}: {}", id, path, e.getMessage(), e);
                throw new StateVaultException(ErrorCode.IO_ERROR, "Failed to delete " + path, e);
            }
        }
        m.latest = null;
        m.state = ComponentState.CLEAN;
        m.loadState = LoadState.UNLOADED;
        m.mutationsSinceSave = 0;
        m.lastSaveAt = null;
        m.lastBlobBytes = 0;
        LOG.warn("Component {} reset: all persisted generations deleted", id);
    }

    public ComponentState componentState(String id) {
        return managed(id).state;
    }

    public LoadState loadState(String id) {
        return managed(id).loadState;
    }

    /** Bytes the Space Guard expects the next save of {@code id} to need. */
    public long estimatedBytes(String id) {
        return estimate(managed(id));
    }

    /** Free space and reserve for the state volume right now. */
    public SpaceBudget currentBudget() {
        try {
            return new SpaceBudget(freeSpace.usableBytes(stateDir), config.reserveBytes());
        } catch (IOException e) {
            LOG.warn("Could not measure free space at {}: {}; admitting all saves", stateDir, e.getMessage());
            return SpaceBudget.unlimited(config.reserveBytes());
        }
    }

    private long estimate(Managed<?> m) {
        return Math.max(BlobCodec.encodedSize(m.descriptor.estimatedSizeBytes()), m.lastBlobBytes);
    }

    private <T> Managed<T> managed(String id) {
        Managed<?> m = components.get(id);
        if (m == null) {
            throw new StateVaultException(ErrorCode.NOT_REGISTERED, "Component not registered: " + id);
        }
        return (Managed<T>) m;
    }

    private static final class Managed<T> {
        final ComponentDescriptor<T> descriptor;
        final ComponentFiles files;
        T latest;
        ComponentState state = ComponentState.CLEAN;
        LoadState loadState = LoadState.UNLOADED;
        long mutationsSinceSave;
        Instant lastSaveAt;
        long lastBlobBytes;

        Managed(ComponentDescriptor<T> descriptor, ComponentFiles files) {
            this.descriptor = descriptor;
            this.files = files;
        }
    }
}
