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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultConfig;
import dev.mars.statevault.StateVaultException;
import dev.mars.statevault.TestStates;
import dev.mars.statevault.TestStates.EntryAgentState;
import dev.mars.statevault.TestStates.EntryAgentStateV1;
import dev.mars.statevault.TestStates.MutableClock;
import dev.mars.statevault.TestStates.ReplayBufferState;
import dev.mars.statevault.schema.BytesStateSerializer;
import dev.mars.statevault.schema.JsonStateSerializer;
import dev.mars.statevault.schema.MigrationChain;
import dev.mars.statevault.schema.StateSerializer;
import dev.mars.statevault.storage.BlobCodec;
import dev.mars.statevault.storage.ChainReport;
import dev.mars.statevault.storage.ComponentFiles;
import dev.mars.statevault.storage.RecoveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link PersistenceCoordinator} against a real state directory.
 */
class PersistenceCoordinatorTest {

    private static final String ENTRY_AGENT = "EntryAgent";
    private static final String REPLAY_BUFFER = "ReplayBuffer";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private AtomicLong freeBytes;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T12:00:00Z"));
        freeBytes = new AtomicLong(Long.MAX_VALUE);
    }

    private PersistenceCoordinator coordinator(StateVaultConfig config) {
        return new PersistenceCoordinator(config, TestStates.verifier(), dir -> freeBytes.get(), clock);
    }

    private PersistenceCoordinator coordinator() {
        return coordinator(TestStates.config(tempDir));
    }

    private static ComponentDescriptor<EntryAgentState> entryAgent(Priority priority, CadencePolicy cadence) {
        return ComponentDescriptor.builder(ENTRY_AGENT, JsonStateSerializer.of(EntryAgentState.class, 0))
                .priority(priority)
                .cadence(cadence)
                .estimatedSizeBytes(1_000)
                .build();
    }

    private static ComponentDescriptor<EntryAgentState> entryAgent() {
        return entryAgent(Priority.CRITICAL, CadencePolicy.everyCheckpoint());
    }

    private static ComponentDescriptor<ReplayBufferState> replayBuffer(CadencePolicy cadence) {
        return ComponentDescriptor.builder(REPLAY_BUFFER, JsonStateSerializer.of(ReplayBufferState.class, 0))
                .priority(Priority.LOW)
                .cadence(cadence)
                .estimatedSizeBytes(4_000)
                .build();
    }

    private ComponentFiles files(String id) {
        return new ComponentFiles(tempDir, id);
    }

    private static void flipLastByte(Path path) throws IOException {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long pos = ch.size() - 1;
            ByteBuffer buf = ByteBuffer.allocate(1);
            ch.read(buf, pos);
            buf.flip();
            ch.write(ByteBuffer.wrap(new byte[]{(byte) (buf.get() ^ 0xFF)}), pos);
        }
    }

    // ========================================================================
    // Save and load
    // ========================================================================

    @Test
    @DisplayName("Saved entry agent state loads back identical from main")
    void testSaveThenLoad() {
        PersistenceCoordinator first = coordinator();
        first.register(entryAgent());
        first.load(ENTRY_AGENT);

        SaveOutcome outcome = first.save(ENTRY_AGENT, new EntryAgentState(12345, 0.15));
        assertTrue(outcome.saved());
        assertTrue(Files.exists(files(ENTRY_AGENT).main()));
        assertEquals(outcome.bytesWritten(), BlobCodec.encodedSize(
                JsonStateSerializer.of(EntryAgentState.class, 0).encode(new EntryAgentState(12345, 0.15)).length));

        PersistenceCoordinator second = coordinator();
        second.register(entryAgent());
        RecoveryResult<EntryAgentState> result = second.load(ENTRY_AGENT);

        assertTrue(result.found());
        assertEquals(0, result.generationUsed());
        assertEquals(new EntryAgentState(12345, 0.15), result.state().orElseThrow());
        assertEquals(clock.instant().getEpochSecond(), result.savedAtEpochSeconds());
        assertEquals(LoadState.LOADED, second.loadState(ENTRY_AGENT));
        assertEquals(ComponentState.CLEAN, second.componentState(ENTRY_AGENT));
    }

    @Test
    @DisplayName("Corrupt main signature: load falls back to generation 1 and reports degraded")
    void testCorruptMainRecoveredFromBackup() throws IOException {
        PersistenceCoordinator first = coordinator();
        first.register(entryAgent());
        first.save(ENTRY_AGENT, new EntryAgentState(100, 0.3));
        first.save(ENTRY_AGENT, new EntryAgentState(200, 0.2));

        flipLastByte(files(ENTRY_AGENT).main());

        PersistenceCoordinator second = coordinator();
        second.register(entryAgent());
        RecoveryResult<EntryAgentState> result = second.load(ENTRY_AGENT);

        assertEquals(1, result.generationUsed());
        assertTrue(result.recoveredFromBackup());
        assertEquals(new EntryAgentState(100, 0.3), result.state().orElseThrow());
        assertEquals(LoadState.LOADED_DEGRADED, second.loadState(ENTRY_AGENT));
        assertTrue(second.loadState(ENTRY_AGENT).degraded());
    }

    @Test
    @DisplayName("After saves A, B, C the backups hold B and A")
    void testThreeSavesRotate() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(entryAgent());
        coordinator.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));
        coordinator.save(ENTRY_AGENT, new EntryAgentState(2, 0.2));
        coordinator.save(ENTRY_AGENT, new EntryAgentState(3, 0.3));

        ChainReport report = coordinator.inspect(ENTRY_AGENT);
        assertEquals(3, report.validCount());
        assertFalse(report.generations().get(3).exists());

        PersistenceCoordinator reader = coordinator();
        reader.register(entryAgent());
        assertEquals(3L, reader.<EntryAgentState>load(ENTRY_AGENT).state().orElseThrow().totalUpdates());
        // force the loader down the chain
        assertDoesNotThrow(() -> Files.delete(files(ENTRY_AGENT).main()));
        assertEquals(2L, reader.<EntryAgentState>load(ENTRY_AGENT).state().orElseThrow().totalUpdates());
        assertDoesNotThrow(() -> Files.delete(files(ENTRY_AGENT).generation(1)));
        assertEquals(1L, reader.<EntryAgentState>load(ENTRY_AGENT).state().orElseThrow().totalUpdates());
    }

    @Test
    void testFreshStart() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(entryAgent());
        assertEquals(LoadState.UNLOADED, coordinator.loadState(ENTRY_AGENT));

        RecoveryResult<EntryAgentState> result = coordinator.load(ENTRY_AGENT);

        assertFalse(result.found());
        assertFalse(result.lost());
        assertEquals(LoadState.FRESH, coordinator.loadState(ENTRY_AGENT));
        assertEquals(ComponentState.CLEAN, coordinator.componentState(ENTRY_AGENT));
    }

    @Test
    @DisplayName("Every generation corrupt: fresh start with an unrecoverable failure, no exception")
    void testAllGenerationsCorrupt() throws IOException {
        PersistenceCoordinator first = coordinator();
        first.register(entryAgent());
        for (int i = 0; i < 5; i++) {
            first.save(ENTRY_AGENT, new EntryAgentState(i, 0.1));
        }
        for (Path path : files(ENTRY_AGENT).chain()) {
            flipLastByte(path);
        }

        PersistenceCoordinator second = coordinator();
        second.register(entryAgent());
        RecoveryResult<EntryAgentState> result = second.load(ENTRY_AGENT);

        assertTrue(result.lost());
        assertEquals(ErrorCode.UNRECOVERABLE, result.failure().orElseThrow());
        assertEquals(LoadState.FRESH, second.loadState(ENTRY_AGENT));
    }

    @Test
    void testStaleTempDeletedOnLoad() throws IOException {
        PersistenceCoordinator first = coordinator();
        first.register(entryAgent());
        first.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));
        Files.write(files(ENTRY_AGENT).temp(), new byte[]{9, 9, 9});

        PersistenceCoordinator second = coordinator();
        second.register(entryAgent());
        RecoveryResult<EntryAgentState> result = second.load(ENTRY_AGENT);

        assertFalse(Files.exists(files(ENTRY_AGENT).temp()));
        assertEquals(1L, result.state().orElseThrow().totalUpdates());
    }

    @Test
    @DisplayName("Blobs signed with another installation key are rejected")
    void testForeignKeyRejected() {
        PersistenceCoordinator first = coordinator();
        first.register(entryAgent());
        first.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));

        Path otherKey = tempDir.resolve("other").resolve("statevault.key");
        StateVaultConfig config = StateVaultConfig.builder()
                .stateDir(tempDir).keyFile(otherKey).syncEnabled(false).reserveBytes(0).maxPayloadSizeMb(4).build();
        PersistenceCoordinator second = new PersistenceCoordinator(config, null, dir -> Long.MAX_VALUE, clock);
        second.register(entryAgent());

        RecoveryResult<EntryAgentState> result = second.load(ENTRY_AGENT);

        assertTrue(Files.exists(otherKey));
        assertTrue(result.lost());
    }

    // ========================================================================
    // State machine
    // ========================================================================

    @Nested
    @DisplayName("Save state machine")
    class StateMachine {

        @Test
        void testCleanDirtyClean() {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(entryAgent());
            coordinator.load(ENTRY_AGENT);
            assertEquals(ComponentState.CLEAN, coordinator.componentState(ENTRY_AGENT));

            coordinator.update(ENTRY_AGENT, new EntryAgentState(1, 0.1));
            assertEquals(ComponentState.DIRTY, coordinator.componentState(ENTRY_AGENT));

            CheckpointReport report = coordinator.checkpoint();
            assertEquals(List.of(ENTRY_AGENT), report.savedIds());
            assertEquals(ComponentState.CLEAN, coordinator.componentState(ENTRY_AGENT));

            assertTrue(coordinator.checkpoint().outcomes().isEmpty());
        }

        @Test
        @DisplayName("A failing encode leaves the component dirty and main untouched")
        void testFailedSaveStaysDirty() throws IOException {
            FlakySerializer serializer = new FlakySerializer();
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(ComponentDescriptor.builder("Flaky", serializer).build());
            assertTrue(coordinator.save("Flaky", new byte[]{1}).saved());
            byte[] before = Files.readAllBytes(files("Flaky").main());

            serializer.failing = true;
            SaveOutcome outcome = coordinator.save("Flaky", new byte[]{2});

            assertEquals(SaveOutcome.Status.FAILED, outcome.status());
            assertEquals(Optional.of(ErrorCode.INVALID_ARGUMENT), outcome.error());
            assertEquals(ComponentState.DIRTY, coordinator.componentState("Flaky"));
            assertArrayEquals(before, Files.readAllBytes(files("Flaky").main()));
            assertFalse(Files.exists(files("Flaky").generation(1)));

            serializer.failing = false;
            assertEquals(List.of("Flaky"), coordinator.checkpoint().savedIds());
            assertEquals(ComponentState.CLEAN, coordinator.componentState("Flaky"));
        }

        @Test
        @DisplayName("A rotation failure discards the temp file and keeps main")
        void testRotationFailureKeepsMain() throws IOException {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(entryAgent());
            coordinator.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));
            coordinator.save(ENTRY_AGENT, new EntryAgentState(2, 0.2));
            coordinator.save(ENTRY_AGENT, new EntryAgentState(3, 0.3));
            Path blocker = files(ENTRY_AGENT).generation(3);
            Files.createDirectory(blocker);
            Files.write(blocker.resolve("occupied"), new byte[]{1});
            byte[] before = Files.readAllBytes(files(ENTRY_AGENT).main());

            SaveOutcome outcome = coordinator.save(ENTRY_AGENT, new EntryAgentState(4, 0.4));

            assertEquals(Optional.of(ErrorCode.IO_ERROR), outcome.error());
            assertEquals(ComponentState.DIRTY, coordinator.componentState(ENTRY_AGENT));
            assertArrayEquals(before, Files.readAllBytes(files(ENTRY_AGENT).main()));
            assertFalse(Files.exists(files(ENTRY_AGENT).temp()));
        }

        @Test
        void testOversizedPayloadFails() {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(ComponentDescriptor.builder("Blob", new BytesStateSerializer(0)).build());

            SaveOutcome outcome = coordinator.save("Blob", new byte[5 * 1024 * 1024]);

            assertEquals(SaveOutcome.Status.FAILED, outcome.status());
            assertEquals(Optional.of(ErrorCode.INVALID_ARGUMENT), outcome.error());
            assertFalse(Files.exists(files("Blob").main()));
        }
    }

    // ========================================================================
    // Cadence and shutdown
    // ========================================================================

    @Nested
    @DisplayName("Cadence")
    class Cadence {

        @Test
        void testMutationThreshold() {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(entryAgent(Priority.CRITICAL, CadencePolicy.everyMutations(3)));

            coordinator.update(ENTRY_AGENT, new EntryAgentState(1, 0.1));
            coordinator.update(ENTRY_AGENT, new EntryAgentState(2, 0.1));
            assertTrue(coordinator.checkpoint().outcomes().isEmpty());

            coordinator.update(ENTRY_AGENT, new EntryAgentState(3, 0.1));
            assertEquals(List.of(ENTRY_AGENT), coordinator.checkpoint().savedIds());
        }

        @Test
        void testInterval() {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(entryAgent(Priority.CRITICAL, CadencePolicy.every(Duration.ofMinutes(60))));

            coordinator.update(ENTRY_AGENT, new EntryAgentState(1, 0.1));
            assertEquals(List.of(ENTRY_AGENT), coordinator.checkpoint().savedIds());

            coordinator.update(ENTRY_AGENT, new EntryAgentState(2, 0.1));
            clock.advance(Duration.ofMinutes(30));
            assertTrue(coordinator.checkpoint().outcomes().isEmpty());

            clock.advance(Duration.ofMinutes(30));
            assertEquals(List.of(ENTRY_AGENT), coordinator.checkpoint().savedIds());
        }

        @Test
        @DisplayName("Shutdown saves dirty components regardless of cadence")
        void testShutdown() {
            PersistenceCoordinator coordinator = coordinator();
            coordinator.register(entryAgent());
            coordinator.register(replayBuffer(CadencePolicy.shutdownOnly()));
            coordinator.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));
            coordinator.update(REPLAY_BUFFER, new ReplayBufferState(List.of(1.0, 2.0), 10));
            assertTrue(coordinator.checkpoint().outcomes().isEmpty());

            CheckpointReport report = coordinator.shutdown();

            assertEquals(List.of(REPLAY_BUFFER), report.savedIds());
            assertTrue(report.allSaved());
            assertTrue(Files.exists(files(REPLAY_BUFFER).main()));
            assertFalse(Files.exists(files(ENTRY_AGENT).generation(1)));
        }
    }

    // ========================================================================
    // Space Guard
    // ========================================================================

    @Nested
    @DisplayName("Space budget")
    class SpaceBudgetTests {

        private static final long RESERVE = 1_000;

        private PersistenceCoordinator squeezed() {
            StateVaultConfig config = StateVaultConfig.builder()
                    .stateDir(tempDir).syncEnabled(false).reserveBytes(RESERVE).maxPayloadSizeMb(4).build();
            PersistenceCoordinator coordinator = coordinator(config);
            coordinator.register(entryAgent());
            coordinator.register(replayBuffer(CadencePolicy.everyCheckpoint()));
            return coordinator;
        }

        @Test
        @DisplayName("Budget one byte short: critical saved, low priority skipped and reported")
        void testOneByteShort() {
            PersistenceCoordinator coordinator = squeezed();
            long needed = RESERVE + coordinator.estimatedBytes(ENTRY_AGENT) + coordinator.estimatedBytes(REPLAY_BUFFER);
            freeBytes.set(needed - 1);
            coordinator.update(ENTRY_AGENT, new EntryAgentState(12345, 0.15));
            coordinator.update(REPLAY_BUFFER, new ReplayBufferState(List.of(0.5), 100));

            CheckpointReport report = coordinator.checkpoint();

            assertEquals(List.of(ENTRY_AGENT), report.savedIds());
            assertEquals(List.of(REPLAY_BUFFER), report.skippedIds());
            assertFalse(report.spaceError());
            assertEquals(ComponentState.DIRTY, coordinator.componentState(REPLAY_BUFFER));
            assertFalse(Files.exists(files(REPLAY_BUFFER).main()));

            freeBytes.set(Long.MAX_VALUE);
            assertEquals(List.of(REPLAY_BUFFER), coordinator.checkpoint().savedIds());
        }

        @Test
        void testEstimates() {
            PersistenceCoordinator coordinator = squeezed();

            assertEquals(BlobCodec.encodedSize(1_000), coordinator.estimatedBytes(ENTRY_AGENT));
            assertEquals(BlobCodec.encodedSize(4_000), coordinator.estimatedBytes(REPLAY_BUFFER));
        }

        @Test
        @DisplayName("Free space below the reserve skips every component, critical included")
        void testBelowReserve() {
            PersistenceCoordinator coordinator = squeezed();
            freeBytes.set(RESERVE - 1);

            SaveOutcome outcome = coordinator.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));

            assertEquals(SaveOutcome.Status.SKIPPED, outcome.status());
            assertEquals(Optional.of(ErrorCode.SPACE_ERROR), outcome.error());
            assertEquals(ComponentState.DIRTY, coordinator.componentState(ENTRY_AGENT));
            assertTrue(coordinator.currentBudget().freeBytes() < RESERVE);
        }

        @Test
        @DisplayName("Unmeasurable free space admits every save")
        void testFreeSpaceUnmeasurable() {
            StateVaultConfig config = StateVaultConfig.builder()
                    .stateDir(tempDir).syncEnabled(false).reserveBytes(RESERVE).maxPayloadSizeMb(4).build();
            PersistenceCoordinator coordinator = new PersistenceCoordinator(config, TestStates.verifier(),
                    dir -> {
                        throw new IOException("statfs failed");
                    }, clock);
            coordinator.register(replayBuffer(CadencePolicy.everyCheckpoint()));

            assertTrue(coordinator.save(REPLAY_BUFFER, new ReplayBufferState(List.of(), 1)).saved());
        }
    }

    // ========================================================================
    // Schema evolution
    // ========================================================================

    @Nested
    @DisplayName("Schema evolution")
    class SchemaEvolution {

        @Test
        @DisplayName("State saved at v0 loads into v1 through the migration chain")
        void testMigrationOnLoad() {
            PersistenceCoordinator old = coordinator();
            old.register(entryAgent());
            old.save(ENTRY_AGENT, new EntryAgentState(12345, 0.15));

            MigrationChain<JsonNode> chain = MigrationChain.<JsonNode>builder(1)
                    .step(0, node -> ((ObjectNode) node).put("learning_rate", 0.01))
                    .build();
            PersistenceCoordinator upgraded = coordinator();
            upgraded.register(ComponentDescriptor.builder(ENTRY_AGENT,
                    new JsonStateSerializer<>(EntryAgentStateV1.class, chain)).build());

            RecoveryResult<EntryAgentStateV1> result = upgraded.load(ENTRY_AGENT);

            assertTrue(result.migrated());
            assertEquals(0, result.fromVersion());
            assertEquals(new EntryAgentStateV1(12345, 0.15, 0.01), result.state().orElseThrow());
            assertEquals(ComponentState.CLEAN, upgraded.componentState(ENTRY_AGENT));
        }

        @Test
        @DisplayName("State from a newer build is a schema error and the files are left alone")
        void testNewerSchemaStartsFresh() {
            PersistenceCoordinator newer = coordinator();
            newer.register(ComponentDescriptor.builder(ENTRY_AGENT,
                    JsonStateSerializer.of(EntryAgentState.class, 2)).build());
            newer.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));

            PersistenceCoordinator older = coordinator();
            older.register(entryAgent());
            RecoveryResult<EntryAgentState> result = older.load(ENTRY_AGENT);

            assertEquals(ErrorCode.SCHEMA_ERROR, result.failure().orElseThrow());
            assertEquals(LoadState.FRESH, older.loadState(ENTRY_AGENT));
            assertTrue(Files.exists(files(ENTRY_AGENT).main()));
        }
    }

    // ========================================================================
    // Snapshots, reset, registration
    // ========================================================================

    @Test
    void testSnapshot() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(replayBuffer(CadencePolicy.shutdownOnly()));
        ReplayBufferState hot = new ReplayBufferState(List.of(0.25, 0.75), 64);

        assertTrue(coordinator.saveSnapshot(REPLAY_BUFFER, hot).saved());

        assertEquals(Optional.of(hot), coordinator.loadSnapshot(REPLAY_BUFFER));
        assertEquals(ComponentState.CLEAN, coordinator.componentState(REPLAY_BUFFER));
        assertFalse(Files.exists(files(REPLAY_BUFFER).main()));
    }

    @Test
    void testSnapshotAbsent() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(replayBuffer(CadencePolicy.shutdownOnly()));

        assertTrue(coordinator.loadSnapshot(REPLAY_BUFFER).isEmpty());
    }

    @Test
    void testReset() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(entryAgent());
        coordinator.save(ENTRY_AGENT, new EntryAgentState(1, 0.1));
        coordinator.save(ENTRY_AGENT, new EntryAgentState(2, 0.1));
        coordinator.saveSnapshot(ENTRY_AGENT, new EntryAgentState(3, 0.1));

        coordinator.reset(ENTRY_AGENT);

        assertTrue(files(ENTRY_AGENT).chain().stream().noneMatch(Files::exists));
        assertFalse(Files.exists(files(ENTRY_AGENT).snapshot()));
        assertEquals(LoadState.UNLOADED, coordinator.loadState(ENTRY_AGENT));
        assertFalse(coordinator.load(ENTRY_AGENT).lost());
    }

    @Test
    void testRegistrationErrors() {
        PersistenceCoordinator coordinator = coordinator();
        coordinator.register(entryAgent());

        StateVaultException duplicate = assertThrows(StateVaultException.class,
                () -> coordinator.register(entryAgent()));
        assertEquals(ErrorCode.INVALID_ARGUMENT, duplicate.errorCode());

        StateVaultException unknown = assertThrows(StateVaultException.class, () -> coordinator.load("Nope"));
        assertEquals(ErrorCode.NOT_REGISTERED, unknown.errorCode());

        StateVaultException nullState = assertThrows(StateVaultException.class,
                () -> coordinator.update(ENTRY_AGENT, null));
        assertEquals(ErrorCode.INVALID_ARGUMENT, nullState.errorCode());

        StateVaultException badId = assertThrows(StateVaultException.class,
                () -> ComponentDescriptor.builder("../escape", new BytesStateSerializer(0)).build());
        assertEquals(ErrorCode.INVALID_ARGUMENT, badId.errorCode());
        assertEquals(Set.of(ENTRY_AGENT), coordinator.componentIds());
    }

    /** Byte serializer that can be told to fail on encode. */
    private static final class FlakySerializer implements StateSerializer<byte[]> {
        private final BytesStateSerializer delegate = new BytesStateSerializer(0);
        boolean failing;

        @Override
        public String format() {
            return "bytes";
        }

        @Override
        public int schemaVersion() {
            return 0;
        }

        @Override
        public byte[] encode(byte[] state) {
            if (failing) {
                throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "encoder unavailable");
            }
            return delegate.encode(state);
        }

        @Override
        public Decoded<byte[]> decode(byte[] payload, int version) {
            return delegate.decode(payload, version);
        }
    }
}
