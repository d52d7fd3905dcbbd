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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.TestStates;
import dev.mars.statevault.TestStates.EntryAgentState;
import dev.mars.statevault.schema.JsonStateSerializer;
import dev.mars.statevault.schema.MigrationChain;
import dev.mars.statevault.storage.RecoveryResult.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecoveryLoader}: newest-first walk over the backup chain.
 */
class RecoveryLoaderTest {

    @TempDir
    Path tempDir;

    private BlobCodec codec;
    private AtomicWriter writer;
    private RecoveryLoader loader;
    private ComponentFiles files;
    private JsonStateSerializer<EntryAgentState> serializer;

    @BeforeEach
    void setUp() {
        codec = new BlobCodec(TestStates.verifier(), 1 << 20);
        writer = new AtomicWriter(codec, false);
        loader = new RecoveryLoader(codec);
        files = new ComponentFiles(tempDir, "entry_agent");
        serializer = JsonStateSerializer.of(EntryAgentState.class, 0);
    }

    private void writeGeneration(int gen, EntryAgentState state, int version) {
        writer.write(files.generation(gen), codec.encode(new StateBlob(version, 1000L + gen, serializer.encode(state))));
    }

    private void writeGeneration(int gen, EntryAgentState state) {
        writeGeneration(gen, state, 0);
    }

    private void writeRawPayload(int gen, String payload) {
        writer.write(files.generation(gen),
                codec.encode(new StateBlob(0, 1L, payload.getBytes(StandardCharsets.UTF_8))));
    }

    /** Flips one bit of the last signature byte, in place. */
    private void corruptLastByte(Path path) throws Exception {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long pos = ch.size() - 1;
            ByteBuffer one = ByteBuffer.allocate(1);
            ch.read(one, pos);
            one.flip();
            byte b = one.get();
            ch.write(ByteBuffer.wrap(new byte[]{(byte) (b ^ 0x01)}), pos);
        }
    }

    // =====================================================================
    // Newest-first selection
    // =====================================================================

    @Test
    void testLoad_NothingOnDisk() {
        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertFalse(result.found());
        assertEquals(-1, result.generationUsed());
        assertTrue(result.failure().isEmpty());
        assertFalse(result.lost());
        assertEquals(4, result.attempts().size());
        assertTrue(result.attempts().stream().allMatch(a -> a.outcome() == Outcome.MISSING));
    }

    @Test
    void testLoad_MainPreferred() {
        writeGeneration(1, new EntryAgentState(1, 0.5));
        writeGeneration(0, new EntryAgentState(12345, 0.15));

        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertTrue(result.found());
        assertEquals(0, result.generationUsed());
        assertEquals(new EntryAgentState(12345, 0.15), result.state().orElseThrow());
        assertEquals(1000L, result.savedAtEpochSeconds());
        assertFalse(result.recoveredFromBackup());
        assertFalse(result.migrated());
    }

    @Test
    @DisplayName("Corrupt main falls back to generation 1")
    void testLoad_CorruptMainFallsBack() throws Exception {
        writeGeneration(1, new EntryAgentState(100, 0.3));
        writeGeneration(0, new EntryAgentState(200, 0.2));
        corruptLastByte(files.main());

        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertTrue(result.found());
        assertEquals(1, result.generationUsed());
        assertTrue(result.recoveredFromBackup());
        assertEquals(new EntryAgentState(100, 0.3), result.state().orElseThrow());
        assertEquals(Outcome.INTEGRITY_FAILED, result.attempts().get(0).outcome());
        assertEquals(Outcome.RECOVERED, result.attempts().get(1).outcome());
    }

    @Test
    void testLoad_SkipsMissingAndCorruptToOldest() throws Exception {
        writeGeneration(3, new EntryAgentState(3, 0.9));
        writeGeneration(2, new EntryAgentState(2, 0.8));
        corruptLastByte(files.generation(2));
        Files.write(files.main(), new byte[]{1, 2, 3});

        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertEquals(3, result.generationUsed());
        assertEquals(3L, result.state().orElseThrow().totalUpdates());
        assertEquals(Outcome.INTEGRITY_FAILED, result.attempts().get(0).outcome());
        assertEquals(Outcome.MISSING, result.attempts().get(1).outcome());
        assertEquals(Outcome.INTEGRITY_FAILED, result.attempts().get(2).outcome());
    }

    @Test
    @DisplayName("Every generation present but corrupt is reported as unrecoverable")
    void testLoad_AllCorrupt() throws Exception {
        for (int gen = 0; gen <= 3; gen++) {
            writeGeneration(gen, new EntryAgentState(gen, 0.1));
            corruptLastByte(files.generation(gen));
        }

        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertFalse(result.found());
        assertTrue(result.lost());
        assertEquals(ErrorCode.UNRECOVERABLE, result.failure().orElseThrow());
    }

    @Test
    void testLoad_UnreadableGenerationSkipped() throws Exception {
        Files.createDirectory(files.main());
        writeGeneration(1, new EntryAgentState(7, 0.7));

        RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

        assertEquals(1, result.generationUsed());
        assertEquals(Outcome.UNREADABLE, result.attempts().get(0).outcome());
    }

    // =====================================================================
    // Payload and schema failures
    // =====================================================================

    @Nested
    @DisplayName("Payload failures")
    class PayloadFailures {

        @Test
        @DisplayName("A signed blob whose payload is not valid JSON is skipped")
        void testLoad_MalformedPayloadSkipped() {
            writeGeneration(1, new EntryAgentState(5, 0.5));
            writeRawPayload(0, "{not json");

            RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

            assertEquals(1, result.generationUsed());
            assertEquals(Outcome.MALFORMED, result.attempts().get(0).outcome());
        }

        @Test
        @DisplayName("A blob newer than the registered schema stops the walk")
        void testLoad_SchemaErrorStopsWalk() {
            writeGeneration(1, new EntryAgentState(5, 0.5), 0);
            writeGeneration(0, new EntryAgentState(6, 0.6), 4);

            RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

            assertFalse(result.found());
            assertEquals(ErrorCode.SCHEMA_ERROR, result.failure().orElseThrow());
            assertEquals(1, result.attempts().size());
            assertEquals(Outcome.SCHEMA_FAILED, result.attempts().get(0).outcome());
            assertTrue(Files.exists(files.generation(1)));
        }

        @Test
        void testLoad_WrongFieldTypeIsSchemaError() {
            writeRawPayload(0, "{\"total_updates\":\"many\",\"epsilon\":0.1}");

            RecoveryResult<EntryAgentState> result = loader.load(files, serializer);

            assertEquals(ErrorCode.SCHEMA_ERROR, result.failure().orElseThrow());
        }

        @Test
        @DisplayName("A migration step that throws is reported as a schema failure")
        void testLoad_ThrowingMigrationIsSchemaFailure() {
            MigrationChain<JsonNode> chain = MigrationChain.<JsonNode>builder(1)
                    .step(0, node -> ((ObjectNode) node).put("learning_rate", 0.01))
                    .build();
            writeGeneration(1, new EntryAgentState(5, 0.5));
            writeRawPayload(0, "[1, 2]");

            RecoveryResult<EntryAgentState> result =
                    loader.load(files, new JsonStateSerializer<>(EntryAgentState.class, chain));

            assertFalse(result.found());
            assertEquals(ErrorCode.SCHEMA_ERROR, result.failure().orElseThrow());
            assertEquals(Outcome.SCHEMA_FAILED, result.attempts().get(0).outcome());
        }
    }

    // =====================================================================
    // Stale temps and inspection
    // =====================================================================

    @Test
    @DisplayName("Temp files left by an interrupted write are deleted and never loaded")
    void testDeleteStaleTemps() throws Exception {
        writeGeneration(0, new EntryAgentState(1, 0.1));
        Files.write(files.temp(), codec.encode(new StateBlob(0, 9L, serializer.encode(new EntryAgentState(99, 0.9)))));
        Files.write(files.snapshotTemp(), new byte[]{0});

        assertEquals(2, loader.deleteStaleTemps(files));
        assertFalse(Files.exists(files.temp()));
        assertFalse(Files.exists(files.snapshotTemp()));
        assertEquals(1L, loader.load(files, serializer).state().orElseThrow().totalUpdates());
        assertEquals(0, loader.deleteStaleTemps(files));
    }

    @Test
    void testInspect() throws Exception {
        writeGeneration(0, new EntryAgentState(1, 0.1));
        writeGeneration(2, new EntryAgentState(2, 0.2));
        corruptLastByte(files.generation(2));

        ChainReport report = loader.inspect(files);

        assertEquals("entry_agent", report.componentId());
        assertEquals(4, report.generations().size());
        assertEquals(1, report.validCount());
        assertEquals(1, report.corrupt().size());
        assertEquals(2, report.corrupt().get(0).generation());

        ChainReport.GenerationStatus main = report.generations().get(0);
        assertTrue(main.exists());
        assertTrue(main.valid());
        assertEquals(0, main.schemaVersion());
        assertEquals(1000L, main.savedAtEpochSeconds());
        assertEquals(Files.size(files.main()), main.sizeBytes());
        assertFalse(report.generations().get(1).exists());
    }
}
