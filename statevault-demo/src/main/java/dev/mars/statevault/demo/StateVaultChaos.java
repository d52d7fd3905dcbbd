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
package dev.mars.statevault.demo;

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultConfig;
import dev.mars.statevault.demo.DemoStates.EntryAgentState;
import dev.mars.statevault.demo.DemoStates.ReplayBufferState;
import dev.mars.statevault.engine.CheckpointReport;
import dev.mars.statevault.engine.ComponentDescriptor;
import dev.mars.statevault.engine.LoadState;
import dev.mars.statevault.engine.PersistenceCoordinator;
import dev.mars.statevault.schema.JsonStateSerializer;
import dev.mars.statevault.storage.ComponentFiles;
import dev.mars.statevault.storage.RecoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chaos testing for the state vault.
 * <p>
 * Every scenario damages the state directory the way a crash, a bad disk or a
 * careless operator would, then checks that the next load returns either the
 * newest intact state or a clean fresh start, never wrong data:
 * <ul>
 *   <li>Bit flips in main and in every generation</li>
 *   <li>Torn temp files from a crash mid-write</li>
 *   <li>Crashes between the renames of a rotation</li>
 *   <li>Free space squeezed below the save budget</li>
 *   <li>Blobs from another installation and from a newer build</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl statevault-demo -am
 *
 * # Run all chaos scenarios
 * java -cp statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar dev.mars.statevault.demo.StateVaultChaos
 *
 * # Run one group
 * java -cp statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar dev.mars.statevault.demo.StateVaultChaos corruption
 * java -cp statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar dev.mars.statevault.demo.StateVaultChaos crash
 * java -cp statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar dev.mars.statevault.demo.StateVaultChaos space
 * java -cp statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar dev.mars.statevault.demo.StateVaultChaos stress
 * </pre>
 *
 * @see PersistenceCoordinator
 */
public class StateVaultChaos {

    private static final Logger LOG = LoggerFactory.getLogger(StateVaultChaos.class);

    private static final String AGENT = StateVaultDemo.ENTRY_AGENT;
    private static final String BUFFER = StateVaultDemo.REPLAY_BUFFER;

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public StateVaultChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------------------------------+");
        System.out.println("|              STATE VAULT CHAOS TESTING                        |");
        System.out.println("+---------------------------------------------------------------+");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("statevault-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());

        StateVaultChaos chaos = new StateVaultChaos(chaosDir);
        String filter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (filter) {
                case "corruption" -> chaos.runCorruptionTests();
                case "crash" -> chaos.runCrashTests();
                case "space" -> chaos.runSpaceTests();
                case "stress" -> chaos.runStressTests();
                case "all" -> {
                    chaos.runCorruptionTests();
                    chaos.runCrashTests();
                    chaos.runSpaceTests();
                    chaos.runStressTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + filter);
                    System.err.println("Available: corruption, crash, space, stress, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.printf("RESULTS: %d passed, %d failed%n", chaos.testsPassed.get(), chaos.testsFailed.get());
            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CORRUPTION
    // =========================================================================

    private void runCorruptionTests() {
        printSection("CORRUPTION");

        chaosTest("Flipped signature byte in main", this::corruptMainSignature);
        chaosTest("Random byte flips (200 rounds)", this::randomByteFlips);
        chaosTest("Every generation corrupt", this::everyGenerationCorrupt);
        chaosTest("Main truncated to zero bytes", this::mainTruncated);
        chaosTest("Blob from another installation", this::foreignInstallation);
        chaosTest("Blob from a newer build", this::newerBuild);
    }

    private void corruptMainSignature() throws Exception {
        Path dir = createTestDir("corrupt-main");
        withCoordinator(dir, c -> {
            c.save(AGENT, new EntryAgentState(100, 0.3));
            c.save(AGENT, new EntryAgentState(200, 0.2));
        });
        flipByte(files(dir).main(), -1);

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.generationUsed() == 1, "expected generation 1, got " + result.generationUsed());
            check(result.state().orElseThrow().totalUpdates() == 100, "wrong state from backup");
            check(c.loadState(AGENT) == LoadState.LOADED_DEGRADED, "expected degraded load");
        });
    }

    private void randomByteFlips() throws Exception {
        Path dir = createTestDir("random-flips");
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int round = 0; round < 200; round++) {
            long older = round * 2L;
            long newer = older + 1;
            withCoordinator(dir, c -> {
                c.save(AGENT, new EntryAgentState(older, 0.5));
                c.save(AGENT, new EntryAgentState(newer, 0.5));
            });
            Path main = files(dir).main();
            flipByte(main, random.nextInt((int) Files.size(main)));

            final int r = round;
            withCoordinator(dir, c -> {
                RecoveryResult<EntryAgentState> result = c.load(AGENT);
                check(result.generationUsed() == 1, "round " + r + ": flipped main was accepted");
                check(result.state().orElseThrow().totalUpdates() == older, "round " + r + ": wrong backup state");
            });
        }
    }

    private void everyGenerationCorrupt() throws Exception {
        Path dir = createTestDir("all-corrupt");
        withCoordinator(dir, c -> {
            for (int i = 0; i < 6; i++) {
                c.save(AGENT, new EntryAgentState(i, 0.5));
            }
        });
        for (Path path : files(dir).chain()) {
            flipByte(path, 20);
        }

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.lost(), "expected lost state");
            check(result.failure().orElseThrow() == ErrorCode.UNRECOVERABLE, "expected UNRECOVERABLE");
            check(c.loadState(AGENT) == LoadState.FRESH, "expected FRESH");
        });
    }

    private void mainTruncated() throws Exception {
        Path dir = createTestDir("truncated");
        withCoordinator(dir, c -> {
            c.save(AGENT, new EntryAgentState(1, 0.5));
            c.save(AGENT, new EntryAgentState(2, 0.5));
        });
        Files.write(files(dir).main(), new byte[0]);

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.state().orElseThrow().totalUpdates() == 1, "expected state from backup");
        });
    }

    private void foreignInstallation() throws Exception {
        Path dir = createTestDir("foreign");
        withCoordinator(dir, c -> c.save(AGENT, new EntryAgentState(1, 0.5)));
        Files.delete(dir.resolve("statevault.key"));

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(!result.found(), "blob signed under another key was accepted");
        });
    }

    private void newerBuild() throws Exception {
        Path dir = createTestDir("newer-build");
        PersistenceCoordinator newer = new PersistenceCoordinator(config(dir));
        newer.register(ComponentDescriptor.builder(AGENT, JsonStateSerializer.of(EntryAgentState.class, 5)).build());
        newer.save(AGENT, new EntryAgentState(1, 0.5));

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.failure().orElseThrow() == ErrorCode.SCHEMA_ERROR, "expected SCHEMA_ERROR");
            check(Files.exists(files(dir).main()), "newer blob must be left on disk");
        });
    }

    // =========================================================================
    // CRASH SIMULATION
    // =========================================================================

    private void runCrashTests() {
        printSection("CRASH SIMULATION");

        chaosTest("Torn temp file left by crash mid-write", this::tornTemp);
        chaosTest("Crash after rotation, before commit", this::crashBeforeCommit);
        chaosTest("Crash between rotation renames", this::crashMidRotation);
        chaosTest("Process killed without shutdown pass", this::killedWithoutShutdown);
    }

    private void tornTemp() throws Exception {
        Path dir = createTestDir("torn-temp");
        withCoordinator(dir, c -> c.save(AGENT, new EntryAgentState(7, 0.5)));
        byte[] main = Files.readAllBytes(files(dir).main());
        Files.write(files(dir).temp(), Arrays.copyOf(main, main.length / 2));

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.generationUsed() == 0, "expected main");
            check(result.state().orElseThrow().totalUpdates() == 7, "wrong state");
            check(!Files.exists(files(dir).temp()), "stale temp not deleted");
        });
    }

    private void crashBeforeCommit() throws Exception {
        Path dir = createTestDir("crash-before-commit");
        withCoordinator(dir, c -> {
            c.save(AGENT, new EntryAgentState(1, 0.5));
            c.save(AGENT, new EntryAgentState(2, 0.5));
        });
        // main was rotated away and the new temp never renamed
        ComponentFiles files = files(dir);
        Files.move(files.generation(1), files.generation(2), StandardCopyOption.REPLACE_EXISTING);
        Files.move(files.main(), files.generation(1));
        Files.write(files.temp(), new byte[]{0x01, 0x02, 0x03});

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.generationUsed() == 1, "expected generation 1, got " + result.generationUsed());
            check(result.state().orElseThrow().totalUpdates() == 2, "expected the last committed state");
        });
    }

    private void crashMidRotation() throws Exception {
        Path dir = createTestDir("crash-mid-rotation");
        withCoordinator(dir, c -> {
            for (int i = 1; i <= 3; i++) {
                c.save(AGENT, new EntryAgentState(i, 0.5));
            }
        });
        // gen2 -> gen3 done, gen1 -> gen2 not yet: gen2 and gen3 hold the same blob
        ComponentFiles files = files(dir);
        Files.copy(files.generation(2), files.generation(3));

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.state().orElseThrow().totalUpdates() == 3, "expected main");
            c.save(AGENT, new EntryAgentState(4, 0.5));
        });
        withCoordinator(dir, c -> {
            check(c.inspect(AGENT).validCount() == 4, "chain should be full and valid");
            check(c.<EntryAgentState>load(AGENT).state().orElseThrow().totalUpdates() == 4, "expected newest");
        });
    }

    private void killedWithoutShutdown() throws Exception {
        Path dir = createTestDir("killed");
        withCoordinator(dir, c -> {
            c.save(AGENT, new EntryAgentState(10, 0.5));
            // mutated after the last save; lost when the process dies
            c.update(AGENT, new EntryAgentState(11, 0.5));
        });

        withCoordinator(dir, c -> {
            RecoveryResult<EntryAgentState> result = c.load(AGENT);
            check(result.state().orElseThrow().totalUpdates() == 10, "expected the last saved state");
        });
    }

    // =========================================================================
    // SPACE PRESSURE
    // =========================================================================

    private void runSpaceTests() {
        printSection("SPACE PRESSURE");

        chaosTest("Budget one byte short of all estimates", this::budgetOneByteShort);
        chaosTest("Free space below reserve", this::belowReserve);
    }

    private void budgetOneByteShort() throws Exception {
        Path dir = createTestDir("one-byte-short");
        AtomicLong free = new AtomicLong(Long.MAX_VALUE);
        StateVaultConfig config = StateVaultConfig.builder().stateDir(dir).syncEnabled(false).reserveBytes(1_000).build();
        PersistenceCoordinator c = new PersistenceCoordinator(config, null, path -> free.get(), Clock.systemUTC());
        StateVaultDemo.register(c);

        free.set(1_000 + c.estimatedBytes(AGENT) + c.estimatedBytes(BUFFER) - 1);
        c.update(AGENT, new EntryAgentState(1, 0.5));
        c.update(BUFFER, ReplayBufferState.empty(10).add(0.5));
        CheckpointReport report = c.shutdown();

        check(report.savedIds().equals(List.of(AGENT)), "critical component not saved: " + report.savedIds());
        check(report.skippedIds().equals(List.of(BUFFER)), "low priority not skipped: " + report.skippedIds());

        free.set(Long.MAX_VALUE);
        check(c.shutdown().savedIds().equals(List.of(BUFFER)), "skipped component not retried");
    }

    private void belowReserve() throws Exception {
        Path dir = createTestDir("below-reserve");
        StateVaultConfig config = StateVaultConfig.builder().stateDir(dir).syncEnabled(false).reserveBytes(1_000).build();
        PersistenceCoordinator c = new PersistenceCoordinator(config, null, path -> 999L, Clock.systemUTC());
        StateVaultDemo.register(c);

        c.update(AGENT, new EntryAgentState(1, 0.5));
        CheckpointReport report = c.shutdown();

        check(report.spaceError(), "expected a space error");
        check(report.skippedIds().equals(List.of(AGENT)), "critical must be skipped below reserve");
        check(!Files.exists(files(dir).main()), "nothing may be written below reserve");
    }

    // =========================================================================
    // STRESS
    // =========================================================================

    private void runStressTests() {
        printSection("STRESS");

        chaosTest("1000 saves keep a four-deep chain", this::manySaves);
        chaosTest("Restart after every save (100 cycles)", this::restartCycles);
    }

    private void manySaves() throws Exception {
        Path dir = createTestDir("many-saves");
        withCoordinator(dir, c -> {
            EntryAgentState state = EntryAgentState.initial();
            for (int i = 0; i < 1000; i++) {
                state = state.learn();
                check(c.save(AGENT, state).saved(), "save " + i + " failed");
            }
            check(c.inspect(AGENT).validCount() == 4, "expected four generations");
        });
        withCoordinator(dir, c -> check(
                c.<EntryAgentState>load(AGENT).state().orElseThrow().totalUpdates() == 1000, "expected 1000 updates"));
    }

    private void restartCycles() throws Exception {
        Path dir = createTestDir("restart-cycles");
        for (int cycle = 1; cycle <= 100; cycle++) {
            final long expected = cycle - 1;
            withCoordinator(dir, c -> {
                RecoveryResult<EntryAgentState> result = c.load(AGENT);
                long current = result.state().map(EntryAgentState::totalUpdates).orElse(0L);
                check(current == expected, "expected " + expected + " updates, found " + current);
                c.update(AGENT, new EntryAgentState(current + 1, 0.5));
                check(c.shutdown().allSaved(), "shutdown pass incomplete");
            });
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private static StateVaultConfig config(Path dir) {
        return StateVaultConfig.builder().stateDir(dir).syncEnabled(false).reserveBytes(0).build();
    }

    private static ComponentFiles files(Path dir) {
        return new ComponentFiles(dir, AGENT);
    }

    private static void withCoordinator(Path dir, CoordinatorAction action) throws Exception {
        PersistenceCoordinator coordinator = new PersistenceCoordinator(config(dir));
        StateVaultDemo.register(coordinator);
        action.run(coordinator);
    }

    /** XORs the byte at {@code offset}; a negative offset counts from the end. */
    private static void flipByte(Path path, long offset) throws IOException {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long pos = offset < 0 ? ch.size() + offset : offset;
            ByteBuffer buf = ByteBuffer.allocate(1);
            ch.read(buf, pos);
            buf.flip();
            ch.write(ByteBuffer.wrap(new byte[]{(byte) (buf.get() ^ 0xFF)}), pos);
        }
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new AssertionError(message);
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("+---------------------------------------------------------------+");
        System.out.printf("|  %-61s|%n", name);
        System.out.println("+---------------------------------------------------------------+");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(StateVaultChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", path, e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }

    @FunctionalInterface
    interface CoordinatorAction {
        void run(PersistenceCoordinator coordinator) throws Exception;
    }
}
