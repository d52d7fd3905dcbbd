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

import dev.mars.statevault.StateVaultConfig;
import dev.mars.statevault.demo.DemoStates.EntryAgentState;
import dev.mars.statevault.demo.DemoStates.ReplayBufferState;
import dev.mars.statevault.engine.CadencePolicy;
import dev.mars.statevault.engine.CheckpointReport;
import dev.mars.statevault.engine.ComponentDescriptor;
import dev.mars.statevault.engine.PersistenceCoordinator;
import dev.mars.statevault.engine.Priority;
import dev.mars.statevault.schema.JsonStateSerializer;
import dev.mars.statevault.storage.ChainReport;
import dev.mars.statevault.storage.RecoveryResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Demo entry point for the state vault.
 * <p>
 * Simulates a host with two components across process restarts:
 * <ul>
 *   <li>Recovering each component from its backup chain</li>
 *   <li>Mutating state and saving on cadence at each checkpoint</li>
 *   <li>Writing a lightweight snapshot of the replay buffer</li>
 *   <li>A final save pass at shutdown</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StateVaultConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (state directory only)</li>
 *   <li>System properties: {@code -Dstatevault.stateDir=/path -Dstatevault.reserveMb=16 ...}</li>
 *   <li>Environment variables: {@code STATEVAULT_STATE_DIR, STATEVAULT_RESERVE_MB, ...}</li>
 *   <li>Properties file: {@code statevault.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl statevault-demo -am
 *
 * # Run with default configuration
 * java -jar statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI state directory override
 * java -jar statevault-demo/target/statevault-demo-1.0-SNAPSHOT.jar /path/to/state
 * </pre>
 *
 * @see StateVaultConfig
 */
public class StateVaultDemo {

    static final String ENTRY_AGENT = "EntryAgent";
    static final String REPLAY_BUFFER = "ReplayBuffer";

    private static final int TICKS = 25;

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|          State Vault Demo             |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        StateVaultConfig config = args.length > 0 && !args[0].isBlank()
                ? StateVaultConfig.builder().stateDir(args[0]).build()
                : StateVaultConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        PersistenceCoordinator coordinator = new PersistenceCoordinator(config);
        register(coordinator);

        EntryAgentState agent = recover(coordinator, ENTRY_AGENT, EntryAgentState.initial());
        ReplayBufferState buffer = recover(coordinator, REPLAY_BUFFER, ReplayBufferState.empty(50));
        coordinator.<ReplayBufferState>loadSnapshot(REPLAY_BUFFER).ifPresent(snap ->
                System.out.println("[OK] Last snapshot of " + REPLAY_BUFFER + " holds " + snap.rewards().size() + " rewards"));

        System.out.println();
        System.out.println("  Running " + TICKS + " ticks from total_updates=" + agent.totalUpdates());
        int saved = 0;
        for (int tick = 1; tick <= TICKS; tick++) {
            agent = agent.learn();
            buffer = buffer.add(ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
            coordinator.update(ENTRY_AGENT, agent);
            coordinator.update(REPLAY_BUFFER, buffer);

            CheckpointReport report = coordinator.checkpoint();
            saved += report.savedIds().size();
            if (!report.skippedIds().isEmpty()) {
                System.out.println("  [WARN] tick " + tick + ": skipped " + report.skippedIds());
            }
            if (tick % 5 == 0) {
                coordinator.saveSnapshot(REPLAY_BUFFER, buffer);
            }
        }
        System.out.println("[OK] " + saved + " scheduled saves during the run");

        CheckpointReport finalPass = coordinator.shutdown();
        System.out.println("[OK] Shutdown pass saved " + finalPass.savedIds()
                + (finalPass.allSaved() ? "" : ", incomplete: skipped=" + finalPass.skippedIds()
                + " failed=" + finalPass.failedIds()));

        System.out.println();
        printChain(coordinator.inspect(ENTRY_AGENT));
        printChain(coordinator.inspect(REPLAY_BUFFER));

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  State vault demo complete!           |");
        System.out.println("|  Run again to see state recovered.    |");
        System.out.println("+---------------------------------------+");
    }

    static void register(PersistenceCoordinator coordinator) {
        coordinator.register(ComponentDescriptor.builder(ENTRY_AGENT, JsonStateSerializer.of(EntryAgentState.class, 0))
                .priority(Priority.CRITICAL)
                .cadence(CadencePolicy.everyMutations(10).orEvery(Duration.ofMinutes(60)))
                .estimatedSizeBytes(256)
                .build());
        coordinator.register(ComponentDescriptor.builder(REPLAY_BUFFER, JsonStateSerializer.of(ReplayBufferState.class, 0))
                .priority(Priority.LOW)
                .cadence(CadencePolicy.shutdownOnly())
                .estimatedSizeBytes(4096)
                .build());
    }

    private static <T> T recover(PersistenceCoordinator coordinator, String id, T initial) {
        RecoveryResult<T> result = coordinator.load(id);
        if (result.found()) {
            System.out.println("[OK] " + id + " recovered from generation " + result.generationUsed()
                    + (result.recoveredFromBackup() ? " (recovered from backup)" : "")
                    + (result.migrated() ? " (migrated from v" + result.fromVersion() + ")" : ""));
            return result.state().orElseThrow();
        }
        if (result.lost()) {
            System.out.println("[WARN] " + id + " could not be recovered (" + result.failure().orElseThrow()
                    + "), starting fresh");
        } else {
            System.out.println("[OK] " + id + " has no saved state, starting fresh");
        }
        coordinator.update(id, initial);
        return initial;
    }

    private static void printChain(ChainReport report) {
        System.out.println("  " + report.componentId() + ":");
        for (ChainReport.GenerationStatus g : report.generations()) {
            if (!g.exists()) {
                continue;
            }
            System.out.printf("    gen%d  %6d bytes  v%d  savedAt=%d  %s%n", g.generation(), g.sizeBytes(),
                    g.schemaVersion(), g.savedAtEpochSeconds(), g.valid() ? "OK" : "CORRUPT");
        }
    }
}
