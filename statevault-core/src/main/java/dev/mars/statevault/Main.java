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
package dev.mars.statevault;

import dev.mars.statevault.storage.BlobCodec;
import dev.mars.statevault.storage.ChainReport;
import dev.mars.statevault.storage.ChainReport.GenerationStatus;
import dev.mars.statevault.storage.ComponentFiles;
import dev.mars.statevault.storage.IntegrityVerifier;
import dev.mars.statevault.storage.RecoveryLoader;

import java.io.PrintStream;
import java.nio.file.Files;
import java.time.Instant;

/**
 * Prints the integrity of each component's generation chain.
 * <p>
 * Read-only: no file is created, renamed or deleted. A state root without a
 * signing key is reported and exits with status 2.
 *
 * <pre>
 * java -cp statevault-core.jar dev.mars.statevault.Main EntryAgent ReplayBuffer
 * java -Dstatevault.stateDir=/var/lib/agent/state -cp statevault-core.jar dev.mars.statevault.Main EntryAgent
 * </pre>
 */
public class Main {

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: Main <componentId> [componentId...]");
            System.exit(2);
        }
        System.exit(run(StateVaultConfig.load(), args, System.out, System.err));
    }

    /**
     * @return 0 when every generation present is valid, 1 if any is corrupt or an id
     *         is invalid, 2 if the state directory or the signing key is missing
     */
    static int run(StateVaultConfig config, String[] ids, PrintStream out, PrintStream err) {
        if (!Files.isDirectory(config.stateDir())) {
            err.println("State directory does not exist: " + config.stateDir());
            return 2;
        }
        if (!Files.isRegularFile(config.keyFile())) {
            err.println("Signing key not found: " + config.keyFile());
            return 2;
        }
        RecoveryLoader loader = new RecoveryLoader(
                new BlobCodec(IntegrityVerifier.load(config.keyFile()), config.maxPayloadSizeBytes()));

        out.println("State root: " + config.stateDir().toAbsolutePath());
        int corrupt = 0;
        for (String id : ids) {
            if (!ComponentFiles.isValidId(id)) {
                err.println("Not a valid component id: " + id);
                corrupt++;
                continue;
            }
            ChainReport report = loader.inspect(new ComponentFiles(config.stateDir(), id));
            out.printf("%n%s (%d valid generations)%n", id, report.validCount());
            for (GenerationStatus g : report.generations()) {
                if (!g.exists()) {
                    out.printf("  [%d] -%n", g.generation());
                } else if (g.valid()) {
                    out.printf("  [%d] OK       %8d bytes  v%d  saved %s%n", g.generation(), g.sizeBytes(),
                            g.schemaVersion(), Instant.ofEpochSecond(g.savedAtEpochSeconds()));
                } else {
                    out.printf("  [%d] CORRUPT  %8d bytes%n", g.generation(), g.sizeBytes());
                }
            }
            corrupt += report.corrupt().size();
        }
        return corrupt > 0 ? 1 : 0;
    }
}
