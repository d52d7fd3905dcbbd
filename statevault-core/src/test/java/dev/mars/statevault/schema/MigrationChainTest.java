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
package dev.mars.statevault.schema;

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MigrationChain}.
 */
class MigrationChainTest {

    private static MigrationChain<List<String>> recordingChain(int current) {
        MigrationChain.Builder<List<String>> builder = MigrationChain.builder(current);
        for (int v = 0; v < current; v++) {
            final int from = v;
            builder.step(v, list -> {
                List<String> next = new ArrayList<>(list);
                next.add(from + "->" + (from + 1));
                return next;
            });
        }
        return builder.build();
    }

    @Test
    @DisplayName("Current-version payload passes through untouched")
    void testMigrate_CurrentVersionIsIdentity() {
        MigrationChain<List<String>> chain = recordingChain(3);
        List<String> payload = List.of("original");

        MigrationChain.Migrated<List<String>> result = chain.migrate(payload, 3);

        assertSame(payload, result.value());
        assertEquals(0, result.stepsApplied());
        assertFalse(result.migrated());
    }

    @Test
    @DisplayName("Steps run in ascending order from the stored version")
    void testMigrate_StepsInOrder() {
        MigrationChain<List<String>> chain = recordingChain(3);

        MigrationChain.Migrated<List<String>> result = chain.migrate(List.of(), 0);

        assertEquals(List.of("0->1", "1->2", "2->3"), result.value());
        assertEquals(0, result.fromVersion());
        assertEquals(3, result.toVersion());
        assertEquals(3, result.stepsApplied());
        assertTrue(result.migrated());
    }

    @Test
    void testMigrate_PartialPath() {
        MigrationChain.Migrated<List<String>> result = recordingChain(3).migrate(List.of(), 2);

        assertEquals(List.of("2->3"), result.value());
    }

    @Test
    void testMigrate_NewerVersionRejected() {
        StateVaultException e = assertThrows(StateVaultException.class,
                () -> recordingChain(2).migrate(List.of(), 3));

        assertEquals(ErrorCode.SCHEMA_ERROR, e.errorCode());
        assertFalse(e.errorCode().recoverable());
    }

    @Test
    void testMigrate_NegativeVersionRejected() {
        StateVaultException e = assertThrows(StateVaultException.class,
                () -> recordingChain(2).migrate(List.of(), -1));

        assertEquals(ErrorCode.SCHEMA_ERROR, e.errorCode());
    }

    @Test
    @DisplayName("A hole in the chain is a schema error, not a partial migration")
    void testMigrate_MissingStep() {
        MigrationChain<String> chain = MigrationChain.<String>builder(3)
                .step(0, s -> s + "a")
                .step(2, s -> s + "c")
                .build();

        assertFalse(chain.isTotal());
        assertEquals(2, chain.size());
        assertEquals("xc", chain.migrate("x", 2).value());
        StateVaultException e = assertThrows(StateVaultException.class, () -> chain.migrate("x", 0));
        assertEquals(ErrorCode.SCHEMA_ERROR, e.errorCode());
        assertTrue(e.getMessage().contains("1 to 2"));
    }

    @Test
    @DisplayName("A step that throws surfaces as a schema error")
    void testMigrate_FailingStepIsSchemaError() {
        MigrationChain<String> chain = MigrationChain.<String>builder(2)
                .step(0, s -> s + "a")
                .step(1, s -> {
                    throw new IllegalStateException("field 'epsilon' missing");
                })
                .build();

        StateVaultException e = assertThrows(StateVaultException.class, () -> chain.migrate("x", 0));

        assertEquals(ErrorCode.SCHEMA_ERROR, e.errorCode());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("1 to 2"));
    }

    @Test
    void testNone() {
        MigrationChain<String> chain = MigrationChain.none(0);

        assertTrue(chain.isTotal());
        assertEquals("x", chain.migrate("x", 0).value());
        assertThrows(StateVaultException.class, () -> MigrationChain.<String>none(1).migrate("x", 0));
    }

    @Test
    void testBuilder_RejectsDuplicateAndOutOfRange() {
        MigrationChain.Builder<String> builder = MigrationChain.<String>builder(2).step(0, s -> s);

        assertThrows(IllegalArgumentException.class, () -> builder.step(0, s -> s));
        assertThrows(IllegalArgumentException.class, () -> builder.step(2, s -> s));
        assertThrows(IllegalArgumentException.class, () -> builder.step(-1, s -> s));
        assertThrows(IllegalArgumentException.class, () -> MigrationChain.builder(-1));
    }

    @Test
    void testIsTotal() {
        assertTrue(recordingChain(4).isTotal());
        assertEquals(4, recordingChain(4).currentVersion());
    }
}
