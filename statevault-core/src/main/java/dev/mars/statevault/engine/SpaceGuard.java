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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which components fit in the space budget for one checkpoint cycle.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>If free space does not even cover the reserve, admit nothing and flag a space error</li>
 *   <li>Sort candidates by priority, most critical first (stable for equal priorities)</li>
 *   <li>{@link Priority#CRITICAL} candidates are always admitted</li>
 *   <li>Other candidates are admitted while {@code reserve + admitted bytes + estimate <= free};
 *       the first one that does not fit ends admission for the rest of the cycle</li>
 * </ol>
 * Skipped components stay dirty and are retried on the next cycle.
 */
public final class SpaceGuard {

    private static final Logger LOG = LoggerFactory.getLogger(SpaceGuard.class);

    /**
     * One component asking to be saved.
     *
     * @param id             component id
     * @param priority       priority tier
     * @param estimatedBytes bytes the save is expected to need
     */
    public record Candidate(String id, Priority priority, long estimatedBytes) {
    }

    /**
     * Result of {@link #admit}.
     *
     * @param admitted   ids to save this cycle, in admission order
     * @param skipped    ids deferred to the next cycle
     * @param spaceError true when even the reserve could not be covered
     */
    public record Admission(List<String> admitted, List<String> skipped, boolean spaceError) {
        public Admission {
            admitted = List.copyOf(admitted);
            skipped = List.copyOf(skipped);
        }

        public boolean isAdmitted(String id) {
            return admitted.contains(id);
        }
    }

    public Admission admit(List<Candidate> candidates, SpaceBudget budget) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(Candidate::priority));

        List<String> admitted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        if (!budget.coversReserve()) {
            sorted.forEach(c -> skipped.add(c.id()));
            if (!skipped.isEmpty()) {
                LOG.error("SPACE ERROR: {} bytes free, reserve is {} bytes; skipping all saves: {}",
                        budget.freeBytes(), budget.reserveBytes(), skipped);
            }
            return new Admission(admitted, skipped, true);
        }

        long used = budget.reserveBytes();
        boolean cutOff = false;
        for (Candidate candidate : sorted) {
            if (candidate.priority() == Priority.CRITICAL) {
                admitted.add(candidate.id());
                used = saturatedAdd(used, candidate.estimatedBytes());
                continue;
            }
            long next = saturatedAdd(used, candidate.estimatedBytes());
            if (!cutOff && next <= budget.freeBytes()) {
                admitted.add(candidate.id());
                used = next;
            } else {
                cutOff = true;
                skipped.add(candidate.id());
            }
        }

        if (!skipped.isEmpty()) {
            LOG.warn("Space budget tight ({} bytes free, {} reserved): saved {}, skipped {} until next cycle",
                    budget.freeBytes(), budget.reserveBytes(), admitted, skipped);
        }
        return new Admission(admitted, skipped, false);
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
