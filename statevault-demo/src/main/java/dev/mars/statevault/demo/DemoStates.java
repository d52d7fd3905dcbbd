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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Host component states used by the demo applications.
 */
public final class DemoStates {

    private DemoStates() {
    }

    /** Learned counters of the entry agent. */
    public record EntryAgentState(@JsonProperty("total_updates") long totalUpdates, double epsilon) {

        public static EntryAgentState initial() {
            return new EntryAgentState(0, 1.0);
        }

        /** One learning step: count the update and decay exploration. */
        public EntryAgentState learn() {
            return new EntryAgentState(totalUpdates + 1, Math.max(0.05, epsilon * 0.995));
        }
    }

    /** Bounded buffer of recent rewards. */
    public record ReplayBufferState(List<Double> rewards, int capacity) {

        public static ReplayBufferState empty(int capacity) {
            return new ReplayBufferState(List.of(), capacity);
        }

        public ReplayBufferState add(double reward) {
            List<Double> next = new ArrayList<>(rewards);
            next.add(reward);
            while (next.size() > capacity) {
                next.remove(0);
            }
            return new ReplayBufferState(List.copyOf(next), capacity);
        }
    }
}
