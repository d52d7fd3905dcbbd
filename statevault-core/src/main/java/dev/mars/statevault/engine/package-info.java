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
/**
 * Host-facing persistence coordination.
 * <p>
 * {@link dev.mars.statevault.engine.PersistenceCoordinator} owns one state root and
 * drives, per component:
 * <ul>
 *   <li>the save state machine {@code CLEAN -> DIRTY -> SAVING -> {CLEAN | DIRTY}}</li>
 *   <li>the startup state machine {@code UNLOADED -> LOADING -> {LOADED | LOADED_DEGRADED | FRESH}}</li>
 *   <li>cadence ({@link dev.mars.statevault.engine.CadencePolicy}) and priority
 *       ({@link dev.mars.statevault.engine.Priority}) under the
 *       {@link dev.mars.statevault.engine.SpaceGuard} budget</li>
 * </ul>
 * The coordinator is an explicit value owned by the host's top-level context, not a
 * singleton; one coordinator per state root.
 */
package dev.mars.statevault.engine;
