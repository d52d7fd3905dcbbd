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
 * File-level persistence primitives.
 * <p>
 * This package provides the on-disk half of the state vault:
 * <ul>
 *   <li>{@link dev.mars.statevault.storage.IntegrityVerifier} - HMAC signing and constant-time verification</li>
 *   <li>{@link dev.mars.statevault.storage.BlobCodec} - the signed blob layout</li>
 *   <li>{@link dev.mars.statevault.storage.AtomicWriter} - write, verify, rename</li>
 *   <li>{@link dev.mars.statevault.storage.BackupRotator} - generational backup shifting</li>
 *   <li>{@link dev.mars.statevault.storage.RecoveryLoader} - newest-first recovery across the chain</li>
 *   <li>{@link dev.mars.statevault.storage.SnapshotStore} - unsigned lightweight snapshots</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>All-or-nothing:</b> a main file is either absent or a complete, verified blob</li>
 *   <li><b>Never rewrite in place:</b> blobs are only created and renamed, never edited</li>
 *   <li><b>Degrade, don't fail:</b> an unusable generation only moves recovery one slot older</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * state/
 *  ├─ statevault.key   // installation signing key
 *  ├─ EntryAgent       // main blob
 *  ├─ EntryAgent.bak1  // previous save
 *  ├─ EntryAgent.bak2
 *  └─ EntryAgent.bak3
 * </pre>
 *
 * @see dev.mars.statevault.engine.PersistenceCoordinator
 */
package dev.mars.statevault.storage;
