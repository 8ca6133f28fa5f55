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
 * Record Store Layer - file-backed JSON key-value store with transactions.
 * <p>
 * This package provides the persistence core used by the session, auth and
 * sharing subsystems:
 * <ul>
 *   <li>{@link dev.mars.rystore.storage.RecordStore} - The store interface</li>
 *   <li>{@link dev.mars.rystore.storage.FileRecordStore} - One-file-per-record implementation</li>
 *   <li>{@link dev.mars.rystore.storage.StorageKey} - Validated hierarchical keys</li>
 *   <li>{@link dev.mars.rystore.storage.Transaction} - Multi-key all-or-nothing updates</li>
 *   <li>{@link dev.mars.rystore.storage.StoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Atomic replace:</b> A record file is never partially written</li>
 *   <li><b>Global lock order:</b> Transactions lock keys sorted by canonical path</li>
 *   <li><b>Checksum first:</b> Corruption is detected before decryption or parsing</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * dataDir/
 *  ├─ .rystore.lock             // process lock
 *  └─ &lt;s1&gt;/.../&lt;sn&gt;.json        // sha256hex:enc1:... or sha256hex:plaintext:{...}
 * </pre>
 *
 * @see dev.mars.rystore.storage.RecordStore
 */
package dev.mars.rystore.storage;
