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
 * Resource Lock Manager - per-resource shared/exclusive locks.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.rystore.storage.lock.ResourceLockManager} - the lock table</li>
 *   <li>{@link dev.mars.rystore.storage.lock.LockHandle} - a scoped grant, released exactly once</li>
 *   <li>{@link dev.mars.rystore.storage.lock.LockDiagnostics} - holder/waiter visibility per resource</li>
 * </ul>
 * <p>
 * Resources are identified by the canonical path of the record file, so two
 * callers naming the same logical key always contend on the same lock.
 */
package dev.mars.rystore.storage.lock;
