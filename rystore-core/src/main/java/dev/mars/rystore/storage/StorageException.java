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
package dev.mars.rystore.storage;

/**
 * Base exception for all record store failures.
 * <p>
 * Plain instances signal I/O failures and interrupted lock waits. The
 * subclasses carry the distinct failure kinds callers are expected to
 * tell apart:
 * <ul>
 *   <li>{@link ValidationException} - rejected before any I/O</li>
 *   <li>{@link dev.mars.rystore.storage.lock.LockTimeoutException} - bounded wait exceeded, retryable</li>
 *   <li>{@link dev.mars.rystore.storage.secure.IntegrityException} - stored bytes are corrupt</li>
 *   <li>{@link dev.mars.rystore.storage.secure.AuthenticationException} - wrong key or tampered ciphertext</li>
 *   <li>{@link TransactionFinalizedException} - call on a committed or rolled back transaction</li>
 *   <li>{@link PartialCommitException} - apply failed after validation passed</li>
 * </ul>
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
