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

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Key-value store of JSON records.
 * <p>
 * This is the only surface the session, auth and sharing code uses to touch
 * persistent state. Every operation is safe to call from any thread:
 * operations on disjoint keys run in parallel, operations on the same key are
 * serialized by per-key shared/exclusive locks.
 * <p>
 * <b>Critical Contract:</b> a successful {@link #write} or transaction commit
 * has replaced the record file atomically. A reader sees either the old or the
 * new record, never a mix.
 *
 * @see FileRecordStore
 */
public interface RecordStore extends Closeable {

    /**
     * Opens the store. Idempotent.
     */
    void open();

    // ========================================================================
    // Single-key operations
    // ========================================================================

    /**
     * Reads a record under a shared lock.
     *
     * @return the record, or empty if the key has never been written or was removed
     * @throws dev.mars.rystore.storage.secure.IntegrityException      if the file is corrupt
     * @throws dev.mars.rystore.storage.secure.AuthenticationException if the record cannot be decrypted
     * @throws dev.mars.rystore.storage.lock.LockTimeoutException      if the lock wait times out
     */
    <T> Optional<T> read(StorageKey key, Class<T> type);

    /**
     * Reads a record as a JSON tree.
     */
    Optional<JsonNode> read(StorageKey key);

    /**
     * Writes a record under an exclusive lock, creating parent directories as needed.
     *
     * @throws ValidationException if the record is null, not serializable, or too large
     */
    void write(StorageKey key, Object record);

    /**
     * Removes a record. Removing an absent key succeeds.
     */
    void remove(StorageKey key);

    /**
     * Read-modify-write of one record under a single exclusive lock.
     *
     * @return the written record, or empty if the key was absent (nothing is written)
     */
    <T> Optional<T> update(StorageKey key, Class<T> type, UnaryOperator<T> fn);

    // ========================================================================
    // Listing
    // ========================================================================

    /**
     * Lists every key at or below {@code prefix}, sorted. Each call reflects
     * the current directory tree. An unknown prefix yields an empty list.
     */
    List<StorageKey> list(List<String> prefix);

    /**
     * Lazily walks the keys below {@code prefix}, unsorted.
     * <p>
     * The stream holds open directory handles and must be closed.
     */
    Stream<StorageKey> stream(List<String> prefix);

    // ========================================================================
    // Transactions & maintenance
    // ========================================================================

    /**
     * Starts a multi-key transaction. Close it in try-with-resources; an
     * uncommitted transaction is rolled back on close.
     */
    Transaction beginTransaction();

    /**
     * Re-writes every record not yet encrypted through the encrypted path.
     *
     * @return number of records migrated
     * @throws StorageException if no encryption key is configured
     */
    int migrateToEncrypted();

    @Override
    void close();
}
