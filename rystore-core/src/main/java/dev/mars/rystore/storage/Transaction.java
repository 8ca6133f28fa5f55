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

import dev.mars.rystore.storage.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A set of writes and removes applied together.
 * <p>
 * Staging touches no file. {@link #commit()} locks every touched key in global
 * order, prepares every write, and only then applies the operations:
 * <ul>
 *   <li>Lock timeout: nothing applied, all locks released, transaction stays {@code OPEN}.</li>
 *   <li>Invalid record: nothing applied, all locks released, transaction stays {@code OPEN}.</li>
 *   <li>Failure while applying: {@link PartialCommitException}, state {@code FAILED}.</li>
 * </ul>
 * Once the transaction leaves {@code OPEN}, every staging, commit and rollback
 * call throws {@link TransactionFinalizedException}.
 *
 * <pre>{@code
 * try (Transaction tx = store.beginTransaction()) {
 *     tx.stageWrite(StorageKey.of("session", projectId, sessionId), session);
 *     tx.stageRemove(StorageKey.of("share", sessionId));
 *     tx.commit();
 * }
 * }</pre>
 * Operations on the same key are applied in staging order, so the last one wins.
 */
public final class Transaction implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Transaction.class);

    private final long id;
    private final TransactionManager manager;
    private final FileRecordStore store;
    private final List<StagedOperation> staged = new ArrayList<>();
    private final List<LockHandle> held = new ArrayList<>();
    private TransactionState state = TransactionState.OPEN;

    Transaction(long id, TransactionManager manager, FileRecordStore store) {
        this.id = id;
        this.manager = manager;
        this.store = store;
    }

    public long id() {
        return id;
    }

    public synchronized TransactionState state() {
        return state;
    }

    /** Number of operations staged so far. */
    public synchronized int stagedCount() {
        return staged.size();
    }

    /**
     * Stages a write. The record is serialized at commit time.
     *
     * @throws TransactionFinalizedException if the transaction is no longer open
     */
    public synchronized Transaction stageWrite(StorageKey key, Object record) {
        ensureOpen();
        staged.add(StagedOperation.write(Objects.requireNonNull(key, "key"), record));
        return this;
    }

    /**
     * Stages a remove. Removing an absent key is not an error.
     *
     * @throws TransactionFinalizedException if the transaction is no longer open
     */
    public synchronized Transaction stageRemove(StorageKey key) {
        ensureOpen();
        staged.add(StagedOperation.remove(Objects.requireNonNull(key, "key")));
        return this;
    }

    /**
     * Applies every staged operation.
     *
     * @throws dev.mars.rystore.storage.lock.LockTimeoutException if a lock is not granted in time (still OPEN)
     * @throws ValidationException     if a staged record is invalid (still OPEN, nothing written)
     * @throws PartialCommitException  if applying failed after validation (now FAILED)
     * @throws TransactionFinalizedException if the transaction is no longer open
     */
    public synchronized void commit() {
        ensureOpen();
        store.ensureOpen();
        if (staged.isEmpty()) {
            finish(TransactionState.COMMITTED);
            return;
        }

        // 1. Lock in global order
        List<String> order = CommitPlan.lockOrder(store.root(), staged);
        held.addAll(manager.acquireAll(id, order));

        try {
            // 2. Prepare every operation before touching disk
            CommitPlan plan;
            try {
                plan = CommitPlan.prepare(staged, store.codec());
                if (plan.hasWrites()) {
                    store.checkDiskSpace();
                }
            } catch (StorageException e) {
                LOG.debug("Transaction {} rejected before apply: {}", id, e.getMessage());
                throw e;
            }

            // 3. Apply
            try {
                plan.applyTo(store, id);
            } catch (PartialCommitException e) {
                LOG.error("Transaction {} FAILED after applying {} of {} operation(s): {}",
                        id, e.appliedKeys().size(), plan.operations().size(), e.getMessage(), e);
                finish(TransactionState.FAILED);
                throw e;
            }
            LOG.debug("Transaction {} committed {} operation(s) on {} key(s)", id, staged.size(), order.size());
            finish(TransactionState.COMMITTED);
        } finally {
            manager.releaseAll(held);
        }
    }

    /**
     * Discards staged operations and finalizes the transaction.
     *
     * @throws TransactionFinalizedException if the transaction is no longer open
     */
    public synchronized void rollback() {
        ensureOpen();
        manager.releaseAll(held);
        LOG.debug("Transaction {} rolled back, discarding {} operation(s)", id, staged.size());
        finish(TransactionState.ROLLED_BACK);
    }

    /**
     * Rolls back if still open; does nothing otherwise.
     */
    @Override
    public synchronized void close() {
        if (state == TransactionState.OPEN) {
            rollback();
        }
    }

    private void ensureOpen() {
        if (state.isTerminal()) {
            throw new TransactionFinalizedException(id, state);
        }
    }

    private void finish(TransactionState terminal) {
        state = terminal;
        staged.clear();
        manager.finished(this);
    }

    @Override
    public synchronized String toString() {
        return "Transaction{id=" + id + ", state=" + state + ", staged=" + staged.size() + '}';
    }
}
