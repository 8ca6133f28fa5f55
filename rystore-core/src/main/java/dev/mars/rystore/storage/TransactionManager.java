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
import dev.mars.rystore.storage.lock.LockMode;
import dev.mars.rystore.storage.lock.ResourceLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates transactions for one {@link FileRecordStore} and acquires their
 * locks in global order.
 * <p>
 * <b>INVARIANT:</b> commit-time locks are always requested in ascending
 * canonical-path order. Two transactions with overlapping keys therefore never
 * hold-and-wait on each other in opposite orders, so they cannot deadlock.
 */
public final class TransactionManager {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionManager.class);

    private final FileRecordStore store;
    private final ResourceLockManager locks;
    private final Duration lockTimeout;
    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, Transaction> active = new ConcurrentHashMap<>();

    TransactionManager(FileRecordStore store, ResourceLockManager locks, Duration lockTimeout) {
        this.store = store;
        this.locks = locks;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Starts a new transaction in state {@link TransactionState#OPEN}.
     */
    public Transaction begin() {
        store.ensureOpen();
        Transaction tx = new Transaction(nextId.getAndIncrement(), this, store);
        active.put(tx.id(), tx);
        LOG.debug("Transaction {} started", tx.id());
        return tx;
    }

    /** Number of transactions that are still open. */
    public int activeCount() {
        return active.size();
    }

    /**
     * Acquires exclusive locks on {@code orderedResources}, in list order.
     * If any acquisition fails, every lock already taken is released before
     * the failure propagates.
     */
    List<LockHandle> acquireAll(long transactionId, List<String> orderedResources) {
        List<LockHandle> held = new ArrayList<>(orderedResources.size());
        try {
            for (String resource : orderedResources) {
                held.add(locks.acquire(resource, LockMode.EXCLUSIVE, lockTimeout));
            }
        } catch (RuntimeException e) {
            LOG.debug("Transaction {} could not lock all {} resource(s), releasing {} already held",
                    transactionId, orderedResources.size(), held.size());
            releaseAll(held);
            throw e;
        }
        LOG.trace("Transaction {} holds {} lock(s)", transactionId, held.size());
        return held;
    }

    /**
     * Releases handles in reverse acquisition order.
     */
    void releaseAll(List<LockHandle> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            LockHandle handle = held.get(i);
            if (!handle.isReleased()) {
                handle.release();
            }
        }
        held.clear();
    }

    void finished(Transaction tx) {
        active.remove(tx.id());
        LOG.debug("Transaction {} finished: {}", tx.id(), tx.state());
    }
}
