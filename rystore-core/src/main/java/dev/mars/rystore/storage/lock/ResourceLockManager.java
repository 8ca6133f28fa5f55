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
package dev.mars.rystore.storage.lock;

import dev.mars.rystore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process shared/exclusive lock table keyed by canonical resource path.
 * <p>
 * <b>Granting:</b> requests queue per resource in arrival order. The head of
 * the queue is granted as soon as it is compatible with the current holders,
 * and consecutive shared requests behind it are granted together. A queued
 * exclusive request therefore blocks later shared requests, so writers are not
 * starved under heavy read load.
 * <p>
 * <b>Bounded waits:</b> every acquisition takes a timeout. A request that times
 * out, or whose thread is interrupted, is removed from the queue before the
 * exception is thrown, so no lock state survives a failed attempt.
 * <p>
 * <b>Thread Safety:</b> the table is guarded by one {@link ReentrantLock} held
 * only while inspecting or updating entries; waiting threads park on their own
 * {@link Condition}. Idle entries are dropped, so the table only ever contains
 * resources that are held or awaited.
 * <p>
 * Locks are not reentrant. A thread that already holds a resource must not
 * request it again.
 */
public final class ResourceLockManager {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceLockManager.class);

    /** Default bounded wait for an acquisition. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ReentrantLock tableLock = new ReentrantLock();
    private final Map<String, ResourceState> table = new HashMap<>();
    private final Duration defaultTimeout;

    public ResourceLockManager() {
        this(DEFAULT_TIMEOUT);
    }

    public ResourceLockManager(Duration defaultTimeout) {
        if (defaultTimeout == null || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout must be zero or positive: " + defaultTimeout);
        }
        this.defaultTimeout = defaultTimeout;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Acquires a lock with the default timeout.
     *
     * @see #acquire(String, LockMode, Duration)
     */
    public LockHandle acquire(String resource, LockMode mode) {
        return acquire(resource, mode, defaultTimeout);
    }

    /**
     * Blocks until {@code mode} can be granted on {@code resource} or the
     * timeout elapses.
     *
     * @param resource canonical resource path
     * @param mode     requested mode
     * @param timeout  maximum wait; zero means "grant only if immediately available"
     * @return the granted handle, to be released exactly once
     * @throws LockTimeoutException if the lock was not granted in time
     * @throws StorageException     if the waiting thread was interrupted (interrupt flag restored)
     */
    public LockHandle acquire(String resource, LockMode mode, Duration timeout) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(timeout, "timeout");

        long remaining = timeout.toNanos();
        tableLock.lock();
        try {
            ResourceState state = table.computeIfAbsent(resource, ResourceState::new);
            Waiter waiter = new Waiter(mode, tableLock.newCondition());
            state.queue.addLast(waiter);
            state.grantQueued();

            if (!waiter.granted) {
                LOG.debug("Waiting for {} lock on {} ({})", mode, resource, state.snapshot());
            }
            while (!waiter.granted) {
                if (remaining <= 0L) {
                    abandon(state, waiter);
                    LockDiagnostics diagnostics = state.snapshot();
                    LOG.warn("Lock timeout after {} ms: {} on {}", timeout.toMillis(), mode, diagnostics);
                    throw new LockTimeoutException(resource, mode, timeout, diagnostics);
                }
                try {
                    remaining = waiter.condition.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    if (waiter.granted) {
                        // Granted and interrupted in the same instant: hand it straight back.
                        releaseGrant(state, mode);
                    } else {
                        abandon(state, waiter);
                    }
                    Thread.currentThread().interrupt();
                    LOG.debug("Interrupted waiting for {} lock on {}", mode, resource);
                    throw new StorageException("Interrupted waiting for " + mode + " lock on " + resource, e);
                }
            }

            LOG.trace("Granted {} lock on {}", mode, resource);
            return new LockHandle(this, resource, mode);
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the lock, releasing it on every exit path.
     */
    public <T> T withLock(String resource, LockMode mode, Duration timeout, Supplier<T> action) {
        try (LockHandle ignored = acquire(resource, mode, timeout)) {
            return action.get();
        }
    }

    /** Called by {@link LockHandle#release()} after its own double-release check. */
    void release(LockHandle handle) {
        if (handle == null) {
            return;
        }
        tableLock.lock();
        try {
            ResourceState state = table.get(handle.resource());
            if (state == null || state.holders == 0 || state.heldMode != handle.mode()) {
                LOG.error("Release of {} does not match lock table state {}", handle,
                        state == null ? "(absent)" : state.snapshot());
                throw new IllegalStateException("Lock table has no matching grant for " + handle);
            }
            releaseGrant(state, handle.mode());
            LOG.trace("Released {} lock on {}", handle.mode(), handle.resource());
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Snapshot of every resource currently held or awaited, ordered by resource path.
     */
    public SortedMap<String, LockDiagnostics> diagnostics() {
        tableLock.lock();
        try {
            SortedMap<String, LockDiagnostics> result = new TreeMap<>();
            for (ResourceState state : table.values()) {
                result.put(state.resource, state.snapshot());
            }
            return result;
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Snapshot of one resource, empty if nobody holds or awaits it.
     */
    public Optional<LockDiagnostics> diagnostics(String resource) {
        tableLock.lock();
        try {
            ResourceState state = table.get(resource);
            return state == null ? Optional.empty() : Optional.of(state.snapshot());
        } finally {
            tableLock.unlock();
        }
    }

    // ========================================================================
    // Internal Helpers (tableLock held)
    // ========================================================================

    private void releaseGrant(ResourceState state, LockMode mode) {
        state.holders--;
        if (state.holders == 0) {
            state.heldMode = null;
            state.acquiredAtNanos = 0L;
        }
        state.grantQueued();
        removeIfIdle(state);
    }

    private void abandon(ResourceState state, Waiter waiter) {
        state.queue.remove(waiter);
        // The abandoned request may have been the exclusive head blocking shared requests.
        state.grantQueued();
        removeIfIdle(state);
    }

    private void removeIfIdle(ResourceState state) {
        if (state.holders == 0 && state.queue.isEmpty()) {
            table.remove(state.resource);
        }
    }

    private static final class Waiter {
        final LockMode mode;
        final Condition condition;
        boolean granted;

        Waiter(LockMode mode, Condition condition) {
            this.mode = mode;
            this.condition = condition;
        }
    }

    private static final class ResourceState {
        final String resource;
        final ArrayDeque<Waiter> queue = new ArrayDeque<>();
        LockMode heldMode;
        int holders;
        long acquiredAtNanos;

        ResourceState(String resource) {
            this.resource = resource;
        }

        /** Grants the head of the queue while it is compatible with the current holders. */
        void grantQueued() {
            while (!queue.isEmpty()) {
                Waiter head = queue.peekFirst();
                if (holders > 0 && !head.mode.compatibleWith(heldMode)) {
                    return;
                }
                queue.pollFirst();
                if (holders == 0) {
                    heldMode = head.mode;
                    acquiredAtNanos = System.nanoTime();
                }
                holders++;
                head.granted = true;
                head.condition.signal();
            }
        }

        LockDiagnostics snapshot() {
            Duration heldFor = holders == 0
                    ? Duration.ZERO
                    : Duration.ofNanos(System.nanoTime() - acquiredAtNanos);
            return new LockDiagnostics(resource, heldMode, holders, queue.size(), heldFor);
        }
    }
}
