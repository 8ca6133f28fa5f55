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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A granted lock. Release it exactly once, preferably by scoping it in a
 * try-with-resources block:
 * <pre>{@code
 * try (LockHandle lock = locks.acquire(resource, LockMode.EXCLUSIVE)) {
 *     // mutate the resource
 * }
 * }</pre>
 * A second release of the same handle is a programming error and fails with
 * {@link IllegalStateException} instead of being ignored.
 */
public final class LockHandle implements AutoCloseable {

    private final ResourceLockManager manager;
    private final String resource;
    private final LockMode mode;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(ResourceLockManager manager, String resource, LockMode mode) {
        this.manager = manager;
        this.resource = resource;
        this.mode = mode;
    }

    public String resource() {
        return resource;
    }

    public LockMode mode() {
        return mode;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Returns the lock to the manager and wakes eligible waiters.
     *
     * @throws IllegalStateException if this handle was already released
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            throw new IllegalStateException("Lock handle already released: " + mode + " on " + resource);
        }
        manager.release(this);
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "LockHandle{" + mode + " " + resource + (released.get() ? ", released" : "") + "}";
    }
}
