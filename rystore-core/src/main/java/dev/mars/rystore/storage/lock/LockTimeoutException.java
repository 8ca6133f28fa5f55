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

import java.time.Duration;

/**
 * Thrown when a lock could not be granted within the bounded wait.
 * <p>
 * No lock state is left behind for the failed attempt, so the caller may
 * retry, ideally with backoff.
 */
public class LockTimeoutException extends StorageException {

    private final String resource;
    private final Duration timeout;
    private final LockDiagnostics diagnostics;

    public LockTimeoutException(String resource, LockMode mode, Duration timeout, LockDiagnostics diagnostics) {
        super("Lock timeout after " + timeout.toMillis() + "ms waiting for " + mode +
                " on " + resource + " (" + diagnostics + ")");
        this.resource = resource;
        this.timeout = timeout;
        this.diagnostics = diagnostics;
    }

    public String resource() {
        return resource;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Lock table state for the resource at the moment the wait gave up. */
    public LockDiagnostics diagnostics() {
        return diagnostics;
    }
}
