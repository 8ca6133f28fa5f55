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

import java.time.Duration;

/**
 * Point-in-time view of one resource in the lock table.
 *
 * @param resource  canonical resource path
 * @param mode      mode of the current holders, or {@code null} if nobody holds it
 * @param holders   number of current holders (0 or 1 for exclusive)
 * @param waiters   number of queued requests
 * @param heldFor   time since the current holders were first granted, {@link Duration#ZERO} if unheld
 */
public record LockDiagnostics(String resource, LockMode mode, int holders, int waiters, Duration heldFor) {

    @Override
    public String toString() {
        return resource + "{mode=" + (mode == null ? "NONE" : mode) +
                ", holders=" + holders +
                ", waiters=" + waiters +
                ", heldFor=" + heldFor.toMillis() + "ms}";
    }
}
